package com.callplatform.guardsvc.api.dto.response;

import com.callplatform.guardsvc.domain.behavior.BehaviorScore;
import com.callplatform.guardsvc.domain.behavior.SuspiciousActivity;

import java.util.List;

public record BehaviorReportResponse(
    String identifier,
    BehaviorScore score,
    List<SuspiciousActivity> findings,
    long requestsLastHour
) {}
