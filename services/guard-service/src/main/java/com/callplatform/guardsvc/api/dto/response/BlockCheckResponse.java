package com.callplatform.guardsvc.api.dto.response;

import com.callplatform.guardsvc.domain.blocking.BlockingRule;
import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record BlockCheckResponse(
    boolean blocked,
    BlockingRule rule
) {}
