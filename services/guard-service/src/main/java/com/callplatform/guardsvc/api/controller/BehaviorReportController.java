package com.callplatform.guardsvc.api.controller;

import com.callplatform.guardsvc.api.dto.response.BehaviorReportResponse;
import com.callplatform.guardsvc.domain.behavior.BehaviorScore;
import com.callplatform.guardsvc.domain.behavior.BehavioralAnalyzer;
import com.callplatform.guardsvc.domain.behavior.SuspiciousActivity;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Duration;
import java.util.List;

/**
 * Identifiers are the rate-limit identifiers ({@code user:{id}} or {@code ip:{address}}).
 */
@RestController
@RequestMapping("/api/v1/admin/behavior")
@RequiredArgsConstructor
@Tag(name = "Behavior", description = "Behavior scores and findings")
public class BehaviorReportController {

    private final BehavioralAnalyzer behavioralAnalyzer;

    @GetMapping("/{identifier}/score")
    @Operation(summary = "Cached behavior score")
    public BehaviorScore score(@PathVariable String identifier) {
        return behavioralAnalyzer.getBehaviorScore(identifier);
    }

    @PostMapping("/{identifier}/analyze")
    @Operation(summary = "Analyze now", description = "Rescans the identifier's window and refreshes its score")
    public BehaviorReportResponse analyze(@PathVariable String identifier) {
        List<SuspiciousActivity> findings = behavioralAnalyzer.analyzePatterns(identifier, null);
        return new BehaviorReportResponse(identifier,
                behavioralAnalyzer.getBehaviorScore(identifier),
                findings,
                behavioralAnalyzer.countRecent(identifier, Duration.ofHours(1)));
    }
}
