package com.callplatform.guardsvc.api.controller;

import com.callplatform.guardsvc.domain.bypass.BypassAttempt;
import com.callplatform.guardsvc.domain.bypass.BypassDetector;
import com.callplatform.guardsvc.domain.bypass.BypassStats;
import com.callplatform.guardsvc.domain.bypass.BypassType;
import com.callplatform.guardsvc.domain.bypass.StatsPeriod;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/v1/admin/bypass")
@RequiredArgsConstructor
@Tag(name = "Bypass Reporting", description = "Audit trail of evasion attempts")
public class BypassReportController {

    private final BypassDetector bypassDetector;

    @GetMapping("/attempts")
    @Operation(summary = "List attempts", description = "Newest first, optionally filtered by type")
    public List<BypassAttempt> attempts(@RequestParam(required = false) String type) {
        return bypassDetector.getBypassAttempts(type != null ? BypassType.fromCode(type) : null);
    }

    @GetMapping("/stats")
    @Operation(summary = "Attempt statistics", description = "Totals per type and mitigation effectiveness")
    public BypassStats stats(@RequestParam(defaultValue = "day") String period) {
        return bypassDetector.getStats(StatsPeriod.fromCode(period));
    }
}
