package com.callplatform.guardsvc.api.controller;

import com.callplatform.guardsvc.api.dto.request.SuspiciousIpRequest;
import com.callplatform.guardsvc.api.dto.response.SuspiciousIpResponse;
import com.callplatform.guardsvc.domain.ratelimit.RateLimitService;
import com.callplatform.guardsvc.shared.exception.InvalidRequestException;
import com.callplatform.guardsvc.shared.http.IpAddresses;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Duration;

@RestController
@RequestMapping("/api/v1/admin/suspicious-ips")
@RequiredArgsConstructor
@Tag(name = "Suspicious IPs", description = "Suspicious-IP registry")
public class SuspiciousIpController {

    private final RateLimitService rateLimitService;

    @PostMapping
    @Operation(summary = "Register IP", description = "Globally and, when given, for one country")
    public ResponseEntity<SuspiciousIpResponse> register(@Valid @RequestBody SuspiciousIpRequest request) {
        if (!IpAddresses.isValid(request.ipAddress())) {
            throw new InvalidRequestException("ipAddress", "Invalid IP address: " + request.ipAddress());
        }
        Duration ttl = request.ttlSeconds() != null ? Duration.ofSeconds(request.ttlSeconds()) : null;
        rateLimitService.addSuspiciousIP(request.ipAddress(), request.country(), ttl);
        return ResponseEntity.status(HttpStatus.ACCEPTED)
                .body(new SuspiciousIpResponse(request.ipAddress(), request.country(), true));
    }

    @GetMapping("/{ip}")
    @Operation(summary = "Check IP")
    public SuspiciousIpResponse check(@PathVariable String ip, @RequestParam(required = false) String country) {
        return new SuspiciousIpResponse(ip, country, rateLimitService.isIPSuspicious(ip, country));
    }
}
