package com.callplatform.guardsvc.api.controller;

import com.callplatform.guardsvc.domain.geo.GeoBlockDecision;
import com.callplatform.guardsvc.domain.geo.GeoBlockRule;
import com.callplatform.guardsvc.domain.geo.GeoIpAnalyzer;
import com.callplatform.guardsvc.domain.geo.GeoLocation;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/v1/admin/geo")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Geo Rules", description = "Geographic blocking rules and IP lookups")
public class GeoRuleController {

    private final GeoIpAnalyzer geoIpAnalyzer;

    @GetMapping("/rules")
    @Operation(summary = "List rules")
    public List<GeoBlockRule> rules() {
        return geoIpAnalyzer.getRules();
    }

    @PutMapping("/rules")
    @Operation(summary = "Replace rules", description = "Replaces the whole rule set")
    public List<GeoBlockRule> replaceRules(@RequestBody List<GeoBlockRule> rules) {
        log.info("Replacing geo rule set with {} rules", rules.size());
        return geoIpAnalyzer.replaceRules(rules);
    }

    @GetMapping("/lookup/{ip}")
    @Operation(summary = "Look up IP", description = "Location and reputation for one IP")
    public GeoLocation lookup(@PathVariable String ip) {
        return geoIpAnalyzer.analyzeIP(ip);
    }

    @GetMapping("/decision/{ip}")
    @Operation(summary = "Evaluate rules for IP")
    public GeoBlockDecision decision(@PathVariable String ip) {
        return geoIpAnalyzer.shouldBlockIP(ip);
    }

    @DeleteMapping("/cache/{ip}")
    @Operation(summary = "Evict cached lookup")
    public ResponseEntity<Void> evict(@PathVariable String ip) {
        geoIpAnalyzer.evict(ip);
        return ResponseEntity.noContent().build();
    }
}
