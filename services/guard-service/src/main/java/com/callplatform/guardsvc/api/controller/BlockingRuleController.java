package com.callplatform.guardsvc.api.controller;

import com.callplatform.guardsvc.api.dto.request.BlockCheckRequest;
import com.callplatform.guardsvc.api.dto.request.BlockingRuleRequest;
import com.callplatform.guardsvc.api.dto.response.BlockCheckResponse;
import com.callplatform.guardsvc.domain.blocking.BlockingRule;
import com.callplatform.guardsvc.domain.blocking.BlockingRuleService;
import com.callplatform.guardsvc.domain.blocking.BlockingRuleType;
import com.callplatform.guardsvc.shared.exception.RuleNotFoundException;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/v1/admin/blocking-rules")
@RequiredArgsConstructor
@Tag(name = "Blocking Rules", description = "Phone, IP, email and pattern blocks")
public class BlockingRuleController {

    private final BlockingRuleService blockingRuleService;

    @GetMapping
    @Operation(summary = "List active rules")
    public List<BlockingRule> list(@RequestParam(required = false) String type) {
        return blockingRuleService.listActive(type != null ? BlockingRuleType.fromCode(type) : null);
    }

    @GetMapping("/{id}")
    @Operation(summary = "Get rule")
    public BlockingRule get(@PathVariable String id) {
        return blockingRuleService.getRule(id).orElseThrow(() -> new RuleNotFoundException(id));
    }

    @PostMapping
    @Operation(summary = "Create rule", description = "Temporary rules expire after the configured duration")
    public ResponseEntity<BlockingRule> create(@Valid @RequestBody BlockingRuleRequest request) {
        BlockingRule rule = blockingRuleService.createRule(BlockingRuleType.fromCode(request.type()),
                request.value(), request.reason(), request.temporary(), false);
        return ResponseEntity.status(HttpStatus.CREATED).body(rule);
    }

    @PostMapping("/check")
    @Operation(summary = "Check a value against active rules")
    public BlockCheckResponse check(@Valid @RequestBody BlockCheckRequest request) {
        return blockingRuleService.checkBlocked(BlockingRuleType.fromCode(request.type()), request.value())
                .map(rule -> new BlockCheckResponse(true, rule))
                .orElseGet(() -> new BlockCheckResponse(false, null));
    }

    @DeleteMapping("/{id}")
    @Operation(summary = "Remove rule")
    public ResponseEntity<Void> remove(@PathVariable String id) {
        blockingRuleService.removeRule(id);
        return ResponseEntity.noContent().build();
    }
}
