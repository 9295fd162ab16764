package com.claimrules.interfaces.api.extraction;

import com.claimrules.application.extraction.RuleExtractionAppService;
import com.claimrules.domain.extraction.model.PipelineOptions;
import com.claimrules.domain.extraction.model.RuleExtractionResult;
import com.claimrules.infrastructure.ai.ReasoningUsageTracker;
import com.claimrules.interfaces.api.dto.DefaultOptionsResponse;
import com.claimrules.interfaces.api.dto.ExtractionRequest;
import com.claimrules.interfaces.api.dto.ExtractionResponse;
import com.claimrules.interfaces.api.dto.UsageResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/extractions")
@RequiredArgsConstructor
public class ExtractionController {

    private final RuleExtractionAppService extractionAppService;

    @PostMapping
    public ResponseEntity<ExtractionResponse> extract(@Valid @RequestBody ExtractionRequest request) {
        RuleExtractionResult result = extractionAppService.extract(
                request.patentNumber(),
                request.group(),
                request.claimsText(),
                request.knownRules(),
                request.maxBatchSize(),
                request.complexityBudget(),
                request.concurrency());

        return ResponseEntity.ok(ExtractionResponse.from(result));
    }

    @GetMapping("/defaults")
    public ResponseEntity<DefaultOptionsResponse> getDefaults() {
        PipelineOptions options = extractionAppService.defaultOptions();
        return ResponseEntity.ok(new DefaultOptionsResponse(
                options.maxBatchSize(),
                options.complexityBudget(),
                options.concurrency(),
                extractionAppService.getMaxClaimsLength()));
    }

    @GetMapping("/usage")
    public ResponseEntity<UsageResponse> getUsage() {
        ReasoningUsageTracker usage = extractionAppService.getUsageTracker();
        return ResponseEntity.ok(new UsageResponse(
                usage.getTotalRequests(),
                usage.getFailedRequests(),
                usage.getFailureRate(),
                usage.getTotalPromptTokens(),
                usage.getTotalCompletionTokens()));
    }
}
