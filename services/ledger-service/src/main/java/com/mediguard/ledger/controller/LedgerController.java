package com.mediguard.ledger.controller;

import com.mediguard.ledger.domain.ChainEntry;
import com.mediguard.ledger.dto.AnchorCycleResult;
import com.mediguard.ledger.dto.AnchorLookupResponse;
import com.mediguard.ledger.dto.AnchorStatusResponse;
import com.mediguard.ledger.dto.ApiResponse;
import com.mediguard.ledger.dto.ChainEntryResponse;
import com.mediguard.ledger.dto.ChainHeadResponse;
import com.mediguard.ledger.dto.ChainRebuildReport;
import com.mediguard.ledger.dto.ChainVerificationReport;
import com.mediguard.ledger.dto.RecordPredictionRequest;
import com.mediguard.ledger.scheduler.AnchorCommitScheduler;
import com.mediguard.ledger.service.AnchorQueryService;
import com.mediguard.ledger.service.ChainRebuildService;
import com.mediguard.ledger.service.ChainVerifier;
import com.mediguard.ledger.service.HashChainLedger;
import com.mediguard.ledger.service.PredictionRecordingService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

@RestController
@RequestMapping("/api/v1/ledger")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Prediction Ledger", description = "Tamper-evident prediction hash chain and external anchoring")
@Validated
public class LedgerController {

    private final PredictionRecordingService recordingService;
    private final HashChainLedger ledger;
    private final ChainVerifier verifier;
    private final ChainRebuildService rebuildService;
    private final AnchorQueryService anchorQueryService;
    private final AnchorCommitScheduler anchorScheduler;

    @PostMapping("/predictions")
    @Operation(summary = "Record a prediction and append it to the hash chain")
    public ResponseEntity<ApiResponse<ChainEntryResponse>> recordPrediction(
            @Valid @RequestBody RecordPredictionRequest request) {
        log.info("Recording prediction for user: {}", request.getUserId());

        ChainEntry entry = recordingService.recordPrediction(request);
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.success(ChainEntryResponse.from(entry, null)));
    }

    @GetMapping("/chain")
    @Operation(summary = "List chain entries, newest first")
    public ResponseEntity<ApiResponse<Page<ChainEntryResponse>>> listChain(
            @RequestParam(defaultValue = "0") @Min(0) int page,
            @RequestParam(defaultValue = "20") @Min(1) @Max(500) int size) {

        Page<ChainEntryResponse> entries = ledger.listEntries(PageRequest.of(page, size));
        return ResponseEntity.ok(ApiResponse.success(entries));
    }

    @GetMapping("/chain/head")
    @Operation(summary = "Get the current chain head")
    public ResponseEntity<ApiResponse<ChainHeadResponse>> getHead() {
        Optional<ChainEntry> head = ledger.head();
        ChainHeadResponse response = ChainHeadResponse.builder()
                .headHash(head.map(ChainEntry::getCurrentHash).orElse(null))
                .headSequence(head.map(ChainEntry::getSequence).orElse(null))
                .pendingAnchor(ledger.pendingAnchorCount())
                .build();
        return ResponseEntity.ok(ApiResponse.success(response));
    }

    @GetMapping("/chain/verify")
    @Operation(summary = "Verify hash chain integrity from genesis")
    public ResponseEntity<ApiResponse<ChainVerificationReport>> verifyChain() {
        log.info("Verifying hash chain integrity");

        ChainVerificationReport report = verifier.verify();
        return ResponseEntity.ok(ApiResponse.success(report, report.getMessage()));
    }

    @GetMapping("/chain/pending")
    @Operation(summary = "List entries not yet anchored, oldest first")
    public ResponseEntity<ApiResponse<List<ChainEntryResponse>>> getPending(
            @RequestParam(defaultValue = "100") @Min(1) @Max(10000) int limit) {

        List<ChainEntryResponse> pending = ledger.entriesMissingAnchor(limit).stream()
                .map(entry -> ChainEntryResponse.from(entry, null))
                .collect(Collectors.toList());
        return ResponseEntity.ok(ApiResponse.success(pending));
    }

    @PostMapping("/chain/rebuild")
    @Operation(summary = "Rebuild the whole chain from stored predictions (destructive)")
    public ResponseEntity<ApiResponse<ChainRebuildReport>> rebuildChain(
            @RequestParam(defaultValue = "false") boolean confirm) {
        if (!confirm) {
            throw new IllegalArgumentException(
                    "Rebuild deletes every chain entry and anchor assignment; repeat with confirm=true");
        }
        log.warn("Chain rebuild requested through the API");

        ChainRebuildReport report = rebuildService.rebuild();
        return ResponseEntity.ok(ApiResponse.success(report, "Chain rebuilt and verified"));
    }

    @GetMapping("/anchors/status")
    @Operation(summary = "Get anchoring status")
    public ResponseEntity<ApiResponse<AnchorStatusResponse>> getAnchorStatus() {
        return ResponseEntity.ok(ApiResponse.success(anchorQueryService.status()));
    }

    @GetMapping("/anchors/{reference}")
    @Operation(summary = "Look up an anchor transaction")
    public ResponseEntity<ApiResponse<AnchorLookupResponse>> getAnchor(@PathVariable String reference) {
        return ResponseEntity.ok(ApiResponse.success(anchorQueryService.lookup(reference)));
    }

    @PostMapping("/anchors/commit")
    @Operation(summary = "Run an anchor commit cycle now")
    public ResponseEntity<ApiResponse<AnchorCycleResult>> commitNow() {
        AnchorCycleResult result = anchorScheduler.triggerNow();
        return ResponseEntity.ok(ApiResponse.success(result, result.getOutcome().name()));
    }
}
