package com.creditengine.api.controller;

import com.creditengine.analytics.PlatformAnalytics;
import com.creditengine.api.dto.AdminAdjustmentRequest;
import com.creditengine.balance.ReconciliationResult;
import com.creditengine.balance.ReconciliationSummary;
import com.creditengine.ledger.TransactionView;
import com.creditengine.orchestrator.CreditOrchestrator;
import com.creditengine.referral.ReferralReconciliationReport;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Duration;

import static com.creditengine.api.controller.CreditOperationException.unwrap;

/**
 * REST API for administrative credit operations.
 */
@RestController
@RequestMapping("/api/v1/admin/credits")
@RequiredArgsConstructor
@Tag(name = "Credit administration", description = "Manual adjustments, reconciliation and platform analytics")
public class AdminCreditController {

    private final CreditOrchestrator creditOrchestrator;

    @PostMapping("/{userId}/add")
    @Operation(summary = "Manually credit a user")
    public ResponseEntity<TransactionView> addCredits(@PathVariable String userId,
                                                      @Valid @RequestBody AdminAdjustmentRequest request) {
        return ResponseEntity.ok(unwrap(creditOrchestrator.adminAddCredits(
            userId, request.getAmount(), request.getReason(), request.getAdminId())));
    }

    @PostMapping("/{userId}/deduct")
    @Operation(summary = "Manually debit a user")
    public ResponseEntity<TransactionView> deductCredits(@PathVariable String userId,
                                                         @Valid @RequestBody AdminAdjustmentRequest request) {
        return ResponseEntity.ok(unwrap(creditOrchestrator.adminDeductCredits(
            userId, request.getAmount(), request.getReason(), request.getAdminId())));
    }

    @PostMapping("/reconcile/{userId}")
    @Operation(summary = "Compare a user's cached balance with the ledger")
    public ResponseEntity<ReconciliationResult> reconcileUser(@PathVariable String userId,
                                                              @RequestParam(defaultValue = "false") boolean repair) {
        return ResponseEntity.ok(unwrap(creditOrchestrator.reconcileBalance(userId, repair)));
    }

    @PostMapping("/reconcile")
    @Operation(summary = "Compare every cached balance with the ledger")
    public ResponseEntity<ReconciliationSummary> reconcileAll(@RequestParam(defaultValue = "false") boolean repair) {
        return ResponseEntity.ok(unwrap(creditOrchestrator.reconcileAllBalances(repair)));
    }

    @PostMapping("/referrals/resume")
    @Operation(summary = "Settle referrals left pending by an interrupted payout")
    public ResponseEntity<ReferralReconciliationReport> resumeReferrals(
            @RequestParam(defaultValue = "5") long olderThanMinutes) {
        return ResponseEntity.ok(unwrap(
            creditOrchestrator.resumePendingReferrals(Duration.ofMinutes(olderThanMinutes))));
    }

    @GetMapping("/analytics")
    @Operation(summary = "Get platform-wide credit totals")
    public ResponseEntity<PlatformAnalytics> getPlatformAnalytics() {
        return ResponseEntity.ok(unwrap(creditOrchestrator.getPlatformAnalytics()));
    }
}
