package com.creditengine.api.controller;

import com.creditengine.analytics.AnalyticsQuery;
import com.creditengine.analytics.AnalyticsSnapshot;
import com.creditengine.api.dto.CreditAdjustmentRequest;
import com.creditengine.api.dto.ProcessReferralRequest;
import com.creditengine.api.dto.RedeemPurchaseRequest;
import com.creditengine.balance.BalanceView;
import com.creditengine.bonus.DailyBonusStatus;
import com.creditengine.ledger.TransactionFilter;
import com.creditengine.ledger.TransactionType;
import com.creditengine.orchestrator.CreditOrchestrator;
import com.creditengine.orchestrator.DailyBonusClaimResult;
import com.creditengine.orchestrator.TransactionPage;
import com.creditengine.purchase.CreditProduct;
import com.creditengine.purchase.PurchaseResult;
import com.creditengine.referral.ReferralResult;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;
import java.util.List;

import static com.creditengine.api.controller.CreditOperationException.unwrap;

/**
 * REST API for user-facing credit operations.
 */
@RestController
@RequestMapping("/api/v1/credits")
@RequiredArgsConstructor
@Tag(name = "Credits", description = "Credit balance, purchase, bonus and referral API")
public class CreditController {

    private final CreditOrchestrator creditOrchestrator;

    @GetMapping("/{userId}/balance")
    @Operation(summary = "Get a user's credit balance")
    public ResponseEntity<BalanceView> getBalance(@PathVariable String userId) {
        return ResponseEntity.ok(unwrap(creditOrchestrator.getBalance(userId)));
    }

    @PostMapping("/{userId}/add")
    @Operation(summary = "Grant credits to a user")
    public ResponseEntity<BalanceView> addCredits(@PathVariable String userId,
                                                  @Valid @RequestBody CreditAdjustmentRequest request) {
        return ResponseEntity.ok(unwrap(
            creditOrchestrator.addCredits(userId, request.getAmount(), request.getDescription())));
    }

    @PostMapping("/{userId}/deduct")
    @Operation(summary = "Spend a user's credits")
    public ResponseEntity<BalanceView> deductCredits(@PathVariable String userId,
                                                     @Valid @RequestBody CreditAdjustmentRequest request) {
        return ResponseEntity.ok(unwrap(creditOrchestrator.deductCredits(
            userId, request.getAmount(), request.getDescription(), request.getMetadata())));
    }

    @PostMapping("/purchases")
    @Operation(summary = "Redeem a store purchase for credits")
    public ResponseEntity<PurchaseResult> processPurchase(@Valid @RequestBody RedeemPurchaseRequest request) {
        return ResponseEntity.ok(unwrap(creditOrchestrator.processPurchase(request.toPurchaseRequest())));
    }

    @GetMapping("/products")
    @Operation(summary = "List purchasable credit packs")
    public ResponseEntity<List<CreditProduct>> getProducts() {
        return ResponseEntity.ok(unwrap(creditOrchestrator.getAvailableProducts()));
    }

    @GetMapping("/{userId}/daily-bonus")
    @Operation(summary = "Get daily bonus eligibility and streak")
    public ResponseEntity<DailyBonusStatus> getDailyBonusStatus(@PathVariable String userId) {
        return ResponseEntity.ok(unwrap(creditOrchestrator.getDailyBonusStatus(userId)));
    }

    @PostMapping("/{userId}/daily-bonus")
    @Operation(summary = "Claim today's daily bonus")
    public ResponseEntity<DailyBonusClaimResult> claimDailyBonus(@PathVariable String userId) {
        return ResponseEntity.ok(unwrap(creditOrchestrator.claimDailyBonus(userId)));
    }

    @PostMapping("/referrals")
    @Operation(summary = "Pay out a referral to both users")
    public ResponseEntity<ReferralResult> processReferral(@Valid @RequestBody ProcessReferralRequest request) {
        return ResponseEntity.ok(unwrap(creditOrchestrator.processReferral(request.toReferralRequest())));
    }

    @GetMapping("/{userId}/transactions")
    @Operation(summary = "Get a user's transaction history")
    public ResponseEntity<TransactionPage> getTransactions(
            @PathVariable String userId,
            @RequestParam(required = false) TransactionType type,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant from,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant to,
            @RequestParam(defaultValue = "1") int page,
            @RequestParam(defaultValue = "20") int limit) {
        TransactionFilter filter = TransactionFilter.builder()
            .type(type)
            .from(from)
            .to(to)
            .build();
        return ResponseEntity.ok(unwrap(creditOrchestrator.getUserTransactions(userId, filter, page, limit)));
    }

    @GetMapping("/{userId}/analytics")
    @Operation(summary = "Get a user's credit analytics")
    public ResponseEntity<AnalyticsSnapshot> getAnalytics(
            @PathVariable String userId,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant from,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant to,
            @RequestParam(defaultValue = "true") boolean includeAdmin) {
        AnalyticsQuery query = AnalyticsQuery.builder()
            .userId(userId)
            .from(from)
            .to(to)
            .includeAdmin(includeAdmin)
            .build();
        return ResponseEntity.ok(unwrap(creditOrchestrator.getCreditAnalytics(query)));
    }
}
