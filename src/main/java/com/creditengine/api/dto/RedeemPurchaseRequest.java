package com.creditengine.api.dto;

import com.creditengine.purchase.Platform;
import com.creditengine.purchase.PurchaseRequest;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Data;

/**
 * DTO for redeeming a store purchase.
 */
@Data
public class RedeemPurchaseRequest {

    @NotBlank(message = "User ID is required")
    @Size(max = 128, message = "User ID must be at most 128 characters")
    private String userId;

    @NotBlank(message = "Product ID is required")
    @Size(max = 128, message = "Product ID must be at most 128 characters")
    private String productId;

    @NotBlank(message = "Purchase token is required")
    @Size(max = 1024, message = "Purchase token must be at most 1024 characters")
    private String purchaseToken;

    @NotNull(message = "Platform is required")
    private Platform platform;

    @NotBlank(message = "Transaction ID is required")
    @Size(max = 128, message = "Transaction ID must be at most 128 characters")
    private String transactionId;

    private String receiptData;

    public PurchaseRequest toPurchaseRequest() {
        return PurchaseRequest.builder()
            .userId(userId)
            .productId(productId)
            .purchaseToken(purchaseToken)
            .platform(platform)
            .transactionId(transactionId)
            .receiptData(receiptData)
            .build();
    }
}
