package com.creditengine.purchase;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;

/**
 * A purchasable credit pack.
 */
@Entity
@Table(name = "credit_products")
@Getter
@ToString
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class CreditProduct {

    @Id
    @Column(name = "product_id", nullable = false, updatable = false)
    private String productId;

    @Column(name = "name", nullable = false)
    private String name;

    @Column(name = "credits", nullable = false)
    private long credits;

    @Column(name = "active", nullable = false)
    private boolean active;

    public CreditProduct(String productId, String name, long credits) {
        if (credits <= 0) {
            throw new IllegalArgumentException("Product credits must be positive");
        }
        this.productId = productId;
        this.name = name;
        this.credits = credits;
        this.active = true;
    }
}
