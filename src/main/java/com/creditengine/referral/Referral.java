package com.creditengine.referral;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.time.Instant;
import java.util.UUID;

/**
 * A referral between two users. A user can be referred only once.
 *
 * The row is committed PENDING before any credits move. Each payout leg is
 * recorded as it lands, and the referral becomes COMPLETED once both have.
 */
@Entity
@Table(name = "credit_referrals", uniqueConstraints = {
    @UniqueConstraint(name = "uk_referral_referee", columnNames = "referee_user_id")
}, indexes = {
    @Index(name = "idx_referral_status_created", columnList = "status, created_at")
})
@Getter
@ToString
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class Referral {

    @Id
    @Column(name = "id", nullable = false, updatable = false, length = 36)
    private String id;

    @Column(name = "referrer_user_id", nullable = false, updatable = false)
    private String referrerUserId;

    @Column(name = "referee_user_id", nullable = false, updatable = false)
    private String refereeUserId;

    @Column(name = "referral_code", nullable = false, updatable = false)
    private String referralCode;

    @Enumerated(EnumType.STRING)
    @Column(name = "type", nullable = false, updatable = false, length = 32)
    private ReferralType type;

    @Column(name = "referrer_credits", nullable = false, updatable = false)
    private long referrerCredits;

    @Column(name = "referee_credits", nullable = false, updatable = false)
    private long refereeCredits;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 16)
    private ReferralStatus status;

    @Column(name = "referee_transaction_id", length = 36)
    private String refereeTransactionId;

    @Column(name = "referrer_transaction_id", length = 36)
    private String referrerTransactionId;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "completed_at")
    private Instant completedAt;

    @Version
    @Column(name = "version")
    private Long version;

    public Referral(String referrerUserId, String refereeUserId, String referralCode,
                    ReferralType type, Instant createdAt) {
        this.id = UUID.randomUUID().toString();
        this.referrerUserId = referrerUserId;
        this.refereeUserId = refereeUserId;
        this.referralCode = referralCode;
        this.type = type;
        this.referrerCredits = type.getReferrerCredits();
        this.refereeCredits = type.getRefereeCredits();
        this.status = ReferralStatus.PENDING;
        this.createdAt = createdAt;
    }

    public boolean isCompleted() {
        return status == ReferralStatus.COMPLETED;
    }

    /**
     * Whether a request describes this same referral.
     */
    public boolean matches(ReferralRequest request) {
        return referrerUserId.equals(request.getReferrerUserId())
            && referralCode.equals(request.getReferralCode())
            && type == request.getType();
    }

    public void complete(String refereeTransactionId, String referrerTransactionId, Instant now) {
        this.refereeTransactionId = refereeTransactionId;
        this.referrerTransactionId = referrerTransactionId;
        this.status = ReferralStatus.COMPLETED;
        this.completedAt = now;
    }
}
