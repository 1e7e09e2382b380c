package com.creditengine.analytics;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder
public class AnalyticsQuery {
    String userId;

    /**
     * Inclusive bounds on createdAt; null means unbounded.
     */
    Instant from;
    Instant to;

    /**
     * Whether ADMIN_ADD and ADMIN_DEDUCT entries count.
     */
    @Builder.Default
    boolean includeAdmin = true;

    public static AnalyticsQuery forUser(String userId) {
        return AnalyticsQuery.builder().userId(userId).build();
    }
}
