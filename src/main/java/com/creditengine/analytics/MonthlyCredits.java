package com.creditengine.analytics;

/**
 * Credits earned and spent in one UTC calendar month ("yyyy-MM").
 */
public record MonthlyCredits(String month, long earned, long spent) {
}
