package com.homepage.api.model;

import lombok.Getter;
import lombok.ToString;

/**
 * Grandfather-father-son thresholds: number of day, ISO week and month buckets to keep.
 */
@Getter
@ToString
public class RetentionPolicy {

    private final int days;
    private final int weeks;
    private final int months;

    public RetentionPolicy(int days, int weeks, int months) {
        this.days = Math.max(0, days);
        this.weeks = Math.max(0, weeks);
        this.months = Math.max(0, months);
    }
}
