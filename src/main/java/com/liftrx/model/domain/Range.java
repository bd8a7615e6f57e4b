package com.liftrx.model.domain;

/**
 * 闭区间 [min, max]
 */
public record Range(int min, int max) {

    public Range {
        if (min > max) {
            throw new IllegalArgumentException("区间下限大于上限: " + min + " > " + max);
        }
    }

    public boolean contains(int value) {
        return value >= min && value <= max;
    }

    /**
     * 区间中点，向下取整
     */
    public int midpoint() {
        return (min + max) / 2;
    }
}
