package com.liftrx.service.solver;

/**
 * 打分权重，各项可独立调整
 * 恢复惩罚为负数
 */
public record ScoringWeights(
        double goalAlignment,
        double compoundPreference,
        double recoveryPenalty24h,
        double recoveryPenalty48h,
        double fitnessLevelMatch,
        double muscleCoverageGap) {

    public static ScoringWeights defaults() {
        return new ScoringWeights(10, 5, -20, -10, 5, 15);
    }
}
