package com.liftrx.service.solver;

import com.liftrx.model.domain.Exercise;
import com.liftrx.model.domain.FitnessLevel;
import com.liftrx.model.domain.Goal;
import com.liftrx.model.domain.PrescriptionRequest;
import com.liftrx.model.domain.Range;
import com.liftrx.model.domain.RecoveryWindows;
import org.springframework.stereotype.Component;

/**
 * 动作打分
 * 总分 = 目标契合 + 复合动作 + 恢复惩罚 + 水平匹配 + 覆盖缺口
 * 前四项在一次求解内不变 (基础分)，覆盖缺口随已选动作变化
 */
@Component
public class ExerciseScorer {

    private static final double OVER_DIFFICULTY_PENALTY = 5.0;

    private final ScoringWeights weights;

    public ExerciseScorer(ScoringWeights weights) {
        this.weights = weights;
    }

    public ScoringWeights getWeights() {
        return weights;
    }

    public double score(Exercise exercise, PrescriptionRequest request, MuscleCoverage coverage, RecoveryWindows recovery) {
        return baseScore(exercise, request, recovery) + coverageGapScore(exercise, coverage);
    }

    public double baseScore(Exercise exercise, PrescriptionRequest request, RecoveryWindows recovery) {
        return goalAlignment(exercise, request)
                + (exercise.compound() ? weights.compoundPreference() : 0)
                + recoveryPenalty(exercise, recovery)
                + fitnessMatch(exercise, request.fitnessLevel());
    }

    public double coverageGapScore(Exercise exercise, MuscleCoverage coverage) {
        long uncovered = exercise.activatedMuscles().stream()
                .filter(m -> !coverage.contains(m))
                .count();
        return gapScore(uncovered);
    }

    double gapScore(long uncoveredMuscles) {
        return uncoveredMuscles * weights.muscleCoverageGap();
    }

    double goalAlignment(Exercise exercise, PrescriptionRequest request) {
        double score = 0;
        for (Goal goal : request.goals()) {
            if (goal.prefers(exercise.movementPattern())) {
                score += weights.goalAlignment();
            }
            if (goal.isPrefersCompound() && exercise.compound()) {
                score += weights.goalAlignment() / 2;
            }
        }
        return score;
    }

    /**
     * 按肌群逐个累计，疲劳肌群越多惩罚越大
     */
    double recoveryPenalty(Exercise exercise, RecoveryWindows recovery) {
        double penalty = 0;
        for (String muscle : exercise.activatedMuscles()) {
            if (recovery.last24h().contains(muscle)) {
                penalty += weights.recoveryPenalty24h();
            } else if (recovery.last48h().contains(muscle)) {
                penalty += weights.recoveryPenalty48h();
            }
        }
        return penalty;
    }

    double fitnessMatch(Exercise exercise, FitnessLevel level) {
        if (level == null) {
            return 0;
        }
        Range band = level.getDifficultyBand();
        if (band.contains(exercise.difficulty())) {
            return weights.fitnessLevelMatch();
        }
        if (exercise.difficulty() > band.max()) {
            return -OVER_DIFFICULTY_PENALTY * (exercise.difficulty() - band.max());
        }
        return 0;
    }
}
