package com.liftrx.service.solver;

import com.liftrx.service.analysis.BalanceDiagnostic;

/**
 * 各后端共用的求解组件
 */
public record SolverComponents(
        HardFilter hardFilter,
        ExerciseScorer scorer,
        TimeEstimator timeEstimator,
        CoverageTracker coverageTracker,
        SubstitutionFinder substitutionFinder,
        VolumePlanner volumePlanner,
        BalanceDiagnostic balanceDiagnostic,
        int substitutionLimit) {
}
