package com.liftrx.service.solver;

import com.liftrx.service.analysis.BalanceDiagnostic;

final class SolverFixtures {

    private SolverFixtures() {
    }

    static SolverComponents components(int substitutionLimit) {
        HardFilter hardFilter = new HardFilter();
        return new SolverComponents(hardFilter, new ExerciseScorer(ScoringWeights.defaults()), new TimeEstimator(),
                new CoverageTracker(), new SubstitutionFinder(hardFilter), new VolumePlanner(),
                new BalanceDiagnostic(), substitutionLimit);
    }

    static SolverComponents components() {
        return components(3);
    }
}
