package com.liftrx.service.solver;

import com.liftrx.model.domain.Exercise;
import com.liftrx.model.domain.PrescriptionRequest;
import com.liftrx.model.domain.RecoveryWindows;

import java.util.*;

/**
 * 参考实现：每轮对全部未选动作逐项打分
 */
public class GreedySolverBackend extends AbstractSolverBackend {

    public static final String NAME = "greedy";

    private final ExerciseScorer scorer;

    public GreedySolverBackend(SolverComponents components) {
        super(components);
        this.scorer = components.scorer();
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    protected SelectionState openState(List<Exercise> eligible, PrescriptionRequest request, RecoveryWindows recovery) {
        Set<String> selectedIds = new HashSet<>();
        return new SelectionState() {
            @Override
            public List<Exercise> rankRemaining(MuscleCoverage coverage) {
                List<Scored> scored = new ArrayList<>();
                for (Exercise exercise : eligible) {
                    if (!selectedIds.contains(exercise.id())) {
                        scored.add(new Scored(exercise, scorer.score(exercise, request, coverage, recovery)));
                    }
                }
                // List.sort 为稳定排序，同分保持原顺序
                scored.sort(Comparator.comparingDouble(Scored::score).reversed());
                return scored.stream().map(Scored::exercise).toList();
            }

            @Override
            public void commit(Exercise exercise) {
                selectedIds.add(exercise.id());
            }
        };
    }

    private record Scored(Exercise exercise, double score) {
    }
}
