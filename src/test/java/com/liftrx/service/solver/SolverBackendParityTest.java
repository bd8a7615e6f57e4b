package com.liftrx.service.solver;

import com.liftrx.model.domain.*;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static com.liftrx.support.TestExercises.*;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * greedy 与 indexed 在相同输入下输出完全一致
 */
class SolverBackendParityTest {

    private final SolverBackend greedy = new GreedySolverBackend(SolverFixtures.components());
    private final SolverBackend indexed = new IndexedSolverBackend(SolverFixtures.components());

    @Test
    void backendsProduceIdenticalPrescriptions() {
        List<String> locations = List.of("gym", "home", "park", "hotel");
        List<List<Goal>> goalSets = List.of(List.of(), List.of(Goal.STRENGTH), List.of(Goal.HYPERTROPHY, Goal.ENDURANCE),
                List.of(Goal.MOBILITY), List.of(Goal.FAT_LOSS, Goal.STRENGTH));
        List<RecoveryWindows> recoveries = List.of(
                RecoveryWindows.none(),
                new RecoveryWindows(Set.of("chest", "quads"), Set.of("lats")),
                new RecoveryWindows(Set.of(), Set.of("glutes", "biceps", "abs")));
        List<FitnessLevel> levels = new ArrayList<>(List.of(FitnessLevel.values()));
        levels.add(null);

        int compared = 0;
        for (String location : locations) {
            for (List<Goal> goals : goalSets) {
                for (RecoveryWindows recovery : recoveries) {
                    for (FitnessLevel level : levels) {
                        for (int minutes : new int[]{15, 30, 60, 120}) {
                            PrescriptionRequest request = request(location, minutes)
                                    .equipment(Set.of("dumbbell", "pullup_bar"))
                                    .goals(goals)
                                    .fitnessLevel(level)
                                    .build();
                            assertSame(greedy.solve(catalog(), request, recovery),
                                    indexed.solve(catalog(), request, recovery));
                            compared++;
                        }
                    }
                }
            }
        }
        assertThat(compared).isEqualTo(4 * 5 * 3 * 4 * 4);
    }

    private void assertSame(PackingResult expected, PackingResult actual) {
        assertThat(actual.exercises()).isEqualTo(expected.exercises());
        assertThat(actual.coverage()).isEqualTo(expected.coverage());
        assertThat(actual.actualDurationSeconds()).isEqualTo(expected.actualDurationSeconds());
        assertThat(actual.substitutions()).isEqualTo(expected.substitutions());
        assertThat(actual.balanceIssues()).isEqualTo(expected.balanceIssues());
    }
}
