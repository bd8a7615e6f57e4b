package com.liftrx.service.solver;

import com.liftrx.model.domain.Exercise;
import com.liftrx.model.domain.PrescriptionRequest;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static com.liftrx.support.TestExercises.*;
import static org.assertj.core.api.Assertions.assertThat;

class SubstitutionFinderTest {

    private final SubstitutionFinder finder = new SubstitutionFinder(new HardFilter());

    private List<String> ids(List<Exercise> exercises) {
        return exercises.stream().map(Exercise::id).toList();
    }

    @Test
    void findsExercisesSharingPrimaryMuscleInCatalogOrder() {
        PrescriptionRequest gym = request("gym", 45).build();

        assertThat(ids(finder.findSubstitutions(gobletSquat(), all(), gym, 3)))
                .containsExactly("back_squat", "romanian_deadlift");
    }

    @Test
    void respectsLimit() {
        PrescriptionRequest gym = request("gym", 45).build();

        assertThat(ids(finder.findSubstitutions(gobletSquat(), all(), gym, 1))).containsExactly("back_squat");
        assertThat(finder.findSubstitutions(gobletSquat(), all(), gym, 0)).isEmpty();
    }

    @Test
    void onlyOffersExercisesAvailableAtVenue() {
        PrescriptionRequest home = request("home", 45).equipment(Set.of("dumbbell")).build();

        // 杠铃深蹲只在健身房，引体向上缺少单杠
        assertThat(finder.findSubstitutions(gobletSquat(), all(), home, 3)).isEmpty();
        assertThat(finder.findSubstitutions(dumbbellRow(), all(), home, 3)).isEmpty();

        PrescriptionRequest withBar = request("home", 45).equipment(Set.of("dumbbell", "pullup_bar")).build();
        assertThat(ids(finder.findSubstitutions(dumbbellRow(), all(), withBar, 3))).containsExactly("pull_up");
    }

    @Test
    void excludedExerciseIsNotOffered() {
        PrescriptionRequest gym = request("gym", 45).excludedExercises(Set.of("pull_up")).build();

        assertThat(finder.findSubstitutions(dumbbellRow(), all(), gym, 3)).isEmpty();
    }

    @Test
    void exerciseLoadingExcludedMuscleIsNotOffered() {
        // 罗马尼亚硬拉竖脊肌激活 50 > 40
        PrescriptionRequest gym = request("gym", 45).excludedMuscles(Set.of("lower_back")).build();

        assertThat(ids(finder.findSubstitutions(gobletSquat(), all(), gym, 3))).containsExactly("back_squat");
    }

    @Test
    void neverReturnsTheExerciseItself() {
        PrescriptionRequest gym = request("gym", 45).build();

        assertThat(ids(finder.findSubstitutions(pushUp(), all(), gym, 3))).isEmpty();
    }
}
