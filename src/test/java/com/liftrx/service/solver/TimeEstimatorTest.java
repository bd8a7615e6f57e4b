package com.liftrx.service.solver;

import com.liftrx.model.domain.Exercise;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static com.liftrx.support.TestExercises.base;
import static org.assertj.core.api.Assertions.assertThat;

class TimeEstimatorTest {

    private final TimeEstimator estimator = new TimeEstimator();

    private final Exercise bodyweight = base("bodyweight").restSeconds(60).build();
    private final Exercise loaded = base("loaded").restSeconds(180).equipmentRequired(Set.of("barbell")).build();

    @Test
    void bodyweightExerciseHasNoSetup() {
        // 0 + 3×30 + 2×60
        assertThat(estimator.estimate(bodyweight, 3, 10, 1.0)).isEqualTo(210);
    }

    @Test
    void equipmentAddsSetupTime() {
        // 30 + 3×15 + 2×180
        assertThat(estimator.estimate(loaded, 3, 5, 1.0)).isEqualTo(435);
    }

    @Test
    void halvingRestMultiplierReducesTime() {
        int full = estimator.estimate(loaded, 3, 5, 1.0);
        int half = estimator.estimate(loaded, 3, 5, 0.5);

        assertThat(half).isLessThan(full).isEqualTo(255);
    }

    @Test
    void singleSetHasNoRest() {
        assertThat(estimator.estimate(bodyweight, 1, 10, 1.0)).isEqualTo(30);
    }

    @Test
    void scaledRestRoundsToNearestSecond() {
        Exercise shortRest = base("short").restSeconds(45).build();

        assertThat(estimator.scaledRest(shortRest, 0.75)).isEqualTo(34);
        assertThat(estimator.scaledRest(shortRest, 1.5)).isEqualTo(68);
    }
}
