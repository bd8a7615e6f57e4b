package com.liftrx.service.analysis;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.liftrx.mapper.WorkoutActivationMapper;
import com.liftrx.model.domain.RecoveryWindows;
import com.liftrx.model.entity.WorkoutActivation;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.*;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.*;

class RecoveryWindowResolverTest {

    private static final Instant NOW = Instant.parse("2026-03-10T12:00:00Z");

    private WorkoutActivationMapper mapper;
    private RecoveryWindowResolver resolver;

    @BeforeEach
    void setUp() {
        mapper = mock(WorkoutActivationMapper.class);
        resolver = new RecoveryWindowResolver(mapper, new ObjectMapper(), Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private WorkoutActivation workout(String id, Duration ago, String activations) {
        WorkoutActivation row = new WorkoutActivation();
        row.setWorkoutId(id);
        row.setCompletedAt(LocalDateTime.ofInstant(NOW.minus(ago), ZoneOffset.UTC));
        row.setMuscleActivations(activations);
        return row;
    }

    @Test
    void bucketsMusclesByWorkoutAge() {
        when(mapper.selectByWorkoutIds(anyList())).thenReturn(List.of(
                workout("w1", Duration.ofHours(10), "{\"chest\": 80, \"triceps\": 0}"),
                workout("w2", Duration.ofHours(30), "{\"lats\": 70, \"chest\": 50}"),
                workout("w3", Duration.ofHours(50), "{\"quads\": 90}")));

        RecoveryWindows windows = resolver.resolve(List.of("w1", "w2", "w3"));

        assertThat(windows.last24h()).containsExactly("chest");
        assertThat(windows.last48h()).containsExactly("lats");
    }

    @Test
    void exactly24HoursFallsIntoSecondWindow() {
        when(mapper.selectByWorkoutIds(anyList())).thenReturn(List.of(
                workout("w1", Duration.ofHours(24), "{\"glutes\": 60}"),
                workout("w2", Duration.ofHours(48), "{\"abs\": 60}")));

        RecoveryWindows windows = resolver.resolve(List.of("w1", "w2"));

        assertThat(windows.last24h()).isEmpty();
        assertThat(windows.last48h()).containsExactly("glutes");
    }

    @Test
    void emptyInputSkipsDataLayer() {
        assertThat(resolver.resolve(List.of())).isEqualTo(RecoveryWindows.none());
        assertThat(resolver.resolve(null).isEmpty()).isTrue();
        verifyNoInteractions(mapper);
    }

    @Test
    void malformedOrMissingDataIsSkipped() {
        WorkoutActivation noTime = workout("w3", Duration.ofHours(1), "{\"biceps\": 40}");
        noTime.setCompletedAt(null);
        when(mapper.selectByWorkoutIds(anyList())).thenReturn(List.of(
                workout("w1", Duration.ofHours(2), "not-json"),
                workout("w2", Duration.ofHours(3), null),
                noTime,
                workout("w4", Duration.ofHours(5), "{\"calves\": 35}")));

        RecoveryWindows windows = resolver.resolve(List.of("w1", "w2", "w3", "w4"));

        assertThat(windows.last24h()).containsExactly("calves");
        assertThat(windows.last48h()).isEmpty();
    }
}
