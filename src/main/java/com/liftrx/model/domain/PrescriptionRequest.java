package com.liftrx.model.domain;

import lombok.Builder;

import java.util.*;

/**
 * 求解请求 (已通过接口层校验)
 * 可选列表为 null 时按空处理
 */
@Builder(toBuilder = true)
public record PrescriptionRequest(
        int timeAvailable,
        String location,
        Set<String> equipment,
        List<Goal> goals,
        FitnessLevel fitnessLevel,
        Set<String> excludedExercises,
        Set<String> excludedMuscles,
        List<String> recentWorkoutIds) {

    public PrescriptionRequest {
        equipment = equipment == null ? Set.of() : Collections.unmodifiableSet(new LinkedHashSet<>(equipment));
        goals = goals == null ? List.of() : List.copyOf(goals);
        excludedExercises = excludedExercises == null ? Set.of() : Set.copyOf(excludedExercises);
        excludedMuscles = excludedMuscles == null ? Set.of() : Set.copyOf(excludedMuscles);
        recentWorkoutIds = recentWorkoutIds == null ? List.of() : List.copyOf(recentWorkoutIds);
    }

    public Optional<Goal> primaryGoal() {
        return goals.isEmpty() ? Optional.empty() : Optional.of(goals.get(0));
    }
}
