package com.liftrx.model.domain;

import lombok.Builder;

import java.util.List;

/**
 * 处方中的单个动作 (创建后不可变)
 *
 * @param reps        次数标记，数值型如 "10"
 * @param restSeconds 已乘以目标休息系数的组间休息
 */
@Builder
public record PrescribedExercise(
        String exerciseId,
        String name,
        int sets,
        String reps,
        int restSeconds,
        int estimatedSeconds,
        List<String> primaryMuscles,
        List<String> secondaryMuscles,
        String notes,
        MovementPattern movementPattern) {

    public PrescribedExercise {
        primaryMuscles = primaryMuscles == null ? List.of() : List.copyOf(primaryMuscles);
        secondaryMuscles = secondaryMuscles == null ? List.of() : List.copyOf(secondaryMuscles);
    }
}
