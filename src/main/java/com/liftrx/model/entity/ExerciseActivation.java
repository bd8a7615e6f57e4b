package com.liftrx.model.entity;

import lombok.Data;

/**
 * 动作-肌群激活度 (exercise_activations 表)
 */
@Data
public class ExerciseActivation {
    private String exerciseId;
    private String muscleId;

    /**
     * 激活度 (0-100)
     */
    private Integer activation;
}
