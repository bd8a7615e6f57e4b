package com.liftrx.model.entity;

import lombok.Data;

import java.time.LocalDateTime;

/**
 * 已完成训练的肌群刺激记录 (workouts 表投影)
 */
@Data
public class WorkoutActivation {
    private String workoutId;

    /**
     * 训练完成时间 (UTC)
     */
    private LocalDateTime completedAt;

    /**
     * 肌群激活 JSON (如 {"chest": 80, "triceps": 45})
     */
    private String muscleActivations;
}
