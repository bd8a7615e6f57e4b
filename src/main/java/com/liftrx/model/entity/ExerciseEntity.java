package com.liftrx.model.entity;

import lombok.Data;

/**
 * 动作库实体 (exercises 表)
 */
@Data
public class ExerciseEntity {
    private String id;
    private String name;

    /**
     * 难度 (1-5)
     */
    private Integer difficulty;

    /**
     * 动作模式编码 (push/pull/squat/hinge/carry/core/isolation)
     */
    private String movementPattern;

    private Boolean isCompound;

    /**
     * 可用场地 JSON (如 ["gym", "home"])
     */
    private String locations;

    /**
     * 必需器械 JSON (如 ["barbell", "bench"])
     */
    private String equipmentRequired;

    private String equipmentOptional;

    /**
     * 显式标记的主练肌群 JSON
     */
    private String primaryMuscles;

    /**
     * 组间休息基准 (秒)
     */
    private Integer restSeconds;
}
