package com.liftrx.model.vo;

import lombok.Data;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

/**
 * 训练处方结果
 */
@Data
public class PrescriptionResultVO {

    private List<ExerciseItem> exercises;

    /**
     * 肌群ID -> 覆盖情况
     */
    private Map<String, CoverageItem> coverage;

    /**
     * 动作部分实际耗时 (秒，不含热身放松)
     */
    private Integer actualDurationSeconds;

    /**
     * 动作ID -> 可替代动作
     */
    private Map<String, List<ExerciseItem>> substitutions;

    /**
     * 训练平衡提示 (仅供参考)
     */
    private List<String> balanceIssues;

    private String backend;
    private LocalDateTime generatedAt;

    @Data
    public static class ExerciseItem {
        private String exerciseId;
        private String name;
        private Integer sets;
        private String reps;
        private Integer restSeconds;
        private Integer estimatedSeconds;
        private List<String> primaryMuscles;
        private List<String> secondaryMuscles;
        private String notes;

        /**
         * 动作模式编码 (push/pull/squat/hinge/carry/core/isolation)
         */
        private String movementPattern;
    }

    @Data
    public static class CoverageItem {
        private String name;

        /**
         * primary / secondary
         */
        private String activationLevel;
        private Integer totalSets;
    }
}
