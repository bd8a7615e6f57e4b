package com.liftrx.model.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

import java.util.List;

/**
 * 训练处方请求
 */
@Data
public class PrescriptionRequestDTO {

    /**
     * 可用训练时长 (分钟, 15-120)
     */
    @NotNull(message = "训练时长不能为空")
    @Min(value = 15, message = "训练时长不能少于15分钟")
    @Max(value = 120, message = "训练时长不能超过120分钟")
    private Integer timeAvailable;

    /**
     * 训练场地 (gym/home/park/hotel/office/travel)
     *
     * @see com.liftrx.common.PrescriptionConstants
     */
    @NotBlank(message = "训练场地不能为空")
    private String location;

    /**
     * 可用器械，如 ["dumbbell", "bench"]
     */
    private List<String> equipment;

    /**
     * 训练目标，第一个为主目标
     * 如: ["strength", "hypertrophy"]
     */
    private List<String> goals;

    /**
     * 训练水平 (beginner/intermediate/advanced)，可为空
     */
    private String fitnessLevel;

    private List<String> excludedExercises;
    private List<String> excludedMuscles;

    /**
     * 近期训练ID，用于计算恢复窗口
     */
    private List<String> recentWorkoutIds;
}
