package com.liftrx.model.domain;

import java.util.Arrays;
import java.util.EnumSet;
import java.util.Set;

import static com.liftrx.model.domain.MovementPattern.*;

/**
 * 训练目标及其处方参数
 * 偏好动作模式 / 是否偏好复合动作 / 组数区间 / 次数区间 / 休息时长系数
 */
public enum Goal {
    STRENGTH("strength", EnumSet.of(SQUAT, HINGE, PUSH, PULL), true,
            new Range(4, 6), new Range(3, 5), 1.5),
    HYPERTROPHY("hypertrophy", EnumSet.of(PUSH, PULL, SQUAT, HINGE), true,
            new Range(3, 5), new Range(8, 12), 1.0),
    ENDURANCE("endurance", EnumSet.of(PUSH, PULL, SQUAT, CORE), false,
            new Range(2, 3), new Range(15, 25), 0.5),
    MOBILITY("mobility", EnumSet.of(CORE, HINGE, SQUAT), false,
            new Range(2, 3), new Range(10, 15), 0.75),
    FAT_LOSS("fat_loss", EnumSet.of(SQUAT, HINGE, PUSH, PULL), true,
            new Range(3, 4), new Range(12, 16), 0.6);

    private final String code;
    private final Set<MovementPattern> preferredPatterns;
    private final boolean prefersCompound;
    private final Range sets;
    private final Range reps;
    private final double restMultiplier;

    Goal(String code, Set<MovementPattern> preferredPatterns, boolean prefersCompound,
         Range sets, Range reps, double restMultiplier) {
        this.code = code;
        this.preferredPatterns = preferredPatterns;
        this.prefersCompound = prefersCompound;
        this.sets = sets;
        this.reps = reps;
        this.restMultiplier = restMultiplier;
    }

    public String getCode() {
        return code;
    }

    public boolean prefers(MovementPattern pattern) {
        return preferredPatterns.contains(pattern);
    }

    public boolean isPrefersCompound() {
        return prefersCompound;
    }

    public Range getSets() {
        return sets;
    }

    public Range getReps() {
        return reps;
    }

    public double getRestMultiplier() {
        return restMultiplier;
    }

    public static Goal fromCode(String code) {
        return Arrays.stream(values())
                .filter(g -> g.code.equalsIgnoreCase(code))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("未知训练目标: " + code));
    }
}
