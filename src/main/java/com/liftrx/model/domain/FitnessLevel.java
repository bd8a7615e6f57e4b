package com.liftrx.model.domain;

import java.util.Arrays;

/**
 * 训练水平及其适配的动作难度区间
 */
public enum FitnessLevel {
    BEGINNER("beginner", new Range(1, 2)),
    INTERMEDIATE("intermediate", new Range(2, 3)),
    ADVANCED("advanced", new Range(3, 5));

    private final String code;
    private final Range difficultyBand;

    FitnessLevel(String code, Range difficultyBand) {
        this.code = code;
        this.difficultyBand = difficultyBand;
    }

    public String getCode() {
        return code;
    }

    public Range getDifficultyBand() {
        return difficultyBand;
    }

    public static FitnessLevel fromCode(String code) {
        return Arrays.stream(values())
                .filter(l -> l.code.equalsIgnoreCase(code))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("未知训练水平: " + code));
    }
}
