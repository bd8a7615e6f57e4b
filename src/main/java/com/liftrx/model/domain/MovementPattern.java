package com.liftrx.model.domain;

import java.util.Arrays;

/**
 * 动作模式
 */
public enum MovementPattern {
    PUSH("push"),
    PULL("pull"),
    SQUAT("squat"),
    HINGE("hinge"),
    CARRY("carry"),
    CORE("core"),
    ISOLATION("isolation");

    private final String code;

    MovementPattern(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    /**
     * 上肢模式 (推/拉)
     */
    public boolean isUpperBody() {
        return this == PUSH || this == PULL;
    }

    /**
     * 下肢模式 (蹲/髋铰链)
     */
    public boolean isLowerBody() {
        return this == SQUAT || this == HINGE;
    }

    public static MovementPattern fromCode(String code) {
        return Arrays.stream(values())
                .filter(p -> p.code.equalsIgnoreCase(code))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("未知动作模式: " + code));
    }
}
