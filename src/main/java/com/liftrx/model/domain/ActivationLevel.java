package com.liftrx.model.domain;

/**
 * 肌群覆盖等级，只允许 SECONDARY -> PRIMARY 单向升级
 */
public enum ActivationLevel {
    SECONDARY("secondary"),
    PRIMARY("primary");

    private final String code;

    ActivationLevel(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }
}
