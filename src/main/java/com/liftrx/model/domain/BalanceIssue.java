package com.liftrx.model.domain;

/**
 * 训练平衡诊断结果 (仅提示，不影响选择)
 */
public record BalanceIssue(Type type, int dominant, int opposite, String message) {

    public enum Type {
        PUSH_DOMINANT,
        PULL_DOMINANT,
        UPPER_DOMINANT,
        LOWER_DOMINANT
    }
}
