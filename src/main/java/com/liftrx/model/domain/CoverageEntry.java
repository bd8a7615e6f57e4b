package com.liftrx.model.domain;

/**
 * 单个肌群的覆盖情况快照
 */
public record CoverageEntry(String muscleId, String name, ActivationLevel activationLevel, int totalSets) {
}
