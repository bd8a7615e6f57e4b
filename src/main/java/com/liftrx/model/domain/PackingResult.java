package com.liftrx.model.domain;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 一次求解的输出
 *
 * @param coverage      肌群ID -> 覆盖情况，按首次覆盖顺序
 * @param substitutions 动作ID -> 可替代动作
 */
public record PackingResult(
        List<PrescribedExercise> exercises,
        Map<String, CoverageEntry> coverage,
        int actualDurationSeconds,
        Map<String, List<PrescribedExercise>> substitutions,
        List<BalanceIssue> balanceIssues,
        String backend) {

    public PackingResult {
        exercises = exercises == null ? List.of() : List.copyOf(exercises);
        coverage = coverage == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(coverage));
        substitutions = substitutions == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(substitutions));
        balanceIssues = balanceIssues == null ? List.of() : List.copyOf(balanceIssues);
    }

    public static PackingResult empty(String backend) {
        return new PackingResult(List.of(), Map.of(), 0, Map.of(), List.of(), backend);
    }

    public boolean isEmpty() {
        return exercises.isEmpty();
    }
}
