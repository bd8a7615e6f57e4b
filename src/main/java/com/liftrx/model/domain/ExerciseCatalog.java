package com.liftrx.model.domain;

import java.time.LocalDateTime;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 动作库快照：全部动作 + 肌群名称
 */
public record ExerciseCatalog(List<Exercise> exercises, Map<String, String> muscleNames, LocalDateTime loadedAt) {

    public ExerciseCatalog {
        exercises = exercises == null ? List.of() : List.copyOf(exercises);
        muscleNames = muscleNames == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(muscleNames));
    }

    public static ExerciseCatalog of(List<Exercise> exercises, Map<String, String> muscleNames) {
        return new ExerciseCatalog(exercises, muscleNames, null);
    }

    public String muscleName(String muscleId) {
        return muscleNames.getOrDefault(muscleId, muscleId);
    }

    public boolean isEmpty() {
        return exercises.isEmpty();
    }
}
