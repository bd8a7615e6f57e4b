package com.liftrx.service.catalog;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.liftrx.mapper.ExerciseMapper;
import com.liftrx.mapper.MuscleMapper;
import com.liftrx.model.domain.Exercise;
import com.liftrx.model.domain.MovementPattern;
import com.liftrx.model.entity.ExerciseActivation;
import com.liftrx.model.entity.ExerciseEntity;
import com.liftrx.model.entity.MuscleEntity;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

import java.util.*;

/**
 * 基于 MyBatis 的动作库加载
 * 动作表与激活度表分两次查询，在内存中组装
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class MybatisExerciseCatalogLoader implements ExerciseCatalogLoader {

    private static final int DEFAULT_DIFFICULTY = 2;
    private static final int DEFAULT_REST_SECONDS = 60;

    private final ExerciseMapper exerciseMapper;
    private final MuscleMapper muscleMapper;
    private final ObjectMapper objectMapper;

    @Override
    public List<Exercise> getAllExercises() {
        List<ExerciseEntity> rows = exerciseMapper.selectAll();
        Map<String, Map<String, Integer>> activations = groupActivations(exerciseMapper.selectAllActivations());

        List<Exercise> exercises = new ArrayList<>(rows.size());
        for (ExerciseEntity row : rows) {
            exercises.add(toDomain(row, activations.getOrDefault(row.getId(), Collections.emptyMap())));
        }
        log.info("动作库加载完成, 动作数={}, 含激活数据={}", exercises.size(), activations.size());
        return exercises;
    }

    @Override
    public Map<String, String> getMuscleNames() {
        Map<String, String> names = new LinkedHashMap<>();
        for (MuscleEntity muscle : muscleMapper.selectAll()) {
            names.put(muscle.getId(), StringUtils.defaultIfBlank(muscle.getName(), muscle.getId()));
        }
        return names;
    }

    private Map<String, Map<String, Integer>> groupActivations(List<ExerciseActivation> rows) {
        Map<String, Map<String, Integer>> grouped = new HashMap<>();
        for (ExerciseActivation row : rows) {
            if (row.getActivation() == null) {
                continue;
            }
            grouped.computeIfAbsent(row.getExerciseId(), k -> new LinkedHashMap<>())
                    .put(row.getMuscleId(), row.getActivation());
        }
        return grouped;
    }

    private Exercise toDomain(ExerciseEntity row, Map<String, Integer> activations) {
        return Exercise.builder()
                .id(row.getId())
                .name(row.getName())
                .difficulty(row.getDifficulty() != null ? row.getDifficulty() : DEFAULT_DIFFICULTY)
                .movementPattern(parsePattern(row))
                .compound(Boolean.TRUE.equals(row.getIsCompound()))
                .locations(new LinkedHashSet<>(fromJson(row.getLocations())))
                .equipmentRequired(new LinkedHashSet<>(fromJson(row.getEquipmentRequired())))
                .equipmentOptional(new LinkedHashSet<>(fromJson(row.getEquipmentOptional())))
                .restSeconds(row.getRestSeconds() != null ? row.getRestSeconds() : DEFAULT_REST_SECONDS)
                .activations(activations)
                .primaryMuscles(fromJson(row.getPrimaryMuscles()))
                .build();
    }

    private MovementPattern parsePattern(ExerciseEntity row) {
        if (StringUtils.isBlank(row.getMovementPattern())) {
            return null;
        }
        try {
            return MovementPattern.fromCode(row.getMovementPattern());
        } catch (IllegalArgumentException e) {
            log.warn("动作 {} 的动作模式无法识别: {}", row.getId(), row.getMovementPattern());
            return null;
        }
    }

    /**
     * JSON 数组 -> List，格式错误按空处理
     */
    private List<String> fromJson(String json) {
        if (json == null || json.isBlank()) {
            return Collections.emptyList();
        }
        try {
            return objectMapper.readValue(json, new TypeReference<List<String>>() {
            });
        } catch (JsonProcessingException e) {
            log.error("解析JSON数组失败: {}", json, e);
            return Collections.emptyList();
        }
    }
}
