package com.liftrx.service.analysis;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.liftrx.mapper.WorkoutActivationMapper;
import com.liftrx.model.domain.RecoveryWindows;
import com.liftrx.model.entity.WorkoutActivation;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.*;

/**
 * 恢复窗口解析
 * 按训练完成时间把刺激过的肌群分入 24 小时 / 48 小时窗口，更早的训练忽略
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RecoveryWindowResolver {

    private static final Duration WINDOW_24H = Duration.ofHours(24);
    private static final Duration WINDOW_48H = Duration.ofHours(48);

    private final WorkoutActivationMapper workoutActivationMapper;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public RecoveryWindows resolve(List<String> recentWorkoutIds) {
        if (recentWorkoutIds == null || recentWorkoutIds.isEmpty()) {
            return RecoveryWindows.none();
        }

        LocalDateTime now = LocalDateTime.now(clock);
        Set<String> last24h = new LinkedHashSet<>();
        Set<String> last48h = new LinkedHashSet<>();

        for (WorkoutActivation workout : workoutActivationMapper.selectByWorkoutIds(recentWorkoutIds)) {
            if (workout.getCompletedAt() == null) {
                log.warn("训练记录缺少完成时间, workoutId={}", workout.getWorkoutId());
                continue;
            }
            Duration elapsed = Duration.between(workout.getCompletedAt(), now);
            Set<String> target;
            if (elapsed.compareTo(WINDOW_24H) < 0) {
                target = last24h;
            } else if (elapsed.compareTo(WINDOW_48H) < 0) {
                target = last48h;
            } else {
                continue;
            }
            parseActivations(workout).forEach((muscle, activation) -> {
                if (activation != null && activation > 0) {
                    target.add(muscle);
                }
            });
        }

        log.debug("恢复窗口: 24h={}, 48h={}", last24h, last48h);
        return new RecoveryWindows(last24h, last48h);
    }

    private Map<String, Integer> parseActivations(WorkoutActivation workout) {
        String json = workout.getMuscleActivations();
        if (json == null || json.isBlank()) {
            return Collections.emptyMap();
        }
        try {
            return objectMapper.readValue(json, new TypeReference<LinkedHashMap<String, Integer>>() {
            });
        } catch (JsonProcessingException e) {
            log.error("解析肌群激活数据失败, workoutId={}", workout.getWorkoutId(), e);
            return Collections.emptyMap();
        }
    }
}
