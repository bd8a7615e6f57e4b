package com.liftrx.model.domain;

import com.liftrx.common.PrescriptionConstants;
import lombok.Builder;

import java.util.*;

/**
 * 动作库中的动作 (单次求解内不可变)
 *
 * @param activations    肌群ID -> 激活度 (0-100)，保持动作库中的顺序
 * @param primaryMuscles 动作库中显式标记的主练肌群；构造时会补入激活度达到阈值的肌群
 */
@Builder(toBuilder = true)
public record Exercise(
        String id,
        String name,
        int difficulty,
        MovementPattern movementPattern,
        boolean compound,
        Set<String> locations,
        Set<String> equipmentRequired,
        Set<String> equipmentOptional,
        int restSeconds,
        Map<String, Integer> activations,
        List<String> primaryMuscles) {

    public Exercise {
        Objects.requireNonNull(id, "exercise id");
        locations = immutableSet(locations);
        equipmentRequired = immutableSet(equipmentRequired);
        equipmentOptional = immutableSet(equipmentOptional);
        activations = copyActivations(activations);
        primaryMuscles = derivePrimaryMuscles(activations, primaryMuscles);
    }

    public int activationOf(String muscleId) {
        return activations.getOrDefault(muscleId, 0);
    }

    /**
     * 激活度大于0即视为参与
     */
    public boolean activates(String muscleId) {
        return activationOf(muscleId) > 0;
    }

    public List<String> activatedMuscles() {
        return activations.entrySet().stream()
                .filter(e -> e.getValue() != null && e.getValue() > 0)
                .map(Map.Entry::getKey)
                .toList();
    }

    public boolean isPrimary(String muscleId) {
        return primaryMuscles.contains(muscleId);
    }

    public List<String> secondaryMuscles() {
        return activatedMuscles().stream()
                .filter(m -> !isPrimary(m))
                .toList();
    }

    public boolean requiresEquipment() {
        return !equipmentRequired.isEmpty();
    }

    private static Set<String> immutableSet(Set<String> source) {
        return source == null
                ? Collections.emptySet()
                : Collections.unmodifiableSet(new LinkedHashSet<>(source));
    }

    /**
     * 缺失激活度的条目直接丢弃，查询时按 0 处理
     */
    private static Map<String, Integer> copyActivations(Map<String, Integer> source) {
        if (source == null) {
            return Collections.emptyMap();
        }
        Map<String, Integer> copy = new LinkedHashMap<>();
        source.forEach((muscle, activation) -> {
            if (muscle != null && activation != null) {
                copy.put(muscle, activation);
            }
        });
        return Collections.unmodifiableMap(copy);
    }

    private static List<String> derivePrimaryMuscles(Map<String, Integer> activations, List<String> flagged) {
        Set<String> flaggedSet = flagged == null ? Collections.emptySet() : new HashSet<>(flagged);
        LinkedHashSet<String> primary = new LinkedHashSet<>();
        activations.forEach((muscle, activation) -> {
            if (flaggedSet.contains(muscle)
                    || (activation != null && activation >= PrescriptionConstants.PRIMARY_ACTIVATION_THRESHOLD)) {
                primary.add(muscle);
            }
        });
        // 显式标记但不在激活表中的肌群追加在末尾
        if (flagged != null) {
            primary.addAll(flagged);
        }
        return List.copyOf(primary);
    }
}
