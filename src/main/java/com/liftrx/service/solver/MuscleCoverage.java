package com.liftrx.service.solver;

import com.liftrx.model.domain.ActivationLevel;
import com.liftrx.model.domain.CoverageEntry;

import java.util.*;

/**
 * 单次求解内的肌群覆盖累加器
 * 肌群一旦进入即不再移除，等级只升不降
 */
public class MuscleCoverage {

    private final Map<String, String> muscleNames;
    private final Map<String, Slot> slots = new LinkedHashMap<>();

    public MuscleCoverage(Map<String, String> muscleNames) {
        this.muscleNames = muscleNames == null ? Map.of() : muscleNames;
    }

    public boolean contains(String muscleId) {
        return slots.containsKey(muscleId);
    }

    public int size() {
        return slots.size();
    }

    public Optional<CoverageEntry> get(String muscleId) {
        Slot slot = slots.get(muscleId);
        return slot == null ? Optional.empty() : Optional.of(slot.toEntry(muscleId));
    }

    public Map<String, CoverageEntry> snapshot() {
        Map<String, CoverageEntry> copy = new LinkedHashMap<>();
        slots.forEach((id, slot) -> copy.put(id, slot.toEntry(id)));
        return copy;
    }

    void insert(String muscleId, ActivationLevel level, int sets) {
        slots.put(muscleId, new Slot(muscleNames.getOrDefault(muscleId, muscleId), level, sets));
    }

    void accumulate(String muscleId, int sets, boolean promote) {
        Slot slot = slots.get(muscleId);
        slot.totalSets += sets;
        if (promote) {
            slot.level = ActivationLevel.PRIMARY;
        }
    }

    private static final class Slot {
        private final String name;
        private ActivationLevel level;
        private int totalSets;

        private Slot(String name, ActivationLevel level, int totalSets) {
            this.name = name;
            this.level = level;
            this.totalSets = totalSets;
        }

        private CoverageEntry toEntry(String muscleId) {
            return new CoverageEntry(muscleId, name, level, totalSets);
        }
    }
}
