package com.liftrx.service.solver;

import com.liftrx.common.PrescriptionConstants;
import com.liftrx.model.domain.Exercise;
import com.liftrx.model.domain.PrescriptionRequest;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * 硬过滤：场地、器械、排除动作、排除肌群
 * 无副作用，保持输入顺序
 */
@Component
public class HardFilter {

    public List<Exercise> filter(List<Exercise> exercises, PrescriptionRequest request) {
        return exercises.stream()
                .filter(e -> passes(e, request))
                .toList();
    }

    public boolean passes(Exercise exercise, PrescriptionRequest request) {
        return fitsVenue(exercise, request)
                && !request.excludedExercises().contains(exercise.id())
                && !touchesExcludedMuscle(exercise, request);
    }

    /**
     * 场地与器械条件
     */
    public boolean fitsVenue(Exercise exercise, PrescriptionRequest request) {
        if (!exercise.locations().contains(request.location())) {
            return false;
        }
        // 健身房视为器械齐全
        if (PrescriptionConstants.isFullEquipmentLocation(request.location())) {
            return true;
        }
        return request.equipment().containsAll(exercise.equipmentRequired());
    }

    private boolean touchesExcludedMuscle(Exercise exercise, PrescriptionRequest request) {
        for (String muscle : request.excludedMuscles()) {
            if (exercise.isPrimary(muscle)
                    || exercise.activationOf(muscle) > PrescriptionConstants.EXCLUDED_MUSCLE_ACTIVATION_LIMIT) {
                return true;
            }
        }
        return false;
    }
}
