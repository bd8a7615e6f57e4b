package com.liftrx.service.solver;

import com.liftrx.common.PrescriptionConstants;
import com.liftrx.model.domain.Goal;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * 组数/次数/休息系数：取第一个目标的配置，无目标时用默认值
 */
@Component
public class VolumePlanner {

    public SetsReps determineSetsReps(List<Goal> goals) {
        if (goals == null || goals.isEmpty()) {
            return new SetsReps(PrescriptionConstants.DEFAULT_SETS, PrescriptionConstants.DEFAULT_REPS);
        }
        Goal first = goals.get(0);
        return new SetsReps(first.getSets().midpoint(), first.getReps().midpoint());
    }

    public double restMultiplier(List<Goal> goals) {
        if (goals == null || goals.isEmpty()) {
            return PrescriptionConstants.DEFAULT_REST_MULTIPLIER;
        }
        return goals.get(0).getRestMultiplier();
    }

    public record SetsReps(int sets, int reps) {
    }
}
