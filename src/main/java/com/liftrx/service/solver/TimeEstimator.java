package com.liftrx.service.solver;

import com.liftrx.model.domain.Exercise;
import org.springframework.stereotype.Component;

import static com.liftrx.common.PrescriptionConstants.EQUIPMENT_SETUP_SECONDS;
import static com.liftrx.common.PrescriptionConstants.REP_DURATION_SECONDS;

/**
 * 动作耗时估算 (纯函数)
 * 耗时 = 器械准备 + 组数 × 次数 × 3秒 + (组数-1) × 休息
 */
@Component
public class TimeEstimator {

    public int estimate(Exercise exercise, int sets, int reps, double restMultiplier) {
        int setup = exercise.requiresEquipment() ? EQUIPMENT_SETUP_SECONDS : 0;
        int work = sets * (reps * REP_DURATION_SECONDS);
        int rest = Math.max(0, sets - 1) * scaledRest(exercise, restMultiplier);
        return setup + work + rest;
    }

    /**
     * 组间休息，四舍五入到秒
     */
    public int scaledRest(Exercise exercise, double restMultiplier) {
        return (int) Math.round(exercise.restSeconds() * restMultiplier);
    }
}
