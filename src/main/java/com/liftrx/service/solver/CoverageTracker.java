package com.liftrx.service.solver;

import com.liftrx.common.PrescriptionConstants;
import com.liftrx.model.domain.ActivationLevel;
import com.liftrx.model.domain.Exercise;
import org.springframework.stereotype.Component;

/**
 * 覆盖记账：动作入选后把其参与的肌群累加到覆盖表
 */
@Component
public class CoverageTracker {

    public void update(MuscleCoverage coverage, Exercise exercise, int sets) {
        for (String muscle : exercise.activatedMuscles()) {
            boolean primary = exercise.isPrimary(muscle)
                    || exercise.activationOf(muscle) >= PrescriptionConstants.PRIMARY_ACTIVATION_THRESHOLD;
            if (!coverage.contains(muscle)) {
                coverage.insert(muscle, primary ? ActivationLevel.PRIMARY : ActivationLevel.SECONDARY, sets);
            } else {
                coverage.accumulate(muscle, sets, primary);
            }
        }
    }
}
