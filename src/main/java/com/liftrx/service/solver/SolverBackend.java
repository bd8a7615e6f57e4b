package com.liftrx.service.solver;

import com.liftrx.model.domain.ExerciseCatalog;
import com.liftrx.model.domain.PackingResult;
import com.liftrx.model.domain.PrescriptionRequest;
import com.liftrx.model.domain.RecoveryWindows;

/**
 * 求解后端
 * 所有实现必须同步返回完整结果，且输出满足同一组不变量
 */
public interface SolverBackend {

    /**
     * 后端名称，对应配置 prescription.solver.backend
     */
    String name();

    PackingResult solve(ExerciseCatalog catalog, PrescriptionRequest request, RecoveryWindows recovery);
}
