package com.liftrx.service.impl;

import com.liftrx.common.PrescriptionConstants;
import com.liftrx.model.domain.*;
import com.liftrx.model.dto.PrescriptionRequestDTO;
import com.liftrx.model.vo.PrescriptionResultVO;
import com.liftrx.service.PrescriptionService;
import com.liftrx.service.analysis.RecoveryWindowResolver;
import com.liftrx.service.catalog.ExerciseCatalogCache;
import com.liftrx.service.solver.SolverBackend;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.*;

@Slf4j
@Service
@RequiredArgsConstructor
public class PrescriptionServiceImpl implements PrescriptionService {

    private final ExerciseCatalogCache catalogCache;
    private final RecoveryWindowResolver recoveryWindowResolver;
    private final SolverBackend solverBackend;
    private final Clock clock;

    @Override
    public PrescriptionResultVO prescribe(PrescriptionRequestDTO dto) {
        // 1. 请求转换与校验
        PrescriptionRequest request = toRequest(dto);
        log.info("生成训练处方, location={}, time={}min, goals={}, level={}",
                request.location(), request.timeAvailable(), request.goals(), request.fitnessLevel());

        // 2. 准备数据：动作库 + 恢复窗口
        ExerciseCatalog catalog = catalogCache.get();
        RecoveryWindows recovery = recoveryWindowResolver.resolve(request.recentWorkoutIds());

        // 3. 求解
        PackingResult result = solverBackend.solve(catalog, request, recovery);
        if (result.isEmpty()) {
            log.info("无可用动作, 返回空处方, location={}", PrescriptionConstants.getLocationCnName(request.location()));
        } else {
            log.info("处方生成完成, backend={}, 动作数={}, 耗时={}秒, 覆盖肌群={}",
                    result.backend(), result.exercises().size(), result.actualDurationSeconds(), result.coverage().size());
        }

        return toVO(result);
    }

    @Override
    public void invalidateCatalog() {
        catalogCache.invalidate();
    }

    /**
     * DTO -> 领域请求，非法编码抛出 IllegalArgumentException
     */
    private PrescriptionRequest toRequest(PrescriptionRequestDTO dto) {
        String location = StringUtils.trimToEmpty(dto.getLocation()).toLowerCase(Locale.ROOT);
        if (!PrescriptionConstants.isValidLocation(location)) {
            throw new IllegalArgumentException("不支持的训练场地: " + dto.getLocation());
        }

        List<Goal> goals = new ArrayList<>();
        for (String code : nonBlank(dto.getGoals())) {
            goals.add(Goal.fromCode(code.trim()));
        }

        FitnessLevel level = StringUtils.isBlank(dto.getFitnessLevel())
                ? null
                : FitnessLevel.fromCode(dto.getFitnessLevel().trim());

        return PrescriptionRequest.builder()
                .timeAvailable(dto.getTimeAvailable())
                .location(location)
                .equipment(new LinkedHashSet<>(nonBlank(dto.getEquipment())))
                .goals(goals)
                .fitnessLevel(level)
                .excludedExercises(new HashSet<>(nonBlank(dto.getExcludedExercises())))
                .excludedMuscles(new HashSet<>(nonBlank(dto.getExcludedMuscles())))
                .recentWorkoutIds(nonBlank(dto.getRecentWorkoutIds()))
                .build();
    }

    private List<String> nonBlank(List<String> values) {
        if (values == null) {
            return Collections.emptyList();
        }
        return values.stream().filter(StringUtils::isNotBlank).toList();
    }

    /**
     * 领域结果 -> VO
     */
    private PrescriptionResultVO toVO(PackingResult result) {
        PrescriptionResultVO vo = new PrescriptionResultVO();
        vo.setExercises(result.exercises().stream().map(this::toItem).toList());

        Map<String, PrescriptionResultVO.CoverageItem> coverage = new LinkedHashMap<>();
        result.coverage().forEach((muscleId, entry) -> {
            PrescriptionResultVO.CoverageItem item = new PrescriptionResultVO.CoverageItem();
            item.setName(entry.name());
            item.setActivationLevel(entry.activationLevel().getCode());
            item.setTotalSets(entry.totalSets());
            coverage.put(muscleId, item);
        });
        vo.setCoverage(coverage);

        Map<String, List<PrescriptionResultVO.ExerciseItem>> substitutions = new LinkedHashMap<>();
        result.substitutions().forEach((id, alts) -> substitutions.put(id, alts.stream().map(this::toItem).toList()));
        vo.setSubstitutions(substitutions);

        vo.setActualDurationSeconds(result.actualDurationSeconds());
        vo.setBalanceIssues(result.balanceIssues().stream().map(BalanceIssue::message).toList());
        vo.setBackend(result.backend());
        vo.setGeneratedAt(LocalDateTime.now(clock));
        return vo;
    }

    private PrescriptionResultVO.ExerciseItem toItem(PrescribedExercise exercise) {
        PrescriptionResultVO.ExerciseItem item = new PrescriptionResultVO.ExerciseItem();
        item.setExerciseId(exercise.exerciseId());
        item.setName(exercise.name());
        item.setSets(exercise.sets());
        item.setReps(exercise.reps());
        item.setRestSeconds(exercise.restSeconds());
        item.setEstimatedSeconds(exercise.estimatedSeconds());
        item.setPrimaryMuscles(exercise.primaryMuscles());
        item.setSecondaryMuscles(exercise.secondaryMuscles());
        item.setNotes(exercise.notes());
        if (exercise.movementPattern() != null) {
            item.setMovementPattern(exercise.movementPattern().getCode());
        }
        return item;
    }
}
