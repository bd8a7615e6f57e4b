package com.liftrx.service.solver;

import com.liftrx.model.domain.*;
import com.liftrx.service.analysis.BalanceDiagnostic;
import lombok.extern.slf4j.Slf4j;

import java.util.*;
import java.util.stream.Collectors;

import static com.liftrx.common.PrescriptionConstants.*;

/**
 * 贪心装箱主流程
 * 过滤 -> 循环 (打分排序 -> 取第一个放得下的动作 -> 记账) -> 结束
 * 打分与排序由子类实现，其余步骤各后端共用
 */
@Slf4j
public abstract class AbstractSolverBackend implements SolverBackend {

    protected final HardFilter hardFilter;
    protected final TimeEstimator timeEstimator;
    protected final CoverageTracker coverageTracker;
    protected final SubstitutionFinder substitutionFinder;
    protected final VolumePlanner volumePlanner;
    protected final BalanceDiagnostic balanceDiagnostic;
    protected final int substitutionLimit;

    protected AbstractSolverBackend(SolverComponents components) {
        this.hardFilter = components.hardFilter();
        this.timeEstimator = components.timeEstimator();
        this.coverageTracker = components.coverageTracker();
        this.substitutionFinder = components.substitutionFinder();
        this.volumePlanner = components.volumePlanner();
        this.balanceDiagnostic = components.balanceDiagnostic();
        this.substitutionLimit = components.substitutionLimit();
    }

    /**
     * 为一次求解建立打分状态
     */
    protected abstract SelectionState openState(List<Exercise> eligible, PrescriptionRequest request,
                                                RecoveryWindows recovery);

    @Override
    public PackingResult solve(ExerciseCatalog catalog, PrescriptionRequest request, RecoveryWindows recovery) {
        List<Exercise> eligible = hardFilter.filter(catalog.exercises(), request);
        if (eligible.isEmpty()) {
            log.info("[{}] 硬过滤后无可用动作，返回空处方, location={}", name(), request.location());
            return PackingResult.empty(name());
        }

        VolumePlanner.SetsReps volume = volumePlanner.determineSetsReps(request.goals());
        double restMultiplier = volumePlanner.restMultiplier(request.goals());
        int timeRemaining = initialBudgetSeconds(request.timeAvailable());

        SelectionState state = openState(eligible, request, recovery);
        MuscleCoverage coverage = new MuscleCoverage(catalog.muscleNames());
        List<PrescribedExercise> selected = new ArrayList<>();
        Map<String, List<PrescribedExercise>> substitutions = new LinkedHashMap<>();
        int duration = 0;

        while (timeRemaining > MIN_REMAINING_SECONDS) {
            List<Exercise> ranked = state.rankRemaining(coverage);
            Exercise pick = null;
            int needed = 0;
            for (Exercise candidate : ranked) {
                int estimate = timeEstimator.estimate(candidate, volume.sets(), volume.reps(), restMultiplier);
                if (estimate <= timeRemaining) {
                    pick = candidate;
                    needed = estimate;
                    break;
                }
            }
            if (pick == null) {
                log.debug("[{}] 剩余 {} 秒，已无可放入的动作", name(), timeRemaining);
                break;
            }

            state.commit(pick);
            coverageTracker.update(coverage, pick, volume.sets());
            selected.add(prescribe(pick, volume, restMultiplier, needed,
                    coachingNote(pick, recovery, catalog)));
            substitutions.put(pick.id(), findSubstitutes(pick, catalog, request, volume, restMultiplier));
            timeRemaining -= needed;
            duration += needed;
            log.debug("[{}] 选入 {}，耗时 {} 秒，剩余 {} 秒", name(), pick.id(), needed, timeRemaining);
        }

        List<BalanceIssue> issues = balanceDiagnostic.analyze(selected);
        return new PackingResult(selected, coverage.snapshot(), duration, substitutions, issues, name());
    }

    /**
     * 可用于动作的时间 = 总时长 - 热身放松
     */
    public static int initialBudgetSeconds(int timeAvailableMinutes) {
        int overhead = timeAvailableMinutes >= LONG_SESSION_MINUTES
                ? LONG_SESSION_OVERHEAD_SECONDS
                : SHORT_SESSION_OVERHEAD_SECONDS;
        return timeAvailableMinutes * 60 - overhead;
    }

    private List<PrescribedExercise> findSubstitutes(Exercise pick, ExerciseCatalog catalog, PrescriptionRequest request,
                                                     VolumePlanner.SetsReps volume, double restMultiplier) {
        return substitutionFinder.findSubstitutions(pick, catalog.exercises(), request, substitutionLimit).stream()
                .map(alt -> prescribe(alt, volume, restMultiplier,
                        timeEstimator.estimate(alt, volume.sets(), volume.reps(), restMultiplier),
                        "可替代「" + pick.name() + "」"))
                .toList();
    }

    private PrescribedExercise prescribe(Exercise exercise, VolumePlanner.SetsReps volume, double restMultiplier,
                                         int estimatedSeconds, String notes) {
        return PrescribedExercise.builder()
                .exerciseId(exercise.id())
                .name(exercise.name())
                .sets(volume.sets())
                .reps(String.valueOf(volume.reps()))
                .restSeconds(timeEstimator.scaledRest(exercise, restMultiplier))
                .estimatedSeconds(estimatedSeconds)
                .primaryMuscles(exercise.primaryMuscles())
                .secondaryMuscles(exercise.secondaryMuscles())
                .notes(notes)
                .movementPattern(exercise.movementPattern())
                .build();
    }

    /**
     * 涉及近期练过的肌群时给出提醒，24小时优先
     */
    private String coachingNote(Exercise exercise, RecoveryWindows recovery, ExerciseCatalog catalog) {
        if (recovery.isEmpty()) {
            return null;
        }
        String within24h = fatiguedNames(exercise, recovery.last24h(), catalog);
        if (!within24h.isEmpty()) {
            return "24小时内已练过" + within24h + "，建议降低负荷";
        }
        String within48h = fatiguedNames(exercise, recovery.last48h(), catalog);
        if (!within48h.isEmpty()) {
            return "48小时内练过" + within48h + "，注意控制强度";
        }
        return null;
    }

    private String fatiguedNames(Exercise exercise, Set<String> window, ExerciseCatalog catalog) {
        return exercise.activatedMuscles().stream()
                .filter(window::contains)
                .map(catalog::muscleName)
                .collect(Collectors.joining("、"));
    }

    /**
     * 单次求解的打分状态，不跨调用共享
     */
    protected interface SelectionState {

        /**
         * 未选动作按分数降序排列，同分保持动作库顺序
         */
        List<Exercise> rankRemaining(MuscleCoverage coverage);

        void commit(Exercise exercise);
    }
}
