package com.liftrx.service.solver;

import com.liftrx.model.domain.Exercise;
import com.liftrx.model.domain.PrescriptionRequest;
import com.liftrx.model.domain.RecoveryWindows;
import lombok.extern.slf4j.Slf4j;

import java.util.*;

/**
 * 索引实现：肌群ID映射为位下标，基础分每次求解只算一次
 * 覆盖缺口 = |参与肌群位图 - 已覆盖位图|，结果与 greedy 一致
 */
@Slf4j
public class IndexedSolverBackend extends AbstractSolverBackend {

    public static final String NAME = "indexed";

    private final ExerciseScorer scorer;

    public IndexedSolverBackend(SolverComponents components) {
        super(components);
        this.scorer = components.scorer();
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    protected SelectionState openState(List<Exercise> eligible, PrescriptionRequest request, RecoveryWindows recovery) {
        Map<String, Integer> muscleIndex = new HashMap<>();
        Map<String, Integer> exerciseIndex = new HashMap<>();
        int n = eligible.size();
        double[] baseScores = new double[n];
        BitSet[] activated = new BitSet[n];

        for (int i = 0; i < n; i++) {
            Exercise exercise = eligible.get(i);
            exerciseIndex.put(exercise.id(), i);
            baseScores[i] = scorer.baseScore(exercise, request, recovery);
            BitSet bits = new BitSet();
            for (String muscle : exercise.activatedMuscles()) {
                bits.set(muscleIndex.computeIfAbsent(muscle, k -> muscleIndex.size()));
            }
            activated[i] = bits;
        }
        log.debug("[{}] 索引建立完成，动作 {} 个，肌群 {} 个", NAME, n, muscleIndex.size());

        BitSet covered = new BitSet(muscleIndex.size());
        BitSet remaining = new BitSet(n);
        remaining.set(0, n);

        return new SelectionState() {
            @Override
            public List<Exercise> rankRemaining(MuscleCoverage coverage) {
                List<Integer> order = new ArrayList<>(remaining.cardinality());
                double[] scores = new double[n];
                for (int i = remaining.nextSetBit(0); i >= 0; i = remaining.nextSetBit(i + 1)) {
                    BitSet gap = (BitSet) activated[i].clone();
                    gap.andNot(covered);
                    scores[i] = baseScores[i] + scorer.gapScore(gap.cardinality());
                    order.add(i);
                }
                // 稳定排序，同分按下标 (即动作库顺序)
                order.sort((a, b) -> Double.compare(scores[b], scores[a]));
                return order.stream().map(eligible::get).toList();
            }

            @Override
            public void commit(Exercise exercise) {
                Integer i = exerciseIndex.get(exercise.id());
                if (i == null) {
                    throw new IllegalStateException("动作不在候选集中: " + exercise.id());
                }
                remaining.clear(i);
                covered.or(activated[i]);
            }
        };
    }
}
