package com.liftrx.service.solver;

import com.liftrx.model.domain.Exercise;
import com.liftrx.model.domain.PrescriptionRequest;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * 替代动作查找：通过与正选动作相同的硬过滤 (场地、器械、排除动作、排除肌群)，
 * 且与原动作共享至少一个主练肌群；按动作库顺序返回，不做额外排序
 */
@Component
public class SubstitutionFinder {

    private final HardFilter hardFilter;

    public SubstitutionFinder(HardFilter hardFilter) {
        this.hardFilter = hardFilter;
    }

    public List<Exercise> findSubstitutions(Exercise exercise, List<Exercise> catalog,
                                            PrescriptionRequest request, int limit) {
        if (limit <= 0) {
            return List.of();
        }
        return catalog.stream()
                .filter(candidate -> !candidate.id().equals(exercise.id()))
                .filter(candidate -> hardFilter.passes(candidate, request))
                .filter(candidate -> sharesPrimaryMuscle(exercise, candidate))
                .limit(limit)
                .toList();
    }

    private boolean sharesPrimaryMuscle(Exercise original, Exercise candidate) {
        return candidate.primaryMuscles().stream().anyMatch(original::isPrimary);
    }
}
