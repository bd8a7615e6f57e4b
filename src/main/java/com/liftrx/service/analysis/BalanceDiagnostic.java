package com.liftrx.service.analysis;

import com.liftrx.common.PrescriptionConstants;
import com.liftrx.model.domain.BalanceIssue;
import com.liftrx.model.domain.MovementPattern;
import com.liftrx.model.domain.PrescribedExercise;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * 训练平衡诊断 (推/拉、上肢/下肢)
 * 结果仅作提示，不回写到动作选择
 */
@Slf4j
@Component
public class BalanceDiagnostic {

    public List<BalanceIssue> analyze(List<PrescribedExercise> selected) {
        if (selected == null || selected.size() < PrescriptionConstants.BALANCE_MIN_EXERCISES) {
            return List.of();
        }
        List<MovementPattern> patterns = selected.stream()
                .map(PrescribedExercise::movementPattern)
                .filter(Objects::nonNull)
                .toList();

        int push = count(patterns, MovementPattern.PUSH);
        int pull = count(patterns, MovementPattern.PULL);
        int upper = (int) patterns.stream().filter(MovementPattern::isUpperBody).count();
        int lower = (int) patterns.stream().filter(MovementPattern::isLowerBody).count();

        List<BalanceIssue> issues = new ArrayList<>();
        check(push, pull, BalanceIssue.Type.PUSH_DOMINANT, BalanceIssue.Type.PULL_DOMINANT, "推", "拉", issues);
        check(upper, lower, BalanceIssue.Type.UPPER_DOMINANT, BalanceIssue.Type.LOWER_DOMINANT, "上肢", "下肢", issues);

        for (BalanceIssue issue : issues) {
            log.warn("训练平衡提示: {}", issue.message());
        }
        return issues;
    }

    private void check(int a, int b, BalanceIssue.Type aDominant, BalanceIssue.Type bDominant,
                       String aName, String bName, List<BalanceIssue> issues) {
        if (a + b < 2) {
            return;
        }
        if (isDominant(a, b)) {
            issues.add(new BalanceIssue(aDominant, a, b, describe(aName, a, bName, b)));
        } else if (isDominant(b, a)) {
            issues.add(new BalanceIssue(bDominant, b, a, describe(bName, b, aName, a)));
        }
    }

    private boolean isDominant(int side, int opposite) {
        if (opposite == 0) {
            return side >= 2;
        }
        return (double) side / opposite > PrescriptionConstants.BALANCE_RATIO_LIMIT;
    }

    private String describe(String dominantName, int dominant, String oppositeName, int opposite) {
        return String.format("%s类动作 %d 个，%s类动作 %d 个，比例失衡，建议下次训练补充%s类动作",
                dominantName, dominant, oppositeName, opposite, oppositeName);
    }

    private int count(List<MovementPattern> patterns, MovementPattern target) {
        return (int) patterns.stream().filter(p -> p == target).count();
    }
}
