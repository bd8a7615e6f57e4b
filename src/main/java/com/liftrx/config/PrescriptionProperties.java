package com.liftrx.config;

import com.liftrx.common.PrescriptionConstants;
import com.liftrx.service.solver.ScoringWeights;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * 处方引擎配置 (prescription.*)
 */
@Data
@ConfigurationProperties(prefix = "prescription")
public class PrescriptionProperties {

    private Catalog catalog = new Catalog();
    private Solver solver = new Solver();
    private Weights weights = new Weights();

    @Data
    public static class Catalog {
        /**
         * 动作库缓存有效期
         */
        private Duration ttl = Duration.ofMinutes(5);
    }

    @Data
    public static class Solver {
        /**
         * 求解后端: greedy / indexed
         */
        private String backend = "greedy";

        /**
         * 每个动作最多返回的替代动作数
         */
        private int substitutionLimit = PrescriptionConstants.DEFAULT_SUBSTITUTION_LIMIT;
    }

    @Data
    public static class Weights {
        private double goalAlignment = 10;
        private double compoundPreference = 5;
        private double recoveryPenalty24h = -20;
        private double recoveryPenalty48h = -10;
        private double fitnessLevelMatch = 5;
        private double muscleCoverageGap = 15;

        public ScoringWeights toScoringWeights() {
            return new ScoringWeights(goalAlignment, compoundPreference, recoveryPenalty24h,
                    recoveryPenalty48h, fitnessLevelMatch, muscleCoverageGap);
        }
    }
}
