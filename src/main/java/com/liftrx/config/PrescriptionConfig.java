package com.liftrx.config;

import com.liftrx.service.analysis.BalanceDiagnostic;
import com.liftrx.service.solver.*;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * 处方引擎装配
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(PrescriptionProperties.class)
public class PrescriptionConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public ScoringWeights scoringWeights(PrescriptionProperties properties) {
        return properties.getWeights().toScoringWeights();
    }

    /**
     * 按 prescription.solver.backend 选择求解后端
     */
    @Bean
    public SolverBackend solverBackend(PrescriptionProperties properties,
                                       HardFilter hardFilter,
                                       ExerciseScorer scorer,
                                       TimeEstimator timeEstimator,
                                       CoverageTracker coverageTracker,
                                       SubstitutionFinder substitutionFinder,
                                       VolumePlanner volumePlanner,
                                       BalanceDiagnostic balanceDiagnostic) {
        SolverComponents components = new SolverComponents(hardFilter, scorer, timeEstimator, coverageTracker,
                substitutionFinder, volumePlanner, balanceDiagnostic,
                properties.getSolver().getSubstitutionLimit());
        String backend = properties.getSolver().getBackend();
        log.info("求解后端: {}", backend);
        return switch (backend) {
            case GreedySolverBackend.NAME -> new GreedySolverBackend(components);
            case IndexedSolverBackend.NAME -> new IndexedSolverBackend(components);
            default -> throw new IllegalStateException("未知求解后端: " + backend);
        };
    }
}
