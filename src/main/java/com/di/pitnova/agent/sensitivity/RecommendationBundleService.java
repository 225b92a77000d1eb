package com.di.pitnova.agent.sensitivity;

import com.di.pitnova.agent.degradation.DegradationModelService;
import com.di.pitnova.agent.explanation.ExplanationGenerator;
import com.di.pitnova.agent.optimizer.DecisionPoint;
import com.di.pitnova.agent.optimizer.OptimizationResult;
import com.di.pitnova.agent.optimizer.PitWindowOptimizer;
import com.di.pitnova.agent.optimizer.PitWindowRange;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * One call: optimize once, then add pit window, explanation, sensitivities and the VSC what-if.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RecommendationBundleService {

    private final PitWindowOptimizer optimizer;
    private final SensitivityAnalyzer sensitivityAnalyzer;
    private final ExplanationGenerator explanationGenerator;
    private final DegradationModelService degradationModelService;

    public RecommendationBundle bundle(DecisionPoint dp, boolean includeExplanation) {
        OptimizationResult result = optimizer.optimize(dp);
        Optional<PitWindowRange> window = optimizer.pitWindowRange(result);

        String explanation = null;
        if (includeExplanation) {
            explanation = explanationGenerator.explain(result, degradationModelService::degradationRate)
                    .getSummaryDisplay();
        }

        RecommendationBundle bundle = RecommendationBundle.builder()
                .recommendedLap(result.recommendedPitLap().orElse(null))
                .pitWindowMin(window.map(PitWindowRange::earliestLap).orElse(null))
                .pitWindowMax(window.map(PitWindowRange::latestLap).orElse(null))
                .explanation(explanation)
                .sensitivityPitLossMessage(sensitivityAnalyzer.pitLossSensitivity(dp).getMessage())
                .sensitivityDegradationMessage(sensitivityAnalyzer.degradationSensitivity(dp).getMessage())
                .vscMessage(sensitivityAnalyzer.safetyCarScenario(dp).getMessage())
                .build();
        log.info("[BUNDLE] {} lap {}: recommended={}, window={}",
                dp.getTrackId(), dp.getCurrentLap(),
                bundle.getRecommendedLap() != null ? "lap " + bundle.getRecommendedLap() : "stay out",
                window.map(w -> w.earliestLap() + "-" + w.latestLap()).orElse("none"));
        return bundle;
    }
}
