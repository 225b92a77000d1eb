package com.di.pitnova.controller;

import com.di.pitnova.agent.degradation.DegradationModelService;
import com.di.pitnova.agent.degradation.FittedDegradationModel;
import com.di.pitnova.agent.explanation.ExplanationGenerator;
import com.di.pitnova.agent.explanation.StrategyExplanation;
import com.di.pitnova.agent.optimizer.DecisionPoint;
import com.di.pitnova.agent.optimizer.OptimizationResult;
import com.di.pitnova.agent.optimizer.OptimizerProperties;
import com.di.pitnova.agent.optimizer.PitWindowOptimizer;
import com.di.pitnova.agent.optimizer.PitWindowRange;
import com.di.pitnova.agent.sensitivity.RecommendationBundle;
import com.di.pitnova.agent.sensitivity.RecommendationBundleService;
import com.di.pitnova.controller.dto.CandidateView;
import com.di.pitnova.controller.dto.FitRequest;
import com.di.pitnova.controller.dto.ModelView;
import com.di.pitnova.controller.dto.OptimizeRequest;
import com.di.pitnova.controller.dto.OptimizeResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Pit-window API: fit models, optimize a decision point, bundle sensitivities.
 * Errors are mapped by {@link com.di.pitnova.exception.GlobalExceptionHandler}.
 */
@Slf4j
@RestController
@RequestMapping("/api/strategy")
@RequiredArgsConstructor
public class StrategyController {

    private final DegradationModelService degradationModelService;
    private final PitWindowOptimizer pitWindowOptimizer;
    private final ExplanationGenerator explanationGenerator;
    private final RecommendationBundleService recommendationBundleService;
    private final OptimizerProperties optimizerProperties;

    /**
     * Example: POST /api/strategy/optimize
     * {"currentLap":20,"currentCompound":"SOFT","lapInStint":20,"totalRaceLaps":57,"trackId":"Bahrain","newCompound":"HARD"}
     */
    @PostMapping(value = "/optimize", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<OptimizeResponse> optimize(@Valid @RequestBody OptimizeRequest request) {
        DecisionPoint dp = request.toDecisionPoint(optimizerProperties);
        OptimizationResult result = request.getPitLossSec() != null
                ? pitWindowOptimizer.optimize(dp, request.getPitLossSec())
                : pitWindowOptimizer.optimize(dp);
        Optional<PitWindowRange> window = pitWindowOptimizer.pitWindowRange(result);

        OptimizeResponse.OptimizeResponseBuilder body = OptimizeResponse.builder()
                .trackId(result.getDecisionPoint().getTrackId())
                .currentLap(dp.getCurrentLap())
                .totalRaceLaps(dp.getTotalRaceLaps())
                .pitLossSec(result.getPitLossSec())
                .recommendedPitLap(pitWindowOptimizer.recommendedPitLap(result).orElse(null))
                .pitWindowMin(window.map(PitWindowRange::earliestLap).orElse(null))
                .pitWindowMax(window.map(PitWindowRange::latestLap).orElse(null))
                .candidates(result.getCandidates().stream().map(CandidateView::from).toList());

        if (request.isIncludeExplanation()) {
            StrategyExplanation explanation = explanationGenerator.explain(result, degradationModelService::degradationRate);
            body.explanation(explanation.sections()).explanationDisplay(explanation.getSummaryDisplay());
        }
        return ResponseEntity.ok(body.build());
    }

    @PostMapping(value = "/bundle", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<RecommendationBundle> bundle(@Valid @RequestBody OptimizeRequest request) {
        DecisionPoint dp = request.toDecisionPoint(optimizerProperties);
        return ResponseEntity.ok(recommendationBundleService.bundle(dp, request.isIncludeExplanation()));
    }

    @PostMapping(value = "/models/fit", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<List<ModelView>> fit(@Valid @RequestBody FitRequest request) {
        List<ModelView> fitted;
        if (request.getCompound() != null) {
            FittedDegradationModel model = request.getMinSamples() != null
                    ? degradationModelService.fit(request.getLaps(), request.getTrackId(), request.getCompound(), request.getMinSamples())
                    : degradationModelService.fit(request.getLaps(), request.getTrackId(), request.getCompound());
            fitted = List.of(ModelView.from(model));
        } else {
            fitted = degradationModelService.fitAll(request.getLaps(), request.getTrackId()).values().stream()
                    .map(ModelView::from)
                    .toList();
        }
        log.info("[API] fitted {} model(s) for {}", fitted.size(), request.getTrackId());
        return ResponseEntity.ok(fitted);
    }

    @GetMapping(value = "/models", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<List<ModelView>> models() {
        return ResponseEntity.ok(degradationModelService.getStore().snapshot().values().stream()
                .map(ModelView::from)
                .toList());
    }

    @PostMapping(value = "/models/persist", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<Map<String, Object>> persist() {
        Path file = degradationModelService.persist();
        return ResponseEntity.ok(Map.of(
                "path", file.toAbsolutePath().toString(),
                "models", degradationModelService.getStore().size()));
    }
}
