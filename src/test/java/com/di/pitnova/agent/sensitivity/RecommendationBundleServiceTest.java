package com.di.pitnova.agent.sensitivity;

import com.di.pitnova.StrategyFixtures;
import com.di.pitnova.agent.degradation.DegradationModelService;
import com.di.pitnova.agent.explanation.ExplanationGenerator;
import com.di.pitnova.agent.optimizer.OptimizerProperties;
import com.di.pitnova.agent.optimizer.PitWindowOptimizer;
import com.di.pitnova.agent.pitloss.PitLossTable;
import com.di.pitnova.exception.InvalidRaceStateException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static com.di.pitnova.StrategyFixtures.softToHard;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("RecommendationBundleService Tests")
class RecommendationBundleServiceTest {

    private final DegradationModelService models = StrategyFixtures.fittedService();
    private final PitWindowOptimizer optimizer =
            new PitWindowOptimizer(models, new PitLossTable(), new OptimizerProperties());
    private final RecommendationBundleService service = new RecommendationBundleService(optimizer,
            new SensitivityAnalyzer(optimizer, models, new SensitivityProperties()),
            new ExplanationGenerator(), models);

    @Test
    @DisplayName("Bundle carries the recommendation, window, explanation and what-if messages")
    void fullBundle() {
        RecommendationBundle bundle = service.bundle(softToHard(25, 6, 50, 10), true);

        assertEquals(25, bundle.getRecommendedLap());
        // one lap later already costs 2.15 s, outside the 2.0 s window
        assertEquals(25, bundle.getPitWindowMin());
        assertEquals(25, bundle.getPitWindowMax());
        assertNotNull(bundle.getExplanation());
        assertTrue(bundle.getExplanation().startsWith("• Recommendation: pit on lap 25 for HARD"));
        assertTrue(bundle.getSensitivityPitLossMessage().startsWith("If pit loss changes by ±2.0 s"));
        assertTrue(bundle.getSensitivityDegradationMessage().startsWith("If degradation changes by ±0.02 s/lap"));
        assertTrue(bundle.getVscMessage().startsWith("Under a virtual safety car"));
    }

    @Test
    @DisplayName("Explanation is omitted when not requested")
    void withoutExplanation() {
        assertNull(service.bundle(softToHard(25, 6, 50, 10), false).getExplanation());
    }

    @Test
    @DisplayName("Invalid decision point fails the whole bundle")
    void invalidDecisionPoint() {
        assertThrows(InvalidRaceStateException.class, () -> service.bundle(softToHard(60, 6, 50, 10), true));
    }
}
