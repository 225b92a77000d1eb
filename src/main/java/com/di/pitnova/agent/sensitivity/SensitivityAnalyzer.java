package com.di.pitnova.agent.sensitivity;

import com.di.pitnova.agent.degradation.LapTimePredictor;
import com.di.pitnova.agent.optimizer.DecisionPoint;
import com.di.pitnova.agent.optimizer.PitWindowOptimizer;
import com.di.pitnova.agent.pitloss.PitLossTable;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * What-if analysis around one decision point: how the recommended pit lap moves when pit loss
 * or degradation changes by a small amount, and under a virtual safety car.
 */
@Slf4j
@Service
public class SensitivityAnalyzer {

    private final PitWindowOptimizer optimizer;
    private final LapTimePredictor predictor;
    private final SensitivityProperties properties;

    @Autowired
    public SensitivityAnalyzer(PitWindowOptimizer optimizer,
                               LapTimePredictor predictor,
                               SensitivityProperties properties) {
        this.optimizer = optimizer;
        this.predictor = predictor;
        this.properties = properties != null ? properties : new SensitivityProperties();
    }

    public SensitivityResult pitLossSensitivity(DecisionPoint dp) {
        return pitLossSensitivity(dp, properties.getPitLossDeltaSec());
    }

    /** Base pit loss, base + delta and base - delta (floored at zero). */
    public SensitivityResult pitLossSensitivity(DecisionPoint dp, double deltaSec) {
        double base = pitLossTable().getPitLoss(dp.getTrackId());
        Integer baseLap = recommend(dp, predictor, base);
        Integer plusLap = recommend(dp, predictor, base + deltaSec);
        Integer minusLap = recommend(dp, predictor, Math.max(0.0, base - deltaSec));

        String prefix = "If pit loss changes by ±" + fmt(deltaSec) + " s (base " + fmt(base) + " s), ";
        String message = describe(prefix, deltaSec, " s", baseLap, plusLap, minusLap);
        log.info("[SENSITIVITY] pit loss ±{}s at {} lap {}: base={} plus={} minus={}",
                deltaSec, dp.getTrackId(), dp.getCurrentLap(), lapStr(baseLap), lapStr(plusLap), lapStr(minusLap));
        return SensitivityResult.builder()
                .parameter(SensitivityResult.Parameter.PIT_LOSS)
                .baseValue(base)
                .delta(deltaSec)
                .baseRecommendedLap(baseLap)
                .plusDeltaRecommendedLap(plusLap)
                .minusDeltaRecommendedLap(minusLap)
                .message(message)
                .build();
    }

    public SensitivityResult degradationSensitivity(DecisionPoint dp) {
        return degradationSensitivity(dp, properties.getDegradationDeltaSecPerLap());
    }

    /** Every compound's degradation slope shifted by +delta and -delta s/lap. */
    public SensitivityResult degradationSensitivity(DecisionPoint dp, double deltaSecPerLap) {
        double pitLoss = pitLossTable().getPitLoss(dp.getTrackId());
        Integer baseLap = recommend(dp, predictor, pitLoss);
        Integer plusLap = recommend(dp, new DegradationDeltaPredictor(predictor, deltaSecPerLap), pitLoss);
        Integer minusLap = recommend(dp, new DegradationDeltaPredictor(predictor, -deltaSecPerLap), pitLoss);

        String prefix = "If degradation changes by ±" + fmt2(deltaSecPerLap) + " s/lap, ";
        String message = describe(prefix, deltaSecPerLap, " s/lap", baseLap, plusLap, minusLap);
        log.info("[SENSITIVITY] degradation ±{}s/lap at {} lap {}: base={} plus={} minus={}",
                deltaSecPerLap, dp.getTrackId(), dp.getCurrentLap(), lapStr(baseLap), lapStr(plusLap), lapStr(minusLap));
        return SensitivityResult.builder()
                .parameter(SensitivityResult.Parameter.DEGRADATION)
                .baseValue(0.0)
                .delta(deltaSecPerLap)
                .baseRecommendedLap(baseLap)
                .plusDeltaRecommendedLap(plusLap)
                .minusDeltaRecommendedLap(minusLap)
                .message(message)
                .build();
    }

    /** Recommendation with the VSC-scaled pit loss versus green-flag pit loss. */
    public SafetyCarScenario safetyCarScenario(DecisionPoint dp) {
        PitLossTable table = pitLossTable();
        double normal = table.getPitLoss(dp.getTrackId());
        double vsc = table.getPitLoss(dp.getTrackId(), true);
        Integer normalLap = recommend(dp, predictor, normal);
        Integer vscLap = recommend(dp, predictor, vsc);

        String message;
        if (Objects.equals(normalLap, vscLap)) {
            message = "Under a virtual safety car (pit loss " + fmt(vsc) + " s instead of " + fmt(normal)
                    + " s) the recommendation is unchanged: " + lapStr(normalLap) + ".";
        } else {
            message = "Under a virtual safety car (pit loss " + fmt(vsc) + " s instead of " + fmt(normal)
                    + " s) the recommendation moves from " + lapStr(normalLap) + " to " + lapStr(vscLap) + ".";
        }
        log.info("[SENSITIVITY] VSC at {} lap {}: normal={} vsc={}",
                dp.getTrackId(), dp.getCurrentLap(), lapStr(normalLap), lapStr(vscLap));
        return SafetyCarScenario.builder()
                .normalPitLossSec(normal)
                .vscPitLossSec(vsc)
                .normalRecommendedLap(normalLap)
                .vscRecommendedLap(vscLap)
                .message(message)
                .build();
    }

    private Integer recommend(DecisionPoint dp, LapTimePredictor p, double pitLossSec) {
        return optimizer.optimize(dp, p, pitLossSec).recommendedPitLap().orElse(null);
    }

    private PitLossTable pitLossTable() {
        return optimizer.getPitLossTable();
    }

    private static String describe(String prefix, double delta, String unit,
                                   Integer baseLap, Integer plusLap, Integer minusLap) {
        if (baseLap == null && plusLap == null && minusLap == null) {
            return prefix + "the recommendation stays \"stay out\" in all cases.";
        }
        String d = unit.equals(" s") ? fmt(delta) : fmt2(delta);
        if (baseLap == null) {
            return prefix + "recommended pit lap shifts: base = stay out; +" + d + unit + " → "
                    + lapStr(plusLap) + "; -" + d + unit + " → " + lapStr(minusLap) + ".";
        }
        List<String> changes = new ArrayList<>();
        if (plusLap == null || !plusLap.equals(baseLap)) changes.add("+" + d + unit + ": " + lapStr(plusLap));
        if (minusLap == null || !minusLap.equals(baseLap)) changes.add("-" + d + unit + ": " + lapStr(minusLap));
        if (changes.isEmpty()) {
            return prefix + "recommended pit lap stays at lap " + baseLap + ".";
        }
        return prefix + "recommended pit lap changes from lap " + baseLap + " to " + String.join("; ", changes) + ".";
    }

    private static String lapStr(Integer lap) {
        return lap != null ? "lap " + lap : "stay out";
    }

    private static String fmt(double v) {
        return String.format(Locale.ROOT, "%.1f", v);
    }

    private static String fmt2(double v) {
        return String.format(Locale.ROOT, "%.2f", v);
    }
}
