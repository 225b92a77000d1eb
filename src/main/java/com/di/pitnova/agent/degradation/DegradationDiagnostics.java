package com.di.pitnova.agent.degradation;

import com.di.pitnova.model.Compound;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Degradation curves and slope-change ("cliff") detection on top of a fitted model.
 * The linear model has a constant slope, so no cliffs are expected today.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DegradationDiagnostics {

    private final DegradationModelService degradationModelService;
    private final DegradationProperties properties;

    public record CurvePoint(int lapInStint, double predictedLapTimeSec) {}

    /**
     * @param slopeSecPerLap first difference to the previous lap; null for the first point
     * @param slopeChange    second difference; null for the first two points
     */
    public record CliffPoint(int lapInStint, double predictedLapTimeSec,
                             Double slopeSecPerLap, Double slopeChange, boolean cliffCandidate) {}

    public List<CurvePoint> degradationCurve(String trackId, Compound compound, double fuelKg, Double trackTemp) {
        return degradationCurve(trackId, compound, fuelKg, trackTemp,
                properties.getCurveLapInStintMin(), properties.getCurveLapInStintMax());
    }

    public List<CurvePoint> degradationCurve(String trackId, Compound compound, double fuelKg, Double trackTemp,
                                             int fromLap, int toLap) {
        if (fromLap < 1 || toLap < fromLap) {
            throw new IllegalArgumentException("Invalid lap-in-stint range " + fromLap + ".." + toLap);
        }
        List<CurvePoint> curve = new ArrayList<>(toLap - fromLap + 1);
        for (int lap = fromLap; lap <= toLap; lap++) {
            curve.add(new CurvePoint(lap, degradationModelService.predict(trackId, compound, lap, fuelKg, trackTemp)));
        }
        return curve;
    }

    public List<CliffPoint> detectCliffs(String trackId, Compound compound, double fuelKg, Double trackTemp,
                                         int fromLap, int toLap) {
        return detectCliffs(degradationCurve(trackId, compound, fuelKg, trackTemp, fromLap, toLap),
                properties.getCliffSlopeChangeThreshold());
    }

    /** Flags laps where the slope grows by at least {@code threshold} s/lap over the previous lap. */
    public static List<CliffPoint> detectCliffs(List<CurvePoint> curve, double threshold) {
        List<CliffPoint> out = new ArrayList<>(curve.size());
        Double prevSlope = null;
        for (int i = 0; i < curve.size(); i++) {
            CurvePoint p = curve.get(i);
            Double slope = i == 0 ? null : p.predictedLapTimeSec() - curve.get(i - 1).predictedLapTimeSec();
            Double change = slope != null && prevSlope != null ? slope - prevSlope : null;
            boolean cliff = change != null && change >= threshold;
            out.add(new CliffPoint(p.lapInStint(), p.predictedLapTimeSec(), slope, change, cliff));
            prevSlope = slope;
        }
        long cliffs = out.stream().filter(CliffPoint::cliffCandidate).count();
        if (cliffs > 0) {
            log.info("[DEGRADATION] {} cliff candidate(s) above {} s/lap", cliffs, threshold);
        }
        return out;
    }

    public List<Integer> cliffLaps(List<CliffPoint> points) {
        return points.stream().filter(CliffPoint::cliffCandidate).map(CliffPoint::lapInStint).toList();
    }
}
