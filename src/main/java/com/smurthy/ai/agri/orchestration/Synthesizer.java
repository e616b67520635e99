package com.smurthy.ai.agri.orchestration;

import com.smurthy.ai.agri.model.Horizon;
import com.smurthy.ai.agri.model.PartialFailure;
import com.smurthy.ai.agri.model.Recommendation;
import com.smurthy.ai.agri.model.SpecialistResult;
import com.smurthy.ai.agri.model.SynthesizedResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Merges specialist results into one response.
 *
 * Rules:
 * 1. success when at least one specialist succeeded
 * 2. a single success is returned as-is, several are keyed by category ("weather", "crop", ...)
 * 3. confidence is the plain mean over successes, 0 when there are none
 * 4. every failure or timeout is reported, even when the overall answer succeeded
 * 5. recommendations are grouped by horizon and ordered HIGH to LOW, keeping result order on ties
 */
@Component
public class Synthesizer {

    private static final Logger log = LoggerFactory.getLogger(Synthesizer.class);

    public SynthesizedResponse synthesize(List<SpecialistResult> results) {
        List<SpecialistResult> successes = new ArrayList<>();
        List<PartialFailure> failures = new ArrayList<>();
        for (SpecialistResult result : results) {
            if (result.isSuccess()) {
                successes.add(result);
            } else {
                failures.add(PartialFailure.from(result));
            }
        }

        if (successes.isEmpty()) {
            log.warn("[Synthesizer] All {} specialist(s) failed", failures.size());
            return SynthesizedResponse.totalFailure(failures);
        }

        double confidence = successes.stream()
                .mapToDouble(SpecialistResult::confidence)
                .average()
                .orElse(0.0);

        Set<String> sources = new LinkedHashSet<>();
        successes.forEach(result -> sources.add(result.source()));

        log.debug("[Synthesizer] {} success(es), {} failure(s), confidence {}",
                successes.size(), failures.size(), confidence);

        return new SynthesizedResponse(true, mergePayloads(successes), confidence,
                List.copyOf(sources), failures, rankRecommendations(successes));
    }

    static Map<String, Object> mergePayloads(List<SpecialistResult> successes) {
        if (successes.size() == 1) {
            return successes.get(0).payload();
        }
        Map<String, Object> merged = new LinkedHashMap<>();
        for (SpecialistResult result : successes) {
            String key = result.category().key();
            if (merged.containsKey(key)) {
                key = key + "." + result.source();
            }
            String unique = key;
            for (int n = 2; merged.containsKey(unique); n++) {
                unique = key + "#" + n;
            }
            merged.put(unique, result.payload());
        }
        return merged;
    }

    static Map<Horizon, List<Recommendation>> rankRecommendations(List<SpecialistResult> successes) {
        Map<Horizon, List<Recommendation>> grouped = new EnumMap<>(Horizon.class);
        for (SpecialistResult result : successes) {
            for (Recommendation recommendation : result.recommendations()) {
                grouped.computeIfAbsent(recommendation.horizon(), h -> new ArrayList<>()).add(recommendation);
            }
        }
        // List.sort is stable, so equal priorities keep result order
        grouped.values().forEach(list -> list.sort(Comparator.comparing(Recommendation::priority)));
        grouped.replaceAll((horizon, list) -> List.copyOf(list));
        return grouped;
    }
}
