package com.smurthy.ai.agri.agents;

import com.smurthy.ai.agri.model.Category;
import com.smurthy.ai.agri.model.Horizon;
import com.smurthy.ai.agri.model.Priority;
import com.smurthy.ai.agri.model.Query;
import com.smurthy.ai.agri.model.Recommendation;
import com.smurthy.ai.agri.model.SpecialistResult;
import com.smurthy.ai.agri.service.CropKnowledgeBase;
import com.smurthy.ai.agri.service.CropKnowledgeBase.CropProfile;
import com.smurthy.ai.agri.service.CropKnowledgeBase.MarketPrice;
import com.smurthy.ai.agri.service.CropKnowledgeBase.PestRisk;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Specialized Agent for Crop Selection and Management
 *
 * Recommends crops for the season and soil, scores their suitability against the farm context
 * and adds market prices, the sowing calendar and pest risks.
 */
@Component
public class CropAgent implements Specialist {

    private static final Logger log = LoggerFactory.getLogger(CropAgent.class);

    static final String NAME = "Crop Agent";
    static final String DEFAULT_SEASON = "Kharif";
    static final String DEFAULT_SOIL = "Alluvial";

    private static final SpecialistProfile PROFILE = new SpecialistProfile(
            "Crop specialist: crop selection, varieties, sowing calendar, market prices and pest risks",
            List.of("Crop recommendations by season and soil", "Suitability scoring", "Market prices",
                    "Crop calendar", "Pest risk analysis"),
            List.of("crop", "seed", "variety", "harvest", "yield", "pest", "fertilizer", "soil",
                    "फसल", "बीज", "खाद"));

    private final CropKnowledgeBase knowledgeBase;

    @Autowired(required = false)
    private AdvisoryNarrator narrator;

    public CropAgent(CropKnowledgeBase knowledgeBase) {
        this.knowledgeBase = knowledgeBase;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Category category() {
        return Category.CROP;
    }

    @Override
    public SpecialistProfile profile() {
        return PROFILE;
    }

    @Override
    public SpecialistResult invoke(Query query, Map<String, Object> context) {
        log.debug("[CropAgent] Processing: {}", query.text());
        long startTime = System.currentTimeMillis();

        try {
            String season = ContextValues.titleText(context, Query.SEASON, DEFAULT_SEASON);
            String soilType = ContextValues.titleText(context, Query.SOIL_TYPE, DEFAULT_SOIL);
            String cropType = ContextValues.text(context, Query.CROP_TYPE, null);

            List<CropProfile> crops = knowledgeBase.cropsFor(season, soilType);
            Map<String, Suitability> suitability = analyzeSuitability(crops, context);

            Map<String, MarketPrice> marketData = new LinkedHashMap<>();
            crops.forEach(crop -> marketData.put(crop.name(), knowledgeBase.priceOf(crop.name())));

            String focusCrop = cropType != null ? cropType : bestCrop(suitability);
            PestRisk pestRisk = focusCrop != null ? knowledgeBase.pestRisk(focusCrop) : null;

            Map<String, Object> data = new LinkedHashMap<>();
            data.put("season", season);
            data.put("soil_type", soilType);
            data.put("recommendations", crops);
            data.put("suitability_analysis", suitability);
            data.put("market_data", marketData);
            knowledgeBase.calendarFor(season).ifPresent(calendar -> data.put("crop_calendar", calendar));
            if (pestRisk != null) {
                data.put("pest_risks", Map.of(focusCrop, pestRisk));
            }
            if (crops.isEmpty()) {
                data.put("note", "No crop data for " + season + " season on " + soilType + " soil");
            }

            if (narrator != null) {
                narrator.narrate(Category.CROP, Relevance.languageOf(query), query.text(), data)
                        .ifPresent(text -> data.put("advisory", text));
            }

            long elapsed = System.currentTimeMillis() - startTime;
            log.info("[CropAgent] Completed in {}ms ({} crops for {}/{})", elapsed, crops.size(), season, soilType);

            return SpecialistResult.success(Category.CROP, NAME, data,
                    Relevance.confidence(Category.CROP, query),
                    recommendations(season, crops, suitability, focusCrop, pestRisk));

        } catch (Exception e) {
            long elapsed = System.currentTimeMillis() - startTime;
            log.error("[CropAgent] Error processing query", e);
            return SpecialistResult.failure(Category.CROP, NAME,
                    "Failed to build crop advice: " + e.getMessage(), Duration.ofMillis(elapsed));
        }
    }

    /**
     * Scores each crop out of 100 against temperature, water, demand, pest pressure and budget.
     */
    static Map<String, Suitability> analyzeSuitability(List<CropProfile> crops, Map<String, Object> context) {
        double temperature = ContextValues.number(context, "temperature", 25);
        String water = ContextValues.lowerText(context, "water_availability", "medium");
        String demand = ContextValues.lowerText(context, "market_demand", "medium");
        String pestPressure = ContextValues.lowerText(context, "pest_pressure", "low");
        String budget = ContextValues.lowerText(context, "budget", "medium");

        Map<String, Suitability> analysis = new LinkedHashMap<>();
        for (CropProfile crop : crops) {
            int score = 0;
            List<String> factors = new ArrayList<>();

            if (temperature < 35) {
                score += 20;
                factors.add("Favorable temperature");
            }
            if ("high".equals(water)) {
                score += 25;
                factors.add("Good water availability");
            } else if ("Low".equals(crop.waterNeed())) {
                score += 20;
                factors.add("Low water requirement");
            }
            if ("high".equals(demand)) {
                score += 25;
                factors.add("High market demand");
            }
            if ("low".equals(pestPressure)) {
                score += 15;
                factors.add("Low pest pressure");
            }
            if ("high".equals(budget)) {
                score += 15;
                factors.add("High budget for inputs");
            }

            score = Math.min(score, 100);
            String verdict = score >= 80 ? "Highly Recommended" : score >= 60 ? "Recommended" : "Moderate";
            analysis.put(crop.name(), new Suitability(score, factors, verdict));
        }
        return analysis;
    }

    private static String bestCrop(Map<String, Suitability> suitability) {
        return suitability.entrySet().stream()
                .max(Comparator.comparingInt(entry -> entry.getValue().suitabilityScore()))
                .map(Map.Entry::getKey)
                .orElse(null);
    }

    private List<Recommendation> recommendations(String season, List<CropProfile> crops,
                                                 Map<String, Suitability> suitability,
                                                 String focusCrop, PestRisk pestRisk) {
        List<Recommendation> recommendations = new ArrayList<>();

        String best = bestCrop(suitability);
        if (best != null) {
            CropProfile profile = crops.stream().filter(crop -> crop.name().equals(best)).findFirst().orElseThrow();
            String window = knowledgeBase.calendarFor(season)
                    .map(calendar -> " between " + calendar.plantingStart() + " and " + calendar.plantingEnd())
                    .orElse("");
            recommendations.add(Recommendation.of(Category.CROP, Horizon.SHORT_TERM_PLAN, Priority.HIGH,
                    "Sow " + best + " (" + String.join(" or ", profile.varieties()) + ")" + window
                            + ", " + suitability.get(best).recommendation().toLowerCase(Locale.ROOT) + " for your farm"));
        }

        if (pestRisk != null && !pestRisk.pests().isEmpty()) {
            Priority priority = "High".equals(pestRisk.riskLevel()) ? Priority.HIGH : Priority.MEDIUM;
            recommendations.add(Recommendation.of(Category.CROP, Horizon.RISK_MITIGATION, priority,
                    focusCrop + ": " + pestRisk.recommendation()));
        }

        for (CropProfile crop : crops) {
            MarketPrice price = knowledgeBase.priceOf(crop.name());
            if ("Rising".equals(price.trend())) {
                recommendations.add(Recommendation.of(Category.CROP, Horizon.OPPORTUNITY, Priority.MEDIUM,
                        crop.name() + " prices are rising (₹" + price.currentPrice() + " " + price.unit() + ")"));
            }
        }

        recommendations.add(Recommendation.of(Category.CROP, Horizon.LONG_TERM_STRATEGY, Priority.LOW,
                "Rotate cereals with pulses and get a Soil Health Card test every two seasons"));

        return recommendations;
    }

    public record Suitability(int suitabilityScore, List<String> factors, String recommendation) {}
}
