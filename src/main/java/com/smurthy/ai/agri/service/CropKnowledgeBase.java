package com.smurthy.ai.agri.service;

import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Static agronomy reference data: crops by season and soil, mandi prices, sowing calendars
 * and common pests.
 */
@Service
public class CropKnowledgeBase {

    public static final List<String> SOIL_TYPES = List.of(
            "Alluvial", "Black", "Red", "Laterite", "Mountain", "Desert", "Saline");

    public static final List<String> SEASONS = List.of("Kharif", "Rabi", "Zaid");

    public record CropProfile(String name, List<String> varieties, int durationDays, String waterNeed) {}

    public record MarketPrice(int currentPrice, String unit, String trend) {
        static MarketPrice unknown() {
            return new MarketPrice(0, "per quintal", "Unknown");
        }
    }

    public record CropCalendar(String plantingStart, String plantingEnd, String harvestStart, String harvestEnd,
                               List<String> keyActivities) {}

    public record PestRisk(List<String> pests, String riskLevel, String recommendation) {}

    private static final Map<String, Map<String, List<CropProfile>>> CROPS = Map.of(
            "Kharif", Map.of(
                    "Alluvial", List.of(
                            new CropProfile("Rice", List.of("IR64", "Swarna", "Pusa Basmati"), 120, "High"),
                            new CropProfile("Maize", List.of("Hybrid Maize", "Sweet Corn"), 90, "Medium"),
                            new CropProfile("Cotton", List.of("BT Cotton", "Desi Cotton"), 150, "Medium")),
                    "Black", List.of(
                            new CropProfile("Soybean", List.of("JS-335", "JS-9305"), 100, "Medium"),
                            new CropProfile("Groundnut", List.of("TMV-2", "JL-24"), 110, "Low")),
                    "Red", List.of(
                            new CropProfile("Groundnut", List.of("TMV-2", "K-6"), 110, "Low"),
                            new CropProfile("Bajra", List.of("HHB-67", "ICTP-8203"), 80, "Low"))),
            "Rabi", Map.of(
                    "Alluvial", List.of(
                            new CropProfile("Wheat", List.of("HD-2967", "PBW-343"), 140, "Medium"),
                            new CropProfile("Mustard", List.of("Pusa Bold", "RH-30"), 120, "Low")),
                    "Black", List.of(
                            new CropProfile("Chickpea", List.of("JG-11", "Pusa-372"), 130, "Low"),
                            new CropProfile("Lentil", List.of("PL-406", "PL-639"), 110, "Low"))),
            "Zaid", Map.of(
                    "Alluvial", List.of(
                            new CropProfile("Moong", List.of("SML-668", "Pusa Vishal"), 65, "Low"),
                            new CropProfile("Watermelon", List.of("Sugar Baby", "Arka Manik"), 85, "Medium"))));

    private static final Map<String, MarketPrice> PRICES = Map.ofEntries(
            Map.entry("Rice", new MarketPrice(1800, "per quintal", "Stable")),
            Map.entry("Wheat", new MarketPrice(2100, "per quintal", "Rising")),
            Map.entry("Maize", new MarketPrice(1500, "per quintal", "Stable")),
            Map.entry("Cotton", new MarketPrice(5500, "per quintal", "Falling")),
            Map.entry("Soybean", new MarketPrice(3200, "per quintal", "Rising")),
            Map.entry("Groundnut", new MarketPrice(4800, "per quintal", "Stable")),
            Map.entry("Mustard", new MarketPrice(4200, "per quintal", "Rising")),
            Map.entry("Chickpea", new MarketPrice(3800, "per quintal", "Stable")),
            Map.entry("Lentil", new MarketPrice(5200, "per quintal", "Rising")),
            Map.entry("Bajra", new MarketPrice(2200, "per quintal", "Stable")),
            Map.entry("Moong", new MarketPrice(7000, "per quintal", "Rising")));

    private static final Map<String, CropCalendar> CALENDARS = Map.of(
            "Kharif", new CropCalendar("June", "August", "September", "November",
                    List.of("Land preparation", "Seed treatment", "Planting", "Weeding", "Pest control")),
            "Rabi", new CropCalendar("October", "December", "March", "May",
                    List.of("Land preparation", "Seed treatment", "Planting", "Irrigation", "Fertilization")),
            "Zaid", new CropCalendar("March", "April", "May", "June",
                    List.of("Land preparation", "Planting", "Frequent irrigation", "Mulching")));

    private static final Map<String, List<String>> PESTS = Map.of(
            "Rice", List.of("Rice stem borer", "Rice leaf folder", "Brown plant hopper"),
            "Wheat", List.of("Aphids", "Termites", "Rust diseases"),
            "Cotton", List.of("Bollworm", "Aphids", "Whitefly"),
            "Maize", List.of("Fall armyworm", "Stem borer", "Ear rot"),
            "Soybean", List.of("Girdle beetle", "Yellow mosaic virus"),
            "Chickpea", List.of("Pod borer"));

    public List<CropProfile> cropsFor(String season, String soilType) {
        return CROPS.getOrDefault(season, Map.of()).getOrDefault(soilType, List.of());
    }

    public MarketPrice priceOf(String crop) {
        return PRICES.getOrDefault(crop, MarketPrice.unknown());
    }

    public Optional<CropCalendar> calendarFor(String season) {
        return Optional.ofNullable(CALENDARS.get(season));
    }

    public PestRisk pestRisk(String crop) {
        List<String> pests = PESTS.getOrDefault(crop, List.of());
        String riskLevel = pests.size() > 2 ? "High" : pests.size() > 1 ? "Medium" : "Low";
        String recommendation = pests.isEmpty()
                ? "No major pests recorded, follow routine field scouting"
                : "Monitor for " + String.join(", ", pests) + " and apply preventive measures";
        return new PestRisk(pests, riskLevel, recommendation);
    }

    /**
     * Every crop the knowledge base can recommend, with the seasons it fits.
     */
    public Map<String, Set<String>> cropSeasons() {
        Map<String, Set<String>> seasons = new LinkedHashMap<>();
        for (String season : SEASONS) {
            for (String soil : SOIL_TYPES) {
                for (CropProfile crop : cropsFor(season, soil)) {
                    seasons.computeIfAbsent(crop.name(), name -> new LinkedHashSet<>()).add(season);
                }
            }
        }
        return seasons;
    }
}
