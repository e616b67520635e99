package com.smurthy.ai.agri.service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reference lists served by the informational endpoints.
 */
public final class AgriculturalCatalog {

    public static final List<String> MAJOR_CROPS = List.of(
            "Rice", "Wheat", "Maize", "Cotton", "Sugarcane", "Pulses",
            "Oilseeds", "Vegetables", "Fruits", "Spices");

    private static final Map<String, List<String>> EXAMPLE_QUERIES = new LinkedHashMap<>();

    static {
        EXAMPLE_QUERIES.put("weather_queries", List.of(
                "When should I irrigate my wheat crop?",
                "What's the weather forecast for next week in Pune?",
                "Is it going to rain today?",
                "क्या आज बारिश होगी?",
                "मेरी गेहूं की फसल को कब सिंचाई करनी चाहिए?"));
        EXAMPLE_QUERIES.put("crop_queries", List.of(
                "Which crop should I plant this kharif season?",
                "What are the best rice varieties for my area?",
                "How to control pests in cotton?",
                "इस मौसम में कौन सी फसल लगानी चाहिए?",
                "मेरे क्षेत्र के लिए सबसे अच्छे चावल की किस्में कौन सी हैं?"));
        EXAMPLE_QUERIES.put("finance_queries", List.of(
                "What loans are available for farmers with 3 acres?",
                "Tell me about PM-KISAN scheme",
                "How to get crop insurance?",
                "किसानों के लिए कौन से ऋण उपलब्ध हैं?",
                "PM-KISAN योजना के बारे में बताएं"));
        EXAMPLE_QUERIES.put("comprehensive_queries", List.of(
                "I have 5 acres of black soil near Nagpur, which crop should I sow this kharif, will the rain "
                        + "be enough and which loan can I get?"));
    }

    private AgriculturalCatalog() {}

    public static Map<String, List<String>> exampleQueries() {
        return EXAMPLE_QUERIES;
    }
}
