package com.smurthy.ai.agri.agents;

import com.smurthy.ai.agri.model.Category;
import com.smurthy.ai.agri.model.Horizon;
import com.smurthy.ai.agri.model.Priority;
import com.smurthy.ai.agri.model.Query;
import com.smurthy.ai.agri.model.Recommendation;
import com.smurthy.ai.agri.model.SpecialistResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Specialized Agent for Agricultural Finance
 *
 * Handles:
 * - Loan options filtered by farmer type and land holding
 * - Central and state government schemes
 * - Crop insurance and market outlook
 * - Loan eligibility estimate
 */
@Component
public class FinanceAgent implements Specialist {

    private static final Logger log = LoggerFactory.getLogger(FinanceAgent.class);

    static final String NAME = "Finance Agent";
    static final String DEFAULT_FARMER_TYPE = "small";
    static final String DEFAULT_STATE = "Maharashtra";
    static final double DEFAULT_LAND_AREA = 2.0;

    static final double RUPEES_PER_HECTARE = 50_000;

    private static final SpecialistProfile PROFILE = new SpecialistProfile(
            "Agricultural finance specialist: loans, government schemes, insurance and market outlook",
            List.of("Loan options", "Government schemes", "Crop insurance", "Market trend analysis",
                    "Loan eligibility"),
            List.of("loan", "credit", "bank", "scheme", "subsidy", "insurance", "price", "kcc",
                    "ऋण", "योजना", "बीमा"));

    public record LoanOption(String name, String institution, String interestRate, String maxAmount,
                             String tenure, String eligibility, List<String> features) {}

    public record Scheme(String name, String description, String coverage, String premium,
                         List<String> benefits) {}

    public record MarketTrend(int currentPrice, String trend, String forecast, List<String> factors) {}

    public record InsuranceOption(String name, String coverage, String premiumRate, String sumInsured,
                                  List<String> features) {}

    public record LoanEligibility(double eligibleAmountInr, String eligibleAmount, List<String> factors,
                                  List<String> recommendations) {}

    private static final String KCC = "Kisan Credit Card (KCC)";
    private static final String PM_KISAN = "PM-KISAN";
    private static final String TERM_LOAN = "Agricultural Term Loan";
    private static final String MICROFINANCE = "Microfinance Loan";

    private static final List<LoanOption> LOANS = List.of(
            new LoanOption(KCC, "All Banks", "7.0%", "₹3,00,000", "5 years", "All farmers",
                    List.of("No collateral for loans up to ₹1.6 lakh", "Flexible repayment", "Crop insurance included")),
            new LoanOption(PM_KISAN, "Government of India", "0%", "₹6,000/year", "Annual",
                    "Small and marginal farmers",
                    List.of("Direct benefit transfer", "No repayment required", "Three installments per year")),
            new LoanOption(TERM_LOAN, "NABARD", "8.5%", "₹10,00,000", "3-7 years", "Farmers with land documents",
                    List.of("For farm mechanization", "Infrastructure development", "Collateral required")),
            new LoanOption(MICROFINANCE, "MFIs", "18-24%", "₹50,000", "1-2 years", "Small farmers, women farmers",
                    List.of("Group lending", "Weekly/monthly repayment", "No collateral")));

    private static final List<Scheme> CENTRAL_SCHEMES = List.of(
            new Scheme("PM Fasal Bima Yojana", "Crop insurance scheme covering yield and weather risks",
                    "All food crops, oilseeds, and commercial crops",
                    "2% for Kharif, 1.5% for Rabi, 5% for commercial crops",
                    List.of("Yield loss coverage", "Weather risk coverage", "Post-harvest losses")),
            new Scheme(PM_KISAN, "Direct income support of ₹6,000 per year to farmers",
                    "Small and marginal farmers", "Free",
                    List.of("Direct bank transfer", "No repayment", "Three installments")),
            new Scheme("PM Kisan Maan Dhan Yojana", "Pension scheme for small and marginal farmers",
                    "Farmers aged 18-40 years at entry", "₹55-200 per month",
                    List.of("₹3,000 monthly pension after 60", "Matching government contribution")),
            new Scheme("Soil Health Card Scheme", "Free soil testing and recommendations", "All farmers", "Free",
                    List.of("Soil testing", "Fertilizer recommendations", "Crop-specific advice")));

    private static final Map<String, List<Scheme>> STATE_SCHEMES = Map.of(
            "Maharashtra", List.of(new Scheme("Maharashtra Krishi Sanjivani Yojana", "Weather-based crop insurance",
                    "All crops in Maharashtra", "Subsidized rates",
                    List.of("Weather risk coverage", "Quick claim settlement"))),
            "Punjab", List.of(new Scheme("Punjab Kisan Vikas Yojana", "Support for crop diversification",
                    "Farmers switching from paddy", "Free",
                    List.of("Financial assistance", "Technical support", "Market linkage"))),
            "Telangana", List.of(new Scheme("Rythu Bandhu", "Investment support per acre each season",
                    "All land-owning farmers in Telangana", "Free",
                    List.of("₹5,000 per acre per season", "Direct bank transfer"))));

    private static final Map<String, MarketTrend> MARKET_TRENDS = Map.of(
            "Rice", new MarketTrend(1800, "Stable", "Expected to remain stable",
                    List.of("Good monsoon", "Government procurement", "Export demand")),
            "Wheat", new MarketTrend(2100, "Rising", "Expected to increase by 5-10%",
                    List.of("Reduced production", "Increased demand", "Export opportunities")),
            "Cotton", new MarketTrend(5500, "Falling", "Expected to stabilize",
                    List.of("Global price pressure", "Textile industry slowdown")));

    @Autowired(required = false)
    private AdvisoryNarrator narrator;

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Category category() {
        return Category.FINANCE;
    }

    @Override
    public SpecialistProfile profile() {
        return PROFILE;
    }

    @Override
    public SpecialistResult invoke(Query query, Map<String, Object> context) {
        log.debug("[FinanceAgent] Processing: {}", query.text());
        long startTime = System.currentTimeMillis();

        try {
            String farmerType = ContextValues.lowerText(context, Query.FARMER_TYPE, DEFAULT_FARMER_TYPE);
            double landArea = ContextValues.number(context, Query.LAND_AREA, DEFAULT_LAND_AREA);
            String cropType = ContextValues.text(context, Query.CROP_TYPE, "general");
            String state = ContextValues.text(context, Query.STATE, DEFAULT_STATE);
            String creditScore = ContextValues.lowerText(context, "credit_score", "good");

            List<LoanOption> loans = loanOptions(farmerType, landArea);
            List<Scheme> schemes = governmentSchemes(state);
            MarketTrend marketTrend = marketTrend(cropType);
            LoanEligibility eligibility = loanEligibility(farmerType, landArea, creditScore);

            Map<String, Object> data = new LinkedHashMap<>();
            data.put("loan_options", loans);
            data.put("government_schemes", schemes);
            data.put("market_analysis", marketTrend);
            data.put("insurance_options", insuranceOptions(landArea));
            data.put("loan_eligibility", eligibility);

            if (narrator != null) {
                narrator.narrate(Category.FINANCE, Relevance.languageOf(query), query.text(), data)
                        .ifPresent(text -> data.put("advisory", text));
            }

            long elapsed = System.currentTimeMillis() - startTime;
            log.info("[FinanceAgent] Completed in {}ms ({} loans, {} schemes)", elapsed, loans.size(), schemes.size());

            return SpecialistResult.success(Category.FINANCE, NAME, data,
                    Relevance.confidence(Category.FINANCE, query),
                    recommendations(farmerType, landArea, cropType, marketTrend, eligibility, context));

        } catch (Exception e) {
            long elapsed = System.currentTimeMillis() - startTime;
            log.error("[FinanceAgent] Error processing query", e);
            return SpecialistResult.failure(Category.FINANCE, NAME,
                    "Failed to build finance advice: " + e.getMessage(), Duration.ofMillis(elapsed));
        }
    }

    /**
     * Small holdings under 2 ha see collateral-free products, medium farms of 2-10 ha see bank
     * credit; everyone else sees the full list.
     */
    static List<LoanOption> loanOptions(String farmerType, double landArea) {
        Set<String> allowed;
        if ("small".equals(farmerType) && landArea < 2) {
            allowed = Set.of(KCC, PM_KISAN, MICROFINANCE);
        } else if ("medium".equals(farmerType) && landArea >= 2 && landArea <= 10) {
            allowed = Set.of(KCC, TERM_LOAN);
        } else {
            return LOANS;
        }
        return LOANS.stream().filter(loan -> allowed.contains(loan.name())).collect(Collectors.toList());
    }

    static List<Scheme> governmentSchemes(String state) {
        List<Scheme> schemes = new ArrayList<>(CENTRAL_SCHEMES);
        schemes.addAll(STATE_SCHEMES.getOrDefault(state, List.of()));
        return schemes;
    }

    static MarketTrend marketTrend(String cropType) {
        return MARKET_TRENDS.getOrDefault(cropType,
                new MarketTrend(0, "Unknown", "Data not available", List.of()));
    }

    static List<InsuranceOption> insuranceOptions(double landArea) {
        return List.of(
                new InsuranceOption("PM Fasal Bima Yojana", "Yield loss, weather risk, post-harvest losses",
                        "2% for Kharif, 1.5% for Rabi", rupees(landArea * 50_000),
                        List.of("Government subsidy", "Quick settlement", "Comprehensive coverage")),
                new InsuranceOption("Weather-Based Crop Insurance", "Weather-related losses", "3-5%",
                        rupees(landArea * 40_000),
                        List.of("Weather station data", "Automatic settlement", "No crop cutting experiments")),
                new InsuranceOption("Crop Insurance for Horticulture", "Fruits and vegetables", "5-8%",
                        rupees(landArea * 60_000),
                        List.of("Specialized coverage", "Market price protection", "Quality loss coverage")));
    }

    /**
     * land (ha) × ₹50,000 × farmer multiplier (small 0.8, medium 1.0, large 1.2)
     * × credit multiplier (excellent 1.2, good 1.0, otherwise 0.7)
     */
    static LoanEligibility loanEligibility(String farmerType, double landArea, String creditScore) {
        double farmerMultiplier = switch (farmerType) {
            case "small" -> 0.8;
            case "medium" -> 1.0;
            default -> 1.2;
        };
        double creditMultiplier = switch (creditScore) {
            case "excellent" -> 1.2;
            case "good" -> 1.0;
            default -> 0.7;
        };
        double eligible = landArea * RUPEES_PER_HECTARE * farmerMultiplier * creditMultiplier;

        return new LoanEligibility(eligible, rupees(eligible),
                List.of("Land area: " + landArea + " hectares",
                        "Farmer type: " + farmerType,
                        "Credit score: " + creditScore),
                List.of("Maintain good credit history",
                        "Keep land documents updated",
                        "Consider crop insurance for better terms"));
    }

    private static List<Recommendation> recommendations(String farmerType, double landArea, String cropType,
                                                        MarketTrend marketTrend, LoanEligibility eligibility,
                                                        Map<String, Object> context) {
        List<Recommendation> recommendations = new ArrayList<>();

        if ("small".equals(farmerType)) {
            recommendations.add(Recommendation.of(Category.FINANCE, Horizon.IMMEDIATE_ACTION, Priority.MEDIUM,
                    "Register for PM-KISAN to receive ₹6,000 per year in three installments"));
        }

        recommendations.add(Recommendation.of(Category.FINANCE, Horizon.SHORT_TERM_PLAN, Priority.HIGH,
                "Apply for a Kisan Credit Card: estimated eligibility " + eligibility.eligibleAmount()));

        String season = ContextValues.titleText(context, Query.SEASON, "Kharif");
        recommendations.add(Recommendation.of(Category.FINANCE, Horizon.RISK_MITIGATION, Priority.HIGH,
                "Enroll in PM Fasal Bima Yojana before the " + season + " cut-off date (sum insured about "
                        + rupees(landArea * 50_000) + ")"));

        switch (marketTrend.trend()) {
            case "Rising" -> recommendations.add(Recommendation.of(Category.FINANCE, Horizon.OPPORTUNITY,
                    Priority.MEDIUM, cropType + " prices are rising: " + marketTrend.forecast().toLowerCase(Locale.ROOT)));
            case "Falling" -> recommendations.add(Recommendation.of(Category.FINANCE, Horizon.RISK_MITIGATION,
                    Priority.MEDIUM, cropType + " prices are falling: consider warehouse receipts or staggered sales"));
            default -> {
                // no market signal worth acting on
            }
        }

        recommendations.add(Recommendation.of(Category.FINANCE, Horizon.LONG_TERM_STRATEGY, Priority.LOW,
                "Keep land records updated and repay on time to qualify for larger term loans"));

        return recommendations;
    }

    private static String rupees(double amount) {
        return String.format(Locale.ENGLISH, "₹%,.0f", amount);
    }
}
