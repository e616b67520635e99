package com.smurthy.ai.agri.classification;

import com.smurthy.ai.agri.model.Query;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Dictionary based entity extraction: places, crops, seasons and land area.
 *
 * For every entity kind the earliest mention in the text wins. Latin terms match on word
 * boundaries, Devanagari terms by substring.
 */
public class EntityExtractor {

    static final double HECTARES_PER_ACRE = 0.404686;

    private static final Pattern LAND_AREA = Pattern.compile(
            "(\\d+(?:\\.\\d+)?)\\s*(acres?|hectares?|ha)\\b", Pattern.CASE_INSENSITIVE);

    private static final Map<String, String> CITY_STATES = Map.ofEntries(
            Map.entry("Mumbai", "Maharashtra"), Map.entry("Pune", "Maharashtra"),
            Map.entry("Nagpur", "Maharashtra"), Map.entry("Nashik", "Maharashtra"),
            Map.entry("Aurangabad", "Maharashtra"), Map.entry("Kolhapur", "Maharashtra"),
            Map.entry("Solapur", "Maharashtra"), Map.entry("Delhi", "Delhi"),
            Map.entry("Bengaluru", "Karnataka"), Map.entry("Mysuru", "Karnataka"),
            Map.entry("Hubli", "Karnataka"), Map.entry("Chennai", "Tamil Nadu"),
            Map.entry("Coimbatore", "Tamil Nadu"), Map.entry("Madurai", "Tamil Nadu"),
            Map.entry("Hyderabad", "Telangana"), Map.entry("Warangal", "Telangana"),
            Map.entry("Visakhapatnam", "Andhra Pradesh"), Map.entry("Vijayawada", "Andhra Pradesh"),
            Map.entry("Guntur", "Andhra Pradesh"), Map.entry("Kolkata", "West Bengal"),
            Map.entry("Ahmedabad", "Gujarat"), Map.entry("Surat", "Gujarat"),
            Map.entry("Rajkot", "Gujarat"), Map.entry("Vadodara", "Gujarat"),
            Map.entry("Jaipur", "Rajasthan"), Map.entry("Jodhpur", "Rajasthan"),
            Map.entry("Lucknow", "Uttar Pradesh"), Map.entry("Kanpur", "Uttar Pradesh"),
            Map.entry("Varanasi", "Uttar Pradesh"), Map.entry("Agra", "Uttar Pradesh"),
            Map.entry("Bhopal", "Madhya Pradesh"), Map.entry("Indore", "Madhya Pradesh"),
            Map.entry("Patna", "Bihar"), Map.entry("Chandigarh", "Punjab"),
            Map.entry("Ludhiana", "Punjab"), Map.entry("Amritsar", "Punjab"),
            Map.entry("Kochi", "Kerala"), Map.entry("Thiruvananthapuram", "Kerala"),
            Map.entry("Bhubaneswar", "Odisha"), Map.entry("Guwahati", "Assam"),
            Map.entry("Raipur", "Chhattisgarh"), Map.entry("Ranchi", "Jharkhand"),
            Map.entry("Karnal", "Haryana"), Map.entry("Hisar", "Haryana"));

    private final Dictionary cities = new Dictionary(withSurfaceForms(CITY_STATES.keySet(), Map.of(
            "New Delhi", "Delhi", "Bangalore", "Bengaluru", "Mysore", "Mysuru", "Bombay", "Mumbai",
            "Calcutta", "Kolkata", "Madras", "Chennai", "Cochin", "Kochi",
            "मुंबई", "Mumbai", "पुणे", "Pune", "दिल्ली", "Delhi")));

    private final Dictionary states = new Dictionary(withSurfaceForms(List.of(
            "Maharashtra", "Punjab", "Haryana", "Uttar Pradesh", "Madhya Pradesh", "Rajasthan", "Gujarat",
            "Karnataka", "Tamil Nadu", "Kerala", "Andhra Pradesh", "Telangana", "West Bengal", "Bihar",
            "Odisha", "Assam", "Jharkhand", "Chhattisgarh", "Himachal Pradesh", "Uttarakhand"), Map.of(
            "Orissa", "Odisha", "महाराष्ट्र", "Maharashtra", "पंजाब", "Punjab", "हरियाणा", "Haryana",
            "उत्तर प्रदेश", "Uttar Pradesh", "मध्य प्रदेश", "Madhya Pradesh", "राजस्थान", "Rajasthan",
            "गुजरात", "Gujarat", "बिहार", "Bihar")));

    private final Dictionary crops = new Dictionary(Map.ofEntries(
            Map.entry("rice", "Rice"), Map.entry("paddy", "Rice"), Map.entry("wheat", "Wheat"),
            Map.entry("cotton", "Cotton"), Map.entry("sugarcane", "Sugarcane"), Map.entry("maize", "Maize"),
            Map.entry("corn", "Maize"), Map.entry("soybean", "Soybean"), Map.entry("groundnut", "Groundnut"),
            Map.entry("mustard", "Mustard"), Map.entry("chickpea", "Chickpea"), Map.entry("gram", "Chickpea"),
            Map.entry("bajra", "Bajra"), Map.entry("jowar", "Jowar"), Map.entry("barley", "Barley"),
            Map.entry("tomato", "Tomato"), Map.entry("onion", "Onion"), Map.entry("potato", "Potato"),
            Map.entry("धान", "Rice"), Map.entry("चावल", "Rice"), Map.entry("गेहूं", "Wheat"),
            Map.entry("गेहूँ", "Wheat"), Map.entry("कपास", "Cotton"), Map.entry("गन्ना", "Sugarcane"),
            Map.entry("मक्का", "Maize"), Map.entry("सोयाबीन", "Soybean"), Map.entry("मूंगफली", "Groundnut"),
            Map.entry("सरसों", "Mustard"), Map.entry("चना", "Chickpea"), Map.entry("बाजरा", "Bajra"),
            Map.entry("ज्वार", "Jowar"), Map.entry("टमाटर", "Tomato"), Map.entry("प्याज", "Onion"),
            Map.entry("आलू", "Potato")));

    private final Dictionary seasons = new Dictionary(Map.of(
            "kharif", "Kharif", "rabi", "Rabi", "zaid", "Zaid", "zayed", "Zaid",
            "खरीफ", "Kharif", "रबी", "Rabi", "जायद", "Zaid"));

    /**
     * Entities mentioned in the text, keyed by the {@link Query} context keys.
     */
    public Map<String, Object> extract(String text) {
        Map<String, Object> entities = new LinkedHashMap<>();
        if (text == null || text.isBlank()) {
            return entities;
        }

        Optional<String> city = cities.firstMatch(text);
        city.ifPresent(value -> entities.put(Query.LOCATION, value));

        Optional<String> state = states.firstMatch(text).or(() -> city.map(CITY_STATES::get));
        state.ifPresent(value -> entities.put(Query.STATE, value));

        crops.firstMatch(text).ifPresent(value -> entities.put(Query.CROP_TYPE, value));
        seasons.firstMatch(text).ifPresent(value -> entities.put(Query.SEASON, value));
        landAreaInHectares(text).ifPresent(value -> entities.put(Query.LAND_AREA, value));

        return entities;
    }

    static Optional<Double> landAreaInHectares(String text) {
        Matcher matcher = LAND_AREA.matcher(text);
        if (!matcher.find()) {
            return Optional.empty();
        }
        double amount = Double.parseDouble(matcher.group(1));
        boolean acres = matcher.group(2).toLowerCase(Locale.ROOT).startsWith("acre");
        double hectares = acres ? amount * HECTARES_PER_ACRE : amount;
        return Optional.of(BigDecimal.valueOf(hectares).setScale(2, RoundingMode.HALF_UP).doubleValue());
    }

    private static Map<String, String> withSurfaceForms(Iterable<String> canonical, Map<String, String> aliases) {
        Map<String, String> forms = new LinkedHashMap<>();
        canonical.forEach(name -> forms.put(name, name));
        forms.putAll(aliases);
        return forms;
    }

    /**
     * Surface form to canonical value lookup, reporting the earliest mention.
     */
    private static final class Dictionary {

        private record Term(Pattern pattern, String canonical) {}

        private final List<Term> terms = new ArrayList<>();

        Dictionary(Map<String, String> surfaceForms) {
            surfaceForms.forEach((surface, canonical) -> terms.add(new Term(compile(surface), canonical)));
        }

        Optional<String> firstMatch(String text) {
            int bestStart = Integer.MAX_VALUE;
            int bestLength = -1;
            String best = null;
            for (Term term : terms) {
                Matcher matcher = term.pattern().matcher(text);
                if (!matcher.find()) {
                    continue;
                }
                int length = matcher.end() - matcher.start();
                if (matcher.start() < bestStart || (matcher.start() == bestStart && length > bestLength)) {
                    bestStart = matcher.start();
                    bestLength = length;
                    best = term.canonical();
                }
            }
            return Optional.ofNullable(best);
        }

        private static Pattern compile(String surface) {
            String quoted = Pattern.quote(surface);
            if (surface.chars().allMatch(c -> c < 0x0900)) {
                // plural forms ("tomatoes", "potatoes") still count as the crop
                return Pattern.compile("(?<![\\p{L}\\p{N}])" + quoted + "(?:s|es)?(?![\\p{L}\\p{N}])",
                        Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
            }
            return Pattern.compile(quoted);
        }
    }
}
