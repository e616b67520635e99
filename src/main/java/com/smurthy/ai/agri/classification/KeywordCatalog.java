package com.smurthy.ai.agri.classification;

import com.smurthy.ai.agri.model.Category;
import com.smurthy.ai.agri.model.Language;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Per-category keyword sets, in English and in every supported Indian language.
 * <p>
 * English keywords match whole words, optionally followed by one suffix of {@code s, es, ed, d,
 * ing, y} ("rains", "rainy", "sowing"). A keyword ending in a silent "e" also matches with the
 * "e" dropped before {@code ed, ing} ("irrigating", "cultivated"). Keywords in Indic scripts
 * match as substrings since those scripts attach postpositions and vowel signs directly to the word.
 */
public final class KeywordCatalog {

    private static final String INFLECTION = "(?:s|es|ed|d|ing|y)?";
    private static final String SILENT_E_INFLECTION = "(?:ed|ing)";

    private static final Map<Category, Map<Language, List<String>>> KEYWORDS = new EnumMap<>(Category.class);

    static {
        KEYWORDS.put(Category.WEATHER, Map.of(
                Language.ENGLISH, List.of("weather", "rain", "rainfall", "temperature", "irrigate", "irrigation",
                        "water", "humidity", "forecast", "drought", "flood", "monsoon", "climate", "moisture",
                        "frost", "heatwave"),
                Language.HINDI, List.of("मौसम", "बारिश", "तापमान", "सिंचाई", "पानी", "नमी"),
                Language.MARATHI, List.of("हवामान", "पाऊस", "तापमान", "सिंचन", "पाणी", "ओलावा"),
                Language.TAMIL, List.of("வானிலை", "மழை", "வெப்பநிலை", "நீர்ப்பாசனம்", "தண்ணீர்", "ஈரப்பதம்"),
                Language.TELUGU, List.of("వాతావరణం", "వర్షం", "ఉష్ణోగ్రత", "నీటిపారుదల", "నీరు", "తేమ"),
                Language.BENGALI, List.of("আবহাওয়া", "বৃষ্টি", "তাপমাত্রা", "সেচ", "জল"),
                Language.GUJARATI, List.of("હવામાન", "વરસાદ", "તાપમાન", "સિંચાઈ", "પાણી"),
                Language.KANNADA, List.of("ಹವಾಮಾನ", "ಮಳೆ", "ತಾಪಮಾನ", "ನೀರಾವರಿ", "ನೀರು"),
                Language.MALAYALAM, List.of("കാലാവസ്ഥ", "മഴ", "താപനില", "ജലസേചനം", "വെള്ളം"),
                Language.PUNJABI, List.of("ਮੌਸਮ", "ਮੀਂਹ", "ਤਾਪਮਾਨ", "ਸਿੰਚਾਈ", "ਪਾਣੀ")));

        KEYWORDS.put(Category.CROP, Map.of(
                Language.ENGLISH, List.of("crop", "seed", "variety", "varieties", "plant", "sow", "harvest", "yield",
                        "pest", "pesticide", "disease", "fertilizer", "soil", "cultivate", "cultivation", "weed"),
                Language.HINDI, List.of("फसल", "बीज", "किस्म", "रोपण", "उपज", "कीट", "खाद", "मिट्टी"),
                Language.MARATHI, List.of("पीक", "बियाणे", "वाण", "लागवड", "उत्पादन", "खत", "माती"),
                Language.TAMIL, List.of("பயிர்", "விதை", "வகை", "நடவு", "அறுவடை", "மகசூல்"),
                Language.TELUGU, List.of("పంట", "విత్తనం", "రకం", "నాటడం", "దిగుబడి"),
                Language.BENGALI, List.of("ফসল", "বীজ", "জাত", "রোপণ", "ফলন"),
                Language.GUJARATI, List.of("પાક", "બીજ", "જાત", "વાવેતર", "ઉપજ"),
                Language.KANNADA, List.of("ಬೆಳೆ", "ಬೀಜ", "ತಳಿ", "ಬಿತ್ತನೆ", "ಇಳುವರಿ"),
                Language.MALAYALAM, List.of("വിള", "വിത്ത്", "ഇനം", "നടീൽ", "വിളവ്"),
                Language.PUNJABI, List.of("ਫਸਲ", "ਬੀਜ", "ਕਿਸਮ", "ਬਿਜਾਈ", "ਝਾੜ")));

        KEYWORDS.put(Category.FINANCE, Map.of(
                Language.ENGLISH, List.of("loan", "credit", "finance", "money", "bank", "scheme", "subsidy",
                        "subsidies", "insurance", "price", "profit", "investment", "budget", "market", "kcc",
                        "pm-kisan"),
                Language.HINDI, List.of("ऋण", "क्रेडिट", "वित्त", "पैसा", "बैंक", "योजना", "सब्सिडी", "बीमा", "कर्ज"),
                Language.MARATHI, List.of("कर्ज", "वित्त", "पैसे", "बँक", "योजना", "अनुदान", "विमा"),
                Language.TAMIL, List.of("கடன்", "நிதி", "பணம்", "வங்கி", "திட்டம்", "காப்பீடு"),
                Language.TELUGU, List.of("రుణం", "క్రెడిట్", "ఆర్థిక", "డబ్బు", "బ్యాంక్", "పథకం", "బీమా"),
                Language.BENGALI, List.of("ঋণ", "অর্থ", "টাকা", "ব্যাংক", "প্রকল্প", "বীমা"),
                Language.GUJARATI, List.of("લોન", "ધિરાણ", "નાણાં", "બેંક", "યોજના", "વીમો"),
                Language.KANNADA, List.of("ಸಾಲ", "ಹಣಕಾಸು", "ಹಣ", "ಬ್ಯಾಂಕ್", "ಯೋಜನೆ", "ವಿಮೆ"),
                Language.MALAYALAM, List.of("വായ്പ", "ധനകാര്യം", "പണം", "ബാങ്ക്", "പദ്ധതി", "ഇൻഷുറൻസ്"),
                Language.PUNJABI, List.of("ਕਰਜ਼ਾ", "ਵਿੱਤ", "ਪੈਸਾ", "ਬੈਂਕ", "ਯੋਜਨਾ", "ਬੀਮਾ")));
    }

    private static final Map<String, Pattern> ENGLISH_PATTERNS = compileEnglishPatterns();

    private KeywordCatalog() {} // utility class

    /**
     * Keywords for a category in the given language, empty for GENERAL.
     */
    public static List<String> keywords(Category category, Language language) {
        Map<Language, List<String>> byLanguage = KEYWORDS.get(category);
        if (byLanguage == null) {
            return List.of();
        }
        return byLanguage.getOrDefault(language, List.of());
    }

    /**
     * Distinct keywords of {@code category} found in {@code text}, looking at the given language
     * and at English.
     */
    public static Set<String> matches(Category category, Language language, String text) {
        if (text == null || text.isBlank() || !KEYWORDS.containsKey(category)) {
            return Set.of();
        }
        String lowerText = text.toLowerCase(Locale.ROOT);
        Set<String> matched = new LinkedHashSet<>();

        for (String keyword : keywords(category, Language.ENGLISH)) {
            if (ENGLISH_PATTERNS.get(keyword).matcher(lowerText).find()) {
                matched.add(keyword);
            }
        }
        if (language != null && language != Language.ENGLISH) {
            for (String keyword : keywords(category, language)) {
                if (lowerText.contains(keyword)) {
                    matched.add(keyword);
                }
            }
        }
        return matched;
    }

    /**
     * Keyword hits per specialist category, in category priority order.
     */
    public static Map<Category, Integer> score(Language language, String text) {
        Map<Category, Integer> scores = new LinkedHashMap<>();
        for (Category category : Category.specialistCategories()) {
            scores.put(category, matches(category, language, text).size());
        }
        return scores;
    }

    private static Map<String, Pattern> compileEnglishPatterns() {
        Map<String, Pattern> patterns = new LinkedHashMap<>();
        for (Map<Language, List<String>> byLanguage : KEYWORDS.values()) {
            for (String keyword : byLanguage.get(Language.ENGLISH)) {
                patterns.put(keyword, Pattern.compile(
                        "(?<![\\p{L}\\p{N}])" + inflected(keyword) + "(?![\\p{L}\\p{N}])",
                        Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE));
            }
        }
        return Collections.unmodifiableMap(patterns);
    }

    private static String inflected(String keyword) {
        String plain = Pattern.quote(keyword) + INFLECTION;
        if (keyword.length() > 3 && keyword.endsWith("e")) {
            String stem = Pattern.quote(keyword.substring(0, keyword.length() - 1));
            return "(?:" + plain + "|" + stem + SILENT_E_INFLECTION + ")";
        }
        return plain;
    }
}
