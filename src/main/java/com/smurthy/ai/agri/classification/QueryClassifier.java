package com.smurthy.ai.agri.classification;

import com.smurthy.ai.agri.model.Category;
import com.smurthy.ai.agri.model.Classification;
import com.smurthy.ai.agri.model.Language;
import com.smurthy.ai.agri.model.Query;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Language and intent classifier.
 *
 * Decides which language a query is written in, which specialist category fits it best
 * and which entities it mentions. Pure keyword and dictionary work: no I/O, and any
 * unexpected input degrades to English + GENERAL instead of failing.
 *
 * Scoring:
 * - one point per distinct keyword hit (detected language plus English)
 * - highest score wins, ties resolved by {@link Category#specialistCategories()} order
 * - nothing hit: GENERAL
 */
@Component
public class QueryClassifier {

    private static final Logger log = LoggerFactory.getLogger(QueryClassifier.class);

    private final LanguageDetector languageDetector;
    private final EntityExtractor entityExtractor;

    public QueryClassifier() {
        this(new LanguageDetector(), new EntityExtractor());
    }

    QueryClassifier(LanguageDetector languageDetector, EntityExtractor entityExtractor) {
        this.languageDetector = languageDetector;
        this.entityExtractor = entityExtractor;
    }

    public Classification classify(Query query) {
        try {
            Language language = languageDetector.resolve(query.text(), query.requestedLanguage());
            Map<Category, Integer> scores = KeywordCatalog.score(language, query.text());
            Category primary = primaryOf(scores);
            List<Category> secondaries = query.comprehensive() ? secondariesOf(scores, primary) : List.of();
            Map<String, Object> entities = mergeEntities(entityExtractor.extract(query.text()), query.context());

            log.debug("[QueryClassifier] language={} primary={} secondaries={} scores={}",
                    language.code(), primary, secondaries, scores);
            return new Classification(language, primary, secondaries, scores, entities);

        } catch (RuntimeException e) {
            log.warn("[QueryClassifier] Falling back to GENERAL for query: {}", e.getMessage());
            return Classification.general(Language.ENGLISH, query.context());
        }
    }

    static Category primaryOf(Map<Category, Integer> scores) {
        Category best = Category.GENERAL;
        int bestScore = 0;
        // strictly greater keeps the earlier (higher priority) category on ties
        for (Category category : Category.specialistCategories()) {
            int score = scores.getOrDefault(category, 0);
            if (score > bestScore) {
                best = category;
                bestScore = score;
            }
        }
        return best;
    }

    static List<Category> secondariesOf(Map<Category, Integer> scores, Category primary) {
        List<Category> priority = Category.specialistCategories();
        List<Category> secondaries = new ArrayList<>();
        for (Category category : priority) {
            if (category != primary && scores.getOrDefault(category, 0) >= 1) {
                secondaries.add(category);
            }
        }
        secondaries.sort(Comparator.comparing((Category c) -> scores.getOrDefault(c, 0)).reversed()
                .thenComparing(priority::indexOf));
        return secondaries;
    }

    private static Map<String, Object> mergeEntities(Map<String, Object> inferred, Map<String, Object> explicit) {
        Map<String, Object> merged = new LinkedHashMap<>(inferred);
        merged.putAll(explicit);
        return merged;
    }
}
