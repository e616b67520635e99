package com.smurthy.ai.agri.agents;

import com.smurthy.ai.agri.classification.KeywordCatalog;
import com.smurthy.ai.agri.classification.LanguageDetector;
import com.smurthy.ai.agri.model.Category;
import com.smurthy.ai.agri.model.Language;
import com.smurthy.ai.agri.model.Query;

/**
 * Keyword based confidence a specialist reports for its own answer.
 */
final class Relevance {

    static final double BASE = 0.5;
    static final double PER_HIT = 0.1;
    static final double CEILING = 0.95;

    private static final LanguageDetector LANGUAGE_DETECTOR = new LanguageDetector();

    private Relevance() {}

    static Language languageOf(Query query) {
        return LANGUAGE_DETECTOR.resolve(query.text(), query.requestedLanguage());
    }

    static double confidence(Category category, Query query) {
        Language language = languageOf(query);
        int hits = KeywordCatalog.matches(category, language, query.text()).size();
        return Math.min(BASE + PER_HIT * hits, CEILING);
    }
}
