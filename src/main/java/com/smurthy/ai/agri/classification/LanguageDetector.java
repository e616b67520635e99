package com.smurthy.ai.agri.classification;

import com.smurthy.ai.agri.model.Language;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Script-density language detection for the supported Indian languages.
 *
 * Signatures are checked in a fixed order and the first one whose script makes up at least
 * {@link #DENSITY_THRESHOLD} of the letters wins. Marathi and Hindi share Devanagari, so Marathi
 * is only chosen when one of its marker words is present as well.
 */
public class LanguageDetector {

    static final double DENSITY_THRESHOLD = 0.30;

    private static final Set<String> MARATHI_MARKERS = Set.of(
            "आहे", "आहेत", "काय", "मला", "आणि", "माझ्या", "माझे", "माझी", "कसे", "कशी",
            "कोणते", "कोणती", "साठी", "हवामान", "पाऊस", "पीक", "बियाणे", "शेती", "करावी");

    private record ScriptSignature(Language language, Character.UnicodeScript script, Set<String> markers) {

        boolean accepts(String text) {
            return markers.isEmpty() || markers.stream().anyMatch(text::contains);
        }
    }

    private static final List<ScriptSignature> SIGNATURES = List.of(
            new ScriptSignature(Language.MARATHI, Character.UnicodeScript.DEVANAGARI, MARATHI_MARKERS),
            new ScriptSignature(Language.HINDI, Character.UnicodeScript.DEVANAGARI, Set.of()),
            new ScriptSignature(Language.BENGALI, Character.UnicodeScript.BENGALI, Set.of()),
            new ScriptSignature(Language.PUNJABI, Character.UnicodeScript.GURMUKHI, Set.of()),
            new ScriptSignature(Language.GUJARATI, Character.UnicodeScript.GUJARATI, Set.of()),
            new ScriptSignature(Language.TAMIL, Character.UnicodeScript.TAMIL, Set.of()),
            new ScriptSignature(Language.TELUGU, Character.UnicodeScript.TELUGU, Set.of()),
            new ScriptSignature(Language.KANNADA, Character.UnicodeScript.KANNADA, Set.of()),
            new ScriptSignature(Language.MALAYALAM, Character.UnicodeScript.MALAYALAM, Set.of())
    );

    /**
     * Resolves the language of a query. A supported requested code always wins; anything else
     * falls through to detection.
     */
    public Language resolve(String text, String requestedCode) {
        Optional<Language> requested = Language.fromCode(requestedCode);
        return requested.orElseGet(() -> detect(text));
    }

    public Language detect(String text) {
        if (text == null || text.isBlank()) {
            return Language.ENGLISH;
        }
        for (ScriptSignature signature : SIGNATURES) {
            if (density(text, signature.script()) >= DENSITY_THRESHOLD && signature.accepts(text)) {
                return signature.language();
            }
        }
        return Language.ENGLISH;
    }

    /**
     * Share of letters (vowel signs included) written in the given script.
     */
    static double density(String text, Character.UnicodeScript script) {
        int letters = 0;
        int inScript = 0;
        for (int i = 0; i < text.length(); ) {
            int codePoint = text.codePointAt(i);
            i += Character.charCount(codePoint);
            if (!isLetterLike(codePoint)) {
                continue;
            }
            letters++;
            if (Character.UnicodeScript.of(codePoint) == script) {
                inScript++;
            }
        }
        return letters == 0 ? 0.0 : (double) inScript / letters;
    }

    private static boolean isLetterLike(int codePoint) {
        if (Character.isLetter(codePoint)) {
            return true;
        }
        int type = Character.getType(codePoint);
        return type == Character.NON_SPACING_MARK || type == Character.COMBINING_SPACING_MARK;
    }
}
