package com.smurthy.ai.agri.classification;

import com.smurthy.ai.agri.model.Language;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class LanguageDetectorTest {

    private final LanguageDetector detector = new LanguageDetector();

    @ParameterizedTest(name = "{0} -> {1}")
    @CsvSource({
            "'मेरी गेहूं की फसल को कब सिंचाई करनी चाहिए?', HINDI",
            "'माझ्या पिकासाठी पाऊस कधी येईल?', MARATHI",
            "'আজ কি বৃষ্টি হবে?', BENGALI",
            "'ਅੱਜ ਮੀਂਹ ਪਵੇਗਾ?', PUNJABI",
            "'આજે વરસાદ પડશે?', GUJARATI",
            "'நாளை மழை வருமா?', TAMIL",
            "'ఈ రోజు వర్షం పడుతుందా?', TELUGU",
            "'ಇಂದು ಮಳೆ ಬರುತ್ತದೆಯೇ?', KANNADA",
            "'ഇന്ന് മഴ പെയ്യുമോ?', MALAYALAM",
            "'Will it rain today?', ENGLISH"
    })
    @DisplayName("Should detect each supported script")
    void testDetectsScripts(String text, Language expected) {
        assertThat(detector.detect(text)).isEqualTo(expected);
    }

    @Test
    @DisplayName("Devanagari without a Marathi marker should be Hindi")
    void testHindiWithoutMarathiMarkers() {
        assertThat(detector.detect("क्या आज बारिश होगी?")).isEqualTo(Language.HINDI);
    }

    @Test
    @DisplayName("A few Indic words in mostly English text should stay English")
    void testLowDensityStaysEnglish() {
        // Given - one short Devanagari word among many Latin letters
        String text = "Please tell me everything about the PM-KISAN योजना and how to register for it";

        // Then
        assertThat(LanguageDetector.density(text, Character.UnicodeScript.DEVANAGARI))
                .isLessThan(LanguageDetector.DENSITY_THRESHOLD);
        assertThat(detector.detect(text)).isEqualTo(Language.ENGLISH);
    }

    @Test
    @DisplayName("Density should count vowel signs as letters")
    void testDensityCountsMarks() {
        assertThat(LanguageDetector.density("बारिश", Character.UnicodeScript.DEVANAGARI)).isCloseTo(1.0, within(1e-9));
        assertThat(LanguageDetector.density("", Character.UnicodeScript.DEVANAGARI)).isZero();
    }

    @Test
    @DisplayName("Blank and null text should default to English")
    void testBlankText() {
        assertThat(detector.detect(null)).isEqualTo(Language.ENGLISH);
        assertThat(detector.detect("   ")).isEqualTo(Language.ENGLISH);
    }

    @Test
    @DisplayName("Requested language should override detection when supported")
    void testResolve() {
        assertThat(detector.resolve("Will it rain?", "ta")).isEqualTo(Language.TAMIL);
        assertThat(detector.resolve("क्या आज बारिश होगी?", "xx")).isEqualTo(Language.HINDI);
        assertThat(detector.resolve("Will it rain?", null)).isEqualTo(Language.ENGLISH);
    }
}
