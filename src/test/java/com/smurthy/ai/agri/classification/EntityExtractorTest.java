package com.smurthy.ai.agri.classification;

import com.smurthy.ai.agri.model.Query;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class EntityExtractorTest {

    private final EntityExtractor extractor = new EntityExtractor();

    @Test
    @DisplayName("Should take the earliest city mentioned")
    void testEarliestCityWins() {
        // When
        Map<String, Object> entities = extractor.extract("Moving from Nagpur to Chennai, which crop should I grow?");

        // Then
        assertThat(entities).containsEntry(Query.LOCATION, "Nagpur")
                .containsEntry(Query.STATE, "Maharashtra");
    }

    @Test
    @DisplayName("Should prefer the longest surface form at the same position")
    void testLongestMatch() {
        Map<String, Object> entities = extractor.extract("Weather in New Delhi tomorrow");

        assertThat(entities).containsEntry(Query.LOCATION, "Delhi");
    }

    @Test
    @DisplayName("An explicitly named state should win over the city's state")
    void testExplicitState() {
        Map<String, Object> entities = extractor.extract("I farm near Punjab border, closest city is Jaipur");

        assertThat(entities).containsEntry(Query.LOCATION, "Jaipur")
                .containsEntry(Query.STATE, "Punjab");
    }

    @Test
    @DisplayName("Should recognise Hindi crop names and seasons")
    void testHindiEntities() {
        Map<String, Object> entities = extractor.extract("रबी में गेहूं की खेती");

        assertThat(entities).containsEntry(Query.CROP_TYPE, "Wheat")
                .containsEntry(Query.SEASON, "Rabi");
    }

    @Test
    @DisplayName("Should accept plural crop names")
    void testPluralCrop() {
        assertThat(extractor.extract("My tomatoes have spots")).containsEntry(Query.CROP_TYPE, "Tomato");
    }

    @Test
    @DisplayName("Should normalise land area to hectares")
    void testLandArea() {
        assertThat(EntityExtractor.landAreaInHectares("I own 10 acres")).contains(4.05);
        assertThat(EntityExtractor.landAreaInHectares("about 3.5 ha of paddy")).contains(3.5);
        assertThat(EntityExtractor.landAreaInHectares("1 acre")).contains(0.40);
        assertThat(EntityExtractor.landAreaInHectares("2 hectares")).contains(2.0);
        assertThat(EntityExtractor.landAreaInHectares("a large farm")).isEmpty();
    }

    @Test
    @DisplayName("Should return nothing for text without entities")
    void testNoEntities() {
        assertThat(extractor.extract("How are you?")).isEmpty();
        assertThat(extractor.extract("   ")).isEmpty();
    }
}
