package com.smurthy.ai.agri;

import com.smurthy.ai.agri.agents.AdvisoryNarrator;
import com.smurthy.ai.agri.agents.Specialist;
import com.smurthy.ai.agri.history.LoggingQueryHistoryStore;
import com.smurthy.ai.agri.history.QueryHistoryStore;
import com.smurthy.ai.agri.model.Category;
import com.smurthy.ai.agri.model.Outcome;
import com.smurthy.ai.agri.model.Query;
import com.smurthy.ai.agri.model.SpecialistResult;
import com.smurthy.ai.agri.model.SynthesizedResponse;
import com.smurthy.ai.agri.orchestration.AdvisoryOrchestrator;
import com.smurthy.ai.agri.orchestration.SpecialistRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.ApplicationContext;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class AgriAdvisorApplicationTests extends BaseIntegrationTest {

    @Autowired
    private ApplicationContext context;

    @Autowired
    private SpecialistRegistry registry;

    @Autowired
    private QueryHistoryStore historyStore;

    @Autowired
    private AdvisoryOrchestrator orchestrator;

    @Autowired
    private List<Specialist> specialists;

    @Test
    @DisplayName("Should register one specialist per category")
    void testRegistryWiring() {
        assertThat(registry.all()).hasSize(3);
        assertThat(registry.resolve(Category.WEATHER)).singleElement()
                .satisfies(specialist -> assertThat(specialist.name()).isEqualTo("Weather Agent"));
        assertThat(registry.resolve(Category.FINANCE)).singleElement()
                .satisfies(specialist -> assertThat(specialist.name()).isEqualTo("Finance Agent"));
    }

    @Test
    @DisplayName("Without DynamoDB and LLM settings the log store is used and no narrator exists")
    void testOptionalInfrastructureDisabled() {
        assertThat(historyStore).isInstanceOf(LoggingQueryHistoryStore.class);
        assertThat(context.getBeanNamesForType(AdvisoryNarrator.class)).isEmpty();
    }

    @Test
    @DisplayName("A comprehensive query should be answered end to end")
    void testEndToEnd() {
        // Given
        Query query = Query.comprehensive(
                "I have 5 acres of black soil near Nagpur, which crop should I sow this kharif, "
                        + "will the rain be enough and which loan can I get?", Map.of());

        // When
        SynthesizedResponse response = orchestrator.handle(query);

        // Then
        assertThat(response.success()).isTrue();
        assertThat(response.failures()).isEmpty();
        assertThat(response.sources()).containsExactly("Crop Agent", "Weather Agent", "Finance Agent");
        assertThat(response.data()).containsOnlyKeys("crop", "weather", "finance");
        assertThat(response.confidence()).isBetween(0.5, 0.95);
    }

    @Test
    @DisplayName("Every wired specialist should succeed with the LLM narrator disabled")
    void testSpecialistsWithoutNarrator() {
        // Given
        Query query = Query.of("Which crop, how much rain and which loan for my farm?");

        // Then
        assertThat(specialists).hasSize(3);
        for (Specialist specialist : specialists) {
            SpecialistResult result = specialist.invoke(query, Map.of());
            assertThat(result.outcome())
                    .as("%s failed: %s", specialist.name(), result.failureReason())
                    .isEqualTo(Outcome.SUCCESS);
            assertThat(result.payload()).doesNotContainKey("advisory");
        }
    }
}
