package com.smurthy.ai.agri.controllers;

import com.smurthy.ai.agri.agents.Specialist;
import com.smurthy.ai.agri.dto.ErrorResponse;
import com.smurthy.ai.agri.dto.QueryRequest;
import com.smurthy.ai.agri.dto.QueryResponse;
import com.smurthy.ai.agri.history.QueryHistoryStore;
import com.smurthy.ai.agri.history.QueryRecord;
import com.smurthy.ai.agri.model.Category;
import com.smurthy.ai.agri.model.Language;
import com.smurthy.ai.agri.orchestration.AdvisoryOrchestrator;
import com.smurthy.ai.agri.orchestration.AdvisoryResult;
import com.smurthy.ai.agri.orchestration.SpecialistRegistry;
import com.smurthy.ai.agri.service.AgriculturalCatalog;
import com.smurthy.ai.agri.service.CropKnowledgeBase;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.util.StringUtils;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * AGRICULTURAL ADVISORY CONTROLLER
 *
 * One endpoint for free-form farmer questions in any supported language; the orchestrator picks
 * the specialists. Per-category endpoints skip classification-based routing.
 *
 * EXAMPLE QUERIES:
 * - "When should I irrigate my wheat crop?" → Weather Agent
 * - "Which crop should I plant this kharif season?" → Crop Agent
 * - "किसानों के लिए कौन से ऋण उपलब्ध हैं?" → Finance Agent (Hindi)
 * - comprehensive=true with several topics → all matching agents, merged
 */
@RestController
public class QueryController {

    private static final Logger log = LoggerFactory.getLogger(QueryController.class);

    private static final String SERVICE_NAME = "Agricultural Advisor";
    private static final String VERSION = "1.0.0";

    private final AdvisoryOrchestrator orchestrator;
    private final SpecialistRegistry registry;
    private final CropKnowledgeBase cropKnowledgeBase;
    private final QueryHistoryStore historyStore;

    public QueryController(AdvisoryOrchestrator orchestrator,
                           SpecialistRegistry registry,
                           CropKnowledgeBase cropKnowledgeBase,
                           QueryHistoryStore historyStore) {
        this.orchestrator = orchestrator;
        this.registry = registry;
        this.cropKnowledgeBase = cropKnowledgeBase;
        this.historyStore = historyStore;
    }

    @GetMapping("/")
    public Map<String, Object> health() {
        Map<String, Object> health = new LinkedHashMap<>();
        health.put("status", "healthy");
        health.put("service", SERVICE_NAME);
        health.put("version", VERSION);
        health.put("agents", registry.all().size());
        health.put("timestamp", Instant.now().toString());
        return health;
    }

    @PostMapping("/query")
    public ResponseEntity<?> query(@RequestBody QueryRequest request) {
        if (!StringUtils.hasText(request.query())) {
            log.warn("Received an empty or null query. Aborting.");
            return ResponseEntity.badRequest().body(ErrorResponse.of("Query text must not be blank"));
        }

        log.info("[QueryController] Query: {} (comprehensive={}, language={})",
                request.query(), Boolean.TRUE.equals(request.comprehensive()), request.language());

        AdvisoryResult result = orchestrator.advise(request.toQuery());
        return ResponseEntity.ok(QueryResponse.from(result));
    }

    /**
     * Sends the query straight to one category's specialists ("weather", "crop", "finance").
     */
    @PostMapping("/query/{category}")
    public ResponseEntity<?> queryCategory(@PathVariable String category, @RequestBody QueryRequest request) {
        Optional<Category> forced = Category.fromKey(category);
        if (forced.isEmpty()) {
            return ResponseEntity.badRequest().body(ErrorResponse.of("Unknown category: " + category));
        }
        if (!StringUtils.hasText(request.query())) {
            log.warn("Received an empty or null query for {}. Aborting.", category);
            return ResponseEntity.badRequest().body(ErrorResponse.of("Query text must not be blank"));
        }

        AdvisoryResult result = orchestrator.advise(request.toQuery(), forced.get());
        return ResponseEntity.ok(QueryResponse.from(result));
    }

    @GetMapping("/agents")
    public Map<String, Object> agents() {
        List<Map<String, Object>> agents = new ArrayList<>();
        for (Specialist specialist : registry.all()) {
            Map<String, Object> agent = new LinkedHashMap<>();
            agent.put("name", specialist.name());
            agent.put("category", specialist.category().key());
            agent.put("description", specialist.profile().description());
            agent.put("capabilities", specialist.profile().capabilities());
            agent.put("keywords", specialist.profile().keywords());
            agents.add(agent);
        }
        return Map.of("agents", agents);
    }

    @GetMapping("/supported-languages")
    public Map<String, Object> supportedLanguages() {
        List<Map<String, String>> languages = new ArrayList<>();
        for (Language language : Language.values()) {
            languages.add(Map.of("code", language.code(), "name", language.displayName()));
        }
        return Map.of("languages", languages, "default", Language.ENGLISH.code());
    }

    @GetMapping("/crops")
    public Map<String, Object> crops() {
        return Map.of(
                "crops", AgriculturalCatalog.MAJOR_CROPS,
                "seasons", CropKnowledgeBase.SEASONS,
                "recommendable", cropKnowledgeBase.cropSeasons());
    }

    @GetMapping("/soil-types")
    public Map<String, Object> soilTypes() {
        return Map.of("soil_types", CropKnowledgeBase.SOIL_TYPES);
    }

    @GetMapping("/examples")
    public Map<String, List<String>> examples() {
        return AgriculturalCatalog.exampleQueries();
    }

    @GetMapping("/history/{category}")
    public ResponseEntity<?> history(@PathVariable String category,
                                     @RequestParam(defaultValue = "10") int limit) {
        Optional<Category> parsed = Category.fromKey(category);
        if (parsed.isEmpty()) {
            return ResponseEntity.badRequest().body(ErrorResponse.of("Unknown category: " + category));
        }
        List<QueryRecord> records = historyStore.recent(parsed.get(), Math.max(1, Math.min(limit, 100)));
        return ResponseEntity.ok(Map.of("category", parsed.get().key(), "queries", records));
    }
}
