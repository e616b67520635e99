package com.smurthy.ai.agri.orchestration;

import com.smurthy.ai.agri.agents.Specialist;
import com.smurthy.ai.agri.model.Category;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Immutable category to specialist table, built once at startup.
 *
 * Every concrete category must be served by at least one specialist. GENERAL resolves to
 * every registered specialist in category order.
 */
public final class SpecialistRegistry {

    private static final Logger log = LoggerFactory.getLogger(SpecialistRegistry.class);

    private final Map<Category, List<Specialist>> byCategory;
    private final List<Specialist> all;

    public SpecialistRegistry(List<? extends Specialist> specialists) {
        Map<Category, List<Specialist>> grouped = new EnumMap<>(Category.class);
        for (Specialist specialist : specialists) {
            if (specialist.category() == Category.GENERAL) {
                throw new RegistryConfigurationException(
                        "Specialist '" + specialist.name() + "' cannot be registered for GENERAL");
            }
            grouped.computeIfAbsent(specialist.category(), c -> new ArrayList<>()).add(specialist);
        }

        for (Category category : Category.specialistCategories()) {
            if (!grouped.containsKey(category)) {
                throw new RegistryConfigurationException("No specialist registered for category " + category);
            }
        }

        Map<Category, List<Specialist>> frozen = new EnumMap<>(Category.class);
        Set<Specialist> everyone = new LinkedHashSet<>();
        for (Category category : Category.specialistCategories()) {
            List<Specialist> forCategory = List.copyOf(grouped.get(category));
            frozen.put(category, forCategory);
            everyone.addAll(forCategory);
        }
        this.byCategory = Collections.unmodifiableMap(frozen);
        this.all = List.copyOf(everyone);

        log.info("[SpecialistRegistry] Registered {} specialists: {}", all.size(),
                all.stream().map(Specialist::name).collect(Collectors.toList()));
    }

    /**
     * Specialists serving a category. GENERAL (or null) means all of them.
     */
    public List<Specialist> resolve(Category category) {
        if (category == null || category == Category.GENERAL) {
            return all;
        }
        return byCategory.getOrDefault(category, List.of());
    }

    public List<Specialist> all() {
        return all;
    }

    public boolean contains(Specialist specialist) {
        return all.contains(specialist);
    }
}
