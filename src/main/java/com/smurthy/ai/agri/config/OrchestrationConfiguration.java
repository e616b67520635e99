package com.smurthy.ai.agri.config;

import com.smurthy.ai.agri.agents.Specialist;
import com.smurthy.ai.agri.orchestration.SpecialistRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Wires the specialist registry and the executor specialists run on.
 */
@Configuration
public class OrchestrationConfiguration {

    private static final Logger log = LoggerFactory.getLogger(OrchestrationConfiguration.class);

    /**
     * Built from every {@link Specialist} bean; fails startup when a category is left uncovered.
     */
    @Bean
    public SpecialistRegistry specialistRegistry(List<Specialist> specialists) {
        return new SpecialistRegistry(specialists);
    }

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService specialistExecutor(DispatchConfig dispatchConfig) {
        log.info("Creating specialist executor with {} threads, default budget {}",
                dispatchConfig.poolSize(), dispatchConfig.specialistTimeout());
        AtomicInteger counter = new AtomicInteger();
        return Executors.newFixedThreadPool(dispatchConfig.poolSize(), runnable -> {
            Thread thread = new Thread(runnable, "specialist-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }
}
