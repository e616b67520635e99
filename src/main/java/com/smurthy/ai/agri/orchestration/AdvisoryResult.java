package com.smurthy.ai.agri.orchestration;

import com.smurthy.ai.agri.model.Classification;
import com.smurthy.ai.agri.model.SynthesizedResponse;

import java.time.Instant;

/**
 * The synthesized answer together with what the orchestrator decided on the way.
 */
public record AdvisoryResult(
        String queryId,
        Classification classification,
        SynthesizedResponse response,
        Instant timestamp
) {}
