package com.smurthy.ai.agri.orchestration;

import com.smurthy.ai.agri.classification.QueryClassifier;
import com.smurthy.ai.agri.history.QueryHistoryRecorder;
import com.smurthy.ai.agri.history.QueryRecord;
import com.smurthy.ai.agri.logging.MdcContext;
import com.smurthy.ai.agri.model.Category;
import com.smurthy.ai.agri.model.Classification;
import com.smurthy.ai.agri.model.Language;
import com.smurthy.ai.agri.model.Outcome;
import com.smurthy.ai.agri.model.PartialFailure;
import com.smurthy.ai.agri.model.Query;
import com.smurthy.ai.agri.model.SpecialistResult;
import com.smurthy.ai.agri.model.SynthesizedResponse;
import com.smurthy.ai.agri.observability.DispatchMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Entry point of the advisory pipeline: classify, dispatch, synthesize.
 *
 * Stateless and safe to call concurrently. Never throws for a valid {@link Query}; anything
 * unexpected is reported as a failed response. After synthesis the outcome is counted in
 * {@link DispatchMetrics} and handed to the history recorder without waiting for it.
 */
@Service
public class AdvisoryOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(AdvisoryOrchestrator.class);

    static final String SOURCE = "Advisory Orchestrator";

    private final QueryClassifier classifier;
    private final Dispatcher dispatcher;
    private final Synthesizer synthesizer;
    private final DispatchMetrics metrics;
    private final QueryHistoryRecorder historyRecorder;

    public AdvisoryOrchestrator(QueryClassifier classifier,
                                Dispatcher dispatcher,
                                Synthesizer synthesizer,
                                DispatchMetrics metrics,
                                QueryHistoryRecorder historyRecorder) {
        this.classifier = classifier;
        this.dispatcher = dispatcher;
        this.synthesizer = synthesizer;
        this.metrics = metrics;
        this.historyRecorder = historyRecorder;
    }

    public SynthesizedResponse handle(Query query) {
        return advise(query).response();
    }

    public AdvisoryResult advise(Query query) {
        return advise(query, null);
    }

    /**
     * @param forced category to send the query to, or null to let the classifier decide
     */
    public AdvisoryResult advise(Query query, Category forced) {
        String queryId = UUID.randomUUID().toString();
        Instant timestamp = Instant.now();
        long startTime = System.currentTimeMillis();
        MdcContext.setQuery(queryId);

        try {
            Classification classification = classifier.classify(query);
            log.info("[Orchestrator] Query {} -> {} ({}){}", queryId, classification.primary(),
                    classification.language().code(), forced != null ? ", forced " + forced : "");

            List<SpecialistResult> results = forced != null
                    ? dispatcher.dispatchTo(forced, classification, query)
                    : dispatcher.dispatch(classification, query);
            SynthesizedResponse response = synthesizer.synthesize(results);

            long elapsed = System.currentTimeMillis() - startTime;
            log.info("[Orchestrator] Query {} answered in {}ms: success={}, confidence={}, failures={}",
                    queryId, elapsed, response.success(), String.format("%.2f", response.confidence()),
                    response.failures().size());

            metrics.recordDispatch(results, response, elapsed);
            historyRecorder.offer(QueryRecord.of(queryId, timestamp, query, classification, response, elapsed));

            return new AdvisoryResult(queryId, classification, response, timestamp);

        } catch (RuntimeException e) {
            log.error("[Orchestrator] Query {} failed unexpectedly", queryId, e);
            SynthesizedResponse failed = SynthesizedResponse.totalFailure(List.of(new PartialFailure(
                    forced != null ? forced : Category.GENERAL, SOURCE, Outcome.FAILURE,
                    "Internal error: " + e.getMessage())));
            return new AdvisoryResult(queryId, Classification.general(Language.ENGLISH, query.context()),
                    failed, timestamp);
        } finally {
            MdcContext.clear();
        }
    }
}
