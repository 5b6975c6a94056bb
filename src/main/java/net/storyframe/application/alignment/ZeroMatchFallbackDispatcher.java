package net.storyframe.application.alignment;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

/**
 * Launches library re-sync work for scenes that produced no matches.
 *
 * <p>Each dispatch runs keyword extraction followed by an auto-sync enqueue on the
 * injected scheduler and returns immediately. Failures end in this class's error
 * consumer: they are logged and counted, never rethrown to the alignment flow.</p>
 */
@Component
public class ZeroMatchFallbackDispatcher {

    private static final Logger log = LoggerFactory.getLogger(ZeroMatchFallbackDispatcher.class);

    static final String DISPATCHED_METRIC = "alignment.fallback.dispatched";
    static final String FAILED_METRIC = "alignment.fallback.failures";

    private final SearchKeywordExtractor keywordExtractor;
    private final AutoSyncQueue autoSyncQueue;
    private final Scheduler scheduler;
    private final Counter dispatchedCounter;
    private final Counter failedCounter;

    public ZeroMatchFallbackDispatcher(SearchKeywordExtractor keywordExtractor,
                                       AutoSyncQueue autoSyncQueue,
                                       @Qualifier("alignmentFallbackScheduler") Scheduler scheduler,
                                       MeterRegistry meterRegistry) {
        this.keywordExtractor = keywordExtractor;
        this.autoSyncQueue = autoSyncQueue;
        this.scheduler = scheduler;
        this.dispatchedCounter = Counter.builder(DISPATCHED_METRIC)
            .description("Auto-sync jobs queued for scenes without matches")
            .register(meterRegistry);
        this.failedCounter = Counter.builder(FAILED_METRIC)
            .description("Zero-match fallbacks that failed before queueing")
            .register(meterRegistry);
    }

    /**
     * Starts the fallback for one scene without waiting for it.
     *
     * @param sceneIndex position of the scene in its sequence, for log context
     * @param intent the scene's intent text
     */
    public void dispatch(int sceneIndex, String intent) {
        log.warn("No matches found for scene {} (\"{}\"). Triggering auto-sync.", sceneIndex, abbreviate(intent));

        queueSync(sceneIndex, intent)
            .subscribeOn(scheduler)
            .subscribe(
                jobId -> log.info("Queued auto-sync job {} for scene {}", jobId, sceneIndex),
                error -> log.error("Zero-match fallback failed for scene {}", sceneIndex, error));
    }

    /**
     * Extracts keywords for the intent and queues a re-sync with them.
     *
     * @return the queued job id; errors when no keywords were extracted or the enqueue failed
     */
    Mono<String> queueSync(int sceneIndex, String intent) {
        return Mono.fromCallable(() -> keywordExtractor.extractSearchKeywords(intent))
            .filter(StringUtils::hasText)
            .switchIfEmpty(Mono.error(() -> new IllegalStateException(
                "Keyword extraction returned no keywords for scene " + sceneIndex)))
            .doOnNext(keywords -> log.debug("Extracted auto-sync keywords \"{}\" for scene {}", keywords, sceneIndex))
            .map(autoSyncQueue::enqueueAutoSync)
            .doOnNext(jobId -> dispatchedCounter.increment())
            .doOnError(error -> failedCounter.increment());
    }

    private static String abbreviate(String intent) {
        if (intent == null) {
            return "";
        }
        return intent.length() <= 60 ? intent : intent.substring(0, 60) + "...";
    }
}
