package net.storyframe.support.sync;

import java.time.Clock;
import java.util.Comparator;
import java.util.Locale;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.PriorityBlockingQueue;
import java.util.concurrent.atomic.AtomicLong;
import lombok.extern.slf4j.Slf4j;
import net.storyframe.application.alignment.AutoSyncQueue;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

/**
 * In-memory queue of library re-sync jobs requested by scenes without matches.
 * <p>
 * Jobs are ephemeral: {@link AutoSyncWorker} drains them with {@link #take()} and
 * releases the dedupe key with {@link #markCompleted(AutoSyncJob)}. While a job for
 * the same keywords is in flight, further requests return the existing job id.
 * <p>
 * Lower priority values are taken first.
 */
@Service
@Slf4j
public class AutoSyncQueueService implements AutoSyncQueue {

    public static final int AUTO_SYNC_PRIORITY = 20;
    private static final String JOB_ID_PREFIX = "autosync-";

    // normalized keywords -> queued job
    private final ConcurrentMap<String, AutoSyncJob> inFlight = new ConcurrentHashMap<>();

    private final BlockingQueue<AutoSyncJob> queue = new PriorityBlockingQueue<>(
        32,
        Comparator.comparingInt(AutoSyncJob::priority).thenComparingLong(AutoSyncJob::enqueuedAtMillis)
    );

    private final AtomicLong enqueuedTotal = new AtomicLong();
    private final Clock clock;

    @Autowired
    public AutoSyncQueueService() {
        this(Clock.systemUTC());
    }

    AutoSyncQueueService(Clock clock) {
        this.clock = clock;
    }

    /**
     * Queues a re-sync for the given search keywords.
     *
     * @param keywords search query for the image library sync
     * @return the id of the queued job, or of the job already in flight for the same keywords
     * @throws IllegalArgumentException when keywords are blank
     */
    @Override
    public String enqueueAutoSync(String keywords) {
        if (!StringUtils.hasText(keywords)) {
            throw new IllegalArgumentException("Auto-sync keywords must not be blank");
        }
        String query = keywords.trim();
        String dedupeKey = query.toLowerCase(Locale.ROOT).replaceAll("\\s+", " ");
        long now = clock.millis();
        AutoSyncJob candidate = new AutoSyncJob(jobIdFor(query, now), query, AUTO_SYNC_PRIORITY, dedupeKey, now);

        AutoSyncJob existing = inFlight.putIfAbsent(dedupeKey, candidate);
        if (existing != null) {
            log.debug("Auto-sync already queued (dedupe): {} -> {}", dedupeKey, existing.jobId());
            return existing.jobId();
        }

        if (!queue.offer(candidate)) {
            inFlight.remove(dedupeKey);
            throw new IllegalStateException("Failed to enqueue auto-sync job for: " + query);
        }
        enqueuedTotal.incrementAndGet();
        log.debug("Enqueued auto-sync job {} (priority={})", candidate.jobId(), AUTO_SYNC_PRIORITY);
        return candidate.jobId();
    }

    /**
     * Takes the next job, blocking until one is available.
     *
     * @throws InterruptedException if interrupted while waiting
     */
    public AutoSyncJob take() throws InterruptedException {
        return queue.take();
    }

    /**
     * Releases the job's dedupe key so the same keywords can be queued again.
     */
    public void markCompleted(AutoSyncJob job) {
        inFlight.remove(job.dedupeKey(), job);
        log.debug("Auto-sync job completed: {}", job.jobId());
    }

    public QueueSnapshot snapshot() {
        return new QueueSnapshot(queue.size(), enqueuedTotal.get());
    }

    static String jobIdFor(String keywords, long epochMillis) {
        return JOB_ID_PREFIX + keywords.trim().replaceAll("\\s+", "-") + "-" + epochMillis;
    }

    /**
     * @param jobId stable identifier returned to the requester
     * @param keywords search query to sync
     * @param priority queue priority, lower first
     * @param dedupeKey normalized keywords
     * @param enqueuedAtMillis enqueue time, used to order equal priorities
     */
    public record AutoSyncJob(String jobId, String keywords, int priority, String dedupeKey, long enqueuedAtMillis) {
    }

    /**
     * @param pending jobs waiting to be taken
     * @param enqueuedTotal jobs accepted since startup, excluding dedupe hits
     */
    public record QueueSnapshot(int pending, long enqueuedTotal) {
    }
}
