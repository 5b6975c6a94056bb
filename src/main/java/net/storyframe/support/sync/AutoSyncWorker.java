package net.storyframe.support.sync;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import net.storyframe.config.AlignmentProperties;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

/**
 * Drains {@link AutoSyncQueueService} on a dedicated thread, one job at a time.
 * <p>
 * Each job is handed to the {@link ImageLibrarySync} and then released with
 * {@link AutoSyncQueueService#markCompleted}, whether or not the sync succeeded,
 * so the same keywords can be queued again by a later request. Failed jobs are
 * not retried.
 */
@Service
@Slf4j
@ConditionalOnProperty(name = "alignment.auto-sync.worker-enabled", havingValue = "true", matchIfMissing = true)
public class AutoSyncWorker {

    private final AutoSyncQueueService queueService;
    private final ImageLibrarySync librarySync;
    private final int imagesPerSync;

    private Thread workerThread;
    private volatile boolean running = false;

    public AutoSyncWorker(AutoSyncQueueService queueService,
                          ImageLibrarySync librarySync,
                          AlignmentProperties properties) {
        this.queueService = queueService;
        this.librarySync = librarySync;
        this.imagesPerSync = properties.getAutoSync().getImagesPerSync();
    }

    @PostConstruct
    void startWorker() {
        running = true;
        workerThread = new Thread(this::processQueue, "auto-sync-worker");
        workerThread.setDaemon(true);
        workerThread.start();
        log.info("Auto-sync worker thread started");
    }

    @PreDestroy
    void stopWorker() {
        running = false;
        if (workerThread != null) {
            workerThread.interrupt();
        }
        log.info("Auto-sync worker thread stopped");
    }

    private void processQueue() {
        while (running && !Thread.currentThread().isInterrupted()) {
            try {
                process(queueService.take());
            } catch (InterruptedException e) {
                log.debug("Auto-sync worker interrupted");
                Thread.currentThread().interrupt();
            }
        }
    }

    void process(AutoSyncQueueService.AutoSyncJob job) {
        try {
            log.info("Processing auto-sync job {} for \"{}\"", job.jobId(), job.keywords());
            int added = librarySync.syncLibrary(job.keywords(), imagesPerSync);
            log.info("Auto-sync job {} added {} images", job.jobId(), added);
        } catch (RuntimeException ex) {
            log.error("Auto-sync job {} failed for \"{}\"", job.jobId(), job.keywords(), ex);
        } finally {
            queueService.markCompleted(job);
        }
    }
}
