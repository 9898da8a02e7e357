package com.example.licitacoes.server.sync;

import com.example.licitacoes.server.config.LicitacoesProperties;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Periodic sync of the configured modalities. One ticker thread submits a run per modality to a
 * worker pool sized to the modality list, so modalities proceed in parallel while runs of the
 * same modality never overlap.
 */
@Component
public class SyncScheduler {

    private static final Logger log = LoggerFactory.getLogger(SyncScheduler.class);

    private final SyncOrchestrator orchestrator;
    private final LicitacoesProperties.Scheduler settings;
    private final Clock clock;

    private final Object lifecycle = new Object();
    private ScheduledExecutorService ticker;
    private ExecutorService workers;
    private volatile boolean stopRequested;

    public SyncScheduler(SyncOrchestrator orchestrator, LicitacoesProperties properties, Clock clock) {
        this.orchestrator = orchestrator;
        this.settings = properties.getSync().getScheduler();
        this.clock = clock;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void startIfEnabled() {
        if (settings.isEnabled()) {
            start(settings.getInterval());
        } else {
            log.info("Sync scheduler disabled");
        }
    }

    /**
     * Starts ticking immediately and then every {@code interval}. Calling it while running is a
     * no-op.
     */
    public void start(Duration interval) {
        if (interval == null || interval.isZero() || interval.isNegative()) {
            throw new IllegalArgumentException("interval must be positive, got " + interval);
        }
        List<Integer> modalidades = List.copyOf(settings.getModalidades());
        if (modalidades.isEmpty()) {
            throw new IllegalStateException("No modalidades configured for the sync scheduler");
        }
        synchronized (lifecycle) {
            if (isRunning()) {
                log.warn("Sync scheduler already running");
                return;
            }
            stopRequested = false;
            workers = Executors.newFixedThreadPool(modalidades.size(), namedThreads("sync-worker-"));
            ticker = Executors.newSingleThreadScheduledExecutor(namedThreads("sync-ticker-"));
            ticker.scheduleWithFixedDelay(() -> tick(modalidades), 0, interval.toMillis(), TimeUnit.MILLISECONDS);
            log.info("Sync scheduler started for modalidades {} every {}", modalidades, interval);
        }
    }

    /**
     * Stops scheduling new runs and waits for in-flight runs to finish their current page.
     */
    public void stop() {
        ScheduledExecutorService tickerToStop;
        ExecutorService workersToStop;
        synchronized (lifecycle) {
            if (ticker == null) {
                return;
            }
            stopRequested = true;
            tickerToStop = ticker;
            workersToStop = workers;
            ticker = null;
            workers = null;
        }

        tickerToStop.shutdown();
        workersToStop.shutdown();
        Duration timeout = settings.getShutdownTimeout();
        try {
            if (!workersToStop.awaitTermination(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Sync workers still running after {}", timeout);
            }
            tickerToStop.awaitTermination(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for sync workers to stop");
        }
        log.info("Sync scheduler stopped");
    }

    @PreDestroy
    public void shutdown() {
        stop();
    }

    public boolean isRunning() {
        synchronized (lifecycle) {
            return ticker != null && !ticker.isShutdown();
        }
    }

    private void tick(List<Integer> modalidades) {
        ExecutorService pool;
        synchronized (lifecycle) {
            pool = workers;
        }
        if (pool == null || stopRequested) {
            return;
        }
        LocalDate today = LocalDate.now(clock);
        LocalDate from = today.minusDays(settings.getInitialLookbackDays());
        for (Integer modalidade : modalidades) {
            if (orchestrator.isRunning(modalidade)) {
                log.debug("Modalidade {} still syncing, skipping this tick", modalidade);
                continue;
            }
            try {
                pool.execute(() -> runOne(new SyncCommand(from, today, modalidade, null)));
            } catch (RejectedExecutionException e) {
                log.debug("Scheduler stopping, modalidade {} not submitted", modalidade);
                return;
            }
        }
    }

    private void runOne(SyncCommand command) {
        try {
            SyncResult result = orchestrator.run(command, () -> stopRequested);
            log.info("Scheduled sync of modalidade {} ended {}: quantidade={}, skipped={}",
                    command.codigoModalidade(), result.status(), result.quantidade(), result.skipped());
        } catch (SyncInProgressException e) {
            log.debug(e.getMessage());
        } catch (RuntimeException e) {
            log.error("Scheduled sync of modalidade {} failed", command.codigoModalidade(), e);
        }
    }

    private static ThreadFactory namedThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
