package com.mediguard.ledger.scheduler;

import com.mediguard.ledger.config.LedgerProperties;
import com.mediguard.ledger.dto.AnchorCycleResult;
import com.mediguard.ledger.service.AnchorCommitService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.SmartLifecycle;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ScheduledFuture;

/**
 * Runs the anchor commit cycle on a fixed delay.
 *
 * <p>Stopping cancels the schedule without interrupting a cycle in flight; the
 * scheduler's thread pool waits for that cycle before shutting down.
 */
@Component
@Slf4j
public class AnchorCommitScheduler implements SmartLifecycle {

    public enum State {
        STOPPED,
        RUNNING
    }

    private final AnchorCommitService commitService;
    private final LedgerProperties.AnchorProperties anchorProperties;

    private volatile State state = State.STOPPED;
    private ThreadPoolTaskScheduler taskScheduler;
    private ScheduledFuture<?> scheduledCycle;

    public AnchorCommitScheduler(AnchorCommitService commitService, LedgerProperties properties) {
        this.commitService = commitService;
        this.anchorProperties = properties.getAnchor();
    }

    @Override
    public synchronized void start() {
        if (state == State.RUNNING) {
            return;
        }
        if (!Boolean.TRUE.equals(anchorProperties.getEnabled())) {
            log.info("Anchor commit scheduler disabled");
            return;
        }

        Duration interval = anchorProperties.getInterval();
        taskScheduler = new ThreadPoolTaskScheduler();
        taskScheduler.setPoolSize(1);
        taskScheduler.setThreadNamePrefix("anchor-commit-");
        taskScheduler.setWaitForTasksToCompleteOnShutdown(true);
        taskScheduler.setAwaitTerminationSeconds((int) anchorProperties.getShutdownTimeout().toSeconds());
        taskScheduler.initialize();

        scheduledCycle = taskScheduler.scheduleWithFixedDelay(this::runCycle,
                Instant.now().plus(anchorProperties.getInitialDelay()), interval);
        state = State.RUNNING;
        log.info("Anchor commit scheduler started: first cycle in {}, then every {}",
                anchorProperties.getInitialDelay(), interval);
    }

    @Override
    public synchronized void stop() {
        if (state == State.STOPPED) {
            return;
        }
        scheduledCycle.cancel(false);
        taskScheduler.shutdown();
        scheduledCycle = null;
        taskScheduler = null;
        state = State.STOPPED;
        log.info("Anchor commit scheduler stopped");
    }

    @Override
    public boolean isRunning() {
        return state == State.RUNNING;
    }

    public State getState() {
        return state;
    }

    /**
     * Runs one cycle immediately on the calling thread, outside the schedule.
     */
    public AnchorCycleResult triggerNow() {
        log.info("Anchor commit cycle triggered manually");
        return commitService.commitPendingEntries();
    }

    private void runCycle() {
        try {
            AnchorCycleResult result = commitService.commitPendingEntries();
            log.info("Scheduled anchor cycle finished: {}", result.getOutcome());
        } catch (RuntimeException e) {
            log.error("Unexpected failure in scheduled anchor cycle", e);
        }
    }
}
