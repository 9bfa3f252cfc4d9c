package io.calcrelay.runner;

import io.calcrelay.config.RunnerSettings;
import io.calcrelay.engine.Backoff;
import io.calcrelay.engine.ProcessEngine;
import io.calcrelay.engine.StepExecutor;
import io.calcrelay.engine.StopSignal;
import io.calcrelay.error.ConcurrencyViolationException;
import io.calcrelay.error.StepSuspendedException;
import io.calcrelay.model.ProcessState;
import io.calcrelay.model.ProcessStep;
import io.calcrelay.model.ProcessingView;
import io.calcrelay.observability.AuditLogger;
import io.calcrelay.storage.Lease;
import io.calcrelay.storage.MetadataStore;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.Semaphore;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Drives playing calcjobs to a terminal step with a bounded pool of driver
 * threads.
 *
 * <p>A selection loop claims calcjobs in primary-key order, at most one per
 * free driver slot. Each driver owns its calcjob through a database lease
 * that is heartbeated while the driver works, so a runner that dies simply
 * lets its leases expire and another runner resumes from the last committed
 * step.
 */
public final class CalcJobRunner {
    private static final long WAKEUP_SENTINEL = -1L;
    private static final long DRAIN_TIMEOUT_MS = 60_000L;

    private final MetadataStore store;
    private final ProcessEngine engine;
    private final RunnerSettings settings;
    private final AuditLogger audit;
    private final StopSignal stop;
    private final String owner;
    private final int limit;

    private final Map<Long, Lease> active = new ConcurrentHashMap<>();
    private final BlockingQueue<Long> wakeups = new LinkedBlockingQueue<>();
    private final AtomicInteger driven = new AtomicInteger();
    private final AtomicInteger finished = new AtomicInteger();
    private final AtomicInteger excepted = new AtomicInteger();
    private final AtomicInteger suspended = new AtomicInteger();
    private final AtomicInteger claimConflicts = new AtomicInteger();
    private final AtomicInteger peakConcurrency = new AtomicInteger();

    /**
     * @param limit maximum number of calcjobs this runner claims, 0 for no limit
     */
    public CalcJobRunner(
            MetadataStore store,
            ProcessEngine engine,
            RunnerSettings settings,
            AuditLogger audit,
            StopSignal stop,
            String owner,
            int limit
    ) {
        this.store = store;
        this.engine = engine;
        this.settings = settings;
        this.audit = audit;
        this.stop = stop;
        this.owner = owner == null || owner.isBlank() ? defaultOwner() : owner;
        this.limit = Math.max(0, limit);
    }

    public static String defaultOwner() {
        return "runner-" + ProcessHandle.current().pid();
    }

    public String owner() {
        return owner;
    }

    /**
     * Returns once nothing is left to claim and every driver has finished.
     */
    public RunOutcome runUntilIdle() {
        return run(false);
    }

    /**
     * Keeps selecting new calcjobs until {@link #requestStop()}.
     */
    public RunOutcome serve() {
        return run(true);
    }

    public void requestStop() {
        stop.request();
        wakeups.offer(WAKEUP_SENTINEL);
    }

    private RunOutcome run(boolean keepServing) {
        long startedAt = System.currentTimeMillis();
        int concurrency = Math.max(1, settings.concurrency());
        Semaphore slots = new Semaphore(concurrency);
        ExecutorService drivers = Executors.newFixedThreadPool(concurrency, namedThreads("calcrelay-driver"));
        ScheduledExecutorService heartbeats = Executors.newSingleThreadScheduledExecutor(namedThreads("calcrelay-heartbeat"));
        long heartbeatEvery = Math.max(100L, settings.leaseTimeoutMs() / 3L);
        heartbeats.scheduleAtFixedRate(this::heartbeatActive, heartbeatEvery, heartbeatEvery, TimeUnit.MILLISECONDS);
        audit.log(AuditLogger.AuditEvent.global("runner.start", owner, "ok", Map.of(
                "concurrency", concurrency,
                "limit", limit,
                "serve", keepServing
        )));
        try {
            while (!stop.isRequested()) {
                boolean limitReached = limit > 0 && driven.get() >= limit;
                int free = slots.availablePermits();
                List<Long> candidates = limitReached || free == 0
                        ? List.of()
                        : store.listClaimable(System.currentTimeMillis(), free, active.keySet());
                int claimed = 0;
                for (Long pk : candidates) {
                    if (limit > 0 && driven.get() >= limit) {
                        break;
                    }
                    Optional<Lease> lease = store.tryClaim(pk, owner, UUID.randomUUID().toString(),
                            System.currentTimeMillis(), settings.leaseTimeoutMs());
                    if (lease.isEmpty()) {
                        claimConflicts.incrementAndGet();
                        audit.log(AuditLogger.AuditEvent.of("calcjob.claim", owner, pk, null, "conflict", Map.of()));
                        continue;
                    }
                    if (!slots.tryAcquire()) {
                        store.release(lease.get());
                        break;
                    }
                    startDriver(drivers, slots, lease.get());
                    claimed++;
                }
                if (claimed > 0) {
                    continue;
                }
                boolean idle = active.isEmpty() && (candidates.isEmpty() || limitReached);
                if (idle && (!keepServing || limitReached)) {
                    break;
                }
                waitForWakeup(settings.selectionIntervalMs());
            }
        } finally {
            drivers.shutdown();
            awaitDrain(drivers);
            heartbeats.shutdownNow();
        }
        RunOutcome outcome = new RunOutcome(
                owner,
                driven.get(),
                finished.get(),
                excepted.get(),
                suspended.get(),
                claimConflicts.get(),
                peakConcurrency.get(),
                stop.isRequested(),
                System.currentTimeMillis() - startedAt
        );
        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("driven", outcome.driven());
        summary.put("finished", outcome.finished());
        summary.put("excepted", outcome.excepted());
        summary.put("suspended", outcome.suspended());
        summary.put("claim_conflicts", outcome.claimConflicts());
        audit.log(AuditLogger.AuditEvent.global("runner.summary", owner, outcome.stopped() ? "stopped" : "idle", summary));
        return outcome;
    }

    private void startDriver(ExecutorService drivers, Semaphore slots, Lease lease) {
        active.put(lease.calcjobPk(), lease);
        peakConcurrency.accumulateAndGet(active.size(), Math::max);
        driven.incrementAndGet();
        audit.log(AuditLogger.AuditEvent.of("calcjob.claim", owner, lease.calcjobPk(), null, "granted",
                Map.of("lease_epoch", lease.epoch())));
        drivers.submit(() -> {
            try {
                drive(lease);
            } catch (RuntimeException e) {
                audit.log(AuditLogger.AuditEvent.of("calcjob.driver", owner, lease.calcjobPk(), null, "error",
                        Map.of("exception", ProcessEngine.describe(e))));
            } finally {
                active.remove(lease.calcjobPk());
                slots.release();
                wakeups.offer(lease.calcjobPk());
            }
        });
    }

    /**
     * Runs one calcjob until it is terminal, suspended, or its lease is lost.
     */
    void drive(Lease lease) {
        long pk = lease.calcjobPk();
        int attempts = 0;
        while (true) {
            ProcessingView view = store.requireProcessing(pk);
            if (view.terminal()) {
                if (view.state() == ProcessState.FINISHED) {
                    finished.incrementAndGet();
                } else {
                    excepted.incrementAndGet();
                }
                return;
            }
            if (stop.isRequested()) {
                suspend(lease, view.step(), "stop requested");
                return;
            }
            ProcessStep step = view.step();
            try {
                engine.advance(lease);
                attempts = 0;
            } catch (StepSuspendedException e) {
                suspend(lease, step, e.getMessage());
                return;
            } catch (ConcurrencyViolationException e) {
                audit.log(AuditLogger.AuditEvent.of("calcjob.lease", owner, pk, step.dbValue(), "lost",
                        Map.of("reason", e.getMessage())));
                return;
            } catch (RuntimeException e) {
                attempts++;
                if (StepExecutor.retryable(e) && attempts < settings.maxStepAttempts()) {
                    long delay = Backoff.exponential(attempts, settings.baseBackoffMs(), settings.maxBackoffMs());
                    Map<String, Object> details = new LinkedHashMap<>();
                    details.put("attempt", attempts);
                    details.put("delay_ms", delay);
                    details.put("exception", ProcessEngine.describe(e));
                    audit.log(AuditLogger.AuditEvent.of("calcjob.retry", owner, pk, step.dbValue(), "scheduled", details));
                    if (stop.await(delay)) {
                        suspend(lease, step, "stop requested during retry backoff");
                        return;
                    }
                    continue;
                }
                try {
                    engine.except(lease, step, e);
                } catch (ConcurrencyViolationException lost) {
                    audit.log(AuditLogger.AuditEvent.of("calcjob.lease", owner, pk, step.dbValue(), "lost",
                            Map.of("reason", lost.getMessage())));
                    return;
                }
            }
        }
    }

    private void suspend(Lease lease, ProcessStep step, String reason) {
        suspended.incrementAndGet();
        store.release(lease);
        audit.log(AuditLogger.AuditEvent.of("calcjob.suspend", owner, lease.calcjobPk(), step.dbValue(), "released",
                Map.of("reason", reason)));
    }

    private void heartbeatActive() {
        long now = System.currentTimeMillis();
        for (Lease lease : active.values()) {
            try {
                if (!store.heartbeat(lease, now, settings.leaseTimeoutMs())) {
                    audit.log(AuditLogger.AuditEvent.of("calcjob.heartbeat", owner, lease.calcjobPk(), null, "lost", Map.of()));
                }
            } catch (RuntimeException e) {
                audit.log(AuditLogger.AuditEvent.of("calcjob.heartbeat", owner, lease.calcjobPk(), null, "error",
                        Map.of("exception", ProcessEngine.describe(e))));
            }
        }
    }

    private void waitForWakeup(long timeoutMs) {
        try {
            wakeups.poll(timeoutMs, TimeUnit.MILLISECONDS);
            wakeups.clear();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            stop.request();
        }
    }

    private void awaitDrain(ExecutorService drivers) {
        try {
            if (!drivers.awaitTermination(DRAIN_TIMEOUT_MS, TimeUnit.MILLISECONDS)) {
                stop.request();
                drivers.shutdownNow();
                drivers.awaitTermination(DRAIN_TIMEOUT_MS, TimeUnit.MILLISECONDS);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            drivers.shutdownNow();
        }
    }

    private static ThreadFactory namedThreads(String prefix) {
        AtomicInteger seq = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + "-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
