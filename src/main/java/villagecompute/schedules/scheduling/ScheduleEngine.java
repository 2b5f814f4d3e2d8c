package villagecompute.schedules.scheduling;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.jboss.logging.Logger;
import villagecompute.schedules.data.ScheduledJobStore;
import villagecompute.schedules.data.models.ScheduledJob;
import villagecompute.schedules.observability.LoggingConfig;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Background poller that dispatches due schedules.
 *
 * <p>
 * A single self-rescheduling timer: each tick reads one due batch, runs the schedules one at a time in
 * oldest-due-first order, then schedules its successor after {@code max(0, interval - elapsed)} so slow ticks do not
 * accumulate drift. Any exception escaping a tick is logged and the loop continues.
 *
 * <p>
 * <b>Lifecycle:</b> {@link #start()} and {@link #stop()} are idempotent. Stopping cancels the pending tick; a tick
 * already in flight finishes its batch but schedules no successor, even if the engine is started again meanwhile.
 * Each start opens a new generation and a tick only re-arms while its own generation is current.
 * {@link #processNow()} runs one batch on the caller's thread and is serialized with background ticks.
 *
 * <p>
 * Instances are independent. The application produces one through CDI; tests construct their own.
 */
public class ScheduleEngine {

    private static final Logger LOG = Logger.getLogger(ScheduleEngine.class);

    private final ScheduledJobStore store;
    private final ScheduleRunner runner;
    private final Clock clock;
    private final MeterRegistry meterRegistry;
    private final Settings settings;

    private final ReentrantLock tickLock = new ReentrantLock();
    private final Object lifecycle = new Object();

    private volatile boolean running;
    private long generation;
    private ScheduledExecutorService timer;
    private ScheduledFuture<?> pendingTick;

    /**
     * Engine configuration.
     *
     * @param interval
     *            time between tick starts
     * @param batchSize
     *            max schedules read per tick
     * @param autostart
     *            whether the host starts the engine at boot
     */
    public record Settings(Duration interval, int batchSize, boolean autostart) {

        public static final Duration DEFAULT_INTERVAL = Duration.ofMillis(60_000);

        public static final int DEFAULT_BATCH_SIZE = 50;

        public Settings {
            if (interval == null || interval.isNegative() || interval.isZero()) {
                throw new IllegalArgumentException("interval must be positive: " + interval);
            }
            if (batchSize < 1) {
                throw new IllegalArgumentException("batchSize must be positive: " + batchSize);
            }
        }

        public static Settings defaults() {
            return new Settings(DEFAULT_INTERVAL, DEFAULT_BATCH_SIZE, true);
        }
    }

    public ScheduleEngine(ScheduledJobStore store, ScheduleRunner runner, Clock clock, MeterRegistry meterRegistry,
            Settings settings) {
        this.store = store;
        this.runner = runner;
        this.clock = clock;
        this.meterRegistry = meterRegistry;
        this.settings = settings;
    }

    public Settings getSettings() {
        return settings;
    }

    public boolean isRunning() {
        return running;
    }

    /**
     * Starts the background loop. The first tick runs asynchronously as soon as possible. No-op when already running.
     */
    public void start() {
        synchronized (lifecycle) {
            if (running) {
                LOG.debug("Schedule engine already running");
                return;
            }
            running = true;
            long current = ++generation;
            timer = Executors.newSingleThreadScheduledExecutor(runnable -> {
                Thread thread = new Thread(runnable, "schedule-engine");
                thread.setDaemon(true);
                return thread;
            });
            pendingTick = timer.schedule(() -> loop(current), 0, TimeUnit.MILLISECONDS);
            LOG.infof("Schedule engine started (interval: %d ms, batch size: %d, worker: %s)",
                    settings.interval().toMillis(), settings.batchSize(), runner.getWorkerId());
        }
    }

    /**
     * Stops the background loop. A tick in flight completes; no further tick is scheduled. No-op when not running.
     */
    public void stop() {
        synchronized (lifecycle) {
            if (!running) {
                return;
            }
            running = false;
            if (pendingTick != null) {
                pendingTick.cancel(false);
                pendingTick = null;
            }
            timer.shutdown();
            timer = null;
            LOG.info("Schedule engine stopped");
        }
    }

    /**
     * Runs one batch synchronously on the calling thread, whether or not the loop is running.
     *
     * @return counts for the batch
     */
    public TickResult processNow() {
        return tick();
    }

    private void loop(long loopGeneration) {
        if (!isCurrent(loopGeneration)) {
            return;
        }
        long startedNanos = System.nanoTime();
        try {
            tick();
        } catch (RuntimeException e) {
            LOG.errorf(e, "Schedule engine tick failed");
        } finally {
            scheduleNext(loopGeneration, startedNanos);
        }
    }

    private boolean isCurrent(long loopGeneration) {
        synchronized (lifecycle) {
            return running && generation == loopGeneration;
        }
    }

    private void scheduleNext(long loopGeneration, long startedNanos) {
        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startedNanos);
        long delayMs = Math.max(0, settings.interval().toMillis() - elapsedMs);
        synchronized (lifecycle) {
            if (!running || generation != loopGeneration || timer == null) {
                LOG.debugf("Tick of generation %d ends without successor", loopGeneration);
                return;
            }
            try {
                pendingTick = timer.schedule(() -> loop(loopGeneration), delayMs, TimeUnit.MILLISECONDS);
            } catch (RejectedExecutionException e) {
                LOG.debugf("Engine timer rejected next tick, engine is stopping: %s", e.getMessage());
            }
        }
    }

    TickResult tick() {
        tickLock.lock();
        Timer.Sample sample = Timer.start(meterRegistry);
        LoggingConfig.enrichWithTraceContext();
        LoggingConfig.setRequestOrigin("scheduler");
        try {
            Instant now = clock.instant();
            List<ScheduledJob> due;
            try {
                due = store.findDueBatch(now, runner.getFailurePolicy().getMaxFailureCount(), settings.batchSize());
            } catch (RuntimeException e) {
                LOG.errorf(e, "Failed to load due schedules");
                Counter.builder("schedules.engine.ticks").tag("result", "error").register(meterRegistry).increment();
                return TickResult.EMPTY;
            }

            int succeeded = 0;
            int failed = 0;
            for (ScheduledJob schedule : due) {
                switch (runner.run(schedule)) {
                    case SUCCEEDED -> succeeded++;
                    case FAILED -> failed++;
                    case SKIPPED -> {
                    }
                }
            }

            TickResult result = new TickResult(succeeded + failed, succeeded, failed);
            Counter.builder("schedules.engine.ticks").tag("result", "ok").register(meterRegistry).increment();
            if (!due.isEmpty()) {
                LOG.infof("Schedule engine tick: %d due, %d succeeded, %d failed", due.size(), succeeded, failed);
            } else {
                LOG.debug("Schedule engine tick: nothing due");
            }
            return result;

        } finally {
            sample.stop(Timer.builder("schedules.engine.tick.duration").register(meterRegistry));
            LoggingConfig.clearMDC();
            tickLock.unlock();
        }
    }
}
