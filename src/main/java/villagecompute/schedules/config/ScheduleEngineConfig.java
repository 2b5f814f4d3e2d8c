package villagecompute.schedules.config;

import io.micrometer.core.instrument.MeterRegistry;
import io.quarkus.runtime.ShutdownEvent;
import io.quarkus.runtime.StartupEvent;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.enterprise.inject.Disposes;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;
import villagecompute.schedules.data.ScheduledJobStore;
import villagecompute.schedules.jobs.JobDispatcher;
import villagecompute.schedules.scheduling.FailurePolicy;
import villagecompute.schedules.scheduling.ScheduleEngine;
import villagecompute.schedules.scheduling.ScheduleRunner;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.time.Clock;
import java.time.Duration;

/**
 * Builds the scheduler engine from configuration and ties it to the application lifecycle.
 *
 * <p>
 * <b>Configuration:</b>
 * <ul>
 * <li>{@code schedules.engine.interval} - time between tick starts (default 60s)</li>
 * <li>{@code schedules.engine.batch-size} - max schedules per tick (default 50)</li>
 * <li>{@code schedules.engine.autostart} - start polling at boot (default true)</li>
 * <li>{@code schedules.engine.dispatch-timeout-ms} - fault-tolerance timeout of one dispatch (default 30000), applied
 * to {@link villagecompute.schedules.services.DelayedJobService#createAndEnqueueJob} through its {@code Timeout/value}
 * override</li>
 * <li>{@code schedules.engine.claim-lease} - dispatch lease held per schedule (default 5m)</li>
 * </ul>
 */
@ApplicationScoped
public class ScheduleEngineConfig {

    private static final Logger LOG = Logger.getLogger(ScheduleEngineConfig.class);

    @ConfigProperty(
            name = "schedules.engine.interval",
            defaultValue = "60s")
    Duration interval;

    @ConfigProperty(
            name = "schedules.engine.batch-size",
            defaultValue = "50")
    int batchSize;

    @ConfigProperty(
            name = "schedules.engine.autostart",
            defaultValue = "true")
    boolean autostart;

    @ConfigProperty(
            name = "schedules.engine.claim-lease",
            defaultValue = "5m")
    Duration claimLease;

    @Inject
    ScheduledJobStore store;

    @Inject
    JobDispatcher jobDispatcher;

    @Inject
    MeterRegistry meterRegistry;

    @Inject
    Clock clock;

    @Produces
    @Singleton
    public ScheduleEngine scheduleEngine() {
        ScheduleRunner runner = new ScheduleRunner(store, jobDispatcher, clock, meterRegistry,
                FailurePolicy.standard(), claimLease, workerId());
        LOG.infof("Configured schedule engine: interval=%s, batchSize=%d, autostart=%s, lease=%s", interval,
                batchSize, autostart, claimLease);
        return new ScheduleEngine(store, runner, clock, meterRegistry,
                new ScheduleEngine.Settings(interval, batchSize, autostart));
    }

    void disposeScheduleEngine(@Disposes ScheduleEngine engine) {
        engine.stop();
    }

    void onStart(@Observes StartupEvent event, ScheduleEngine engine) {
        if (engine.getSettings().autostart()) {
            engine.start();
        } else {
            LOG.info("Schedule engine autostart disabled");
        }
    }

    void onStop(@Observes ShutdownEvent event, ScheduleEngine engine) {
        engine.stop();
    }

    /**
     * Identifies this instance in dispatch leases as {@code hostname:pid}.
     */
    static String workerId() {
        String host;
        try {
            host = InetAddress.getLocalHost().getHostName();
        } catch (UnknownHostException e) {
            host = System.getenv().getOrDefault("HOSTNAME", "unknown");
        }
        return host + ":" + ProcessHandle.current().pid();
    }
}
