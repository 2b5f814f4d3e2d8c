package villagecompute.schedules.api.rest.admin;

import jakarta.inject.Inject;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import org.jboss.logging.Logger;
import villagecompute.schedules.api.types.SchedulerStatusType;
import villagecompute.schedules.api.types.TickResultType;
import villagecompute.schedules.scheduling.ScheduleEngine;
import villagecompute.schedules.scheduling.TickResult;

/**
 * Admin REST endpoints for the scheduler engine.
 *
 * <p>
 * Responsibilities:
 * <ul>
 * <li>{@code GET /admin/api/scheduler} – running flag and settings</li>
 * <li>{@code POST /admin/api/scheduler/start} – start the background loop</li>
 * <li>{@code POST /admin/api/scheduler/stop} – stop the background loop</li>
 * <li>{@code POST /admin/api/scheduler/process} – run one batch synchronously</li>
 * </ul>
 *
 * <p>
 * <b>Security:</b> assumes deployment behind an authenticated admin gateway.
 */
@Path("/admin/api/scheduler")
@Produces(MediaType.APPLICATION_JSON)
public class SchedulerAdminResource {

    private static final Logger LOG = Logger.getLogger(SchedulerAdminResource.class);

    @Inject
    ScheduleEngine scheduleEngine;

    @GET
    public Response getStatus() {
        return Response.ok(toStatus()).build();
    }

    @POST
    @Path("/start")
    public Response start() {
        scheduleEngine.start();
        LOG.info("Schedule engine started via admin API");
        return Response.ok(toStatus()).build();
    }

    @POST
    @Path("/stop")
    public Response stop() {
        scheduleEngine.stop();
        LOG.info("Schedule engine stopped via admin API");
        return Response.ok(toStatus()).build();
    }

    @POST
    @Path("/process")
    public Response process() {
        TickResult result = scheduleEngine.processNow();
        return Response.ok(new TickResultType(result.processed(), result.succeeded(), result.failed())).build();
    }

    private SchedulerStatusType toStatus() {
        ScheduleEngine.Settings settings = scheduleEngine.getSettings();
        return new SchedulerStatusType(scheduleEngine.isRunning(), settings.interval().toMillis(),
                settings.batchSize(), settings.autostart());
    }
}
