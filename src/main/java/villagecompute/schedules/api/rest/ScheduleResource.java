package villagecompute.schedules.api.rest;

import jakarta.inject.Inject;
import jakarta.validation.Valid;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.DELETE;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.HeaderParam;
import jakarta.ws.rs.PATCH;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import org.jboss.logging.Logger;
import villagecompute.schedules.api.types.CreateScheduleRequestType;
import villagecompute.schedules.api.types.RunNowResultType;
import villagecompute.schedules.api.types.ScheduleHistoryType;
import villagecompute.schedules.api.types.ScheduleListType;
import villagecompute.schedules.api.types.ScheduleType;
import villagecompute.schedules.api.types.UpdateScheduleRequestType;
import villagecompute.schedules.data.ScheduleListQuery;
import villagecompute.schedules.data.ScheduledJobPage;
import villagecompute.schedules.data.ScheduledJobPatch;
import villagecompute.schedules.data.models.DelayedJob;
import villagecompute.schedules.data.models.ScheduledJob;
import villagecompute.schedules.exceptions.DispatchException;
import villagecompute.schedules.exceptions.ResourceNotFoundException;
import villagecompute.schedules.exceptions.ValidationException;
import villagecompute.schedules.jobs.DispatchedJob;
import villagecompute.schedules.jobs.JobDispatchRequest;
import villagecompute.schedules.observability.LoggingConfig;
import villagecompute.schedules.services.ScheduleService;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Tenant REST endpoints for schedules.
 *
 * <p>
 * Responsibilities:
 * <ul>
 * <li>{@code GET /api/orgs/{orgId}/schedules} – list with filters and paging</li>
 * <li>{@code POST /api/orgs/{orgId}/schedules} – create</li>
 * <li>{@code GET|PATCH|DELETE /api/orgs/{orgId}/schedules/{id}} – read, partial update, soft delete</li>
 * <li>{@code POST /api/orgs/{orgId}/schedules/{id}/run|pause|resume} – lifecycle actions</li>
 * <li>{@code GET /api/orgs/{orgId}/schedules/{id}/history} – recent dispatched jobs</li>
 * </ul>
 *
 * <p>
 * <b>Identity:</b> authentication happens upstream. The acting user arrives in the {@code X-User-Id} header and is
 * required where it is recorded (create, run).
 */
@Path("/api/orgs/{orgId}/schedules")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class ScheduleResource {

    private static final Logger LOG = Logger.getLogger(ScheduleResource.class);

    public static final String USER_HEADER = "X-User-Id";

    @Inject
    ScheduleService scheduleService;

    /**
     * Lists a tenant's schedules with optional filters.
     *
     * @param orgId
     *            owning organization
     * @param page
     *            1-based page number
     * @param pageSize
     *            rows per page, capped at 200
     * @param search
     *            case-insensitive substring of the name
     * @param orderBy
     *            one of name, nextRunAt, frequency, createdAt
     * @return page of schedules with pagination metadata, or 400 for an unknown frequency or delivery method
     */
    @GET
    public Response listSchedules(@PathParam("orgId") String orgId, @QueryParam("page") Integer page,
            @QueryParam("page_size") Integer pageSize, @QueryParam("job_type") String jobType,
            @QueryParam("frequency") String frequency, @QueryParam("delivery_method") String deliveryMethod,
            @QueryParam("is_active") Boolean isActive, @QueryParam("search") String search,
            @QueryParam("order_by") String orderBy) {
        return handle(orgId, () -> {
            ScheduleListQuery query = new ScheduleListQuery(page, pageSize, jobType,
                    ScheduleService.parseFrequency(frequency), ScheduleService.parseDeliveryMethod(deliveryMethod),
                    isActive, search, orderBy);
            ScheduledJobPage result = scheduleService.list(orgId, query);
            List<ScheduleType> data = result.data().stream().map(this::toType).toList();
            return Response.ok(new ScheduleListType(data,
                    new ScheduleListType.PaginationType(result.page(), result.pageSize(), result.totalCount(),
                            result.totalPages(), result.hasNext(), result.hasPrevious())))
                    .build();
        });
    }

    /**
     * Creates a schedule and computes its first run.
     *
     * @param orgId
     *            owning organization
     * @param userId
     *            acting user from the {@value #USER_HEADER} header, recorded as creator
     * @param request
     *            schedule definition
     * @return 201 with the stored schedule, or 400 on validation failure
     */
    @POST
    public Response createSchedule(@PathParam("orgId") String orgId, @HeaderParam(USER_HEADER) String userId,
            @Valid CreateScheduleRequestType request) {
        if (request == null) {
            return badRequest("Request body required");
        }
        return handle(orgId, () -> {
            ScheduledJob draft = new ScheduledJob();
            draft.name = request.name();
            draft.description = request.description();
            draft.jobType = request.jobType();
            draft.jobConfig = request.jobConfig();
            draft.frequency = ScheduleService.parseFrequency(request.frequency());
            draft.cronExpression = request.cronExpression();
            draft.dayOfWeek = ScheduleService.parseDayOfWeek(request.dayOfWeek());
            draft.dayOfMonth = request.dayOfMonth();
            draft.hour = request.hour();
            draft.minute = request.minute();
            draft.timezone = request.timezone();
            draft.startDate = request.startDate();
            draft.endDate = request.endDate();
            draft.deliveryMethod = ScheduleService.parseDeliveryMethod(request.deliveryMethod());
            draft.deliveryConfig = request.deliveryConfig();

            ScheduledJob created = scheduleService.create(orgId, userId, draft);
            return Response.status(Response.Status.CREATED).entity(toType(created)).build();
        });
    }

    /**
     * Retrieves a single schedule.
     *
     * @param orgId
     *            owning organization
     * @param id
     *            schedule id
     * @return schedule, or 404 if missing, deleted or owned by another tenant
     */
    @GET
    @Path("/{id}")
    public Response getSchedule(@PathParam("orgId") String orgId, @PathParam("id") String id) {
        return handle(orgId, () -> Response.ok(toType(scheduleService.get(orgId, parseId(id)))).build());
    }

    /**
     * Updates a schedule.
     *
     * <p>
     * Null fields are ignored. A change to any recurrence field recomputes the next run; {@code is_active=true} on an
     * inactive schedule behaves like {@code /resume}.
     *
     * @param orgId
     *            owning organization
     * @param id
     *            schedule id
     * @param request
     *            update payload with optional fields
     * @return updated schedule
     */
    @PATCH
    @Path("/{id}")
    public Response updateSchedule(@PathParam("orgId") String orgId, @PathParam("id") String id,
            UpdateScheduleRequestType request) {
        if (request == null) {
            return badRequest("Request body required");
        }
        return handle(orgId, () -> {
            ScheduledJobPatch patch = new ScheduledJobPatch().name(request.name()).description(request.description())
                    .jobType(request.jobType()).jobConfig(request.jobConfig())
                    .frequency(ScheduleService.parseFrequency(request.frequency()))
                    .cronExpression(request.cronExpression())
                    .dayOfWeek(ScheduleService.parseDayOfWeek(request.dayOfWeek()))
                    .dayOfMonth(request.dayOfMonth()).hour(request.hour()).minute(request.minute())
                    .timezone(request.timezone()).startDate(request.startDate()).endDate(request.endDate())
                    .deliveryMethod(ScheduleService.parseDeliveryMethod(request.deliveryMethod()))
                    .deliveryConfig(request.deliveryConfig()).isActive(request.isActive());
            return Response.ok(toType(scheduleService.update(orgId, parseId(id), patch))).build();
        });
    }

    /**
     * Soft-deletes a schedule.
     *
     * @return 204, or 404 if the schedule is already gone
     */
    @DELETE
    @Path("/{id}")
    public Response deleteSchedule(@PathParam("orgId") String orgId, @PathParam("id") String id) {
        return handle(orgId, () -> {
            scheduleService.delete(orgId, parseId(id));
            return Response.noContent().build();
        });
    }

    /**
     * Dispatches the schedule's job now, outside its recurrence.
     *
     * @param orgId
     *            owning organization
     * @param id
     *            schedule id
     * @param userId
     *            acting user, required
     * @return 202 with the dispatched job id, 400 without a user, or 502 if the dispatch failed
     */
    @POST
    @Path("/{id}/run")
    public Response runSchedule(@PathParam("orgId") String orgId, @PathParam("id") String id,
            @HeaderParam(USER_HEADER) String userId) {
        if (userId == null || userId.isBlank()) {
            return badRequest("Missing " + USER_HEADER + " header");
        }
        return handle(orgId, () -> {
            UUID scheduleId = parseId(id);
            DispatchedJob job = scheduleService.runNow(orgId, scheduleId, userId);
            return Response.status(Response.Status.ACCEPTED).entity(new RunNowResultType(scheduleId, job.id()))
                    .build();
        });
    }

    /**
     * Deactivates a schedule, keeping its next run time.
     */
    @POST
    @Path("/{id}/pause")
    public Response pauseSchedule(@PathParam("orgId") String orgId, @PathParam("id") String id) {
        return handle(orgId, () -> Response.ok(toType(scheduleService.pause(orgId, parseId(id)))).build());
    }

    /**
     * Reactivates a schedule with its next run recomputed from now and the failure count reset.
     */
    @POST
    @Path("/{id}/resume")
    public Response resumeSchedule(@PathParam("orgId") String orgId, @PathParam("id") String id) {
        return handle(orgId, () -> Response.ok(toType(scheduleService.resume(orgId, parseId(id)))).build());
    }

    /**
     * Lists the most recent jobs dispatched for a schedule, newest first.
     *
     * @param limit
     *            number of jobs, default 10, max 100
     * @return schedule id and its recent jobs
     */
    @GET
    @Path("/{id}/history")
    public Response getHistory(@PathParam("orgId") String orgId, @PathParam("id") String id,
            @QueryParam("limit") Integer limit) {
        return handle(orgId, () -> {
            UUID scheduleId = parseId(id);
            List<ScheduleHistoryType.JobRunType> jobs = scheduleService.getHistory(orgId, scheduleId, limit).stream()
                    .map(this::toRunType).toList();
            return Response.ok(new ScheduleHistoryType(scheduleId, jobs)).build();
        });
    }

    /**
     * Runs an endpoint body with request logging context and maps domain exceptions to HTTP responses.
     */
    private Response handle(String orgId, Supplier<Response> body) {
        LoggingConfig.enrichWithTraceContext();
        LoggingConfig.setScheduleContext(orgId, null);
        LoggingConfig.setRequestOrigin("/api/orgs/" + orgId + "/schedules");
        try {
            return body.get();
        } catch (ResourceNotFoundException e) {
            return Response.status(Response.Status.NOT_FOUND).entity(new ErrorResponse(e.getMessage())).build();
        } catch (ValidationException e) {
            return badRequest(e.getMessage());
        } catch (DispatchException e) {
            LOG.errorf(e, "Dispatch failed for org %s", orgId);
            return Response.status(Response.Status.BAD_GATEWAY).entity(new ErrorResponse(e.getMessage())).build();
        } catch (Exception e) {
            LOG.errorf(e, "Unexpected error handling schedule request for org %s", orgId);
            return Response.status(Response.Status.INTERNAL_SERVER_ERROR)
                    .entity(new ErrorResponse("Internal server error")).build();
        } finally {
            LoggingConfig.clearMDC();
        }
    }

    private static Response badRequest(String message) {
        return Response.status(Response.Status.BAD_REQUEST).entity(new ErrorResponse(message)).build();
    }

    private static UUID parseId(String id) {
        try {
            return UUID.fromString(id);
        } catch (IllegalArgumentException e) {
            throw new ResourceNotFoundException("Schedule not found: " + id);
        }
    }

    /**
     * Converts a ScheduledJob entity to a ScheduleType DTO.
     */
    private ScheduleType toType(ScheduledJob schedule) {
        return new ScheduleType(schedule.id, schedule.organizationId, schedule.name, schedule.description,
                schedule.jobType, schedule.jobConfig, schedule.frequency.getValue(), schedule.cronExpression,
                schedule.dayOfWeek == null ? null : schedule.dayOfWeek.name().toLowerCase(Locale.ROOT),
                schedule.dayOfMonth, schedule.hour, schedule.minute, schedule.timezone, schedule.startDate,
                schedule.endDate, schedule.deliveryMethod.getValue(), schedule.deliveryConfig, schedule.isActive,
                schedule.lastRunAt, schedule.lastJobId, schedule.nextRunAt, schedule.failureCount, schedule.createdBy,
                schedule.createdAt, schedule.updatedAt);
    }

    private ScheduleHistoryType.JobRunType toRunType(DelayedJob job) {
        Map<String, Object> metadata = job.metadata == null ? Map.of() : job.metadata;
        Object triggeredBy = metadata.get(JobDispatchRequest.META_TRIGGERED_BY);
        return new ScheduleHistoryType.JobRunType(job.id.toString(), job.status.name().toLowerCase(Locale.ROOT),
                triggeredBy == null ? null : triggeredBy.toString(), job.createdAt, job.completedAt,
                job.status == DelayedJob.JobStatus.COMPLETED, job.lastError);
    }

    /**
     * Simple error response record for API errors.
     */
    public record ErrorResponse(String error) {
    }
}
