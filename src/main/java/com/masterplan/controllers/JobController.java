package com.masterplan.controllers;

import com.masterplan.ReleaseServerException;
import com.masterplan.jobs.JobOrchestrator;
import com.masterplan.jobs.JobState;
import com.masterplan.jobs.JobSubscription;
import com.masterplan.util.JsonUtil;
import com.google.common.collect.ImmutableMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import spark.Request;
import spark.Response;
import spark.Service;

import javax.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.io.PrintWriter;
import java.util.List;
import java.util.concurrent.TimeUnit;

import static com.masterplan.util.JsonUtil.toJson;

/**
 * Following and cancelling jobs. Clients may poll a job, or hold open a server-sent events stream that delivers
 * every update of the job and closes after the final one.
 */
public class JobController implements HttpController {

    private static final Logger LOG = LoggerFactory.getLogger(JobController.class);

    /** A comment line is sent when no update arrives for this long, so proxies do not close an idle stream. */
    private static final int KEEPALIVE_SECONDS = 15;

    private final JobOrchestrator jobOrchestrator;

    public JobController (JobOrchestrator jobOrchestrator) {
        this.jobOrchestrator = jobOrchestrator;
    }

    @Override
    public void registerEndpoints (Service sparkService) {
        sparkService.get("/api/jobs", this::getJobs, toJson);
        sparkService.get("/api/jobs/:id", this::getJob, toJson);
        sparkService.get("/api/jobs/:id/stream", this::streamJob);
        sparkService.delete("/api/jobs/:id", this::cancelJob, toJson);
    }

    private List<JobState> getJobs (Request req, Response res) {
        return jobOrchestrator.getJobs();
    }

    private JobState getJob (Request req, Response res) {
        JobState job = jobOrchestrator.getJob(req.params("id"));
        if (job == null) {
            throw ReleaseServerException.notFound("No job with id " + req.params("id"));
        }
        return job;
    }

    private Object streamJob (Request req, Response res) throws IOException {
        String jobId = req.params("id");
        JobSubscription subscription = jobOrchestrator.streamJob(jobId);
        if (subscription == null) {
            throw ReleaseServerException.notFound("No job with id " + jobId);
        }
        HttpServletResponse raw = res.raw();
        raw.setStatus(200);
        raw.setContentType("text/event-stream");
        raw.setCharacterEncoding("UTF-8");
        raw.setHeader("Cache-Control", "no-cache");
        PrintWriter writer = raw.getWriter();
        try (subscription) {
            while (!subscription.isFinished()) {
                JobState state = subscription.poll(KEEPALIVE_SECONDS, TimeUnit.SECONDS);
                if (state == null) {
                    writer.write(": keepalive\n\n");
                } else {
                    writer.write("id: " + state.sequence + "\n");
                    writer.write("event: " + state.status.jsonName() + "\n");
                    writer.write("data: " + JsonUtil.toJsonString(state) + "\n\n");
                }
                // checkError flushes, and reports whether the client has gone away.
                if (writer.checkError()) {
                    LOG.debug("Client stopped following job {}.", jobId);
                    break;
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        // Despite writing to the raw response, Spark requires a non-null return value.
        return "";
    }

    private ImmutableMap<String, Object> cancelJob (Request req, Response res) {
        String jobId = req.params("id");
        if (jobOrchestrator.getJob(jobId) == null) {
            throw ReleaseServerException.notFound("No job with id " + jobId);
        }
        boolean cancelled = jobOrchestrator.cancel(jobId);
        return ImmutableMap.of("job_id", jobId, "cancel_requested", cancelled);
    }

}
