package com.masterplan.controllers;

import com.masterplan.drafts.Draft;
import com.masterplan.jobs.JobOrchestrator;
import com.masterplan.jobs.JobState;
import com.masterplan.release.ReleaseValidationException;
import com.masterplan.util.JsonUtil;
import com.fasterxml.jackson.databind.node.ObjectNode;
import spark.Request;
import spark.Response;
import spark.Service;

import java.util.List;

import static com.masterplan.util.JsonUtil.toJson;

/**
 * Publishing a draft. Validation can be requested on its own, so the editor can show every problem before the user
 * tries to publish. Publishing itself only queues a job and returns its id, as does generating preview tiles.
 */
public class PublishController implements HttpController {

    private final JobOrchestrator jobOrchestrator;

    public PublishController (JobOrchestrator jobOrchestrator) {
        this.jobOrchestrator = jobOrchestrator;
    }

    @Override
    public void registerEndpoints (Service sparkService) {
        sparkService.get("/api/drafts/:project/:version/publish/validate", this::validate, toJson);
        sparkService.post("/api/drafts/:project/:version/publish", this::publish, toJson);
        sparkService.post("/api/drafts/:project/:version/generate-tiles", this::generateTiles, toJson);
    }

    private ObjectNode validate (Request req, Response res) {
        String draftId = draftId(req);
        List<String> errors = jobOrchestrator.validatePublish(draftId);
        ObjectNode body = JsonUtil.objectNode()
                .put("draft_id", draftId)
                .put("valid", errors.isEmpty());
        body.set("errors", JsonUtil.objectMapper.valueToTree(errors));
        return body;
    }

    /**
     * Responds 202 with the new job. Through the exception mapping, a draft that fails validation gets a 400 listing
     * every error without creating a job, and a draft already being published gets a 409 naming the running job.
     */
    private JobState publish (Request req, Response res) {
        String draftId = draftId(req);
        List<String> errors = jobOrchestrator.validatePublish(draftId);
        if (!errors.isEmpty()) {
            throw new ReleaseValidationException(errors);
        }
        return accepted(jobOrchestrator.startPublish(draftId), res);
    }

    private JobState generateTiles (Request req, Response res) {
        return accepted(jobOrchestrator.startTileGeneration(draftId(req)), res);
    }

    private JobState accepted (String jobId, Response res) {
        res.status(202);
        res.header("Location", "/api/jobs/" + jobId);
        return jobOrchestrator.getJob(jobId);
    }

    private static String draftId (Request req) {
        return Draft.draftId(req.params("project"), req.params("version"));
    }

}
