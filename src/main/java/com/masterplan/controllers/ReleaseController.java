package com.masterplan.controllers;

import com.masterplan.ReleaseServerException;
import com.masterplan.release.ReleaseCatalog;
import com.masterplan.release.ReleaseManifest;
import com.masterplan.release.ReleasePointer;
import com.masterplan.util.JsonUtil;
import com.fasterxml.jackson.databind.node.ObjectNode;
import spark.Request;
import spark.Response;
import spark.Service;

import static com.masterplan.util.JsonUtil.toJson;

/** Published releases of a project, and rollback by making an older release current again. */
public class ReleaseController implements HttpController {

    private final ReleaseCatalog releaseCatalog;

    public ReleaseController (ReleaseCatalog releaseCatalog) {
        this.releaseCatalog = releaseCatalog;
    }

    @Override
    public void registerEndpoints (Service sparkService) {
        sparkService.get("/api/projects/:project/releases", this::getReleases, toJson);
        sparkService.get("/api/projects/:project/releases/current", this::getCurrentRelease, toJson);
        sparkService.get("/api/projects/:project/releases/:releaseId", this::getRelease, toJson);
        sparkService.post("/api/projects/:project/releases/:releaseId/activate", this::activate, toJson);
    }

    private ObjectNode getReleases (Request req, Response res) {
        String project = req.params("project");
        ReleasePointer current = releaseCatalog.getCurrent(project);
        ObjectNode body = JsonUtil.objectNode().put("project_slug", project);
        body.put("current_release_id", current == null ? null : current.releaseId);
        body.set("release_ids", JsonUtil.objectMapper.valueToTree(releaseCatalog.listReleases(project)));
        return body;
    }

    private ReleaseManifest getCurrentRelease (Request req, Response res) {
        String project = req.params("project");
        ReleasePointer current = releaseCatalog.getCurrent(project);
        if (current == null) {
            throw ReleaseServerException.notFound("Project " + project + " has no published release.");
        }
        return findManifest(project, current.releaseId);
    }

    private ReleaseManifest getRelease (Request req, Response res) {
        return findManifest(req.params("project"), req.params("releaseId"));
    }

    private ReleasePointer activate (Request req, Response res) {
        String project = req.params("project");
        String releaseId = req.params("releaseId");
        findManifest(project, releaseId);
        return releaseCatalog.activate(project, releaseId);
    }

    private ReleaseManifest findManifest (String project, String releaseId) {
        ReleaseManifest manifest = releaseCatalog.getManifest(project, releaseId);
        if (manifest == null) {
            throw ReleaseServerException.notFound("No release " + releaseId + " in project " + project);
        }
        return manifest;
    }

}
