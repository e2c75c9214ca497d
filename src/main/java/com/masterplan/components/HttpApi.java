package com.masterplan.components;

import com.masterplan.ReleaseServerException;
import com.masterplan.components.eventbus.ErrorEvent;
import com.masterplan.components.eventbus.EventBus;
import com.masterplan.components.eventbus.HttpApiEvent;
import com.masterplan.controllers.HttpController;
import com.masterplan.file.SourceAssetException;
import com.masterplan.jobs.PublishInFlightException;
import com.masterplan.release.ReleaseValidationException;
import com.masterplan.util.JsonUtil;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import spark.Request;
import spark.Response;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static com.masterplan.ReleaseServerException.Type.BAD_REQUEST;
import static com.masterplan.ReleaseServerException.Type.CONFLICT;
import static com.masterplan.ReleaseServerException.Type.RUNTIME;

/**
 * This Component is a web server that serves up the HTTP API endpoints used by the editing UI, and the files of
 * published releases used by the viewer. It must be supplied with a list of HttpController instances implementing
 * the endpoints.
 */
public class HttpApi implements Component {

    private static final Logger LOG = LoggerFactory.getLogger(HttpApi.class);

    // These "attributes" are attached to an incoming HTTP request with String keys, making them available in handlers
    private static final String REQUEST_START_TIME_ATTRIBUTE = "requestStartTime";

    public interface Config {
        int serverPort ();
        String allowOrigin ();
    }

    private final EventBus eventBus;
    private final Config config;

    private final spark.Service sparkService;

    public HttpApi (EventBus eventBus, Config config, List<HttpController> httpControllers) {
        this.eventBus = eventBus;
        this.config = config;
        sparkService = configureSparkService();
        for (HttpController httpController : httpControllers) {
            httpController.registerEndpoints(sparkService);
        }
    }

    private spark.Service configureSparkService () {
        LOG.info("Release server will listen for HTTP connections on port {}.", config.serverPort());
        spark.Service sparkService = spark.Service.ignite();
        sparkService.port(config.serverPort());

        sparkService.before((req, res) -> {
            // Record when the request started, so we can measure elapsed response time.
            req.attribute(REQUEST_START_TIME_ATTRIBUTE, Instant.now());
            // Set CORS headers to allow requests to this API server from a frontend hosted on a different domain.
            res.header("Access-Control-Allow-Origin", config.allowOrigin());
            res.header("Vary", "Origin");
            // The default MIME type is JSON. This will be overridden by the few controllers that do not return JSON.
            res.type("application/json");
        });

        sparkService.after((req, res) -> {
            Instant requestStartTime = req.attribute(REQUEST_START_TIME_ATTRIBUTE);
            Duration elapsed = Duration.between(requestStartTime, Instant.now());
            eventBus.send(new HttpApiEvent(req.requestMethod(), res.status(), req.pathInfo(), elapsed.toMillis()));
        });

        // Handle CORS preflight requests (which are OPTIONS requests).
        sparkService.options("/*", (req, res) -> {
            // Cache the preflight response for up to one day (the maximum allowed by browsers)
            res.header("Access-Control-Max-Age", "86400");
            res.header("Access-Control-Allow-Methods", "GET,POST,DELETE,OPTIONS");
            res.header("Access-Control-Allow-Headers", "Accept,Content-Type,Origin,X-Requested-With,Content-Length");
            return "OK";
        });

        // Spark picks the handler registered for the most specific superclass of the exception thrown.

        sparkService.exception(ReleaseServerException.class, (e, request, response) -> {
            respondToException(e, request, response, e.type, e.getMessage(), e.httpCode);
        });

        sparkService.exception(PublishInFlightException.class, (e, request, response) -> {
            ObjectNode body = errorBody(CONFLICT, e.getMessage());
            body.put("job_id", e.activeJobId);
            body.put("job_type", e.jobType);
            respond(response, 409, body);
        });

        sparkService.exception(ReleaseValidationException.class, (e, request, response) -> {
            ObjectNode body = errorBody(BAD_REQUEST, e.getMessage());
            body.set("errors", JsonUtil.objectMapper.valueToTree(e.errors));
            respond(response, 400, body);
        });

        sparkService.exception(IllegalArgumentException.class, (e, request, response) -> {
            respondToException(e, request, response, BAD_REQUEST, e.getMessage(), 400);
        });

        sparkService.exception(SourceAssetException.class, (e, request, response) -> {
            respondToException(e, request, response, BAD_REQUEST, e.getMessage(), 400);
        });

        sparkService.exception(RuntimeException.class, (e, request, response) -> {
            respondToException(e, request, response, RUNTIME, e.toString(), 500);
        });

        return sparkService;
    }

    private void respondToException (
            Exception e, Request request, Response response,
            ReleaseServerException.Type type, String message, int code
    ) {
        ErrorEvent errorEvent = ErrorEvent.forRequest(e, request.pathInfo());
        // Client errors are expected in normal operation; only record server-side failures as errors.
        if (code >= 500) {
            eventBus.send(errorEvent);
        }
        ObjectNode body = errorBody(type, message);
        body.put("stack_trace", errorEvent.filteredStackTrace);
        respond(response, code, body);
    }

    private static ObjectNode errorBody (ReleaseServerException.Type type, String message) {
        return JsonUtil.objectNode()
                .put("type", type.toString())
                .put("message", message);
    }

    private static void respond (Response response, int code, ObjectNode body) {
        response.status(code);
        response.type("application/json");
        response.body(JsonUtil.toJsonString(body));
    }

    /** Block until the server is ready to accept connections. */
    public void awaitInitialization () {
        sparkService.awaitInitialization();
    }

    public void shutDown () {
        sparkService.stop();
    }

}
