package com.masterplan.components.eventbus;

import com.masterplan.util.ExceptionUtils;

/**
 * Fired each time a Throwable ends a job or an HTTP request. The Throwable is converted to Strings up front so the
 * event can be logged or serialized like any other.
 */
public class ErrorEvent extends Event {

    public final String summary;

    /** The path portion of the HTTP URL, or null if the error did not occur while responding to a request. */
    public final String httpPath;

    /** The id of the job that failed, or null if the error did not occur within a job. */
    public final String jobId;

    public final String stackTrace;

    /** A minimal stack trace showing the immediate cause within our own code. */
    public final String filteredStackTrace;

    private ErrorEvent (Throwable throwable, String httpPath, String jobId) {
        this.summary = ExceptionUtils.shortCauseString(throwable);
        this.stackTrace = ExceptionUtils.stackTraceString(throwable);
        this.filteredStackTrace = ExceptionUtils.filterStackTrace(throwable);
        this.httpPath = httpPath;
        this.jobId = jobId;
        this.success = false;
    }

    public ErrorEvent (Throwable throwable) {
        this(throwable, null, null);
    }

    public static ErrorEvent forRequest (Throwable throwable, String httpPath) {
        return new ErrorEvent(throwable, httpPath, null);
    }

    public static ErrorEvent forJob (Throwable throwable, String jobId) {
        return new ErrorEvent(throwable, null, jobId);
    }

    /** Return a string intended for logging on the console. */
    public String traceWithContext (boolean verbose) {
        StringBuilder builder = new StringBuilder();
        if (jobId != null) {
            builder.append("Job ").append(jobId);
        } else if (httpPath != null) {
            builder.append("Request to ").append(httpPath);
        } else {
            builder.append("Background task");
        }
        builder.append(": ");
        builder.append(verbose ? stackTrace : filteredStackTrace);
        return builder.toString();
    }

    @Override
    public String toString () {
        return "[ErrorEvent " + summary + "]";
    }

}
