package com.masterplan.jobs;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonValue;

import java.time.Instant;
import java.util.Locale;

/** One line of a job's log, as shown to the user following the job. */
public class JobLogEntry {

    public enum Level {
        INFO, WARN, ERROR;

        @JsonValue
        public String jsonName () {
            return name().toLowerCase(Locale.ROOT);
        }

        @JsonCreator
        public static Level forJsonName (String name) {
            return Level.valueOf(name.toUpperCase(Locale.ROOT));
        }
    }

    public final Instant timestamp;
    public final Level level;
    public final String message;

    @JsonCreator
    public JobLogEntry (
            @JsonProperty("timestamp") Instant timestamp,
            @JsonProperty("level") Level level,
            @JsonProperty("message") String message
    ) {
        this.timestamp = timestamp;
        this.level = level;
        this.message = message;
    }

    @Override
    public String toString () {
        return timestamp + " " + level + " " + message;
    }

}
