package com.masterplan.jobs;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/** queued → running → {completed | failed | cancelled}. */
public enum JobStatus {

    QUEUED, RUNNING, COMPLETED, FAILED, CANCELLED;

    public boolean isTerminal () {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }

    @JsonValue
    public String jsonName () {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static JobStatus forJsonName (String name) {
        return JobStatus.valueOf(name.toUpperCase(Locale.ROOT));
    }

}
