package com.masterplan.components.eventbus;

import java.time.Instant;

/**
 * Metadata about server operation: job transitions, errors and HTTP requests. These are intended to be logged or
 * serialized, so the field visibility and types of every subclass should take that into consideration.
 */
public abstract class Event {

    /** The time at which this event happened. */
    public final Instant timestamp = Instant.now();

    public boolean success = true;

    /** The name of the specific subtype, to facilitate filtering once serialized. */
    public String getType () {
        return this.getClass().getSimpleName();
    }

}
