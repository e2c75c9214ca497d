package com.masterplan.release;

import com.google.common.collect.ImmutableList;

import java.util.List;

/**
 * Preconditions for publishing are not met. All problems found are reported together, not just the first.
 */
public class ReleaseValidationException extends RuntimeException {

    public final List<String> errors;

    public ReleaseValidationException (List<String> errors) {
        super("Validation failed: " + String.join("; ", errors));
        this.errors = ImmutableList.copyOf(errors);
    }

}
