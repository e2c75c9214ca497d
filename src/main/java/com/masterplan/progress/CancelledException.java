package com.masterplan.progress;

/**
 * Thrown from ProgressListener.checkCancelled() to unwind an operation whose job has been cancelled.
 * This is not an error: the job ends in the cancelled state rather than failed.
 */
public class CancelledException extends RuntimeException {

    public CancelledException (String message) {
        super(message);
    }

}
