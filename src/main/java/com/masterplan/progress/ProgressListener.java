package com.masterplan.progress;

/**
 * This interface provides simple callbacks to allow long running, asynchronous operations to report on their progress.
 * Take care that all method implementations are very fast as the increment methods might be called in tight loops.
 */
public interface ProgressListener {

    /**
     * Call this method once at the beginning of a new task, specifying how many sub-units of work will be performed.
     * Calling it again on the same listener starts a new named sub-task and resets the count of completed units.
     */
    void beginTask (String description, int totalElements);

    /** Call this method to report that N units of work have been performed. */
    void increment (int n);

    /** Call this method to report that one unit of work has been performed. */
    default void increment () {
        increment(1);
    }

    /**
     * Long running operations call this at points where it is safe to abandon the work, i.e. between units of work
     * and never in the middle of writing an output file. Listeners attached to a cancellable job throw
     * CancelledException here once cancellation has been requested. The default is to never cancel.
     */
    default void checkCancelled () throws CancelledException { /* Default is no-op */ }

}
