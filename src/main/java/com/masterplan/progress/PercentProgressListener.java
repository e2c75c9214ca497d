package com.masterplan.progress;

/**
 * Converts counted units of work into whole percentages. After each increment the percentage is
 * floor(completed * 100 / total), so a task of N equal units reports floor((i + 1) / N * 100) after unit i.
 * Subclasses decide what to do with the percentage, typically rescaling it into a slice of a larger job.
 */
public abstract class PercentProgressListener implements ProgressListener {

    private String description;
    private int totalElements;
    private int completedElements;

    @Override
    public synchronized void beginTask (String description, int totalElements) {
        this.description = description;
        this.totalElements = totalElements;
        this.completedElements = 0;
        percentComplete(0, description);
    }

    @Override
    public synchronized void increment (int n) {
        completedElements = Math.min(totalElements, completedElements + n);
        int percent = totalElements > 0 ? (int) ((completedElements * 100L) / totalElements) : 100;
        percentComplete(percent, description);
    }

    /** Called with a value between 0 and 100 that never decreases within one task. */
    protected abstract void percentComplete (int percent, String description);

}
