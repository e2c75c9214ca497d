package com.masterplan.progress;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * A mock ProgressListener for use in tests, which makes sure all the interface methods are called and records the
 * percentages it would have shown. It can also simulate a user cancelling after some number of units of work.
 */
public class TestingProgressListener implements ProgressListener {

    private String description;
    private int taskCount = 0;
    private int totalElements = 0;
    private int elementsCompleted = 0;
    private int cancelAfter = -1;
    public final List<Integer> percentages = new ArrayList<>();

    public static TestingProgressListener cancellingAfter (int elements) {
        TestingProgressListener listener = new TestingProgressListener();
        listener.cancelAfter = elements;
        return listener;
    }

    @Override
    public void beginTask (String description, int totalElements) {
        this.description = description;
        this.totalElements = totalElements;
        this.elementsCompleted = 0;
        taskCount += 1;
    }

    @Override
    public void increment (int n) {
        elementsCompleted += n;
        assertTrue(elementsCompleted <= totalElements);
        percentages.add(elementsCompleted * 100 / totalElements);
    }

    @Override
    public void checkCancelled () {
        if (cancelAfter >= 0 && elementsCompleted >= cancelAfter) {
            throw new CancelledException("Cancelled by test after " + elementsCompleted + " elements.");
        }
    }

    public int getElementsCompleted () {
        return elementsCompleted;
    }

    public void assertUsedCorrectly () {
        assertNotNull(description);
        assertTrue(taskCount > 0);
        assertTrue(elementsCompleted > 0);
        assertEquals(totalElements, elementsCompleted);
    }

}
