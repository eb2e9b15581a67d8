package com.github.dimitryivaniuta.callpipeline.offline;

/**
 * Outcome of one polling cycle.
 *
 * @param fetched      items in the batch, 0 when the queue was empty
 * @param processed    items the handler accepted
 * @param acknowledged ids sent to {@code event.offline.clear}
 * @param deadLettered items written to the dead-letter file
 * @param pending      items left in the queue for a later cycle
 */
public record CycleReport(int fetched, int processed, int acknowledged, int deadLettered, int pending) {

    public static final CycleReport EMPTY = new CycleReport(0, 0, 0, 0, 0);
}
