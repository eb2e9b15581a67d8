package com.github.dimitryivaniuta.callpipeline.offline;

/**
 * Application processing for one offline event. Throwing marks the delivery failed; it is
 * retried on a later cycle until the retry budget is spent.
 */
@FunctionalInterface
public interface OfflineEventHandler {

    void handle(OfflineEvent event) throws Exception;
}
