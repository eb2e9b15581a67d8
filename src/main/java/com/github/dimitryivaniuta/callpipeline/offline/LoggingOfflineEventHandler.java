package com.github.dimitryivaniuta.callpipeline.offline;

import lombok.extern.slf4j.Slf4j;

/**
 * Default handler: logs the event and reports success. Replace with a bean of your own.
 */
@Slf4j
public class LoggingOfflineEventHandler implements OfflineEventHandler {

    @Override
    public void handle(OfflineEvent event) {
        log.info("Offline event received event={}, messageId={}",
                event.eventName(), event.messageId().orElse("-"));
    }
}
