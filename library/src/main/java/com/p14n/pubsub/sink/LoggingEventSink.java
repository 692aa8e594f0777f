package com.p14n.pubsub.sink;

import java.util.List;

import com.p14n.pubsub.data.BatchedMessage;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Event sink that writes each batch to the log as JSON. Useful when no
 * consumer is attached yet and for diagnosing what a subscription receives.
 */
public class LoggingEventSink implements EventSink {
    private static final Logger logger = LoggerFactory.getLogger(LoggingEventSink.class);

    @Override
    public void emit(String eventName, List<BatchedMessage> batch) {
        logger.atInfo()
                .addArgument(eventName)
                .addArgument(batch.size())
                .log("Batch {} with {} messages");
        if (logger.isDebugEnabled()) {
            logger.atDebug()
                    .addArgument(eventName)
                    .addArgument(() -> BatchJson.encode(batch))
                    .log("Batch {}: {}");
        }
    }
}
