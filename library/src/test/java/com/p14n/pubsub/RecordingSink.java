package com.p14n.pubsub;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

import com.p14n.pubsub.data.BatchedMessage;
import com.p14n.pubsub.sink.EventSink;

/**
 * Event sink that keeps every batch it is given.
 */
public class RecordingSink implements EventSink {

    public record Emission(String eventName, List<BatchedMessage> batch) {
    }

    private final List<Emission> emissions = new CopyOnWriteArrayList<>();

    @Override
    public void emit(String eventName, List<BatchedMessage> batch) {
        emissions.add(new Emission(eventName, List.copyOf(batch)));
    }

    public List<Emission> emissions() {
        return new ArrayList<>(emissions);
    }

    public List<Integer> batchSizes() {
        return emissions.stream().map(e -> e.batch().size()).collect(Collectors.toList());
    }

    public List<String> payloads() {
        return emissions.stream()
                .flatMap(e -> e.batch().stream())
                .map(BatchedMessage::payload)
                .collect(Collectors.toList());
    }

    public int messageCount() {
        return emissions.stream().mapToInt(e -> e.batch().size()).sum();
    }

    /**
     * Waits until at least {@code count} messages have been emitted.
     *
     * @return whether the count was reached in time
     */
    public boolean awaitMessages(int count, long timeout, TimeUnit unit) throws InterruptedException {
        long deadline = System.nanoTime() + unit.toNanos(timeout);
        while (messageCount() < count) {
            if (System.nanoTime() > deadline) {
                return false;
            }
            Thread.sleep(5);
        }
        return true;
    }
}
