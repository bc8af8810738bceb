package com.myorg.relay.publisher;

import com.myorg.relay.contracts.core.message.OutboundMessage;

import java.time.Duration;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Messages waiting for the publisher loop. Any number of writers, one reader.
 * Lives as long as the application, so it outlives every producer session.
 */
public class InboundQueue {

    private final BlockingQueue<OutboundMessage> messages;
    private final int capacity;

    public InboundQueue(int capacity) {
        this.capacity = capacity;
        this.messages = capacity > 0 ? new LinkedBlockingQueue<>(capacity) : new LinkedBlockingQueue<>();
    }

    /** Waits for room when the queue is bounded and full. */
    public void put(OutboundMessage message) throws InterruptedException {
        messages.put(message);
    }

    public boolean offer(OutboundMessage message) {
        return messages.offer(message);
    }

    public OutboundMessage poll(Duration timeout) throws InterruptedException {
        return messages.poll(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    public int size() {
        return messages.size();
    }

    public boolean isBounded() {
        return capacity > 0;
    }
}
