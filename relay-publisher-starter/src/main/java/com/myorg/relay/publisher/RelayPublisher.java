package com.myorg.relay.publisher;

/**
 * Entry point for application code. Publishing only enqueues; delivery happens on the
 * publisher loop and its failures never come back to the caller.
 */
public interface RelayPublisher {

    /**
     * Enqueues a message, waiting for room if the queue is bounded and full.
     *
     * @throws IllegalArgumentException when the topic is blank or the payload is null
     */
    void publish(String topic, byte[] payload) throws InterruptedException;

    /**
     * Enqueues a message if there is room right now.
     *
     * @return false when a bounded queue is full
     */
    boolean tryPublish(String topic, byte[] payload);
}
