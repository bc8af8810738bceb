package com.myorg.relay.publisher;

import com.myorg.relay.contracts.core.message.OutboundMessage;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@RequiredArgsConstructor
public class DefaultRelayPublisher implements RelayPublisher {

    private final InboundQueue queue;

    @Override
    public void publish(String topic, byte[] payload) throws InterruptedException {
        queue.put(OutboundMessage.of(topic, payload));
    }

    @Override
    public boolean tryPublish(String topic, byte[] payload) {
        boolean accepted = queue.offer(OutboundMessage.of(topic, payload));
        if (!accepted) {
            log.debug("Inbound queue full, rejected message for topic={}", topic);
        }
        return accepted;
    }
}
