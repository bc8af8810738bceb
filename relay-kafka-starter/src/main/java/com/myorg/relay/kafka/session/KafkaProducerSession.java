package com.myorg.relay.kafka.session;

import com.myorg.relay.contracts.core.exception.TransportException;
import com.myorg.relay.contracts.core.message.BrokerEndpoint;
import com.myorg.relay.contracts.core.message.OutboundMessage;
import com.myorg.relay.contracts.core.stats.StatsEvent;
import com.myorg.relay.contracts.core.stats.StatsSink;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.core.ProducerFactory;
import org.springframework.kafka.support.SendResult;

import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * A producer session over a {@link KafkaTemplate} bound to one broker list.
 *
 * <p>Send outcomes complete on the Kafka I/O thread; failures are queued on the session's error
 * stream and drained by a dedicated daemon thread that logs them and emits
 * {@code MESSAGE_FAILED}. Reaching {@code maxConsecutiveErrors} failures in a row retires the
 * session so the publisher loop rebuilds it against freshly resolved brokers.
 */
@Slf4j
public class KafkaProducerSession implements ProducerSession {

    private static final TransportException END_OF_STREAM = new TransportException("", "end of error stream", null);

    private final String id;
    private final List<BrokerEndpoint> endpoints;
    private final ProducerFactory<String, byte[]> producerFactory;
    private final KafkaTemplate<String, byte[]> template;
    private final StatsSink stats;
    private final int maxConsecutiveErrors;

    private final BlockingQueue<TransportException> errors = new LinkedBlockingQueue<>();
    private final AtomicInteger consecutiveErrors = new AtomicInteger();
    private final AtomicBoolean retired = new AtomicBoolean();
    private final AtomicBoolean closed = new AtomicBoolean();
    private final ExecutorService errorDrain;

    public KafkaProducerSession(String id,
                                List<BrokerEndpoint> endpoints,
                                ProducerFactory<String, byte[]> producerFactory,
                                KafkaTemplate<String, byte[]> template,
                                StatsSink stats,
                                int maxConsecutiveErrors) {
        this.id = id;
        this.endpoints = List.copyOf(endpoints);
        this.producerFactory = producerFactory;
        this.template = template;
        this.stats = stats;
        this.maxConsecutiveErrors = maxConsecutiveErrors;

        this.errorDrain = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "relay-session-errors-" + id);
            t.setDaemon(true);
            return t;
        });
    }

    void startErrorDrain() {
        errorDrain.execute(this::drainErrors);
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public List<BrokerEndpoint> endpoints() {
        return endpoints;
    }

    @Override
    public void submit(OutboundMessage message) {
        String topic = message.destination();
        if (!isUsable()) {
            throw new TransportException(topic, "Session " + id + " is no longer usable", null);
        }

        CompletableFuture<SendResult<String, byte[]>> future;
        try {
            future = template.send(topic, message.payload());
        } catch (RuntimeException e) {
            retired.set(true);
            throw new TransportException(topic, "Producer rejected record for topic " + topic + ": " + e.getMessage(), e);
        }

        future.whenComplete((result, ex) -> {
            if (ex == null) {
                consecutiveErrors.set(0);
            } else {
                onSendFailure(topic, ex);
            }
        });
    }

    @Override
    public boolean isUsable() {
        return !closed.get() && !retired.get();
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) return;
        try {
            template.flush();
        } finally {
            try {
                producerFactory.reset();
            } finally {
                errors.offer(END_OF_STREAM);
                errorDrain.shutdown();
            }
        }
    }

    int pendingErrors() {
        return errors.size();
    }

    boolean errorDrainTerminated() {
        return errorDrain.isTerminated();
    }

    private void onSendFailure(String topic, Throwable ex) {
        Throwable cause = (ex instanceof CompletionException && ex.getCause() != null) ? ex.getCause() : ex;
        errors.offer(new TransportException(topic, cause.getMessage(), cause));

        if (maxConsecutiveErrors > 0
                && consecutiveErrors.incrementAndGet() >= maxConsecutiveErrors
                && retired.compareAndSet(false, true)) {
            log.warn("Retiring Kafka session {} after {} consecutive send failure(s)", id, maxConsecutiveErrors);
        }
    }

    private void drainErrors() {
        while (true) {
            TransportException e;
            try {
                e = errors.take();
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                return;
            }
            if (e == END_OF_STREAM) return;

            log.warn("Failed to write record to Kafka: session={} topic={} error={}", id, e.getTopic(), e.getMessage(), e.getCause());
            stats.emit(StatsEvent.messageFailed(e.getTopic()));
        }
    }
}
