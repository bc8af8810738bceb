package com.myorg.relay.publisher;

import com.myorg.relay.contracts.core.exception.BrokerDiscoveryException;
import com.myorg.relay.contracts.core.exception.RelayNonRetryableException;
import com.myorg.relay.contracts.core.exception.TransportException;
import com.myorg.relay.contracts.core.message.BrokerEndpoint;
import com.myorg.relay.contracts.core.message.OutboundMessage;
import com.myorg.relay.contracts.core.stats.StatsEvent;
import com.myorg.relay.contracts.core.stats.StatsSink;
import com.myorg.relay.kafka.RelayKafkaConfig;
import com.myorg.relay.kafka.discovery.BrokerResolver;
import com.myorg.relay.kafka.session.ProducerSession;
import com.myorg.relay.kafka.session.SessionManager;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.context.SmartLifecycle;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * Moves messages from the {@link InboundQueue} to Kafka, rebuilding the producer session
 * whenever it is lost.
 *
 * <p>DISCONNECTED -&gt; CONNECTING -&gt; ACTIVE -&gt; DISCONNECTED, forever, until stopped or a
 * configuration error makes further attempts pointless. A message taken from the queue but not
 * accepted by a session is held and handed to the next session before anything else.
 */
@Slf4j
public class RelayPublisherLoop implements SmartLifecycle {

    public static final String MDC_SESSION = "relaySession";

    private final RelayKafkaConfig config;
    private final BrokerResolver resolver;
    private final SessionManager sessions;
    private final InboundQueue queue;
    private final StatsSink stats;
    private final ReconnectPolicy reconnect;
    private final Duration pollInterval;
    private final Duration shutdownTimeout;
    private final boolean autoStartup;

    private volatile PublisherState state = PublisherState.DISCONNECTED;
    private volatile Worker current;

    // only one worker runs the loop at a time, so a single writer
    private volatile OutboundMessage pending;

    public RelayPublisherLoop(RelayKafkaConfig config,
                              BrokerResolver resolver,
                              SessionManager sessions,
                              InboundQueue queue,
                              StatsSink stats,
                              ReconnectPolicy reconnect,
                              RelayPublisherProperties props) {
        this.config = config;
        this.resolver = resolver;
        this.sessions = sessions;
        this.queue = queue;
        this.stats = stats;
        this.reconnect = reconnect;
        this.pollInterval = props.getPollInterval();
        this.shutdownTimeout = props.getShutdownTimeout();
        this.autoStartup = props.isAutoStartup();
    }

    @Override
    public synchronized void start() {
        Worker previous = current;
        if (previous != null && previous.active) return;

        Worker w = new Worker(previous != null ? previous.executor : null);
        current = w;
        state = PublisherState.DISCONNECTED;
        w.executor.execute(() -> run(w));
        log.info("Relay publisher started mode={}", config.mode());
    }

    @Override
    public synchronized void stop() {
        Worker w = current;
        if (w == null || w.executor.isTerminated()) return;

        w.active = false;
        w.executor.shutdownNow();
        try {
            if (!w.executor.awaitTermination(shutdownTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Relay publisher did not stop within {}", shutdownTimeout);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        log.info("Relay publisher stopped, {} message(s) left in queue", queue.size() + (pending != null ? 1 : 0));
    }

    @Override
    public boolean isRunning() {
        Worker w = current;
        return w != null && w.active;
    }

    @Override
    public boolean isAutoStartup() {
        return autoStartup;
    }

    public PublisherState getState() {
        return state;
    }

    private void run(Worker w) {
        try {
            w.awaitPrevious();
            while (w.active) {
                try {
                    ProducerSession session = connect();
                    if (session != null) {
                        pump(session, w);
                    }
                } catch (RelayNonRetryableException e) {
                    throw e;
                } catch (RuntimeException e) {
                    state = PublisherState.DISCONNECTED;
                    log.error("Unexpected failure in relay publisher loop, reconnecting", e);
                    backoff();
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (RelayNonRetryableException e) {
            log.error("Relay publisher giving up: reason={} error={}", e.getReason(), e.getMessage(), e);
        } finally {
            w.active = false;
            w.executor.shutdown();
            // a stopped worker that outlived stop() must not overwrite its successor's state
            if (current == w) {
                state = PublisherState.STOPPED;
            }
        }
    }

    /**
     * One connection attempt. Returns the open session, or null after a failed attempt once
     * the reconnect delay has passed.
     */
    private ProducerSession connect() throws InterruptedException {
        state = PublisherState.CONNECTING;
        try {
            List<BrokerEndpoint> brokers = resolver.resolve(config);
            ProducerSession session = sessions.open(brokers);

            reconnect.reset();
            state = PublisherState.ACTIVE;
            stats.emit(StatsEvent.sessionOpened(BrokerEndpoint.join(brokers)));
            return session;
        } catch (BrokerDiscoveryException e) {
            stats.emit(StatsEvent.discoveryFailed(e.getFramework()));
            stats.emit(StatsEvent.connectionFailed(e.getMessage()));
            log.warn("Broker discovery failed: framework={} error={}", e.getFramework(), e.getMessage());
        } catch (RelayNonRetryableException e) {
            throw e;
        } catch (RuntimeException e) {
            stats.emit(StatsEvent.connectionFailed(e.getMessage()));
            log.warn("Failed to connect to Kafka: {}", e.getMessage());
        }

        state = PublisherState.DISCONNECTED;
        backoff();
        return null;
    }

    private void backoff() throws InterruptedException {
        Duration delay = reconnect.onFailure();
        if (!delay.isZero()) {
            log.debug("Reconnecting in {} ms (attempt {})", delay.toMillis(), reconnect.failures() + 1);
            Thread.sleep(delay.toMillis());
        }
    }

    private void pump(ProducerSession session, Worker w) throws InterruptedException {
        MDC.put(MDC_SESSION, session.id());
        try {
            while (w.active) {
                OutboundMessage msg = pending != null ? pending : queue.poll(pollInterval);
                pending = null;
                try {
                    if (msg == null) {
                        if (!session.isUsable()) break;
                        continue;
                    }
                    if (!session.isUsable()) {
                        pending = msg;
                        break;
                    }
                    session.submit(msg);
                } catch (TransportException e) {
                    pending = msg;
                    log.warn("Session {} rejected message for topic={}: {}", session.id(), e.getTopic(), e.getMessage());
                    break;
                } catch (RuntimeException e) {
                    pending = msg;
                    log.warn("Session {} failed, reconnecting: {}", session.id(), e.toString(), e);
                    break;
                }
                stats.emit(StatsEvent.messageSent(msg.destination()));
            }
        } finally {
            MDC.remove(MDC_SESSION);
            state = PublisherState.DISCONNECTED;
            stats.emit(StatsEvent.sessionClosed(session.id()));
            closeQuietly(session);
        }
    }

    // flush/close must not see the stop interrupt, or buffered records are abandoned
    private void closeQuietly(ProducerSession session) {
        boolean interrupted = Thread.interrupted();
        try {
            sessions.close(session);
        } catch (RuntimeException e) {
            log.warn("Failed to close session {}: {}", session.id(), e.toString(), e);
        } finally {
            if (interrupted) Thread.currentThread().interrupt();
        }
    }

    /**
     * One start() generation. Runs on its own single-thread executor and waits for the previous
     * generation to finish, so two loops never hold sessions at the same time.
     */
    private static final class Worker {
        private final ExecutorService executor = Executors.newSingleThreadExecutor(r -> new Thread(r, "relay-publisher"));
        private final ExecutorService previous;
        private volatile boolean active = true;

        Worker(ExecutorService previous) {
            this.previous = previous;
        }

        void awaitPrevious() throws InterruptedException {
            if (previous == null || previous.isTerminated()) return;
            log.info("Waiting for the previous relay publisher thread to finish");
            while (active && !previous.awaitTermination(1, TimeUnit.SECONDS)) {
                log.debug("Previous relay publisher thread still running");
            }
        }
    }
}
