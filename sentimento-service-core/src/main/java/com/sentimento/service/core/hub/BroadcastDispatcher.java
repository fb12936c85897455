package com.sentimento.service.core.hub;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sentimento.live.model.LiveEvent;
import com.sentimento.service.core.ingest.IngestValidator;
import com.sentimento.service.core.ingest.ValidationResult;
import com.sentimento.service.core.window.SampleWindow;
import java.io.IOException;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Ingest entry point: validate, record exactly one sample, then fan the event out.
 *
 * <p>Accepted events are serialized through a fair lock so sample order and per-connection frame order
 * both follow acceptance order. Nothing inside the lock waits on I/O; transports only enqueue. A
 * failing connection is unregistered and skipped without affecting the rest of the broadcast.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class BroadcastDispatcher {

    private final IngestValidator validator;
    private final SampleWindow window;
    private final ConnectionRegistry registry;
    private final BackpressureGate gate;
    private final ObjectMapper mapper;

    private final ReentrantLock acceptLock = new ReentrantLock(true);
    private final AtomicLong broadcasts = new AtomicLong();

    public IngestOutcome accept(JsonNode raw) {
        ValidationResult result = validator.validate(raw);
        if (result instanceof ValidationResult.Invalid invalid) {
            log.info("Ingest rejected field={} reason={}", invalid.error().field(), invalid.error().message());
            return new IngestOutcome.Rejected(invalid.error());
        }
        LiveEvent event = ((ValidationResult.Valid) result).event();
        String payload = serialize(event);

        FanOutReport report;
        acceptLock.lock();
        try {
            window.push(event.hope(), event.sorrow());
            report = fanOut(payload);
        } finally {
            acceptLock.unlock();
        }
        broadcasts.incrementAndGet();
        log.debug(
                "Broadcast complete attempted={} sent={} dropped={} failed={}",
                report.attempted(),
                report.sent(),
                report.dropped(),
                report.failed());
        return new IngestOutcome.Accepted(event, report, registry.size());
    }

    /**
     * Registers a subscriber and enqueues its first frame while holding the accept lock, so no event
     * can reach the new connection ahead of that frame.
     *
     * @throws ResourceExhaustedException when the registry is full
     */
    public ConnectionId connect(LiveTransport transport, Object firstFrame) {
        acceptLock.lock();
        try {
            ConnectionId id = registry.register(transport);
            sendTo(id, firstFrame);
            return id;
        } finally {
            acceptLock.unlock();
        }
    }

    /** Sends a single frame to one connection through the backpressure gate. */
    public SendDecision sendTo(ConnectionId id, Object frame) {
        Connection connection = registry.find(id).orElse(null);
        if (connection == null) {
            return SendDecision.DROP;
        }
        try {
            return gate.send(connection, serialize(frame));
        } catch (IOException | RuntimeException ex) {
            registry.transportFailed(id, ex);
            return SendDecision.DROP;
        }
    }

    private FanOutReport fanOut(String payload) {
        int attempted = 0;
        int sent = 0;
        int failed = 0;
        for (Connection connection : registry.snapshot()) {
            if (!connection.isRegistered()) {
                continue;
            }
            attempted++;
            try {
                if (gate.send(connection, payload) == SendDecision.SEND) {
                    sent++;
                }
            } catch (IOException | RuntimeException ex) {
                failed++;
                log.warn("Send failed connection={} cause={}", connection.id(), ex.toString());
                registry.transportFailed(connection.id(), ex);
            }
        }
        return new FanOutReport(attempted, sent, attempted - sent, failed);
    }

    private String serialize(Object frame) {
        try {
            return mapper.writeValueAsString(frame);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unable to serialize " + frame.getClass().getSimpleName(), e);
        }
    }

    public long broadcastCount() {
        return broadcasts.get();
    }

    public long droppedTotal() {
        return gate.droppedTotal();
    }

    public int clientCount() {
        return registry.size();
    }
}
