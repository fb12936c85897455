package com.sentimento.service.core.hub;

import com.sentimento.service.core.config.SentimentoProperties;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.atomic.AtomicLong;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Per-send drop policy for slow subscribers.
 *
 * <p>A frame is dropped when the connection already holds more than the ceiling in unflushed bytes.
 * The decision is an O(1) snapshot read and never waits for the transport to drain. Dropped frames are
 * counted and logged, never queued or retried.
 */
@Component
@Slf4j
public class BackpressureGate {

    private final long ceilingBytes;
    private final AtomicLong dropped = new AtomicLong();

    @Autowired
    public BackpressureGate(SentimentoProperties properties) {
        this(properties.getHub().getBufferMaxBytes());
    }

    public BackpressureGate(long ceilingBytes) {
        if (ceilingBytes <= 0) {
            throw new IllegalArgumentException("ceilingBytes must be positive, got " + ceilingBytes);
        }
        this.ceilingBytes = ceilingBytes;
    }

    public static SendDecision decide(long occupancyBytes, long ceilingBytes) {
        return occupancyBytes > ceilingBytes ? SendDecision.DROP : SendDecision.SEND;
    }

    public SendDecision shouldSend(Connection connection, long payloadSizeEstimate) {
        long occupancy = connection.bufferedBytes();
        SendDecision decision = decide(occupancy, ceilingBytes);
        if (decision == SendDecision.DROP) {
            long total = dropped.incrementAndGet();
            log.warn(
                    "Backpressure drop connection={} occupancy={} ceiling={} payloadBytes={} droppedTotal={}",
                    connection.id(),
                    occupancy,
                    ceilingBytes,
                    payloadSizeEstimate,
                    total);
        }
        return decision;
    }

    /**
     * The only outbound path to a connection: consults {@link #shouldSend} and enqueues the frame when
     * allowed.
     *
     * @throws IOException when the transport rejects the frame
     */
    public SendDecision send(Connection connection, String payload) throws IOException {
        SendDecision decision = shouldSend(connection, payload.getBytes(StandardCharsets.UTF_8).length);
        if (decision == SendDecision.SEND) {
            connection.enqueue(payload);
        }
        return decision;
    }

    public long ceilingBytes() {
        return ceilingBytes;
    }

    public long droppedTotal() {
        return dropped.get();
    }
}
