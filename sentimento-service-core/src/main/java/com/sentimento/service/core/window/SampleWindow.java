package com.sentimento.service.core.window;

import com.sentimento.live.model.Composites;
import com.sentimento.service.core.config.SentimentoProperties;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.locks.ReentrantLock;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Fixed-capacity ring buffer of recent composite samples.
 *
 * <p>{@link #push} evicts the oldest sample once the window is full. Readers only walk the requested
 * recent slice, never the whole buffer. A single lock guards both the write and the read critical
 * section; samples are immutable records, so a reader sees either a complete sample or none.
 */
@Component
@Slf4j
public class SampleWindow {

    private final Sample[] ring;
    private final int defaultRecentCount;
    private final Clock clock;
    private final ReentrantLock lock = new ReentrantLock();

    private int next;
    private int size;
    private long totalPushed;

    @Autowired
    public SampleWindow(SentimentoProperties properties, Clock clock) {
        this(properties.getWindow().getCapacity(), properties.getWindow().getRecentCount(), clock);
    }

    public SampleWindow(int capacity, int defaultRecentCount, Clock clock) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("window capacity must be positive, got " + capacity);
        }
        if (defaultRecentCount <= 0) {
            throw new IllegalArgumentException("recent count must be positive, got " + defaultRecentCount);
        }
        this.ring = new Sample[capacity];
        this.defaultRecentCount = defaultRecentCount;
        this.clock = clock;
        log.info("Sample window ready capacity={} recentCount={}", capacity, defaultRecentCount);
    }

    public void push(double hope, double sorrow) {
        if (!Composites.inRange(hope) || !Composites.inRange(sorrow)) {
            throw new IllegalArgumentException("hope and sorrow must be in range [0,1]: hope=" + hope + ", sorrow=" + sorrow);
        }
        Sample sample = new Sample(hope, sorrow, clock.instant());
        lock.lock();
        try {
            ring[next] = sample;
            next = (next + 1) % ring.length;
            if (size < ring.length) {
                size++;
            }
            totalPushed++;
        } finally {
            lock.unlock();
        }
    }

    public MetricsSnapshot snapshot() {
        return snapshot(defaultRecentCount);
    }

    public MetricsSnapshot snapshot(int recentCount) {
        if (recentCount <= 0) {
            throw new IllegalArgumentException("recentCount must be positive, got " + recentCount);
        }
        lock.lock();
        try {
            int count = Math.min(recentCount, size);
            double hopeSum = 0d;
            double sorrowSum = 0d;
            int idx = next;
            for (int i = 0; i < count; i++) {
                idx = idx == 0 ? ring.length - 1 : idx - 1;
                Sample s = ring[idx];
                hopeSum += s.hope();
                sorrowSum += s.sorrow();
            }
            return MetricsSnapshot.of(hopeSum, sorrowSum, count, size, totalPushed);
        } finally {
            lock.unlock();
        }
    }

    /** Returns up to {@code count} newest samples, oldest first. */
    public List<Sample> recent(int count) {
        if (count <= 0) {
            throw new IllegalArgumentException("count must be positive, got " + count);
        }
        lock.lock();
        try {
            int n = Math.min(count, size);
            List<Sample> out = new ArrayList<>(n);
            int start = Math.floorMod(next - n, ring.length);
            for (int i = 0; i < n; i++) {
                out.add(ring[(start + i) % ring.length]);
            }
            return out;
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return size;
        } finally {
            lock.unlock();
        }
    }

    public long totalPushed() {
        lock.lock();
        try {
            return totalPushed;
        } finally {
            lock.unlock();
        }
    }

    public int capacity() {
        return ring.length;
    }

    public int defaultRecentCount() {
        return defaultRecentCount;
    }
}
