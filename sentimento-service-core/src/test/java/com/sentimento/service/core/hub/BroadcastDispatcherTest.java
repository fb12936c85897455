package com.sentimento.service.core.hub;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sentimento.service.core.ingest.IngestValidator;
import com.sentimento.service.core.window.Sample;
import com.sentimento.service.core.window.SampleWindow;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class BroadcastDispatcherTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final Clock CLOCK = Clock.fixed(Instant.parse("2025-10-29T22:00:00Z"), ZoneOffset.UTC);

    private SampleWindow window;
    private ConnectionRegistry registry;
    private BackpressureGate gate;
    private BroadcastDispatcher dispatcher;

    @BeforeEach
    void setUp() {
        window = new SampleWindow(1000, 100, CLOCK);
        registry = new ConnectionRegistry(100, CLOCK);
        gate = new BackpressureGate(512 * 1024L);
        dispatcher = new BroadcastDispatcher(new IngestValidator(CLOCK, MAPPER), window, registry, gate, MAPPER);
    }

    @ParameterizedTest
    @ValueSource(ints = {0, 1, 50})
    void oneSamplePerAcceptedEventRegardlessOfSubscribers(int subscribers) throws Exception {
        List<StubTransport> transports = new ArrayList<>();
        for (int i = 0; i < subscribers; i++) {
            StubTransport t = new StubTransport("client-" + i);
            transports.add(t);
            registry.register(t);
        }

        for (int i = 0; i < 7; i++) {
            IngestOutcome outcome = dispatcher.accept(payload("{\"composites\":{\"hope\":0.6,\"sorrow\":0.4}}"));
            assertThat(outcome).isInstanceOf(IngestOutcome.Accepted.class);
            IngestOutcome.Accepted accepted = (IngestOutcome.Accepted) outcome;
            assertThat(accepted.report().attempted()).isEqualTo(subscribers);
            assertThat(accepted.report().sent()).isEqualTo(subscribers);
            assertThat(accepted.clientCount()).isEqualTo(subscribers);
        }

        assertThat(window.snapshot().sampleCount()).isEqualTo(7);
        assertThat(transports).allSatisfy(t -> assertThat(t.frames).hasSize(7));
    }

    @Test
    void rejectedEventIsNeitherSampledNorBroadcast() throws Exception {
        StubTransport client = new StubTransport("client");
        registry.register(client);

        IngestOutcome outcome = dispatcher.accept(payload("{\"composites\":{\"hope\":1.5,\"sorrow\":0.2}}"));

        assertThat(outcome).isInstanceOf(IngestOutcome.Rejected.class);
        assertThat(((IngestOutcome.Rejected) outcome).error().field()).isEqualTo("composites.hope");
        assertThat(window.snapshot().sampleCount()).isZero();
        assertThat(client.frames).isEmpty();
    }

    @Test
    void slowSubscriberIsDroppedWhileOthersReceiveEverything() throws Exception {
        StubTransport slow = new StubTransport("slow");
        slow.occupancy = 600 * 1024L;
        StubTransport fast = new StubTransport("fast");
        registry.register(slow);
        registry.register(fast);

        for (int i = 0; i < 10; i++) {
            IngestOutcome.Accepted accepted = (IngestOutcome.Accepted)
                    dispatcher.accept(payload("{\"composites\":{\"hope\":0.5,\"sorrow\":0.5}}"));
            assertThat(accepted.clientCount()).isEqualTo(2);
            assertThat(accepted.report()).isEqualTo(new FanOutReport(2, 1, 1, 0));
        }

        assertThat(slow.frames).isEmpty();
        assertThat(fast.frames).hasSize(10);
        assertThat(dispatcher.droppedTotal()).isEqualTo(10);
        assertThat(registry.size()).isEqualTo(2);
        assertThat(window.snapshot().sampleCount()).isEqualTo(10);
    }

    @Test
    void failingTransportIsIsolatedAndUnregistered() throws Exception {
        StubTransport broken = new StubTransport("broken");
        broken.failSends = true;
        StubTransport healthy = new StubTransport("healthy");
        ConnectionId brokenId = registry.register(broken);
        registry.register(healthy);

        IngestOutcome.Accepted first = (IngestOutcome.Accepted)
                dispatcher.accept(payload("{\"composites\":{\"hope\":0.9,\"sorrow\":0.1}}"));

        assertThat(first.report()).isEqualTo(new FanOutReport(2, 1, 1, 1));
        assertThat(first.clientCount()).isEqualTo(1);
        assertThat(registry.find(brokenId)).isEmpty();
        assertThat(broken.closeCode).isEqualTo(LiveTransport.CLOSE_SERVER_ERROR);

        IngestOutcome.Accepted second = (IngestOutcome.Accepted)
                dispatcher.accept(payload("{\"composites\":{\"hope\":0.9,\"sorrow\":0.1}}"));
        assertThat(second.report()).isEqualTo(new FanOutReport(1, 1, 0, 0));
        assertThat(healthy.frames).hasSize(2);
    }

    @Test
    void framesArriveInAcceptanceOrder() throws Exception {
        StubTransport client = new StubTransport("client");
        registry.register(client);

        for (int i = 0; i <= 10; i++) {
            double hope = i / 10.0;
            dispatcher.accept(payload("{\"composites\":{\"hope\":" + hope + ",\"sorrow\":0.0}}"));
        }

        List<Double> received = new ArrayList<>();
        for (String frame : client.frames) {
            received.add(MAPPER.readTree(frame).path("composites").path("hope").asDouble());
        }
        assertThat(received).containsExactly(0.0, 0.1, 0.2, 0.3, 0.4, 0.5, 0.6, 0.7, 0.8, 0.9, 1.0);
        assertThat(window.recent(11)).extracting(Sample::hope).containsExactlyElementsOf(received);
    }

    @Test
    void broadcastFrameCarriesServerTimestampAndMetadata() throws Exception {
        StubTransport client = new StubTransport("client");
        registry.register(client);

        dispatcher.accept(payload(
                "{\"timestamp\":\"1999-01-01T00:00:00Z\",\"composites\":{\"hope\":0.75,\"sorrow\":0.25},"
                        + "\"metadata\":{\"source\":\"analyzer-1\"}}"));

        JsonNode frame = MAPPER.readTree(client.frames.get(0));
        assertThat(frame.path("timestamp").asText()).isEqualTo("2025-10-29T22:00:00.000Z");
        assertThat(frame.path("composites").path("hope").asDouble()).isEqualTo(0.75);
        assertThat(frame.path("composites").path("sorrow").asDouble()).isEqualTo(0.25);
        assertThat(frame.path("metadata").path("source").asText()).isEqualTo("analyzer-1");
    }

    @Test
    void concurrentProducersStillSampleExactlyOncePerEvent() throws Exception {
        for (int i = 0; i < 5; i++) {
            registry.register(new StubTransport("client-" + i));
        }
        ExecutorService pool = Executors.newFixedThreadPool(4);
        List<Future<?>> futures = new ArrayList<>();
        try {
            for (int p = 0; p < 4; p++) {
                futures.add(pool.submit(() -> {
                    for (int i = 0; i < 200; i++) {
                        dispatcher.accept(payload("{\"composites\":{\"hope\":0.3,\"sorrow\":0.7}}"));
                    }
                    return null;
                }));
            }
            for (Future<?> f : futures) {
                f.get(30, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        assertThat(window.totalPushed()).isEqualTo(800);
        assertThat(window.snapshot().sampleCount()).isEqualTo(800);
        assertThat(dispatcher.broadcastCount()).isEqualTo(800);
    }

    @Test
    void sendToRoutesThroughTheGate() {
        StubTransport slow = new StubTransport("slow");
        slow.occupancy = 1024 * 1024L;
        ConnectionId id = registry.register(slow);

        assertThat(dispatcher.sendTo(id, Map.of("type", "welcome"))).isEqualTo(SendDecision.DROP);
        assertThat(dispatcher.sendTo(new ConnectionId(404), Map.of())).isEqualTo(SendDecision.DROP);
        assertThat(slow.frames).isEmpty();
    }

    @Test
    void firstFrameIsQueuedAheadOfABroadcastRacingTheRegistration() throws Exception {
        JsonNode event = payload("{\"composites\":{\"hope\":0.8,\"sorrow\":0.2}}");
        AtomicReference<BroadcastDispatcher> racing = new AtomicReference<>();
        AtomicReference<Thread> producer = new AtomicReference<>();
        ConnectionRegistry racingRegistry = new ConnectionRegistry(100, CLOCK) {
            @Override
            public ConnectionId register(LiveTransport transport) {
                ConnectionId id = super.register(transport);
                Thread thread = new Thread(() -> racing.get().accept(event), "racing-producer");
                producer.set(thread);
                thread.start();
                awaitParkedOrDone(thread);
                return id;
            }
        };
        racing.set(new BroadcastDispatcher(new IngestValidator(CLOCK, MAPPER), window, racingRegistry, gate, MAPPER));
        StubTransport client = new StubTransport("client");

        ConnectionId id = racing.get().connect(client, Map.of("type", "welcome"));
        producer.get().join(5_000);

        assertThat(client.attached).isEqualTo(id);
        assertThat(client.frames).hasSize(2);
        assertThat(MAPPER.readTree(client.frames.get(0)).path("type").asText()).isEqualTo("welcome");
        assertThat(MAPPER.readTree(client.frames.get(1)).path("composites").path("hope").asDouble())
                .isEqualTo(0.8);
    }

    @Test
    void connectAtCapacitySendsNothing() {
        ConnectionRegistry full = new ConnectionRegistry(1, CLOCK);
        BroadcastDispatcher small =
                new BroadcastDispatcher(new IngestValidator(CLOCK, MAPPER), window, full, gate, MAPPER);
        small.connect(new StubTransport("first"), Map.of("type", "welcome"));
        StubTransport second = new StubTransport("second");

        assertThatThrownBy(() -> small.connect(second, Map.of("type", "welcome")))
                .isInstanceOf(ResourceExhaustedException.class);
        assertThat(second.frames).isEmpty();
        assertThat(full.size()).isEqualTo(1);
    }

    private static void awaitParkedOrDone(Thread thread) {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (System.nanoTime() < deadline) {
            Thread.State state = thread.getState();
            if (state == Thread.State.WAITING
                    || state == Thread.State.TIMED_WAITING
                    || state == Thread.State.TERMINATED) {
                return;
            }
            Thread.onSpinWait();
        }
    }

    private static JsonNode payload(String json) throws Exception {
        return MAPPER.readTree(json);
    }
}
