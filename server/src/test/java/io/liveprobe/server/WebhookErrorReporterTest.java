package io.liveprobe.server;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.liveprobe.core.storage.StorageException;
import io.liveprobe.server.dto.ErrorEvent;
import io.undertow.Undertow;
import io.undertow.server.handlers.BlockingHandler;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.net.http.HttpClient;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Delivers events to a throwaway Undertow receiver.
 */
class WebhookErrorReporterTest {

    private static final int PORT = 18091; // test-only port

    private final BlockingQueue<String> received = new LinkedBlockingQueue<>();
    private final AtomicInteger status = new AtomicInteger(200);
    private volatile CountDownLatch hold;
    private Undertow sink;

    @BeforeEach
    void startSink() {
        sink = Undertow.builder()
                .addHttpListener(PORT, "localhost")
                .setHandler(new BlockingHandler(ex -> {
                    received.add(new String(ex.getInputStream().readAllBytes(), StandardCharsets.UTF_8));
                    CountDownLatch gate = hold;
                    if (gate != null) {
                        gate.await(5, TimeUnit.SECONDS);
                    }
                    ex.setStatusCode(status.get());
                    ex.endExchange();
                }))
                .build();
        sink.start();
    }

    @AfterEach
    void stopSink() {
        CountDownLatch gate = hold;
        if (gate != null) {
            gate.countDown();
        }
        sink.stop();
    }

    @Test
    void postsEventAsJson() throws Exception {
        WebhookErrorReporter reporter = new WebhookErrorReporter(URI.create("http://localhost:" + PORT + "/events"));

        reporter.report("Operation failed: update",
                new StorageException("update failed (code=-3, transient=true): timeout", true),
                Map.of("op", "update", "id", "doc-17"));

        String body = received.poll(5, TimeUnit.SECONDS);
        assertNotNull(body, "event was not delivered");
        JsonNode n = new ObjectMapper().readTree(body);
        assertEquals("liveprobe", n.get("app").asText());
        assertEquals("Operation failed: update", n.get("message").asText());
        assertEquals(StorageException.class.getName(), n.get("errorType").asText());
        assertEquals("doc-17", n.get("context").get("id").asText());

        waitFor(() -> reporter.delivered() == 1);
        assertEquals(0L, reporter.failed());
    }

    @Test
    void rejectedEventsAreCountedNotThrown() throws Exception {
        status.set(500);
        WebhookErrorReporter reporter = new WebhookErrorReporter(URI.create("http://localhost:" + PORT + "/events"));

        assertDoesNotThrow(() -> reporter.report("Connectivity degraded", null, Map.of()));

        assertNotNull(received.poll(5, TimeUnit.SECONDS));
        waitFor(() -> reporter.failed() == 1);
        assertEquals(0L, reporter.delivered());
    }

    @Test
    void unreachableSinkIsCountedAsFailure() throws Exception {
        WebhookErrorReporter reporter = new WebhookErrorReporter(URI.create("http://localhost:1/events"));

        assertDoesNotThrow(() -> reporter.report("Operation failed: find", new RuntimeException("x"), null));

        waitFor(() -> reporter.failed() == 1);
    }

    @Test
    void eventsBeyondTheInFlightBoundAreDropped() throws Exception {
        hold = new CountDownLatch(1);
        WebhookErrorReporter reporter = new WebhookErrorReporter(
                URI.create("http://localhost:" + PORT + "/events"),
                HttpClient.newBuilder().version(HttpClient.Version.HTTP_1_1).build(),
                Clock.systemUTC(), 2);

        reporter.report("Operation failed: find", null, Map.of("n", "1"));
        reporter.report("Operation failed: find", null, Map.of("n", "2"));
        assertNotNull(received.poll(5, TimeUnit.SECONDS));
        assertNotNull(received.poll(5, TimeUnit.SECONDS));

        for (int i = 0; i < 3; i++) {
            reporter.report("Operation failed: find", null, Map.of());
        }
        assertEquals(3L, reporter.dropped());

        hold.countDown();
        reporter.close();

        assertEquals(2L, reporter.delivered());
        assertEquals(0L, reporter.failed());
        assertNull(received.poll(200, TimeUnit.MILLISECONDS), "dropped events must not be sent");
    }

    @Test
    void closeWaitsForPendingPosts() {
        WebhookErrorReporter reporter = new WebhookErrorReporter(URI.create("http://localhost:" + PORT + "/events"));
        for (int i = 0; i < 5; i++) {
            reporter.report("Operation failed: insert", null, Map.of());
        }

        reporter.close();

        assertEquals(5L, reporter.delivered() + reporter.failed());
        assertEquals(0L, reporter.dropped());
    }

    @Test
    void eventCarriesTimestampAndEmptyContext() {
        Clock fixed = Clock.fixed(Instant.parse("2024-05-01T10:15:34.120Z"), ZoneOffset.UTC);
        WebhookErrorReporter reporter = new WebhookErrorReporter(
                URI.create("http://localhost:" + PORT), HttpClient.newHttpClient(), fixed, 4);

        ErrorEvent ev = reporter.toEvent("Connectivity recovered", null, null);

        assertEquals("2024-05-01T10:15:34.120Z", ev.timestamp);
        assertNull(ev.errorType);
        assertTrue(ev.context.isEmpty());
    }

    private static void waitFor(BooleanSupplier condition) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (!condition.getAsBoolean()) {
            if (System.nanoTime() > deadline) {
                fail("condition not met within 5s");
            }
            Thread.sleep(10);
        }
    }
}
