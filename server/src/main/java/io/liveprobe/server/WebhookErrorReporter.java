package io.liveprobe.server;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.liveprobe.core.report.ErrorReporter;
import io.liveprobe.server.dto.ErrorEvent;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Posts error events as JSON to an HTTP endpoint.
 *
 * Delivery is asynchronous and fire-and-forget: report() never blocks a
 * worker on the network and never throws. Failed deliveries are logged and
 * counted.
 *
 * At most maxInFlight posts are outstanding at once. Events reported while
 * that many are pending are dropped and counted, so a failure storm at a
 * high operation rate cannot pile up requests. close() waits briefly for
 * pending posts.
 */
public final class WebhookErrorReporter implements ErrorReporter {
    private static final Logger log = Logger.getLogger(WebhookErrorReporter.class.getName());

    static final String APP = "liveprobe";
    static final int DEFAULT_MAX_IN_FLIGHT = 64;
    static final Duration CLOSE_TIMEOUT = Duration.ofSeconds(2);

    private final URI target;
    private final HttpClient http;
    private final ObjectMapper json = new ObjectMapper();
    private final Clock clock;
    private final AtomicLong delivered = new AtomicLong();
    private final AtomicLong failed = new AtomicLong();
    private final AtomicLong dropped = new AtomicLong();
    private final int maxInFlight;
    private final Semaphore inFlight;

    public WebhookErrorReporter(URI target) {
        this(target, HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(2)).build(),
                Clock.systemUTC(), DEFAULT_MAX_IN_FLIGHT);
    }

    WebhookErrorReporter(URI target, HttpClient http, Clock clock, int maxInFlight) {
        if (maxInFlight <= 0) {
            throw new IllegalArgumentException("maxInFlight must be > 0");
        }
        this.target = Objects.requireNonNull(target, "target");
        this.http = Objects.requireNonNull(http, "http");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.maxInFlight = maxInFlight;
        this.inFlight = new Semaphore(maxInFlight);
    }

    @Override
    public void report(String message, Throwable error, Map<String, String> context) {
        byte[] body;
        try {
            body = json.writeValueAsBytes(toEvent(message, error, context));
        } catch (JsonProcessingException e) {
            failed.incrementAndGet();
            log.log(Level.WARNING, "Failed to serialize error event: " + message, e);
            return;
        }

        if (!inFlight.tryAcquire()) {
            if (dropped.incrementAndGet() == 1) {
                log.warning("Error sink saturated (" + maxInFlight + " posts pending); dropping events");
            }
            return;
        }

        HttpRequest req = HttpRequest.newBuilder(target)
                .timeout(Duration.ofSeconds(5))
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofByteArray(body))
                .build();

        http.sendAsync(req, HttpResponse.BodyHandlers.discarding())
                .whenComplete((resp, ex) -> {
                    if (ex != null) {
                        failed.incrementAndGet();
                        log.warning("Error sink delivery failed: " + ex);
                    } else if (resp.statusCode() >= 300) {
                        failed.incrementAndGet();
                        log.warning("Error sink rejected event: HTTP " + resp.statusCode());
                    } else {
                        delivered.incrementAndGet();
                    }
                    inFlight.release();
                });
    }

    /**
     * Wait up to {@link #CLOSE_TIMEOUT} for pending posts. Posts still
     * pending afterwards are left to the HTTP client.
     */
    @Override
    public void close() {
        try {
            if (inFlight.tryAcquire(maxInFlight, CLOSE_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS)) {
                inFlight.release(maxInFlight);
            } else {
                log.warning("Error sink: " + (maxInFlight - inFlight.availablePermits())
                        + " post(s) still pending at close");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warning("Interrupted while waiting for pending error sink posts");
        }
        if (dropped.get() > 0) {
            log.warning("Error sink dropped " + dropped.get() + " event(s) while saturated");
        }
    }

    ErrorEvent toEvent(String message, Throwable error, Map<String, String> context) {
        ErrorEvent ev = new ErrorEvent();
        ev.app = APP;
        ev.timestamp = clock.instant().toString();
        ev.message = message;
        if (error != null) {
            ev.errorType = error.getClass().getName();
            ev.errorMessage = error.getMessage();
        }
        ev.context = context == null ? Map.of() : Map.copyOf(context);
        return ev;
    }

    public long delivered() {
        return delivered.get();
    }

    public long failed() {
        return failed.get();
    }

    public long dropped() {
        return dropped.get();
    }
}
