package com.auditsentinel.server;

import com.auditsentinel.core.engine.DetectionCoordinator;
import com.auditsentinel.core.exception.AnomalyEngineException;
import com.auditsentinel.core.json.JsonMappers;
import com.auditsentinel.core.model.DetectionReport;
import com.auditsentinel.core.model.ExpertFeedback;
import com.auditsentinel.core.model.ReportStatus;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import com.sun.net.httpserver.HttpServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * JSON-over-HTTP front end of the {@link DetectionCoordinator}.
 *
 * <h3>Endpoints</h3>
 * <ul>
 * <li>{@code GET /health} – {@code 200 OK} with body {@code {"status":"UP"}}</li>
 * <li>{@code GET /readiness} – same, once the coordinator is wired</li>
 * <li>{@code POST /detect} – body {@link DetectionRequest}; answers with the
 * {@link DetectionReport}. {@code 200} for SUCCESS and DEGRADED runs,
 * {@code 422} for ERROR, {@code 503} for CANCELLED.</li>
 * <li>{@code POST /feedback} – body {@link FeedbackRequest}; {@code 201} with
 * the stored feedback, {@code 404} for an unknown anomaly</li>
 * <li>{@code GET /feedback/summary} – per-detector feedback counts and
 * precision</li>
 * </ul>
 *
 * <p>
 * Uses the JDK built-in {@link HttpServer}; no servlet container is needed.
 * </p>
 *
 * @since 1.0.0
 */
public class DetectionServer {

    private static final Logger LOG = LoggerFactory.getLogger(DetectionServer.class);
    private static final byte[] HEALTH_RESPONSE = "{\"status\":\"UP\"}".getBytes(StandardCharsets.UTF_8);
    private static final int HANDLER_THREADS = 4;

    private final DetectionCoordinator coordinator;
    private final ObjectMapper mapper;
    private final AtomicBoolean running = new AtomicBoolean(false);

    private HttpServer server;
    private ExecutorService executor;

    public DetectionServer(DetectionCoordinator coordinator) {
        this.coordinator = Objects.requireNonNull(coordinator, "coordinator must not be null");
        this.mapper = JsonMappers.create();
    }

    /**
     * Start serving on the given port.
     *
     * @param port TCP port; {@code 0} picks an ephemeral one
     * @throws IllegalArgumentException if port is out of range
     * @throws UncheckedIOException     if the port cannot be bound
     */
    public void start(int port) {
        if (port < 0 || port > 65_535) {
            throw new IllegalArgumentException("Server port must be in range [0, 65535], got: " + port);
        }
        try {
            server = HttpServer.create(new InetSocketAddress(port), 0);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to bind detection server on port " + port, e);
        }
        server.createContext("/health", DetectionServer::handleHealthCheck);
        server.createContext("/readiness", this::handleReadiness);
        server.createContext("/detect", guarded("POST", this::handleDetect));
        server.createContext("/feedback/summary", guarded("GET", this::handleFeedbackSummary));
        server.createContext("/feedback", guarded("POST", this::handleFeedback));

        AtomicInteger counter = new AtomicInteger();
        executor = Executors.newFixedThreadPool(HANDLER_THREADS, r -> {
            Thread t = new Thread(r, "detection-http-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        server.setExecutor(executor);

        server.start();
        running.set(true);
        LOG.info("Detection server started on port {}", getPort());
    }

    /**
     * Stop the server gracefully.
     */
    public void stop() {
        if (server != null && running.compareAndSet(true, false)) {
            server.stop(0);
            executor.shutdownNow();
            LOG.info("Detection server stopped");
        }
    }

    /**
     * @return {@code true} if the server is currently running
     */
    public boolean isRunning() {
        return running.get();
    }

    /**
     * @return the bound port
     * @throws IllegalStateException if the server was never started
     */
    public int getPort() {
        if (server == null) {
            throw new IllegalStateException("Detection server not started");
        }
        return server.getAddress().getPort();
    }

    // ---------------------------------------------------------------
    // Handlers
    // ---------------------------------------------------------------

    private static void handleHealthCheck(HttpExchange exchange) throws IOException {
        send(exchange, 200, HEALTH_RESPONSE);
    }

    private void handleReadiness(HttpExchange exchange) throws IOException {
        if (running.get()) {
            send(exchange, 200, HEALTH_RESPONSE);
        } else {
            sendError(exchange, 503, "NOT_READY", "Server is shutting down");
        }
    }

    private void handleDetect(HttpExchange exchange) throws IOException {
        DetectionRequest request = readBody(exchange, DetectionRequest.class);
        DetectionReport report = coordinator.detectAnomalies(request.getRecords(), request.getRunConfig());
        sendJson(exchange, statusFor(report.getStatus()), report);
    }

    private void handleFeedback(HttpExchange exchange) throws IOException {
        if (!"/feedback".equals(exchange.getRequestURI().getPath())) {
            sendError(exchange, 404, "NOT_FOUND", "No such resource: " + exchange.getRequestURI().getPath());
            return;
        }
        FeedbackRequest request = readBody(exchange, FeedbackRequest.class);
        if (request.getAnomalyId() == null || request.getFeedbackType() == null) {
            sendError(exchange, 400, "INVALID_REQUEST", "anomalyId and feedbackType are required");
            return;
        }
        try {
            ExpertFeedback feedback = coordinator.recordFeedback(request.getAnomalyId(),
                    request.getFeedbackType(), request.getExpertName(), request.getComments());
            sendJson(exchange, 201, feedback);
        } catch (IllegalArgumentException e) {
            sendError(exchange, 404, "UNKNOWN_ANOMALY", e.getMessage());
        }
    }

    private void handleFeedbackSummary(HttpExchange exchange) throws IOException {
        sendJson(exchange, 200, coordinator.summarizeFeedback());
    }

    static int statusFor(ReportStatus status) {
        switch (status) {
            case ERROR:
                return 422;
            case CANCELLED:
                return 503;
            default:
                return 200;
        }
    }

    // ---------------------------------------------------------------
    // Plumbing
    // ---------------------------------------------------------------

    /**
     * Enforce the HTTP method and translate exceptions into JSON errors.
     */
    private HttpHandler guarded(String method, HttpHandler handler) {
        return exchange -> {
            try {
                if (!method.equalsIgnoreCase(exchange.getRequestMethod())) {
                    exchange.getResponseHeaders().set("Allow", method);
                    sendError(exchange, 405, "METHOD_NOT_ALLOWED",
                            "Use " + method + " for " + exchange.getRequestURI().getPath());
                    return;
                }
                handler.handle(exchange);
            } catch (JsonProcessingException e) {
                LOG.warn("Rejected malformed request to {}: {}", exchange.getRequestURI(), e.getOriginalMessage());
                sendError(exchange, 400, "INVALID_REQUEST", "Malformed JSON: " + e.getOriginalMessage());
            } catch (AnomalyEngineException e) {
                LOG.error("Request to {} failed: {}", exchange.getRequestURI(), e.getMessage(), e);
                sendError(exchange, 500, e.getCode(), e.getMessage());
            } catch (IllegalArgumentException e) {
                sendError(exchange, 400, "INVALID_REQUEST", e.getMessage());
            } catch (RuntimeException e) {
                LOG.error("Unexpected failure handling {}", exchange.getRequestURI(), e);
                sendError(exchange, 500, "INTERNAL_ERROR", e.getMessage());
            } finally {
                exchange.close();
            }
        };
    }

    private <T> T readBody(HttpExchange exchange, Class<T> type) throws IOException {
        try (InputStream in = exchange.getRequestBody()) {
            T value = mapper.readValue(in, type);
            if (value == null) {
                throw new IllegalArgumentException("Request body must not be empty");
            }
            return value;
        }
    }

    private void sendJson(HttpExchange exchange, int status, Object body) throws IOException {
        send(exchange, status, mapper.writeValueAsBytes(body));
    }

    private void sendError(HttpExchange exchange, int status, String code, String message) throws IOException {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("code", code);
        body.put("message", message);
        sendJson(exchange, status, Map.of("error", body));
    }

    private static void send(HttpExchange exchange, int status, byte[] body) throws IOException {
        exchange.getResponseHeaders().set("Content-Type", "application/json");
        exchange.sendResponseHeaders(status, body.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(body);
        }
    }
}
