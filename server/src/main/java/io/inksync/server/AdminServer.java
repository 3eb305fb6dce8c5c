// file: server/src/main/java/io/inksync/server/AdminServer.java
package io.inksync.server;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.inksync.core.engine.PerformanceSnapshot;
import io.inksync.server.dto.ErrorResponse;
import io.inksync.server.dto.HealthResponse;
import io.inksync.server.dto.InterventionView;
import io.inksync.server.dto.PerformanceResponse;
import io.inksync.server.notify.AsyncDispatcher;
import io.inksync.server.perf.Bottleneck;
import io.inksync.server.perf.PerformanceReport;
import io.inksync.server.resolution.AlternativeStrategy;
import io.inksync.server.resolution.ConflictResolutionService;
import io.inksync.server.resolution.ManualIntervention;
import io.inksync.server.resolution.TimeRange;
import io.inksync.server.session.WhiteboardSession;
import io.inksync.server.session.WhiteboardSessionRegistry;
import io.undertow.Undertow;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.Headers;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Read-only operator view over the running engine.
 *
 * Responsibilities:
 *  - Route GET requests to the session registry and the resolution service.
 *  - Convert results to JSON DTOs.
 *  - Map bad input to 400, unknown whiteboards and paths to 404, other methods to 405.
 *  - Log every request through {@link RequestLogger}.
 *
 * Path layout:
 *   - GET /admin/health
 *   - GET /admin/whiteboards/{id}/performance
 *   - GET /admin/interventions/pending
 *   - GET /admin/conflicts/analytics?whiteboardId=&from=&to=   (from/to in epoch millis)
 */
public final class AdminServer {
    private static final Logger log = Logger.getLogger(AdminServer.class.getName());

    private static final String WHITEBOARDS = "/admin/whiteboards/";
    private static final long SESSION_TIMEOUT_MS = 5_000;

    private final Undertow server;
    private final ObjectMapper json = new ObjectMapper();
    private final WhiteboardSessionRegistry sessions;
    private final ConflictResolutionService resolution;
    private final AsyncDispatcher dispatcher;

    public AdminServer(int port,
                       WhiteboardSessionRegistry sessions,
                       ConflictResolutionService resolution,
                       AsyncDispatcher dispatcher) {
        this.sessions = sessions;
        this.resolution = resolution;
        this.dispatcher = dispatcher;
        this.server = Undertow.builder()
                .addHttpListener(port, "0.0.0.0")
                .setHandler(exchange -> {
                    // session reads block on futures; keep them off the IO threads
                    if (exchange.isInIoThread()) {
                        exchange.dispatch(this::handle);
                        return;
                    }
                    handle(exchange);
                }).build();
    }

    public void start() {
        server.start();
    }

    public void stop() {
        server.stop();
    }

    private void handle(HttpServerExchange ex) {
        long start = System.nanoTime();
        String path = ex.getRequestPath();
        String method = ex.getRequestMethod().toString();
        int status = 200;
        Throwable error = null;
        ex.getResponseHeaders().put(Headers.CONTENT_TYPE, "application/json");
        try {
            if (!"GET".equals(method)) {
                status = 405;
                send(ex, status, new ErrorResponse("method not allowed"));
            } else if ("/admin/health".equals(path)) {
                send(ex, status, health());
            } else if ("/admin/interventions/pending".equals(path)) {
                send(ex, status, pendingInterventions());
            } else if ("/admin/conflicts/analytics".equals(path)) {
                TimeRange range = new TimeRange(
                        longParam(ex, "from", Long.MIN_VALUE),
                        longParam(ex, "to", Long.MAX_VALUE));
                send(ex, status, resolution.getConflictAnalytics(param(ex, "whiteboardId").orElse(null), range));
            } else if (path.startsWith(WHITEBOARDS) && path.endsWith("/performance")) {
                String id = path.substring(WHITEBOARDS.length(), path.length() - "/performance".length());
                Optional<WhiteboardSession> session = id.isBlank() ? Optional.empty() : sessions.find(id);
                if (session.isEmpty()) {
                    status = 404;
                    send(ex, status, new ErrorResponse("unknown whiteboard: " + id));
                } else {
                    PerformanceReport report = session.get().performance()
                            .get(SESSION_TIMEOUT_MS, TimeUnit.MILLISECONDS);
                    send(ex, status, toResponse(id, report));
                }
            } else {
                status = 404;
                send(ex, status, new ErrorResponse("not found"));
            }
        } catch (IllegalArgumentException bad) {
            status = 400;
            error = bad;
            send(ex, status, new ErrorResponse(bad.getMessage()));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            status = 503;
            error = e;
            send(ex, status, new ErrorResponse("interrupted"));
        } catch (TimeoutException e) {
            status = 503;
            error = e;
            send(ex, status, new ErrorResponse("whiteboard session busy"));
        } catch (ExecutionException | RuntimeException e) {
            status = 500;
            error = e;
            send(ex, status, new ErrorResponse(e.getClass().getSimpleName() + ": " + e.getMessage()));
        } finally {
            long totalMs = (System.nanoTime() - start) / 1_000_000L;
            RequestLogger.logRequest(method, path, status, totalMs, error);
        }
    }

    private HealthResponse health() {
        var dto = new HealthResponse();
        dto.status = "UP";
        dto.whiteboards = sessions.whiteboardIds().stream().sorted().toList();
        dto.pendingInterventions = resolution.getPendingManualInterventions().size();
        dto.auditFailures = dispatcher.auditFailures();
        dto.notificationFailures = dispatcher.notificationFailures();
        return dto;
    }

    private List<InterventionView> pendingInterventions() {
        var out = new ArrayList<InterventionView>();
        for (ManualIntervention mi : resolution.getPendingManualInterventions()) {
            var v = new InterventionView();
            v.id = mi.id();
            v.conflictId = mi.conflict().id();
            v.whiteboardId = mi.conflict().whiteboardId();
            v.conflictType = mi.conflict().type().name();
            v.severity = mi.conflict().severity().name();
            v.userIds = List.copyOf(mi.conflict().involvedUsers());
            v.operationIds = mi.conflict().operationIds();
            v.requestedAtMillis = mi.requestedAtMillis();
            if (mi.recommendation() != null) {
                v.recommendedStrategy = mi.recommendation().strategy().name();
                v.confidence = mi.recommendation().confidence();
                v.risk = mi.recommendation().risk().name();
                v.reasoning = mi.recommendation().reasoning();
                v.alternatives = mi.recommendation().alternatives().stream()
                        .map(AlternativeStrategy::strategy).map(Enum::name).toList();
            } else {
                v.alternatives = List.of();
            }
            out.add(v);
        }
        return out;
    }

    private static PerformanceResponse toResponse(String whiteboardId, PerformanceReport report) {
        PerformanceSnapshot s = report.snapshot();
        var dto = new PerformanceResponse();
        dto.whiteboardId = whiteboardId;
        dto.operationCount = s.operationCount();
        dto.averageLatencyMillis = s.averageLatencyMillis();
        dto.p95LatencyMillis = s.p95LatencyMillis();
        dto.maxLatencyMillis = s.maxLatencyMillis();
        dto.conflictRate = s.conflictRate();
        dto.resolutionSuccessRate = s.resolutionSuccessRate();
        dto.operationThroughput = s.operationThroughput();
        dto.queueSize = s.queueSize();
        dto.activeConflicts = s.activeConflicts();
        dto.activeUsers = s.activeUsers();
        dto.recommendedOpsPerSecond = s.recommendedOpsPerSecond();
        dto.memoryUsedMb = s.memoryUsedMb();
        dto.bottlenecks = new ArrayList<>();
        for (Bottleneck b : report.bottlenecks()) {
            var bv = new PerformanceResponse.BottleneckView();
            bv.kind = b.kind().name();
            bv.severity = b.severity().name();
            bv.value = b.value();
            bv.threshold = b.threshold();
            bv.description = b.description();
            dto.bottlenecks.add(bv);
        }
        dto.recommendations = report.recommendations();
        return dto;
    }

    private static Optional<String> param(HttpServerExchange ex, String name) {
        Deque<String> values = ex.getQueryParameters().get(name);
        if (values == null || values.isEmpty() || values.peekFirst().isBlank()) {
            return Optional.empty();
        }
        return Optional.of(values.peekFirst());
    }

    private static long longParam(HttpServerExchange ex, String name, long fallback) {
        Optional<String> raw = param(ex, name);
        if (raw.isEmpty()) {
            return fallback;
        }
        try {
            return Long.parseLong(raw.get());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("invalid numeric query param: " + name, e);
        }
    }

    private void send(HttpServerExchange ex, int code, Object body) {
        try {
            ex.setStatusCode(code);
            byte[] bytes = json.writeValueAsBytes(body);
            ex.getResponseSender().send(new String(bytes, StandardCharsets.UTF_8));
        } catch (Exception e) {
            log.log(Level.WARNING, "cannot serialize response for " + ex.getRequestPath(), e);
            ex.setStatusCode(500);
            ex.getResponseSender().send("{\"error\":\"serialization\"}");
        }
    }
}
