// file: server/src/main/java/io/inksync/server/Main.java
package io.inksync.server;

import io.inksync.core.EngineSettings;
import io.inksync.core.error.ConfigurationException;
import io.inksync.core.predict.ConflictPredictor;
import io.inksync.server.config.EngineConfigLoader;
import io.inksync.server.notify.AsyncDispatcher;
import io.inksync.server.notify.LoggingConflictNotifier;
import io.inksync.server.resolution.ConflictResolutionService;
import io.inksync.server.resolution.ResolutionStrategyRegistry;
import io.inksync.server.session.ActivityPredictionChannel;
import io.inksync.server.session.WhiteboardSessionRegistry;
import io.inksync.storage.ConflictAuditLog;
import io.inksync.storage.FileConflictAuditLog;
import io.inksync.storage.InMemoryConflictAuditLog;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;

/**
 * Entry point for one inksync engine process.
 *
 * Responsibilities:
 *  - Parse CLI flags and load the engine configuration (exit 2 when it is invalid).
 *  - Wire the audit log, async dispatcher, resolution service and session registry.
 *  - Start the prediction channel, the maintenance scheduler and the admin HTTP surface.
 *  - Tear everything down in reverse order on shutdown.
 *
 * The transport gateway that feeds operations into the sessions is a separate
 * process; this one exposes the engine to it and an operator view.
 */
public final class Main {
    private static final Logger log = Logger.getLogger(Main.class.getName());

    private Main() {
        // no-op
    }

    public static void main(String[] args) {
        installLogging();
        var cfg = ServerConfig.fromArgs(args);

        EngineSettings settings;
        try {
            settings = cfg.configPath() == null
                    ? EngineSettings.defaults()
                    : new EngineConfigLoader().load(Path.of(cfg.configPath()));
        } catch (ConfigurationException e) {
            System.err.println("Invalid configuration: " + e.getMessage());
            System.exit(2);
            return;
        }

        Clock clock = Clock.systemUTC();

        // ------ Audit + notifications ------
        ConflictAuditLog auditLog = cfg.auditDir() == null
                ? new InMemoryConflictAuditLog()
                : new FileConflictAuditLog(Path.of(cfg.auditDir()), ServerConfig.DEFAULT_AUDIT_ROTATE_BYTES);
        var dispatcher = new AsyncDispatcher(auditLog, new LoggingConflictNotifier());

        // ------ Resolution + sessions ------
        var resolution = new ConflictResolutionService(settings.resolution(),
                ResolutionStrategyRegistry.defaults(), dispatcher, auditLog, clock);
        var sessions = new WhiteboardSessionRegistry(settings, resolution,
                Duration.ofSeconds(cfg.dedupeTtlSeconds()), clock);
        sessions.start();

        // ------ Prediction (best effort) ------
        var predictor = new ConflictPredictor(settings.prediction(), clock);
        var prediction = new ActivityPredictionChannel(sessions, predictor,
                (whiteboardId, predictions) -> log.fine(() -> "whiteboard " + whiteboardId
                        + ": " + predictions.size() + " predicted conflict(s), top " + predictions.get(0).type()),
                settings.prediction(), clock);
        prediction.start();

        // ------ Admin HTTP ------
        var admin = new AdminServer(cfg.adminPort(), sessions, resolution, dispatcher);
        admin.start();
        log.info(String.format("inksync engine up; admin on http://localhost:%d/admin/health, audit log %s",
                cfg.adminPort(), cfg.auditDir() == null ? "in memory" : cfg.auditDir()));

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            try {
                admin.stop();
                prediction.stop();
                sessions.shutdown(Duration.ofSeconds(5));
                dispatcher.close(Duration.ofSeconds(5));
                auditLog.close();
            } catch (RuntimeException e) {
                log.log(Level.WARNING, "error during shutdown", e);
            }
        }, "inksync-shutdown"));
    }

    private static void installLogging() {
        if (System.getProperty("java.util.logging.config.file") != null) {
            return;
        }
        try (InputStream in = Main.class.getResourceAsStream("/logging.properties")) {
            if (in != null) {
                LogManager.getLogManager().readConfiguration(in);
            }
        } catch (IOException e) {
            log.log(Level.WARNING, "cannot read bundled logging.properties, keeping JVM defaults", e);
        }
    }
}
