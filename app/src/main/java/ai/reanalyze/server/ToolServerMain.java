package ai.reanalyze.server;

import ai.reanalyze.ChangeTracker;
import ai.reanalyze.FileWatcherHelper;
import ai.reanalyze.SessionOrchestrator;
import ai.reanalyze.WatchServiceFactory;
import ai.reanalyze.cache.CompilationCacheService;
import ai.reanalyze.cache.FingerprintUnitCompiler;
import ai.reanalyze.graph.DependencyGraphService;
import ai.reanalyze.manifest.ManifestWorkspaceLoader;
import ai.reanalyze.server.http.SimpleHttpServer;
import ai.reanalyze.sessions.SessionRegistry;
import ai.reanalyze.tools.DependencyTools;
import ai.reanalyze.tools.ErrorPayload;
import ai.reanalyze.tools.SessionTools;
import ai.reanalyze.tools.ToolResult;
import ai.reanalyze.util.Json;
import ai.reanalyze.util.ServerConfig;
import com.fasterxml.jackson.databind.JsonNode;
import com.google.common.collect.ImmutableMap;
import com.sun.net.httpserver.HttpExchange;
import java.io.IOException;
import java.io.InputStream;
import java.time.Duration;
import java.util.Map;
import java.util.function.Function;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Tool server entry point. Every tool is exposed as {@code POST /v1/tools/{toolName}} taking a JSON object
 * of arguments and answering with the tool's {@link ToolResult}.
 */
public final class ToolServerMain {
    private static final Logger logger = LogManager.getLogger(ToolServerMain.class);

    static final String TOOLS_PATH = "/v1/tools/";
    private static final Duration CACHE_MAINTENANCE_INTERVAL = Duration.ofMinutes(10);
    private static final Duration IDLE_CLEANUP_INTERVAL = Duration.ofMinutes(30);

    private final SimpleHttpServer server;
    private final SessionOrchestrator orchestrator;
    private final Map<String, Function<JsonNode, ToolResult<?>>> tools;

    public ToolServerMain(ServerConfig config, SessionOrchestrator orchestrator) throws IOException {
        this.orchestrator = orchestrator;
        this.tools = buildTools(new SessionTools(orchestrator), new DependencyTools(orchestrator));

        this.server = new SimpleHttpServer(config.host(), config.port(), config.authToken(), config.httpThreads());
        this.server.registerUnauthenticatedContext("/health/live", this::handleHealthLive);
        this.server.registerAuthenticatedContext(TOOLS_PATH, this::handleTool);

        logger.info("Tool server initialized with {} tools", tools.size());
    }

    /** Wire the default components: manifest workspaces, fingerprint compiler, native file watching. */
    public static ToolServerMain create(ServerConfig config) throws IOException {
        var cache = new CompilationCacheService(config.cacheMaxEntries());
        cache.startMaintenance(CACHE_MAINTENANCE_INTERVAL, config.cacheStaleAge());
        var orchestrator = new SessionOrchestrator(
                new SessionRegistry(),
                new DependencyGraphService(),
                cache,
                new ChangeTracker(WatchServiceFactory.nativeWatchers(config.quiescence())),
                new ManifestWorkspaceLoader(),
                new FingerprintUnitCompiler(),
                FileWatcherHelper.DEFAULT_PATTERNS);
        var idle = config.idleTimeout();
        orchestrator.startIdleCleanup(idle, idle.compareTo(IDLE_CLEANUP_INTERVAL) < 0 ? idle : IDLE_CLEANUP_INTERVAL);
        return new ToolServerMain(config, orchestrator);
    }

    private static Map<String, Function<JsonNode, ToolResult<?>>> buildTools(
            SessionTools sessions, DependencyTools dependencies) {
        return ImmutableMap.<String, Function<JsonNode, ToolResult<?>>>builder()
                .put("startSession", a -> sessions.startSession(text(a, "workspacePath"), bool(a, "prewarm", true)))
                .put("endSession", a -> sessions.endSession(text(a, "sessionId")))
                .put("refreshSession", a -> sessions.refreshSession(text(a, "sessionId")))
                .put("getSessionStatus", a -> sessions.getSessionStatus(text(a, "sessionId")))
                .put("listSessions", a -> sessions.listSessions())
                .put("pause", a -> sessions.pause(text(a, "sessionId"), bool(a, "watchFiles", true)))
                .put("resume", a -> sessions.resume(text(a, "sessionId"), bool(a, "forceFullRebuild", false)))
                .put("previewPauseChanges", a -> sessions.previewPauseChanges(text(a, "sessionId")))
                .put("getCacheStats", a -> sessions.getCacheStats())
                .put("clearCache", a -> sessions.clearCache(text(a, "sessionId")))
                .put("getDependencyGraph", a -> dependencies.getDependencyGraph(text(a, "sessionId")))
                .put("getImpactAnalysis", a -> dependencies.getImpactAnalysis(text(a, "sessionId"), text(a, "unitId")))
                .put("getCompilationOrder", a -> dependencies.getCompilationOrder(text(a, "sessionId")))
                .put("getUnitDetails", a -> dependencies.getUnitDetails(text(a, "sessionId"), text(a, "unitId")))
                .buildOrThrow();
    }

    private void handleHealthLive(HttpExchange exchange) throws IOException {
        if (!exchange.getRequestMethod().equals("GET")) {
            var error = ErrorPayload.of(ErrorPayload.Code.METHOD_NOT_ALLOWED, "Method not allowed");
            SimpleHttpServer.sendJsonResponse(exchange, 405, error);
            return;
        }
        var response = Map.of("status", "live", "sessions", orchestrator.getRegistry().size());
        SimpleHttpServer.sendJsonResponse(exchange, response);
    }

    void handleTool(HttpExchange exchange) throws IOException {
        var toolName = exchange.getRequestURI().getPath().substring(TOOLS_PATH.length());
        var tool = tools.get(toolName);
        if (tool == null) {
            var error = ErrorPayload.of(ErrorPayload.Code.NOT_FOUND, "Unknown tool: " + toolName);
            SimpleHttpServer.sendJsonResponse(exchange, 404, ToolResult.failure(error));
            return;
        }
        if (!exchange.getRequestMethod().equals("POST")) {
            var error = ErrorPayload.of(ErrorPayload.Code.METHOD_NOT_ALLOWED, "Method not allowed");
            SimpleHttpServer.sendJsonResponse(exchange, 405, ToolResult.failure(error));
            return;
        }

        var args = readArguments(exchange);
        if (args == null || !args.isObject()) {
            var error = ErrorPayload.validationError("Request body must be a JSON object of tool arguments");
            SimpleHttpServer.sendJsonResponse(exchange, 400, ToolResult.failure(error));
            return;
        }

        logger.debug("Invoking tool {}", toolName);
        ToolResult<?> result;
        try {
            result = tool.apply(args);
        } catch (IllegalArgumentException e) {
            result = ToolResult.failure(ErrorPayload.validationError(e.getMessage()));
        }
        SimpleHttpServer.sendJsonResponse(exchange, statusFor(result), result);
    }

    /* An empty body means no arguments; a body that is not JSON gives null. */
    private static @Nullable JsonNode readArguments(HttpExchange exchange) {
        try (InputStream is = exchange.getRequestBody()) {
            var bytes = is.readAllBytes();
            if (bytes.length == 0) {
                return Json.getMapper().createObjectNode();
            }
            return Json.getMapper().readTree(bytes);
        } catch (IOException e) {
            logger.warn("Failed to parse tool arguments", e);
            return null;
        }
    }

    static int statusFor(ToolResult<?> result) {
        var error = result.error();
        if (result.success() || error == null) {
            return 200;
        }
        return switch (error.code()) {
            case ErrorPayload.Code.NOT_FOUND -> 404;
            case ErrorPayload.Code.INVALID_STATE, ErrorPayload.Code.GRAPH_UNAVAILABLE, ErrorPayload.Code.CANCELLED -> 409;
            case ErrorPayload.Code.VALIDATION_ERROR, ErrorPayload.Code.WORKSPACE_LOAD_FAILED -> 400;
            default -> 500;
        };
    }

    private static @Nullable String text(JsonNode args, String name) {
        var node = args.get(name);
        return node == null || node.isNull() ? null : node.asText();
    }

    private static boolean bool(JsonNode args, String name, boolean defaultValue) {
        var node = args.get(name);
        if (node == null || node.isNull()) {
            return defaultValue;
        }
        if (!node.isBoolean()) {
            throw new IllegalArgumentException(name + " must be a boolean");
        }
        return node.booleanValue();
    }

    public int getPort() {
        return server.getPort();
    }

    public void start() {
        server.start();
    }

    public void stop(int delaySeconds) {
        logger.info("Stopping tool server");
        server.stop(delaySeconds);
        orchestrator.close();
        orchestrator.getCache().close();
    }

    public static void main(String[] args) {
        try {
            var config = ServerConfig.fromArgs(args);
            logger.info(
                    "Starting ToolServerMain with config: listenAddr={}:{}, quiescence={}ms, idleTimeout={}min, cacheMaxEntries={}",
                    config.host(),
                    config.port(),
                    config.quiescence().toMillis(),
                    config.idleTimeout().toMinutes(),
                    config.cacheMaxEntries());

            var main = create(config);
            main.start();

            Runtime.getRuntime()
                    .addShutdownHook(new Thread(
                            () -> {
                                logger.info("Shutdown signal received, stopping tool server");
                                main.stop(5);
                            },
                            "ToolServer-ShutdownHook"));

            logger.info("ToolServerMain is running on port {}", main.getPort());
            Thread.currentThread().join();
        } catch (InterruptedException e) {
            logger.info("ToolServerMain interrupted", e);
            Thread.currentThread().interrupt();
        } catch (Exception e) {
            logger.error("Fatal error in ToolServerMain", e);
            System.exit(1);
        }
    }
}
