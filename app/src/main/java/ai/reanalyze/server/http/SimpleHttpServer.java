package ai.reanalyze.server.http;

import ai.reanalyze.tools.ErrorPayload;
import ai.reanalyze.util.ExecutorServiceUtil;
import ai.reanalyze.util.Json;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Thin layer over the JDK {@link HttpServer}: a fixed worker pool, Bearer token checks on protected
 * contexts, JSON bodies in and out, and a 500 {@code INTERNAL_ERROR} payload for anything a handler
 * throws.
 */
public final class SimpleHttpServer {
    private static final Logger logger = LogManager.getLogger(SimpleHttpServer.class);

    private final HttpServer httpServer;
    private final ExecutorService workers;
    private final byte[] expectedAuthHeader;

    /**
     * @param host        address to bind, e.g. "127.0.0.1"
     * @param port        port to bind; 0 picks a free one
     * @param authToken   token protected contexts expect as {@code Authorization: Bearer <token>}
     * @param threadCount size of the worker pool
     * @throws IOException if the socket cannot be bound
     */
    public SimpleHttpServer(String host, int port, String authToken, int threadCount) throws IOException {
        this.expectedAuthHeader = ("Bearer " + authToken).getBytes(StandardCharsets.UTF_8);
        this.httpServer = HttpServer.create(new InetSocketAddress(host, port), 0);
        this.workers = Executors.newFixedThreadPool(threadCount, ExecutorServiceUtil.createNamedThreadFactory("HttpWorker"));
        this.httpServer.setExecutor(workers);
        logger.info("HTTP server bound to {}:{} with {} worker threads", host, getPort(), threadCount);
    }

    public void registerUnauthenticatedContext(String path, CheckedHttpHandler handler) {
        httpServer.createContext(path, exchange -> dispatch(path, exchange, handler));
        logger.debug("Registered unauthenticated context: {}", path);
    }

    /** Register a context whose handler only runs for requests carrying the expected Bearer token. */
    public void registerAuthenticatedContext(String path, CheckedHttpHandler handler) {
        httpServer.createContext(path, exchange -> dispatch(path, exchange, ex -> {
            if (!isAuthorized(ex)) {
                logger.warn("Unauthorized request to {} (missing or invalid Authorization header)", ex.getRequestURI());
                sendJsonResponse(ex, 401, ErrorPayload.of(ErrorPayload.Code.UNAUTHORIZED, "Unauthorized"));
                return;
            }
            handler.handle(ex);
        }));
        logger.debug("Registered authenticated context: {}", path);
    }

    private boolean isAuthorized(HttpExchange exchange) {
        var header = exchange.getRequestHeaders().getFirst("Authorization");
        return header != null && MessageDigest.isEqual(header.getBytes(StandardCharsets.UTF_8), expectedAuthHeader);
    }

    private static void dispatch(String path, HttpExchange exchange, CheckedHttpHandler handler) throws IOException {
        try {
            handler.handle(exchange);
        } catch (Exception e) {
            logger.error("Unhandled exception in handler for {}", path, e);
            sendJsonResponse(exchange, 500, ErrorPayload.internalError("Internal server error", e));
        }
    }

    /**
     * Parse the request body as JSON.
     *
     * @return the value, or null if the body is not valid JSON for {@code valueType}
     */
    public static <T> @Nullable T parseJsonRequest(HttpExchange exchange, Class<T> valueType) {
        try (InputStream is = exchange.getRequestBody()) {
            var bytes = is.readAllBytes();
            if (bytes.length == 0) {
                return null;
            }
            return Json.getMapper().readValue(bytes, valueType);
        } catch (IOException e) {
            logger.warn("Failed to parse JSON request body", e);
            return null;
        }
    }

    public static void sendJsonResponse(HttpExchange exchange, Object responseObject) throws IOException {
        sendJsonResponse(exchange, 200, responseObject);
    }

    public static void sendJsonResponse(HttpExchange exchange, int statusCode, Object responseObject)
            throws IOException {
        exchange.getResponseHeaders().add("Content-Type", "application/json; charset=UTF-8");
        var jsonBytes = Json.getMapper().writeValueAsBytes(responseObject);
        exchange.sendResponseHeaders(statusCode, jsonBytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(jsonBytes);
        }
        exchange.close();
    }

    public void start() {
        httpServer.start();
        logger.info("HTTP server started on port {}", getPort());
    }

    /**
     * Stop accepting requests, wait up to {@code delaySeconds} for open exchanges, then stop the workers.
     */
    public void stop(int delaySeconds) {
        httpServer.stop(delaySeconds);
        ExecutorServiceUtil.shutdownQuietly(workers, 1000);
        logger.info("HTTP server stopped");
    }

    public int getPort() {
        return httpServer.getAddress().getPort();
    }

    @FunctionalInterface
    public interface CheckedHttpHandler {
        void handle(HttpExchange exchange) throws Exception;
    }
}
