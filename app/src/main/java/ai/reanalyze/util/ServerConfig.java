package ai.reanalyze.util;

import com.google.common.base.Splitter;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.Properties;
import org.jetbrains.annotations.Nullable;

/**
 * Tool server configuration. Each value is resolved from the command line ({@code --key value} or
 * {@code --key=value}), then the environment, then (where one is defined) a system property, then a default.
 */
public record ServerConfig(
        String host,
        int port,
        String authToken,
        Duration quiescence,
        Duration idleTimeout,
        int cacheMaxEntries,
        Duration cacheStaleAge,
        int httpThreads) {

    public static final String DEFAULT_LISTEN_ADDR = "127.0.0.1:8765";
    public static final Duration DEFAULT_QUIESCENCE = Duration.ofMillis(500);
    public static final Duration DEFAULT_IDLE_TIMEOUT = Duration.ofHours(6);
    public static final int DEFAULT_CACHE_MAX_ENTRIES = 1000;
    public static final Duration DEFAULT_CACHE_STALE_AGE = Duration.ofHours(2);
    public static final int DEFAULT_HTTP_THREADS = 4;

    static final String QUIESCENCE_PROPERTY = "reanalyze.watch.quiescenceMs";

    public ServerConfig {
        if (port < 0 || port > 65535) {
            throw new IllegalArgumentException("port out of range: " + port);
        }
        if (authToken.isBlank()) {
            throw new IllegalArgumentException("auth token must not be blank");
        }
        if (quiescence.isNegative() || quiescence.isZero()) {
            throw new IllegalArgumentException("quiescence window must be positive");
        }
        if (cacheMaxEntries < 1) {
            throw new IllegalArgumentException("cache max entries must be >= 1");
        }
        if (httpThreads < 1) {
            throw new IllegalArgumentException("http threads must be >= 1");
        }
    }

    public static ServerConfig fromArgs(String[] args) {
        return resolve(parseArgs(args), System.getenv(), System.getProperties());
    }

    static ServerConfig resolve(Map<String, String> parsedArgs, Map<String, String> env, Properties props) {
        var listenAddr = valueOr(parsedArgs, "listen-addr", env, "LISTEN_ADDR", DEFAULT_LISTEN_ADDR);
        var parts = Splitter.on(':').splitToList(listenAddr);
        if (parts.size() != 2) {
            throw new IllegalArgumentException("LISTEN_ADDR must be in format host:port, got: " + listenAddr);
        }
        int port = parseInt("LISTEN_ADDR port", parts.get(1));

        var authToken = getConfigValue(parsedArgs, "auth-token", env, "AUTH_TOKEN");
        if (authToken == null || authToken.isBlank()) {
            throw new IllegalArgumentException(
                    "AUTH_TOKEN must be provided via --auth-token argument or AUTH_TOKEN environment variable");
        }

        var quiescenceMs = getConfigValue(parsedArgs, "quiescence-ms", env, "REANALYZE_QUIESCENCE_MS");
        if (quiescenceMs == null || quiescenceMs.isBlank()) {
            quiescenceMs = props.getProperty(QUIESCENCE_PROPERTY);
        }
        var quiescence = quiescenceMs == null || quiescenceMs.isBlank()
                ? DEFAULT_QUIESCENCE
                : Duration.ofMillis(parseInt("quiescence-ms", quiescenceMs));

        var idleMinutes = getConfigValue(parsedArgs, "idle-timeout-minutes", env, "REANALYZE_IDLE_TIMEOUT_MINUTES");
        var idleTimeout = idleMinutes == null || idleMinutes.isBlank()
                ? DEFAULT_IDLE_TIMEOUT
                : Duration.ofMinutes(parseInt("idle-timeout-minutes", idleMinutes));

        var maxEntries = getConfigValue(parsedArgs, "cache-max-entries", env, "REANALYZE_CACHE_MAX_ENTRIES");
        int cacheMaxEntries = maxEntries == null || maxEntries.isBlank()
                ? DEFAULT_CACHE_MAX_ENTRIES
                : parseInt("cache-max-entries", maxEntries);

        var staleMinutes = getConfigValue(parsedArgs, "cache-stale-minutes", env, "REANALYZE_CACHE_STALE_MINUTES");
        var cacheStaleAge = staleMinutes == null || staleMinutes.isBlank()
                ? DEFAULT_CACHE_STALE_AGE
                : Duration.ofMinutes(parseInt("cache-stale-minutes", staleMinutes));

        var threads = parsedArgs.get("http-threads");
        int httpThreads = threads == null || threads.isBlank() ? DEFAULT_HTTP_THREADS : parseInt("http-threads", threads);

        return new ServerConfig(
                parts.get(0),
                port,
                authToken,
                quiescence,
                idleTimeout,
                cacheMaxEntries,
                cacheStaleAge,
                httpThreads);
    }

    /*
     * Parse command-line arguments into a map of keys to values.
     * Supports both --key value and --key=value forms.
     */
    static Map<String, String> parseArgs(String[] args) {
        var result = new HashMap<String, String>();
        for (int i = 0; i < args.length; i++) {
            var arg = args[i];
            if (!arg.startsWith("--")) {
                continue;
            }
            var withoutPrefix = arg.substring(2);
            String key;
            String value;
            if (withoutPrefix.contains("=")) {
                var parts = withoutPrefix.split("=", 2);
                key = parts[0];
                value = parts[1];
            } else {
                key = withoutPrefix;
                if (i + 1 < args.length && !args[i + 1].startsWith("--")) {
                    value = args[++i];
                } else {
                    value = "";
                }
            }
            result.put(key, value);
        }
        return result;
    }

    @Nullable
    private static String getConfigValue(
            Map<String, String> parsedArgs, String argKey, Map<String, String> env, String envVarName) {
        var argValue = parsedArgs.get(argKey);
        if (argValue != null && !argValue.isBlank()) {
            return argValue;
        }
        return env.get(envVarName);
    }

    private static String valueOr(
            Map<String, String> parsedArgs, String argKey, Map<String, String> env, String envVarName, String dflt) {
        var value = getConfigValue(parsedArgs, argKey, env, envVarName);
        return value == null || value.isBlank() ? dflt : value;
    }

    private static int parseInt(String name, String raw) {
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid " + name + ": " + raw, e);
        }
    }
}
