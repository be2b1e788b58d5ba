package org.novelfinder.search.config;

import java.io.IOException;
import java.io.InputStream;
import java.time.Duration;
import java.util.Properties;

/**
 * Typed configuration for the Search Service.
 *
 * <p>Loads {@code application.properties}, then overlays environment variables and finally
 * {@code --key value} command-line arguments. Missing required keys fail fast with
 * {@link IllegalStateException}.</p>
 */
public record SearchConfig(
    int serverPort,
    int maxConcurrency,
    int maxResults,
    int maxActiveSearches,
    Duration taskTimeout,
    Duration sessionTtl,
    Http http,
    String sourcesCatalog
) {
    /** Timeouts for calls to upstream sources. */
    public record Http(
        Duration connectTimeout,
        Duration readTimeout
    ) {}

    /**
     * Loads configuration from classpath properties, environment variables and arguments.
     *
     * @param args command-line arguments of the form {@code --key value}
     * @return a fully-initialized {@link SearchConfig}
     */
    public static SearchConfig load(String[] args) {
        Properties properties = loadProperties("application.properties");
        overlayEnvironment(properties);
        overlayArguments(properties, args);
        return from(properties);
    }

    static SearchConfig from(Properties p) {
        return new SearchConfig(
            requireInt(p, "server.port"),
            requirePositiveInt(p, "search.max.concurrency"),
            requirePositiveInt(p, "search.max.results"),
            requirePositiveInt(p, "search.max.active.searches"),
            Duration.ofMillis(requireInt(p, "search.task.timeout.ms")),
            Duration.ofSeconds(requireInt(p, "search.session.ttl.seconds")),
            readHttp(p),
            requireString(p, "sources.catalog")
        );
    }

    private static Http readHttp(Properties p) {
        return new Http(
            Duration.ofMillis(requireInt(p, "http.connect.timeout")),
            Duration.ofMillis(requireInt(p, "http.read.timeout"))
        );
    }

    private static Properties loadProperties(String resourceName) {
        Properties properties = new Properties();
        try (InputStream in = SearchConfig.class.getClassLoader().getResourceAsStream(resourceName)) {
            if (in != null) {
                properties.load(in);
            }
        } catch (IOException e) {
            throw new IllegalStateException("Failed to load " + resourceName, e);
        }
        return properties;
    }

    private static void overlayEnvironment(Properties properties) {
        properties.putAll(System.getenv());
    }

    static void overlayArguments(Properties properties, String[] args) {
        if (args == null) {
            return;
        }
        for (int i = 0; i < args.length; i++) {
            if (!args[i].startsWith("--")) {
                throw new IllegalStateException("Unexpected argument: " + args[i]);
            }
            if (i + 1 >= args.length) {
                throw new IllegalStateException("Missing value for argument " + args[i]);
            }
            properties.setProperty(args[i].substring(2), args[i + 1]);
            i++;
        }
    }

    private static String requireString(Properties properties, String key) {
        String value = trimToNull(properties.getProperty(key));
        if (value == null) {
            throw new IllegalStateException("Missing required configuration: " + key);
        }
        return value;
    }

    private static int requireInt(Properties properties, String key) {
        String value = requireString(properties, key);
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalStateException("Invalid integer for configuration '" + key + "': '" + value + "'", e);
        }
    }

    private static int requirePositiveInt(Properties properties, String key) {
        int value = requireInt(properties, key);
        if (value < 1) {
            throw new IllegalStateException("Configuration '" + key + "' must be at least 1, got " + value);
        }
        return value;
    }

    private static String trimToNull(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }
}
