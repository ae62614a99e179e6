package org.docsearch.search.config;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

/**
 * Typed configuration for the Search Service.
 *
 * <p>Loads {@code application.properties}, then overlays environment variables, then {@code --key value} command-line
 * arguments. If {@code DATA_DIR} is set in the environment it overrides {@code storage.data.dir}. Missing or invalid
 * keys fail fast with {@link IllegalStateException}.</p>
 */
public record SearchConfig(
    int serverPort,
    int defaultLimit,
    int maxLimit,
    Storage storage
) {
    /** Where snapshots live and how many backups are kept. */
    public record Storage(String dataDir, int backupKeep) {}

    /**
     * Loads configuration from classpath properties, environment variables and command-line arguments.
     *
     * @param args command-line arguments in {@code --key value} form
     * @return a fully-initialized {@link SearchConfig}
     */
    public static SearchConfig load(String[] args) {
        Properties properties = loadProperties("application.properties");
        overlayEnvironment(properties);
        normalizeDataDir(properties);
        overlayArguments(properties, args);
        return from(properties);
    }

    static SearchConfig from(Properties p) {
        int serverPort = requirePort(p, "server.port");
        int defaultLimit = requirePositiveInt(p, "search.default.limit");
        int maxLimit = requirePositiveInt(p, "search.max.limit");
        if (defaultLimit > maxLimit) {
            throw new IllegalStateException("search.default.limit (" + defaultLimit
                + ") must not exceed search.max.limit (" + maxLimit + ")");
        }
        return new SearchConfig(serverPort, defaultLimit, maxLimit, readStorage(p));
    }

    private static Storage readStorage(Properties p) {
        return new Storage(requireString(p, "storage.data.dir"), requirePositiveInt(p, "storage.backup.keep"));
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

    private static void normalizeDataDir(Properties properties) {
        String dataDir = trimToNull(properties.getProperty("DATA_DIR"));
        if (dataDir != null) {
            properties.setProperty("storage.data.dir", dataDir);
        }
    }

    static void overlayArguments(Properties properties, String[] args) {
        for (int i = 0; i < args.length; i++) {
            if (args[i].startsWith("--") && i + 1 < args.length) {
                properties.setProperty(args[i].substring(2), args[i + 1]);
                i++;
            } else {
                throw new IllegalStateException("Unexpected argument '" + args[i] + "', expected --key value");
            }
        }
    }

    private static int requirePort(Properties properties, String key) {
        int port = requireInt(properties, key);
        if (port < 0 || port > 65535) {
            throw new IllegalStateException("Port out of range for '" + key + "': " + port);
        }
        return port;
    }

    private static int requirePositiveInt(Properties properties, String key) {
        int value = requireInt(properties, key);
        if (value < 1) {
            throw new IllegalStateException("Configuration '" + key + "' must be at least 1, got " + value);
        }
        return value;
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

    private static String trimToNull(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }
}
