package com.mailmind.config;

import com.mailmind.exception.ConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.ClassPathResource;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.Resource;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.InputStream;
import java.util.Map;

/**
 * Loads MailMind configuration from YAML files.
 */
public class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    private static final int MIN_POOL_SIZE = 2;
    private static final int MAX_POOL_SIZE = 5;

    /**
     * Load configuration from a path.
     * Supports classpath: prefix for classpath resources.
     *
     * @param path Path to the configuration file
     * @return Loaded configuration
     */
    public static MailMindConfig load(String path) {
        log.info("Loading MailMind configuration from: {}", path);

        Resource resource = getResource(path);
        if (!resource.exists()) {
            throw new ConfigurationException("Configuration file not found: " + path);
        }
        try (InputStream inputStream = resource.getInputStream()) {
            return parseYaml(inputStream);
        } catch (IOException e) {
            throw new ConfigurationException("Failed to load configuration from: " + path, e);
        }
    }

    private static Resource getResource(String path) {
        if (path.startsWith("classpath:")) {
            String resourcePath = path.substring("classpath:".length());
            return new ClassPathResource(resourcePath);
        }
        return new FileSystemResource(path);
    }

    @SuppressWarnings("unchecked")
    static MailMindConfig parseYaml(InputStream inputStream) {
        Yaml yaml = new Yaml();
        Map<String, Object> root = yaml.load(inputStream);

        if (root == null) {
            throw new ConfigurationException("Configuration file is empty");
        }

        // The mailmind section can be at root or under a 'mailmind' key
        Map<String, Object> mailmind = root.containsKey("mailmind")
                ? (Map<String, Object>) root.get("mailmind")
                : root;

        String name = getString(mailmind, "name", "mailmind");
        BackendConfig backend = parseBackend(getSection(mailmind, "backend"));
        PoolConfig pool = parsePool(getSection(mailmind, "pool"));
        DispatcherConfig dispatcher = parseDispatcher(getSection(mailmind, "dispatcher"));
        ClassifierConfig classifier = parseClassifier(getSection(mailmind, "classifier"));

        MailMindConfig config = new MailMindConfig(name, backend, pool, dispatcher, classifier);

        log.info("Loaded MailMind configuration: {} (backend={}, model={}, pool size={}, item timeout={}s)",
                name, backend.baseUrl(), backend.primaryModel(), pool.size(), dispatcher.itemTimeoutSeconds());

        return config;
    }

    private static BackendConfig parseBackend(Map<String, Object> map) {
        BackendConfig defaults = BackendConfig.defaults();
        if (map == null) {
            return defaults;
        }
        return new BackendConfig(
                getString(map, "base-url", defaults.baseUrl()),
                getString(map, "primary-model", defaults.primaryModel()),
                getString(map, "fallback-model", defaults.fallbackModel()),
                getDouble(map, "temperature", defaults.temperature()),
                getInt(map, "context-window", defaults.contextWindow()),
                getInt(map, "connect-timeout-seconds", defaults.connectTimeoutSeconds()),
                getInt(map, "request-timeout-seconds", defaults.requestTimeoutSeconds())
        );
    }

    private static PoolConfig parsePool(Map<String, Object> map) {
        PoolConfig defaults = PoolConfig.defaults();
        if (map == null) {
            return defaults;
        }
        int size = getInt(map, "size", defaults.size());
        if (size < MIN_POOL_SIZE || size > MAX_POOL_SIZE) {
            throw new ConfigurationException("pool.size must be between " + MIN_POOL_SIZE + " and "
                    + MAX_POOL_SIZE + ", got " + size);
        }
        int acquireTimeout = getInt(map, "acquire-timeout-seconds", defaults.acquireTimeoutSeconds());
        if (acquireTimeout <= 0) {
            throw new ConfigurationException("pool.acquire-timeout-seconds must be positive, got " + acquireTimeout);
        }
        return new PoolConfig(size, acquireTimeout,
                getBoolean(map, "initialize-on-startup", defaults.initializeOnStartup()));
    }

    private static DispatcherConfig parseDispatcher(Map<String, Object> map) {
        DispatcherConfig defaults = DispatcherConfig.defaults();
        if (map == null) {
            return defaults;
        }
        int itemTimeout = getInt(map, "item-timeout-seconds", defaults.itemTimeoutSeconds());
        if (itemTimeout <= 0) {
            throw new ConfigurationException("dispatcher.item-timeout-seconds must be positive, got " + itemTimeout);
        }
        return new DispatcherConfig(itemTimeout,
                getString(map, "thread-name-prefix", defaults.threadNamePrefix()));
    }

    private static ClassifierConfig parseClassifier(Map<String, Object> map) {
        ClassifierConfig defaults = ClassifierConfig.defaults();
        if (map == null) {
            return defaults;
        }
        return new ClassifierConfig(
                getDouble(map, "upper-threshold", defaults.upperThreshold()),
                getDouble(map, "lower-threshold", defaults.lowerThreshold()),
                getDouble(map, "base-learning-rate", defaults.baseLearningRate()),
                getDouble(map, "accuracy-target", defaults.accuracyTarget()),
                getDouble(map, "trend-tolerance", defaults.trendTolerance())
        );
    }

    // Helper methods

    @SuppressWarnings("unchecked")
    private static Map<String, Object> getSection(Map<String, Object> map, String key) {
        Object value = map.get(key);
        if (value == null) {
            return null;
        }
        if (!(value instanceof Map)) {
            throw new ConfigurationException("Section '" + key + "' must be a mapping");
        }
        return (Map<String, Object>) value;
    }

    private static String getString(Map<String, Object> map, String key, String defaultValue) {
        Object value = map.get(key);
        return value != null ? value.toString() : defaultValue;
    }

    private static int getInt(Map<String, Object> map, String key, int defaultValue) {
        Object value = map.get(key);
        if (value == null) return defaultValue;
        if (value instanceof Number) return ((Number) value).intValue();
        try {
            return Integer.parseInt(value.toString());
        } catch (NumberFormatException e) {
            throw new ConfigurationException("'" + key + "' must be an integer, got " + value, e);
        }
    }

    private static double getDouble(Map<String, Object> map, String key, double defaultValue) {
        Object value = map.get(key);
        if (value == null) return defaultValue;
        if (value instanceof Number) return ((Number) value).doubleValue();
        try {
            return Double.parseDouble(value.toString());
        } catch (NumberFormatException e) {
            throw new ConfigurationException("'" + key + "' must be a number, got " + value, e);
        }
    }

    private static boolean getBoolean(Map<String, Object> map, String key, boolean defaultValue) {
        Object value = map.get(key);
        if (value == null) return defaultValue;
        if (value instanceof Boolean) return (Boolean) value;
        return Boolean.parseBoolean(value.toString());
    }
}
