package com.amqp.receiver.config;

import java.util.HashMap;
import java.util.Map;
import java.util.Properties;

/**
 * Configuration for receiver links.
 * Supports configuration from properties files, environment variables, and programmatic settings.
 */
public class ReceiverLinkConfig {

    public static final long DEFAULT_LOCK_TIMEOUT_MS = 30000;

    // Longest time an operation waits for the link lock; destroy always waits
    private long lockTimeoutMs = DEFAULT_LOCK_TIMEOUT_MS;

    // Log every arrival and settlement at INFO
    private boolean trace = false;

    public ReceiverLinkConfig() {
        this(System.getenv());
    }

    public ReceiverLinkConfig(Map<String, String> env) {
        loadFromEnvironment(env);
    }

    /**
     * Load configuration from environment variables.
     */
    private void loadFromEnvironment(Map<String, String> env) {
        if (env.containsKey("AMQP_RECEIVER_LOCK_TIMEOUT_MS")) {
            setLockTimeoutMs(Long.parseLong(env.get("AMQP_RECEIVER_LOCK_TIMEOUT_MS")));
        }
        if (env.containsKey("AMQP_RECEIVER_TRACE")) {
            trace = Boolean.parseBoolean(env.get("AMQP_RECEIVER_TRACE"));
        }
    }

    /**
     * Load configuration from Properties object.
     */
    public void loadFromProperties(Properties properties) {
        if (properties.containsKey("receiver.lockTimeoutMs")) {
            setLockTimeoutMs(Long.parseLong(properties.getProperty("receiver.lockTimeoutMs")));
        }
        if (properties.containsKey("receiver.trace")) {
            trace = Boolean.parseBoolean(properties.getProperty("receiver.trace"));
        }
    }

    /**
     * Export configuration as a map.
     */
    public Map<String, Object> toMap() {
        Map<String, Object> map = new HashMap<>();
        map.put("lockTimeoutMs", lockTimeoutMs);
        map.put("trace", trace);
        return map;
    }

    // Getters and setters

    public long getLockTimeoutMs() {
        return lockTimeoutMs;
    }

    public void setLockTimeoutMs(long lockTimeoutMs) {
        if (lockTimeoutMs <= 0) {
            throw new IllegalArgumentException("lockTimeoutMs must be positive, got: " + lockTimeoutMs);
        }
        this.lockTimeoutMs = lockTimeoutMs;
    }

    public boolean isTrace() {
        return trace;
    }

    public void setTrace(boolean trace) {
        this.trace = trace;
    }

    @Override
    public String toString() {
        return "ReceiverLinkConfig{lockTimeoutMs=" + lockTimeoutMs + ", trace=" + trace + "}";
    }
}
