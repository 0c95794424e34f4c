package com.sblite.config;

import com.sblite.messaging.ReceiveMode;

import java.io.IOException;
import java.io.InputStream;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Properties;

/**
 * Configuration for the messaging factory and the receivers it creates.
 * Supports configuration from properties files, environment variables, and programmatic settings.
 */
public class ReceiverConfig {

    // Connection configuration
    private String host = "localhost";
    private int port = 5672;
    private String username = null;
    private String password = null;
    private String containerId = null;
    private long connectTimeoutMs = 10000;
    private int idleTimeoutMs = 0; // 0 = no heartbeat requested

    // Receiver defaults
    private ReceiveMode defaultReceiveMode = ReceiveMode.PEEK_LOCK;

    // Lock policy
    private long lockDurationMs = 0; // 0 = locks never expire
    private long lockSweepIntervalMs = 1000;

    public ReceiverConfig() {
        this(System.getenv());
    }

    ReceiverConfig(Map<String, String> env) {
        loadFromEnvironment(env);
    }

    /**
     * Defaults only, ignoring environment variables.
     */
    public static ReceiverConfig defaults() {
        return new ReceiverConfig(Collections.emptyMap());
    }

    /**
     * Load configuration from a properties file on the classpath.
     */
    public static ReceiverConfig fromClasspath(String resource) {
        ReceiverConfig config = new ReceiverConfig();
        try (InputStream in = ReceiverConfig.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null) {
                throw new IllegalArgumentException("Configuration resource not found: " + resource);
            }
            Properties properties = new Properties();
            properties.load(in);
            config.loadFromProperties(properties);
        } catch (IOException e) {
            throw new IllegalArgumentException("Cannot read configuration resource " + resource, e);
        }
        return config;
    }

    /**
     * Load configuration from environment variables.
     */
    private void loadFromEnvironment(Map<String, String> env) {
        if (env.containsKey("SBLITE_HOST")) {
            host = env.get("SBLITE_HOST");
        }
        if (env.containsKey("SBLITE_PORT")) {
            port = Integer.parseInt(env.get("SBLITE_PORT"));
        }
        if (env.containsKey("SBLITE_USERNAME")) {
            username = env.get("SBLITE_USERNAME");
        }
        if (env.containsKey("SBLITE_PASSWORD")) {
            password = env.get("SBLITE_PASSWORD");
        }
        if (env.containsKey("SBLITE_RECEIVE_MODE")) {
            defaultReceiveMode = ReceiveMode.valueOf(env.get("SBLITE_RECEIVE_MODE"));
        }
        if (env.containsKey("SBLITE_LOCK_DURATION_MS")) {
            lockDurationMs = Long.parseLong(env.get("SBLITE_LOCK_DURATION_MS"));
        }
    }

    /**
     * Load configuration from Properties object.
     */
    public void loadFromProperties(Properties properties) {
        if (properties.containsKey("host")) {
            host = properties.getProperty("host");
        }
        if (properties.containsKey("port")) {
            port = Integer.parseInt(properties.getProperty("port"));
        }
        if (properties.containsKey("username")) {
            username = properties.getProperty("username");
        }
        if (properties.containsKey("password")) {
            password = properties.getProperty("password");
        }
        if (properties.containsKey("container.id")) {
            containerId = properties.getProperty("container.id");
        }
        if (properties.containsKey("connect.timeout.ms")) {
            connectTimeoutMs = Long.parseLong(properties.getProperty("connect.timeout.ms"));
        }
        if (properties.containsKey("idle.timeout.ms")) {
            idleTimeoutMs = Integer.parseInt(properties.getProperty("idle.timeout.ms"));
        }
        if (properties.containsKey("receive.mode")) {
            defaultReceiveMode = ReceiveMode.valueOf(properties.getProperty("receive.mode").trim());
        }
        if (properties.containsKey("lock.duration.ms")) {
            lockDurationMs = Long.parseLong(properties.getProperty("lock.duration.ms"));
        }
        if (properties.containsKey("lock.sweep.interval.ms")) {
            lockSweepIntervalMs = Long.parseLong(properties.getProperty("lock.sweep.interval.ms"));
        }
    }

    /**
     * Export configuration as a map. Credentials are left out.
     */
    public Map<String, Object> toMap() {
        Map<String, Object> map = new HashMap<>();
        map.put("host", host);
        map.put("port", port);
        map.put("username", username);
        map.put("containerId", containerId);
        map.put("connectTimeoutMs", connectTimeoutMs);
        map.put("idleTimeoutMs", idleTimeoutMs);
        map.put("defaultReceiveMode", defaultReceiveMode);
        map.put("lockDurationMs", lockDurationMs);
        map.put("lockSweepIntervalMs", lockSweepIntervalMs);
        return map;
    }

    public boolean hasCredentials() {
        return username != null && !username.isEmpty();
    }

    public boolean isLockExpiryEnabled() {
        return lockDurationMs > 0;
    }

    // Getters and setters

    public String getHost() {
        return host;
    }

    public void setHost(String host) {
        this.host = host;
    }

    public int getPort() {
        return port;
    }

    public void setPort(int port) {
        this.port = port;
    }

    public String getUsername() {
        return username;
    }

    public void setUsername(String username) {
        this.username = username;
    }

    public String getPassword() {
        return password;
    }

    public void setPassword(String password) {
        this.password = password;
    }

    public String getContainerId() {
        return containerId;
    }

    public void setContainerId(String containerId) {
        this.containerId = containerId;
    }

    public long getConnectTimeoutMs() {
        return connectTimeoutMs;
    }

    public void setConnectTimeoutMs(long connectTimeoutMs) {
        this.connectTimeoutMs = connectTimeoutMs;
    }

    public int getIdleTimeoutMs() {
        return idleTimeoutMs;
    }

    public void setIdleTimeoutMs(int idleTimeoutMs) {
        this.idleTimeoutMs = idleTimeoutMs;
    }

    public ReceiveMode getDefaultReceiveMode() {
        return defaultReceiveMode;
    }

    public void setDefaultReceiveMode(ReceiveMode defaultReceiveMode) {
        this.defaultReceiveMode = defaultReceiveMode;
    }

    public long getLockDurationMs() {
        return lockDurationMs;
    }

    public void setLockDurationMs(long lockDurationMs) {
        this.lockDurationMs = lockDurationMs;
    }

    public long getLockSweepIntervalMs() {
        return lockSweepIntervalMs;
    }

    public void setLockSweepIntervalMs(long lockSweepIntervalMs) {
        this.lockSweepIntervalMs = lockSweepIntervalMs;
    }

    @Override
    public String toString() {
        return String.format("ReceiverConfig{host='%s', port=%d, mode=%s, lockDurationMs=%d}",
                host, port, defaultReceiveMode, lockDurationMs);
    }
}
