package com.sblite.config;

import com.sblite.messaging.ReceiveMode;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;
import java.util.Properties;

import static org.assertj.core.api.Assertions.*;

class ReceiverConfigTest {

    @Test
    void testDefaults() {
        ReceiverConfig config = ReceiverConfig.defaults();

        assertThat(config.getHost()).isEqualTo("localhost");
        assertThat(config.getPort()).isEqualTo(5672);
        assertThat(config.getDefaultReceiveMode()).isEqualTo(ReceiveMode.PEEK_LOCK);
        assertThat(config.hasCredentials()).isFalse();
        assertThat(config.isLockExpiryEnabled()).isFalse();
    }

    @Test
    void testEnvironment() {
        Map<String, String> env = new HashMap<>();
        env.put("SBLITE_HOST", "broker.internal");
        env.put("SBLITE_PORT", "5671");
        env.put("SBLITE_USERNAME", "reader");
        env.put("SBLITE_PASSWORD", "secret");
        env.put("SBLITE_RECEIVE_MODE", "RECEIVE_AND_DELETE");
        env.put("SBLITE_LOCK_DURATION_MS", "30000");

        ReceiverConfig config = new ReceiverConfig(env);

        assertThat(config.getHost()).isEqualTo("broker.internal");
        assertThat(config.getPort()).isEqualTo(5671);
        assertThat(config.hasCredentials()).isTrue();
        assertThat(config.getPassword()).isEqualTo("secret");
        assertThat(config.getDefaultReceiveMode()).isEqualTo(ReceiveMode.RECEIVE_AND_DELETE);
        assertThat(config.getLockDurationMs()).isEqualTo(30000);
        assertThat(config.isLockExpiryEnabled()).isTrue();
    }

    @Test
    void testPropertiesOverrideEnvironment() {
        Map<String, String> env = new HashMap<>();
        env.put("SBLITE_HOST", "from-env");
        ReceiverConfig config = new ReceiverConfig(env);
        Properties properties = new Properties();
        properties.setProperty("host", "from-file");
        properties.setProperty("idle.timeout.ms", "15000");

        config.loadFromProperties(properties);

        assertThat(config.getHost()).isEqualTo("from-file");
        assertThat(config.getIdleTimeoutMs()).isEqualTo(15000);
    }

    @Test
    void testFromClasspath() {
        ReceiverConfig config = ReceiverConfig.fromClasspath("sblite-test.properties");

        assertThat(config.getHost()).isEqualTo("sb.example.test");
        assertThat(config.getPort()).isEqualTo(5673);
        assertThat(config.getContainerId()).isEqualTo("receiver-test");
        assertThat(config.getConnectTimeoutMs()).isEqualTo(2500);
        assertThat(config.getDefaultReceiveMode()).isEqualTo(ReceiveMode.RECEIVE_AND_DELETE);
        assertThat(config.getLockDurationMs()).isEqualTo(60000);
        assertThat(config.getLockSweepIntervalMs()).isEqualTo(500);
    }

    @Test
    void testMissingResource() {
        assertThatThrownBy(() -> ReceiverConfig.fromClasspath("does-not-exist.properties"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("does-not-exist.properties");
    }

    @Test
    void testToMapOmitsPassword() {
        ReceiverConfig config = ReceiverConfig.defaults();
        config.setUsername("reader");
        config.setPassword("secret");

        Map<String, Object> map = config.toMap();

        assertThat(map).containsEntry("username", "reader");
        assertThat(map).doesNotContainKey("password");
        assertThat(map.values()).doesNotContain("secret");
    }
}
