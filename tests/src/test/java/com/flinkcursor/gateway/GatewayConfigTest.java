package com.flinkcursor.gateway;

import com.flinkcursor.test.TestCategories;
import org.junit.jupiter.api.*;

import java.time.Duration;

import static org.assertj.core.api.Assertions.*;

@TestCategories.Tier1
@TestCategories.Unit
@DisplayName("GatewayConfig Tests")
public class GatewayConfigTest {

    @AfterEach
    void clearProperties() {
        System.clearProperty(GatewayConfig.PROP_HOST);
        System.clearProperty(GatewayConfig.PROP_PORT);
        System.clearProperty(GatewayConfig.PROP_SESSION_NAME);
    }

    @Test
    @DisplayName("Builds the gateway URL from host and port")
    void testGatewayUrl() {
        GatewayConfig config = GatewayConfig.of("gateway.local", 9091);

        assertThat(config.gatewayUrl()).isEqualTo("http://gateway.local:9091");
        assertThat(config.getSessionName()).isEqualTo(GatewayConfig.DEFAULT_SESSION_NAME);
        assertThat(config.getRequestTimeout()).isEqualTo(GatewayConfig.DEFAULT_REQUEST_TIMEOUT);
    }

    @Test
    @DisplayName("Builder methods update the configuration")
    void testWithMethods() {
        GatewayConfig config = GatewayConfig.of("localhost", 8083)
            .withSessionName("analytics")
            .withConnectTimeout(Duration.ofSeconds(2))
            .withRequestTimeout(Duration.ofSeconds(3));

        assertThat(config.getSessionName()).isEqualTo("analytics");
        assertThat(config.getConnectTimeout()).isEqualTo(Duration.ofSeconds(2));
        assertThat(config.getRequestTimeout()).isEqualTo(Duration.ofSeconds(3));
    }

    @Test
    @DisplayName("Rejects invalid ports and timeouts")
    void testValidation() {
        assertThatThrownBy(() -> GatewayConfig.of("localhost", 0))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> GatewayConfig.of("localhost", 8083).withRequestTimeout(Duration.ZERO))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("requestTimeout must be positive");
        assertThatThrownBy(() -> GatewayConfig.of(null, 8083))
            .isInstanceOf(NullPointerException.class);
    }

    @Test
    @DisplayName("Reads settings from system properties")
    void testFromSystemProperties() {
        System.setProperty(GatewayConfig.PROP_HOST, "flink");
        System.setProperty(GatewayConfig.PROP_PORT, "18083");
        System.setProperty(GatewayConfig.PROP_SESSION_NAME, "etl");

        GatewayConfig config = GatewayConfig.fromSystemProperties();

        assertThat(config.gatewayUrl()).isEqualTo("http://flink:18083");
        assertThat(config.getSessionName()).isEqualTo("etl");
    }

    @Test
    @DisplayName("Invalid port property falls back to the default")
    void testInvalidPortProperty() {
        System.setProperty(GatewayConfig.PROP_PORT, "not-a-port");

        assertThat(GatewayConfig.fromSystemProperties().getPort()).isEqualTo(GatewayConfig.DEFAULT_PORT);
    }
}
