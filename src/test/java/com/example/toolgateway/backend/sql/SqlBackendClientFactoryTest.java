package com.example.toolgateway.backend.sql;

import com.example.toolgateway.backend.BackendClient;
import com.example.toolgateway.config.GatewayProperties;
import com.example.toolgateway.domain.Connection;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SqlBackendClientFactoryTest {

    private static final List<String> DEFAULT_DIALECTS = new GatewayProperties().getSql().getAllowedDialects();
    private static final List<String> WITH_H2 = List.of("mysql", "postgresql", "h2");

    private final Connection connection = Connection.builder().id("c1").kind("sql").name("Orders").build();

    @Test
    void buildsUrlFromParts() {
        assertEquals("jdbc:postgresql://db.internal:5432/orders",
                SqlBackendClientFactory.jdbcUrl(Map.of("dialect", "postgresql", "host", "db.internal",
                        "port", 5432, "database", "orders"), DEFAULT_DIALECTS));
        assertEquals("jdbc:mysql://localhost:3306/shop",
                SqlBackendClientFactory.jdbcUrl(Map.of("database", "shop"), DEFAULT_DIALECTS));
    }

    @Test
    void prefersExplicitUrl() {
        assertEquals("jdbc:mysql://db.internal:3306/shop", SqlBackendClientFactory.jdbcUrl(
                Map.of("jdbc_url", "jdbc:mysql://db.internal:3306/shop", "host", "ignored"), DEFAULT_DIALECTS));
        assertEquals("jdbc:h2:mem:x", SqlBackendClientFactory.jdbcUrl(Map.of("jdbc_url", "jdbc:h2:mem:x"), WITH_H2));
    }

    @Test
    void refusesInitScriptInH2Url() {
        Map<String, Object> config = Map.of("jdbc_url", "jdbc:h2:mem:init_check;INIT=CREATE ALIAS IF NOT EXISTS SETPROP"
                + " FOR 'java.lang.System.setProperty';CALL SETPROP('toolgateway.init.ran','yes')");
        GatewayProperties properties = new GatewayProperties();
        properties.getSql().setAllowedDialects(WITH_H2);

        assertThrows(IllegalArgumentException.class,
                () -> new SqlBackendClientFactory(properties).create(connection, config, Map.of()));
        assertNull(System.getProperty("toolgateway.init.ran"));
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "jdbc:postgresql://db.internal/orders?socketFactory=org.example.Evil",
            "jdbc:mysql://(host=db.internal,autoDeserialize=true)/orders",
            "jdbc:mysql://db.internal/orders&allowLoadLocalInfile=true",
            "jdbc:h2:mem:x",
            "jdbc:derby:memory:x",
            "not-a-url"
    })
    void refusesUrlsOutsideAllowList(String url) {
        assertThrows(IllegalArgumentException.class,
                () -> SqlBackendClientFactory.jdbcUrl(Map.of("jdbc_url", url), DEFAULT_DIALECTS));
    }

    @Test
    void validatesUrlParts() {
        assertThrows(IllegalArgumentException.class,
                () -> SqlBackendClientFactory.jdbcUrl(Map.of("dialect", "h2", "host", "db"), DEFAULT_DIALECTS));
        assertThrows(IllegalArgumentException.class,
                () -> SqlBackendClientFactory.jdbcUrl(Map.of("host", "db.internal/x?socketFactory=a"), DEFAULT_DIALECTS));
        assertThrows(IllegalArgumentException.class,
                () -> SqlBackendClientFactory.jdbcUrl(Map.of("database", "orders;INIT=RUNSCRIPT"), DEFAULT_DIALECTS));
        assertThrows(IllegalArgumentException.class,
                () -> SqlBackendClientFactory.jdbcUrl(Map.of("port", 70000), DEFAULT_DIALECTS));
    }

    @Test
    void defaultsToReadOnly() {
        SqlBackendClientFactory factory = new SqlBackendClientFactory(new GatewayProperties());

        BackendClient client = factory.create(connection, Map.of("host", "db.internal"), Map.of());

        assertInstanceOf(SqlBackendClient.class, client);
        assertTrue(((SqlBackendClient) client).isReadOnly());
        assertFalse(((SqlBackendClient) factory.create(connection, Map.of("read_only", false), Map.of())).isReadOnly());
        assertFalse(((SqlBackendClient) factory.create(connection, Map.of("read_only", "false"), Map.of())).isReadOnly());
    }
}
