package com.di.fleetnova.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("SinkProperties Tests")
class SinkPropertiesTest {

    @Test
    @DisplayName("Should be disabled by default")
    void testDefaults() {
        SinkProperties props = new SinkProperties();
        assertFalse(props.isEnabled());
        assertEquals("timeseries_pivot", props.getPivotTable());
        assertEquals("org.postgresql.Driver", props.getDriverClassName());
    }

    @Test
    @DisplayName("Should snapshot connection settings")
    void testToSnapshot() {
        SinkProperties props = new SinkProperties();
        props.setJdbcUrl("jdbc:postgresql://localhost:5432/fleet");
        props.setUsername("fleet");
        props.setPassword("secret");
        props.setMaximumPoolSize(8);
        props.setMinimumIdle(2);

        SinkConnectionSnapshot snapshot = props.toSnapshot();

        assertEquals("jdbc:postgresql://localhost:5432/fleet", snapshot.jdbcUrl());
        assertEquals("fleet", snapshot.username());
        assertEquals("secret", snapshot.password());
        assertEquals("org.postgresql.Driver", snapshot.driverClassName());
        assertEquals(8, snapshot.maximumPoolSize());
        assertEquals(2, snapshot.minimumIdle());
        assertEquals(30_000L, snapshot.connectionTimeoutMs());
    }
}
