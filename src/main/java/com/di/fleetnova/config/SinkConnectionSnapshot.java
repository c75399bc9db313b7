package com.di.fleetnova.config;

public record SinkConnectionSnapshot(String jdbcUrl, String username, String password, String driverClassName,
                                     int maximumPoolSize, int minimumIdle, long idleTimeoutMs,
                                     long connectionTimeoutMs, long maxLifetimeMs) {
}
