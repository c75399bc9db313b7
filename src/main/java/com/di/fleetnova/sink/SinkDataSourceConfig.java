package com.di.fleetnova.sink;

import com.di.fleetnova.config.SinkConnectionSnapshot;
import com.di.fleetnova.config.SinkProperties;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import javax.sql.DataSource;

/**
 * Connection pool for the relational sink. Only created when {@code fleetnova.sink.enabled=true}.
 */
@Slf4j
@Configuration
@ConditionalOnProperty(name = "fleetnova.sink.enabled", havingValue = "true")
public class SinkDataSourceConfig {

    @Bean(destroyMethod = "close")
    public HikariDataSource sinkDataSource(SinkProperties props) {
        SinkConnectionSnapshot snapshot = props.toSnapshot();
        int effectiveMinIdle = Math.min(snapshot.minimumIdle(), snapshot.maximumPoolSize());

        HikariConfig config = new HikariConfig();
        config.setJdbcUrl(snapshot.jdbcUrl());
        config.setUsername(snapshot.username());
        config.setPassword(snapshot.password());
        config.setDriverClassName(snapshot.driverClassName());
        config.setMaximumPoolSize(snapshot.maximumPoolSize());
        config.setMinimumIdle(effectiveMinIdle);
        config.setIdleTimeout(snapshot.idleTimeoutMs());
        config.setConnectionTimeout(snapshot.connectionTimeoutMs());
        config.setMaxLifetime(snapshot.maxLifetimeMs());
        // connection failures surface at verifyConnection(), not at context start
        config.setInitializationFailTimeout(-1);
        if (snapshot.jdbcUrl() != null && snapshot.jdbcUrl().contains("postgresql")) {
            config.addDataSourceProperty("tcpKeepAlive", "true");
        }
        config.setPoolName("fleetnova-sink");

        log.info("[SINK] Creating pool | url={} | maxPoolSize={}, minIdle={}",
                sanitizeUrl(snapshot.jdbcUrl()), snapshot.maximumPoolSize(), effectiveMinIdle);
        return new HikariDataSource(config);
    }

    @Bean
    public JdbcTemplate sinkJdbcTemplate(DataSource sinkDataSource) {
        return new JdbcTemplate(sinkDataSource);
    }

    @Bean
    public TransactionTemplate sinkTransactionTemplate(DataSource sinkDataSource) {
        return new TransactionTemplate(new DataSourceTransactionManager(sinkDataSource));
    }

    static String sanitizeUrl(String jdbcUrl) {
        if (jdbcUrl == null) {
            return "null";
        }
        return jdbcUrl.replaceAll("password=[^;&]+", "password=***");
    }
}
