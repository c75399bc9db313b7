package com.di.fleetnova.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Optional relational sink ({@code fleetnova.sink.*}). Disabled by default.
 */
@Data
@ConfigurationProperties(prefix = "fleetnova.sink")
public class SinkProperties {

    private boolean enabled = false;

    private String jdbcUrl;
    private String username;
    private String password;
    private String driverClassName = "org.postgresql.Driver";

    private int  maximumPoolSize     = 4;
    private int  minimumIdle         = 1;
    private long idleTimeoutMs       = 600_000L;
    private long connectionTimeoutMs = 30_000L;
    private long maxLifetimeMs       = 1_800_000L;

    private String pivotTable   = "timeseries_pivot";
    private String stagingTable = "timeseries_staging";
    private String gapsTable    = "timeseries_gaps";

    /** Rows per JDBC batch when filling the staging table. */
    private int batchSize = 1000;

    public SinkConnectionSnapshot toSnapshot() {
        return new SinkConnectionSnapshot(jdbcUrl, username, password, driverClassName,
                maximumPoolSize, minimumIdle, idleTimeoutMs, connectionTimeoutMs, maxLifetimeMs);
    }
}
