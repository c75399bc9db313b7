package com.di.fleetnova.config;

import com.di.fleetnova.pipeline.PipelineMode;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Single binding for pipeline configuration.
 *
 * <pre>
 * fleetnova:
 *   pipeline:
 *     mode: all
 *     data-root: ./data
 *     batch-size: 1000
 *     max-workers: 8
 *     days-to-keep: 90
 *     history-days: 5
 *     gap-merge-threshold: 5m
 *     pivot-max-signals:
 * </pre>
 *
 * Every key can be overridden from the environment, e.g. {@code FLEETNOVA_PIPELINE_MAX_WORKERS=16}.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "fleetnova.pipeline")
public class FleetPipelineProperties {

    /** What to run: all, fleet, timeseries or pivot-export. */
    @NotNull
    private PipelineMode mode = PipelineMode.ALL;

    /** Run one pipeline pass when the application starts. */
    private boolean runOnStartup = true;

    // ------------------------------------------------------------------ //
    // Storage layout                                                      //
    // ------------------------------------------------------------------ //

    @NotBlank
    private String dataRoot = "./data";

    @NotBlank
    private String rawDir = "raw_data";

    @NotBlank
    private String transformedDir = "transformed_data";

    @NotBlank
    private String gapsDir = "gaps_data";

    /** Flat location for cross-run state (vessel list, signal catalog, history). */
    @NotBlank
    private String latestDir = "latest";

    /** One published summary per calendar day, named {@code yyyyMMdd}. */
    @NotBlank
    private String dailySummaryDir = "daily_summary";

    // ------------------------------------------------------------------ //
    // Scheduling                                                          //
    // ------------------------------------------------------------------ //

    /** Vessels per batch; the batch boundary is the only synchronisation point. */
    @Min(1)
    private int batchSize = 1000;

    /** Worker pool size for per-vessel processing. */
    @Min(1)
    private int maxWorkers = 8;

    // ------------------------------------------------------------------ //
    // Retention                                                           //
    // ------------------------------------------------------------------ //

    /** Run partitions older than this many days are purged. */
    @Min(1)
    private int daysToKeep = 90;

    /** Size of the historical dedup window in days. */
    @Min(0)
    private int historyDays = 5;

    // ------------------------------------------------------------------ //
    // Transformation                                                      //
    // ------------------------------------------------------------------ //

    /** Null samples closer than this are merged into one gap. */
    @NotNull
    private Duration gapMergeThreshold = Duration.ofMinutes(5);

    /** Column cap for the pivot. Null = no cap. */
    @Min(1)
    private Integer pivotMaxSignals;

    @Valid
    @NotNull
    private PivotExport pivotExport = new PivotExport();

    @Data
    public static class PivotExport {

        /** Newest days to include. Null = all days. */
        @Min(1)
        private Integer maxDays;

        /** Output file of the export job. */
        @NotBlank
        private String output = "./data/pivoted_timeseries.parquet";
    }
}
