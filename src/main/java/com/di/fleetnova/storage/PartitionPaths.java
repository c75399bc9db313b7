package com.di.fleetnova.storage;

import com.di.fleetnova.config.FleetPipelineProperties;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;

/**
 * Directory layout under the data root.
 *
 * <pre>
 * {root}/{raw|transformed|gaps}/YYYY/MM/DD/HH/mm   one partition per run
 * {root}/latest                                    vessel list, catalog, history
 * {root}/daily_summary/yyyyMMdd                    published summary per day
 * </pre>
 */
@Component
public class PartitionPaths {

    private static final DateTimeFormatter RUN_PARTITION = DateTimeFormatter.ofPattern("yyyy/MM/dd/HH/mm");
    private static final DateTimeFormatter DAY_KEY       = DateTimeFormatter.ofPattern("yyyyMMdd");

    private final Path root;
    private final FleetPipelineProperties props;

    public PartitionPaths(FleetPipelineProperties props) {
        this.props = props;
        this.root = Paths.get(props.getDataRoot());
    }

    public static String runPartition(LocalDateTime runStart) {
        return runStart.format(RUN_PARTITION);
    }

    public static String dayKey(LocalDate day) {
        return day.format(DAY_KEY);
    }

    public Path root() {
        return root;
    }

    public Path rawRoot() {
        return root.resolve(props.getRawDir());
    }

    public Path transformedRoot() {
        return root.resolve(props.getTransformedDir());
    }

    public Path gapsRoot() {
        return root.resolve(props.getGapsDir());
    }

    public Path raw(String runPartition) {
        return rawRoot().resolve(runPartition);
    }

    public Path transformed(String runPartition) {
        return transformedRoot().resolve(runPartition);
    }

    public Path gaps(String runPartition) {
        return gapsRoot().resolve(runPartition);
    }

    public Path latest() {
        return root.resolve(props.getLatestDir());
    }

    public Path dailySummary(LocalDate day) {
        return root.resolve(props.getDailySummaryDir()).resolve(dayKey(day));
    }
}
