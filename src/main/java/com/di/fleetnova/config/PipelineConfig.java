package com.di.fleetnova.config;

import com.di.fleetnova.metrics.PipelineMetrics;
import com.di.fleetnova.pipeline.FleetPipeline;
import com.di.fleetnova.pipeline.TimeseriesPivotExporter;
import com.di.fleetnova.pipeline.VesselBatchExecutor;
import com.di.fleetnova.pipeline.VesselProcessor;
import com.di.fleetnova.retention.RetentionStateRepository;
import com.di.fleetnova.retention.RetentionWindowAggregator;
import com.di.fleetnova.sink.WideTableSink;
import com.di.fleetnova.source.FleetDataSource;
import com.di.fleetnova.source.HoppeApiDataSource;
import com.di.fleetnova.storage.LocalFileStore;
import com.di.fleetnova.storage.PartitionPaths;
import com.di.fleetnova.storage.RetentionCleaner;
import com.di.fleetnova.transform.FleetFlattener;
import com.di.fleetnova.transform.GapDetector;
import com.di.fleetnova.transform.MetadataEnricher;
import com.di.fleetnova.transform.PivotShaper;
import com.di.fleetnova.transform.SignalFlattener;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

import java.time.Clock;

/**
 * Wires the transformation components with an explicit {@link PipelineContext}
 * and assembles the pipeline.
 */
@Configuration
public class PipelineConfig {

    @Bean
    public PipelineContext pipelineContext(FleetPipelineProperties props) {
        return PipelineContext.from(props);
    }

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    public SignalFlattener signalFlattener() {
        return new SignalFlattener();
    }

    @Bean
    public FleetFlattener fleetFlattener() {
        return new FleetFlattener();
    }

    @Bean
    public GapDetector gapDetector(PipelineContext context) {
        return new GapDetector(context);
    }

    @Bean
    public MetadataEnricher metadataEnricher() {
        return new MetadataEnricher();
    }

    @Bean
    public RetentionWindowAggregator retentionWindowAggregator(PipelineContext context) {
        return new RetentionWindowAggregator(context);
    }

    @Bean
    public PivotShaper pivotShaper(PipelineContext context) {
        return new PivotShaper(context);
    }

    @Bean
    @ConditionalOnMissingBean(FleetDataSource.class)
    public FleetDataSource fleetDataSource(ApiProperties api) {
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout((int) api.getConnectTimeout().toMillis());
        requestFactory.setReadTimeout((int) api.getReadTimeout().toMillis());
        return new HoppeApiDataSource(api, RestClient.builder().requestFactory(requestFactory));
    }

    @Bean
    public VesselBatchExecutor vesselBatchExecutor(FleetPipelineProperties props, PipelineMetrics metrics) {
        return new VesselBatchExecutor(props.getBatchSize(), props.getMaxWorkers(), metrics);
    }

    @Bean
    public VesselProcessor vesselProcessor(FleetDataSource dataSource, LocalFileStore store, PartitionPaths paths,
                                           SignalFlattener flattener, MetadataEnricher enricher,
                                           GapDetector gapDetector, PipelineMetrics metrics) {
        return new VesselProcessor(dataSource, store, paths, flattener, enricher, gapDetector, metrics);
    }

    @Bean
    public TimeseriesPivotExporter timeseriesPivotExporter(LocalFileStore store, PartitionPaths paths,
                                                           PivotShaper shaper, FleetPipelineProperties props) {
        return new TimeseriesPivotExporter(store, paths, shaper, props);
    }

    @Bean
    public FleetPipeline fleetPipeline(FleetPipelineProperties props, FleetDataSource dataSource,
                                       LocalFileStore store, PartitionPaths paths, FleetFlattener fleetFlattener,
                                       VesselProcessor processor, VesselBatchExecutor executor,
                                       RetentionStateRepository retentionRepository,
                                       RetentionWindowAggregator aggregator, PivotShaper pivotShaper,
                                       WideTableSink sink, TimeseriesPivotExporter exporter,
                                       RetentionCleaner cleaner, PipelineMetrics metrics, Clock clock) {
        return new FleetPipeline(props, dataSource, store, paths, fleetFlattener, processor, executor,
                retentionRepository, aggregator, pivotShaper, sink, exporter, cleaner, metrics, clock);
    }
}
