package com.di.fleetnova;

import com.di.fleetnova.config.FleetPipelineProperties;
import com.di.fleetnova.pipeline.FleetPipeline;
import com.di.fleetnova.pipeline.PipelineMode;
import com.di.fleetnova.runner.PipelineRunner;
import com.di.fleetnova.sink.NoOpWideTableSink;
import com.di.fleetnova.sink.WideTableSink;
import com.di.fleetnova.source.FleetDataSource;
import com.di.fleetnova.source.HoppeApiDataSource;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
@ActiveProfiles("test")
@DisplayName("FleetNova Context Tests")
class FleetNovaContextTest {

    @Autowired
    private FleetPipelineProperties props;

    @Autowired
    private WideTableSink sink;

    @Autowired
    private FleetDataSource dataSource;

    @Autowired
    private FleetPipeline pipeline;

    @Autowired
    private PipelineRunner runner;

    @Test
    @DisplayName("Should bind pipeline defaults")
    void testPropertiesBound() {
        assertEquals(PipelineMode.ALL, props.getMode());
        assertFalse(props.isRunOnStartup());
        assertEquals(Duration.ofMinutes(5), props.getGapMergeThreshold());
        assertEquals(5, props.getHistoryDays());
    }

    @Test
    @DisplayName("Should wire the no-op sink and the API data source by default")
    void testDefaultWiring() {
        assertInstanceOf(NoOpWideTableSink.class, sink);
        assertInstanceOf(HoppeApiDataSource.class, dataSource);
        assertNotNull(pipeline);
    }

    @Test
    @DisplayName("Should do nothing without --mode when run-on-startup is off")
    void testRunnerSkipsWithoutMode() {
        assertTrue(runner.runFromArgs().isEmpty());
    }
}
