package com.di.fleetnova.runner;

import com.di.fleetnova.config.FleetPipelineProperties;
import com.di.fleetnova.pipeline.FleetPipeline;
import com.di.fleetnova.pipeline.PipelineMode;
import com.di.fleetnova.pipeline.RunReport;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.DefaultApplicationArguments;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

/**
 * Entry point for a pipeline pass started from the command line.
 * {@code --mode=all|fleet|timeseries|pivot-export} overrides {@code fleetnova.pipeline.mode}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PipelineRunner {

    static final String MODE_OPTION = "mode";

    private final FleetPipeline pipeline;
    private final FleetPipelineProperties props;

    /**
     * Runs one pass unless {@code run-on-startup} is off and no {@code --mode} was given.
     */
    public Optional<RunReport> runFromArgs(String... args) {
        Optional<PipelineMode> requested = resolveMode(new DefaultApplicationArguments(args));
        if (requested.isEmpty() && !props.isRunOnStartup()) {
            log.info("[RUN] run-on-startup disabled and no --mode given; nothing to do");
            return Optional.empty();
        }
        PipelineMode mode = requested.orElse(props.getMode());
        return Optional.of(pipeline.run(mode));
    }

    static Optional<PipelineMode> resolveMode(ApplicationArguments args) {
        List<String> values = args.getOptionValues(MODE_OPTION);
        if (values == null || values.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(PipelineMode.fromCliValue(values.get(values.size() - 1)));
    }
}
