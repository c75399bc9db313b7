package com.di.fleetnova.sink;

import com.di.fleetnova.model.GapInterval;
import com.di.fleetnova.model.PivotResult;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Set;

@Service
@ConditionalOnProperty(name = "fleetnova.sink.enabled", havingValue = "false", matchIfMissing = true)
public class NoOpWideTableSink implements WideTableSink {

    @Override
    public void verifyConnection() {
        // nothing to reach
    }

    @Override
    public Set<String> existingSignalColumns() {
        return Set.of();
    }

    @Override
    public void write(PivotResult pivot, List<GapInterval> gaps) {
        // no-op when the relational sink is disabled
    }
}
