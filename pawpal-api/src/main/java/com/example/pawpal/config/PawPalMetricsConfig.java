package com.example.pawpal.config;

import com.example.pawpal.model.WalkStatus;
import com.example.pawpal.store.InMemoryTaskStore;
import com.example.pawpal.store.InMemoryWalkStore;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.context.annotation.Configuration;

@Configuration
public class PawPalMetricsConfig {

    public PawPalMetricsConfig(InMemoryTaskStore taskStore, InMemoryWalkStore walkStore, MeterRegistry registry) {
        Gauge.builder("pawpal.tasks.pending", taskStore, store ->
                store.findAll().stream()
                        .filter(t -> !t.isCompleted())
                        .count())
                .description("Tasks not yet completed")
                .register(registry);

        Gauge.builder("pawpal.walks.scheduled", walkStore, store ->
                store.countByStatus(WalkStatus.SCHEDULED))
                .description("Walks in SCHEDULED status")
                .register(registry);
    }
}
