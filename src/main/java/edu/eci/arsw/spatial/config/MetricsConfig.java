package edu.eci.arsw.spatial.config;

import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;

@AutoConfiguration
public class MetricsConfig {
    public MetricsConfig(ObjectProvider<MeterRegistry> registry) {
        registry.ifAvailable(r -> r.config().commonTags("application", "spatial-rtc-client"));
    }
}
