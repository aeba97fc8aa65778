package edu.eci.arsw.spatial.config;

import io.micrometer.core.instrument.MeterRegistry;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.support.StaticListableBeanFactory;

import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.mockito.Mockito.*;

/**
 * Pruebas de MetricsConfig.
 */
class MetricsConfigTest {

    @Test
    void constructor_deberiaRegistrarCommonTags() {
        MeterRegistry registry = mock(MeterRegistry.class);
        MeterRegistry.Config config = mock(MeterRegistry.Config.class);

        when(registry.config()).thenReturn(config);
        when(config.commonTags("application", "spatial-rtc-client")).thenReturn(config);
        StaticListableBeanFactory beans = new StaticListableBeanFactory();
        beans.addBean("meterRegistry", registry);

        MetricsConfig metricsConfig = new MetricsConfig(beans.getBeanProvider(MeterRegistry.class));

        assertNotNull(metricsConfig);
        verify(registry).config();
        verify(config).commonTags("application", "spatial-rtc-client");
        verifyNoMoreInteractions(config);
    }

    @Test
    void constructor_noDeberiaFallar_sinRegistro() {
        StaticListableBeanFactory beans = new StaticListableBeanFactory();

        assertNotNull(new MetricsConfig(beans.getBeanProvider(MeterRegistry.class)));
    }
}
