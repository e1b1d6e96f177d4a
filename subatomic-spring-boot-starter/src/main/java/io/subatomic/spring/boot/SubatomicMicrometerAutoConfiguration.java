package io.subatomic.spring.boot;

import io.micrometer.core.instrument.MeterRegistry;
import io.subatomic.micrometer.MicrometerMetricsExporter;
import io.subatomic.spi.MetricsExporter;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

/**
 * Auto-configuration for Micrometer metrics integration.
 *
 * <p>Creates a {@link MicrometerMetricsExporter} when Micrometer is on the classpath
 * and {@code subatomic.metrics.enabled} is true (default).
 *
 * <p>Runs before {@link SubatomicAutoConfiguration} so the {@link MetricsExporter}
 * bean is available for injection into {@link io.subatomic.Subatomic}.
 */
@AutoConfiguration(before = SubatomicAutoConfiguration.class)
@ConditionalOnClass({MicrometerMetricsExporter.class, MeterRegistry.class})
@ConditionalOnProperty(prefix = "subatomic.metrics", name = "enabled", matchIfMissing = true)
@EnableConfigurationProperties(SubatomicProperties.class)
public class SubatomicMicrometerAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean(MetricsExporter.class)
    public MicrometerMetricsExporter micrometerMetricsExporter(
            MeterRegistry meterRegistry, SubatomicProperties props) {
        return new MicrometerMetricsExporter(meterRegistry, props.getMetrics().getNamePrefix());
    }
}
