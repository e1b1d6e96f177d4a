package io.subatomic.spring.boot;

import io.subatomic.Subatomic;
import io.subatomic.jdbc.JdbcBackendRegistry;
import io.subatomic.jdbc.ThreadBoundConnectionProvider;
import io.subatomic.spi.MetricsExporter;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import javax.sql.DataSource;

/**
 * Auto-configuration for Subatomic.
 *
 * <p>Registers the application {@link DataSource} under {@code subatomic.default-alias} and
 * wires a {@link Subatomic} whose settings are read from {@link SubatomicProperties} on every
 * operation.
 *
 * @see SubatomicProperties
 * @see SubatomicMicrometerAutoConfiguration
 */
@AutoConfiguration(after = DataSourceAutoConfiguration.class)
@ConditionalOnClass({Subatomic.class, JdbcBackendRegistry.class})
@ConditionalOnBean(DataSource.class)
@EnableConfigurationProperties(SubatomicProperties.class)
public class SubatomicAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public ThreadBoundConnectionProvider subatomicConnectionProvider(DataSource dataSource) {
        return new ThreadBoundConnectionProvider(dataSource);
    }

    @Bean
    @ConditionalOnMissingBean
    public JdbcBackendRegistry subatomicBackends(SubatomicProperties props,
                                                 ThreadBoundConnectionProvider connectionProvider) {
        return JdbcBackendRegistry.builder()
                .connectionProvider(props.getDefaultAlias(), connectionProvider)
                .build();
    }

    @Bean
    @ConditionalOnMissingBean
    public Subatomic subatomic(SubatomicProperties props,
                               JdbcBackendRegistry backends,
                               ObjectProvider<MetricsExporter> metricsProvider) {
        return Subatomic.builder()
                .backends(backends)
                .defaultAlias(props.getDefaultAlias())
                .settings(props::toSettings)
                .metrics(metricsProvider.getIfAvailable())
                .build();
    }
}
