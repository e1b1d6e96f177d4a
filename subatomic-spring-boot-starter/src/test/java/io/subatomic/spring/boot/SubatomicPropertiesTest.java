package io.subatomic.spring.boot;

import io.subatomic.SubatomicSettings;
import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Configuration;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SubatomicPropertiesTest {

    private final ApplicationContextRunner runner = new ApplicationContextRunner()
            .withUserConfiguration(PropsConfig.class);

    @Test
    void defaultValues() {
        runner.run(ctx -> {
            var props = ctx.getBean(SubatomicProperties.class);
            assertTrue(props.isAfterCommitNeedsTransaction());
            assertTrue(props.isRunAfterCommitCallbacksInTests());
            assertTrue(props.isCatchUnhandledAfterCommitCallbacksInTests());
            assertEquals("default", props.getDefaultAlias());
            assertTrue(props.getMetrics().isEnabled());
            assertEquals("subatomic", props.getMetrics().getNamePrefix());
            assertEquals(SubatomicSettings.defaults(), props.toSettings());
        });
    }

    @Test
    void customValues() {
        runner.withPropertyValues(
                "subatomic.after-commit-needs-transaction=false",
                "subatomic.run-after-commit-callbacks-in-tests=false",
                "subatomic.catch-unhandled-after-commit-callbacks-in-tests=false",
                "subatomic.default-alias=primary",
                "subatomic.metrics.enabled=false",
                "subatomic.metrics.name-prefix=orders.db"
        ).run(ctx -> {
            var props = ctx.getBean(SubatomicProperties.class);
            assertEquals("primary", props.getDefaultAlias());
            assertFalse(props.getMetrics().isEnabled());
            assertEquals("orders.db", props.getMetrics().getNamePrefix());
            assertEquals(new SubatomicSettings(false, false, false), props.toSettings());
        });
    }

    @Configuration
    @EnableConfigurationProperties(SubatomicProperties.class)
    static class PropsConfig {
    }
}
