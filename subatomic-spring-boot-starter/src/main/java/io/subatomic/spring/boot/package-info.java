/**
 * Spring Boot auto-configuration for Subatomic.
 *
 * <p>{@link io.subatomic.spring.boot.SubatomicAutoConfiguration} wires a
 * {@link io.subatomic.Subatomic} over the application {@code DataSource} from
 * {@code subatomic.*} application properties.
 *
 * @see io.subatomic.spring.boot.SubatomicAutoConfiguration
 * @see io.subatomic.spring.boot.SubatomicMicrometerAutoConfiguration
 * @see io.subatomic.spring.boot.SubatomicProperties
 */
package io.subatomic.spring.boot;
