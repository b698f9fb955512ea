package recurrent.spring.boot;

import io.micrometer.core.instrument.MeterRegistry;
import recurrent.micrometer.MicrometerMetricsExporter;
import recurrent.spi.MetricsExporter;

import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

/**
 * Publishes sweeper and scheduler counters to the application's {@link MeterRegistry}
 * unless {@code recurrent.metrics.enabled=false}.
 *
 * <p>Ordered ahead of {@link RecurrentAutoConfiguration}, which picks up whichever
 * {@link MetricsExporter} is present. The exporter's meters are removed from the
 * registry when the context closes.
 */
@AutoConfiguration(before = RecurrentAutoConfiguration.class)
@ConditionalOnClass({MicrometerMetricsExporter.class, MeterRegistry.class})
@ConditionalOnProperty(prefix = "recurrent.metrics", name = "enabled", matchIfMissing = true)
@EnableConfigurationProperties(RecurrentProperties.class)
public class RecurrentMicrometerAutoConfiguration {

  @Bean(destroyMethod = "close")
  @ConditionalOnMissingBean(MetricsExporter.class)
  public MicrometerMetricsExporter recurrentMetricsExporter(MeterRegistry registry, RecurrentProperties props) {
    String prefix = props.getMetrics().getNamePrefix();
    return new MicrometerMetricsExporter(registry, prefix);
  }
}
