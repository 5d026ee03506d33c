package crawl.governor.infrastructure.config;

import crawl.governor.infrastructure.metrics.MetricsSettings;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

@ConfigurationProperties(prefix = "governor.metrics")
public record MetricsProperties(
    @DefaultValue("60m") Duration retention,
    @DefaultValue("10000") int maxSamples,
    @DefaultValue("1m") Duration shortWindow) {

  public MetricsSettings toSettings() {
    return new MetricsSettings(retention, maxSamples, shortWindow);
  }
}
