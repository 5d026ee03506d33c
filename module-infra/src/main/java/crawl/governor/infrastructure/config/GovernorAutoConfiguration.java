package crawl.governor.infrastructure.config;

import crawl.governor.core.calculator.BackoffCalculator;
import crawl.governor.core.port.out.AlertListener;
import crawl.governor.core.port.out.MemoryReleaseHook;
import crawl.governor.core.port.out.ResourceProbe;
import crawl.governor.core.port.out.Sleeper;
import crawl.governor.infrastructure.alert.AlertDispatcher;
import crawl.governor.infrastructure.alert.AlertThrottler;
import crawl.governor.infrastructure.alert.LoggingAlertListener;
import crawl.governor.infrastructure.executor.AdvisoryActionExecutor;
import crawl.governor.infrastructure.executor.GuardedExecutor;
import crawl.governor.infrastructure.health.GcMemoryReleaseHook;
import crawl.governor.infrastructure.health.HealthCheck;
import crawl.governor.infrastructure.health.HealthMonitor;
import crawl.governor.infrastructure.health.check.ConcurrencyHealthCheck;
import crawl.governor.infrastructure.health.check.CpuHealthCheck;
import crawl.governor.infrastructure.health.check.LatencyHealthCheck;
import crawl.governor.infrastructure.health.check.MemoryHealthCheck;
import crawl.governor.infrastructure.health.check.OpenFilesHealthCheck;
import crawl.governor.infrastructure.health.check.SuccessRateHealthCheck;
import crawl.governor.infrastructure.metrics.MeterRegistryResourceProbe;
import crawl.governor.infrastructure.metrics.MetricsCollector;
import crawl.governor.infrastructure.ratelimit.AdaptiveRateLimiter;
import crawl.governor.infrastructure.resilience.CircuitBreakerRegistry;
import crawl.governor.infrastructure.resilience.ErrorClassifier;
import crawl.governor.infrastructure.resilience.RetryManager;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Clock;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

/**
 * 실행 거버너 AutoConfiguration
 *
 * <p>재시도, 서킷 브레이커, 적응형 제한기, 메트릭 수집기, 헬스 모니터를 하나의 {@link GuardedExecutor}로 조립합니다. 모든 빈은
 * {@code @ConditionalOnMissingBean}이므로 애플리케이션이 같은 타입의 빈을 등록하면 그쪽이 우선합니다.
 *
 * <h2>조건부 활성화</h2>
 *
 * <ul>
 *   <li>{@code governor.health.enabled=false}: 헬스 모니터와 전용 스케줄러를 생성하지 않음
 *   <li>{@code governor.health.memory-release-enabled=false}: 기본 GC 훅 미등록 (애플리케이션 훅은 그대로 실행)
 * </ul>
 *
 * <p>Actuator가 있으면 그쪽 {@link MeterRegistry}를 사용하고, 없으면 {@link SimpleMeterRegistry}로 대체합니다.
 */
@Slf4j
@AutoConfiguration(
    afterName =
        "org.springframework.boot.actuate.autoconfigure.metrics.CompositeMeterRegistryAutoConfiguration")
@EnableConfigurationProperties({
  RetryProperties.class,
  CircuitBreakerProperties.class,
  RateLimiterProperties.class,
  MetricsProperties.class,
  HealthProperties.class
})
public class GovernorAutoConfiguration {

  static final String HEALTH_SCHEDULER_BEAN = "governorHealthScheduler";

  @Bean
  @ConditionalOnMissingBean
  public Clock governorClock() {
    return Clock.systemUTC();
  }

  @Bean
  @ConditionalOnMissingBean
  public MeterRegistry governorMeterRegistry() {
    return new SimpleMeterRegistry();
  }

  @Bean
  @ConditionalOnMissingBean
  public Sleeper governorSleeper() {
    return Sleeper.SYSTEM;
  }

  @Bean
  @ConditionalOnMissingBean
  public ResourceProbe resourceProbe(MeterRegistry meterRegistry) {
    return new MeterRegistryResourceProbe(meterRegistry);
  }

  // ==================== Metrics ====================

  @Bean
  @ConditionalOnMissingBean
  public MetricsCollector metricsCollector(
      MetricsProperties properties,
      ResourceProbe resourceProbe,
      Clock clock,
      MeterRegistry meterRegistry) {
    return new MetricsCollector(properties.toSettings(), resourceProbe, clock, meterRegistry);
  }

  // ==================== Resilience ====================

  @Bean
  @ConditionalOnMissingBean
  public CircuitBreakerRegistry circuitBreakerRegistry(
      CircuitBreakerProperties properties, Clock clock, MeterRegistry meterRegistry) {
    return new CircuitBreakerRegistry(properties.toSettings(), clock, meterRegistry);
  }

  @Bean
  @ConditionalOnMissingBean
  public ErrorClassifier errorClassifier() {
    return new ErrorClassifier();
  }

  @Bean
  @ConditionalOnMissingBean
  public BackoffCalculator backoffCalculator() {
    return new BackoffCalculator();
  }

  @Bean
  @ConditionalOnMissingBean
  public RetryManager retryManager(
      RetryProperties properties,
      CircuitBreakerRegistry circuitBreakerRegistry,
      MetricsCollector metricsCollector,
      ErrorClassifier errorClassifier,
      BackoffCalculator backoffCalculator,
      Sleeper sleeper,
      MeterRegistry meterRegistry) {
    return new RetryManager(
        properties.toPolicy(),
        circuitBreakerRegistry,
        metricsCollector,
        errorClassifier,
        backoffCalculator,
        sleeper,
        meterRegistry);
  }

  // ==================== Rate Limiting ====================

  @Bean
  @ConditionalOnMissingBean
  public AdaptiveRateLimiter adaptiveRateLimiter(
      RateLimiterProperties properties, MeterRegistry meterRegistry) {
    return new AdaptiveRateLimiter(properties.toSettings(), meterRegistry);
  }

  @Bean
  @ConditionalOnMissingBean
  public GuardedExecutor guardedExecutor(
      AdaptiveRateLimiter rateLimiter,
      RetryManager retryManager,
      MetricsCollector metricsCollector) {
    return new GuardedExecutor(rateLimiter, retryManager, metricsCollector);
  }

  @Bean
  @ConditionalOnMissingBean
  public AdvisoryActionExecutor advisoryActionExecutor(MeterRegistry meterRegistry) {
    return new AdvisoryActionExecutor(meterRegistry);
  }

  // ==================== Alerting ====================

  @Bean
  @ConditionalOnMissingBean
  public AlertThrottler alertThrottler(HealthProperties properties, Clock clock) {
    return new AlertThrottler(properties.alertCooldown(), clock);
  }

  @Bean
  @ConditionalOnMissingBean
  public LoggingAlertListener loggingAlertListener() {
    return new LoggingAlertListener();
  }

  @Bean
  @ConditionalOnMissingBean
  public AlertDispatcher alertDispatcher(
      ObjectProvider<AlertListener> listeners,
      AlertThrottler alertThrottler,
      AdvisoryActionExecutor advisoryActionExecutor,
      MeterRegistry meterRegistry) {
    return new AlertDispatcher(
        listeners.orderedStream().toList(), alertThrottler, advisoryActionExecutor, meterRegistry);
  }

  // ==================== Health ====================

  @Bean
  public MemoryHealthCheck memoryHealthCheck() {
    return new MemoryHealthCheck();
  }

  @Bean
  public CpuHealthCheck cpuHealthCheck() {
    return new CpuHealthCheck();
  }

  @Bean
  public OpenFilesHealthCheck openFilesHealthCheck() {
    return new OpenFilesHealthCheck();
  }

  @Bean
  public ConcurrencyHealthCheck concurrencyHealthCheck() {
    return new ConcurrencyHealthCheck();
  }

  @Bean
  public SuccessRateHealthCheck successRateHealthCheck() {
    return new SuccessRateHealthCheck();
  }

  @Bean
  public LatencyHealthCheck latencyHealthCheck() {
    return new LatencyHealthCheck();
  }

  /** 애플리케이션이 등록한 {@link MemoryReleaseHook}과 함께 실행되며, 순서상 마지막입니다. */
  @Bean
  @ConditionalOnProperty(
      prefix = "governor.health",
      name = "memory-release-enabled",
      havingValue = "true",
      matchIfMissing = true)
  public GcMemoryReleaseHook gcMemoryReleaseHook() {
    return new GcMemoryReleaseHook();
  }

  /**
   * 헬스 평가 전용 스케줄러
   *
   * <p>애플리케이션의 {@code taskScheduler}와 분리하여 다른 스케줄 작업의 지연이 헬스 주기에 영향을 주지 않도록 합니다. 평가는 한 번에
   * 하나만 실행되므로 스레드 1개로 충분합니다.
   */
  @Bean(name = HEALTH_SCHEDULER_BEAN)
  @ConditionalOnMissingBean(name = HEALTH_SCHEDULER_BEAN)
  @ConditionalOnProperty(
      prefix = "governor.health",
      name = "enabled",
      havingValue = "true",
      matchIfMissing = true)
  public ThreadPoolTaskScheduler governorHealthScheduler() {
    ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
    scheduler.setPoolSize(1);
    scheduler.setThreadNamePrefix("governor-health-");
    scheduler.setWaitForTasksToCompleteOnShutdown(true);
    scheduler.setAwaitTerminationSeconds(10);
    return scheduler;
  }

  @Bean(initMethod = "start", destroyMethod = "stop")
  @ConditionalOnMissingBean
  @ConditionalOnProperty(
      prefix = "governor.health",
      name = "enabled",
      havingValue = "true",
      matchIfMissing = true)
  public HealthMonitor healthMonitor(
      HealthProperties properties,
      MetricsCollector metricsCollector,
      AdaptiveRateLimiter rateLimiter,
      ResourceProbe resourceProbe,
      AlertDispatcher alertDispatcher,
      ObjectProvider<HealthCheck> checks,
      ObjectProvider<MemoryReleaseHook> memoryReleaseHooks,
      AdvisoryActionExecutor advisoryActionExecutor,
      @Qualifier(HEALTH_SCHEDULER_BEAN) ThreadPoolTaskScheduler scheduler,
      Clock clock,
      MeterRegistry meterRegistry) {
    log.info(
        "[GovernorAutoConfiguration] 헬스 모니터 등록: period={}, limits={}",
        properties.period(),
        properties.limits());
    return new HealthMonitor(
        metricsCollector,
        rateLimiter,
        resourceProbe,
        alertDispatcher,
        checks.orderedStream().toList(),
        memoryReleaseHooks.orderedStream().toList(),
        advisoryActionExecutor,
        properties.limits().toResourceLimits(),
        properties.toThresholds(),
        properties.period(),
        scheduler,
        clock,
        meterRegistry);
  }
}
