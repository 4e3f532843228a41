package keystone.platform.config;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.binder.jvm.ExecutorServiceMetrics;
import java.util.Collections;
import java.util.concurrent.RejectedExecutionException;
import keystone.platform.infrastructure.config.MaintenanceProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

/**
 * 유지보수 스케줄러 스레드 풀
 *
 * <p>기본 TaskScheduler는 단일 스레드라, 느린 저장소 호출 하나가 헬스 체크와 in-flight 복구를 함께 지연시킵니다. 풀 크기는
 * {@code keystone.maintenance.scheduler-pool-size} (기본 2).
 *
 * <ul>
 *   <li>threadNamePrefix: "maintenance-"
 *   <li>종료 시 진행 중인 작업 완료 대기 (최대 30초)
 *   <li>{@code scheduler.rejected} 카운터 + ExecutorServiceMetrics
 * </ul>
 */
@Slf4j
@Configuration(proxyBeanMethods = false)
@EnableScheduling
@ConditionalOnProperty(
    prefix = "keystone.maintenance",
    name = "enabled",
    havingValue = "true",
    matchIfMissing = true)
public class SchedulerConfig {

  private static final int AWAIT_TERMINATION_SECONDS = 30;

  @Bean
  @ConditionalOnMissingBean(name = "taskScheduler")
  public ThreadPoolTaskScheduler taskScheduler(
      MaintenanceProperties properties, MeterRegistry meterRegistry) {
    Counter rejected =
        Counter.builder("scheduler.rejected")
            .description("Number of maintenance jobs rejected")
            .register(meterRegistry);

    ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
    scheduler.setPoolSize(properties.schedulerPoolSize());
    scheduler.setThreadNamePrefix("maintenance-");
    scheduler.setWaitForTasksToCompleteOnShutdown(true);
    scheduler.setAwaitTerminationSeconds(AWAIT_TERMINATION_SECONDS);
    scheduler.setRejectedExecutionHandler(
        (r, executor) -> {
          rejected.increment();
          if (!executor.isShutdown()) {
            log.warn(
                "[TaskScheduler] job rejected: poolSize={}, active={}",
                executor.getPoolSize(),
                executor.getActiveCount());
          }
          throw new RejectedExecutionException("maintenance scheduler rejected job");
        });
    scheduler.initialize();

    new ExecutorServiceMetrics(
            scheduler.getScheduledExecutor(), "task.scheduler", Collections.emptyList())
        .bindTo(meterRegistry);

    log.info("[TaskScheduler] Initialized with poolSize={}", properties.schedulerPoolSize());
    return scheduler;
  }
}
