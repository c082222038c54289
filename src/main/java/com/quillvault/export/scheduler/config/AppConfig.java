package com.quillvault.export.scheduler.config;

import com.quillvault.export.scheduler.config.properties.DeliveryProperties;
import com.quillvault.export.scheduler.config.properties.TriggerLoopProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

@Configuration
public class AppConfig {

  /** Bounded pool running one schedule execution per thread. */
  @Bean(name = "executionExecutor")
  public ThreadPoolTaskExecutor executionExecutor(TriggerLoopProperties props) {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(props.getWorkerPoolSize());
    executor.setMaxPoolSize(props.getWorkerPoolSize());
    executor.setQueueCapacity(props.getQueueCapacity());
    executor.setThreadNamePrefix("export-worker-");
    executor.setWaitForTasksToCompleteOnShutdown(true);
    executor.setAwaitTerminationSeconds(30);
    return executor;
  }

  /** Separate pool for recipient fan-out so a hung transport never holds an execution worker. */
  @Bean(name = "deliveryExecutor")
  public ThreadPoolTaskExecutor deliveryExecutor(DeliveryProperties props) {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(props.getPoolSize());
    executor.setMaxPoolSize(props.getPoolSize());
    executor.setQueueCapacity(256);
    executor.setThreadNamePrefix("export-delivery-");
    executor.setWaitForTasksToCompleteOnShutdown(true);
    executor.setAwaitTerminationSeconds(30);
    return executor;
  }

  /** PDF rendering runs here so a hung render can be abandoned at its timeout. */
  @Bean(name = "renderExecutor")
  public ThreadPoolTaskExecutor renderExecutor(TriggerLoopProperties props) {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(props.getWorkerPoolSize());
    executor.setMaxPoolSize(props.getWorkerPoolSize());
    executor.setQueueCapacity(props.getWorkerPoolSize());
    executor.setThreadNamePrefix("export-render-");
    executor.setWaitForTasksToCompleteOnShutdown(false);
    return executor;
  }

  /** Drives the trigger loop ticks and the watchdog cycle. */
  @Bean(name = "triggerScheduler")
  public ThreadPoolTaskScheduler triggerScheduler() {
    ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
    scheduler.setPoolSize(2);
    scheduler.setThreadNamePrefix("export-trigger-");
    scheduler.setWaitForTasksToCompleteOnShutdown(true);
    scheduler.setAwaitTerminationSeconds(30);
    return scheduler;
  }
}
