/*
 * Where: escalation infrastructure configuration
 * What: thread pools for per-alert escalation timers and channel sender calls
 * Why: timers and blocking transports must not share the request threads
 */
package com.serenity.escalation.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

@Configuration
public class SchedulingConfig {

  @Bean
  public ThreadPoolTaskScheduler escalationTaskScheduler(EscalationProperties properties) {
    final ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
    scheduler.setPoolSize(properties.timerPoolSize());
    scheduler.setThreadNamePrefix("escalation-timer-");
    scheduler.setRemoveOnCancelPolicy(true);
    scheduler.setWaitForTasksToCompleteOnShutdown(false);
    return scheduler;
  }

  @Bean
  public ThreadPoolTaskExecutor channelSenderExecutor(NotificationQueueProperties properties) {
    final ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(properties.senderPoolSize());
    executor.setMaxPoolSize(properties.senderPoolSize());
    executor.setQueueCapacity(properties.batchSize() * 2);
    executor.setThreadNamePrefix("channel-sender-");
    return executor;
  }
}
