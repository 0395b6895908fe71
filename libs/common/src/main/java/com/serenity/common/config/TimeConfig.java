/*
 * Where: shared configuration
 * What: exposes Clock as a bean
 * Why: deadlines, backoff and retention all read time from one injectable source
 */
package com.serenity.common.config;

import java.time.Clock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class TimeConfig {

  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }
}
