package com.quillvault.export.scheduler.config;

import java.time.Clock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.validation.beanvalidation.LocalValidatorFactoryBean;

@Configuration
public class TimeConfig {

  /** Every due-time comparison, log timestamp and entity audit column reads this clock. */
  @Bean
  @Primary
  public Clock clock() {
    return Clock.systemUTC();
  }

  // Request validation and the scheduler must agree on "now"
  @Bean
  @Primary
  public LocalValidatorFactoryBean validator(Clock clock) {
    LocalValidatorFactoryBean factory = new LocalValidatorFactoryBean();
    factory.setConfigurationInitializer(configuration -> configuration.clockProvider(() -> clock));
    return factory;
  }
}
