package com.quillvault.export.scheduler.config;

import com.quillvault.export.scheduler.config.properties.DeliveryProperties;
import com.quillvault.export.scheduler.config.properties.ExecutionProperties;
import com.quillvault.export.scheduler.config.properties.TriggerLoopProperties;
import com.quillvault.export.scheduler.config.properties.WatchdogProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties({
  TriggerLoopProperties.class,
  DeliveryProperties.class,
  WatchdogProperties.class,
  ExecutionProperties.class
})
public class PropertiesConfig { }
