package com.taskhub.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Enables @Scheduled methods (AttachmentMaintenanceScheduler).
 */
@Configuration
@EnableScheduling
public class SchedulerConfig {
}
