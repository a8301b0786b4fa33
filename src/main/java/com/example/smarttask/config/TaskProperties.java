package com.example.smarttask.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "tasks")
@Validated
public class TaskProperties {

    private final Statistics statistics = new Statistics();

    public Statistics getStatistics() {
        return statistics;
    }

    public static final class Statistics {
        /** Open tasks due within this window from now count as "due soon". */
        private Duration dueSoonWindow = Duration.ofDays(7);

        public Duration getDueSoonWindow() {
            return dueSoonWindow;
        }

        public void setDueSoonWindow(Duration dueSoonWindow) {
            this.dueSoonWindow = dueSoonWindow;
        }
    }
}
