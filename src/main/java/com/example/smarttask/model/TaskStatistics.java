package com.example.smarttask.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class TaskStatistics {

    long totalTasks;
    long pendingTasks;
    long inProgressTasks;
    long completedTasks;
    long tasksDueSoon;
    double completionRate;
}
