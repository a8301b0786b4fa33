package com.example.smarttask.response;

import com.example.smarttask.model.Task;
import com.example.smarttask.model.TaskStatus;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.LocalDateTime;
import java.util.Objects;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record TaskResponse(
        Long id,
        String title,
        String description,
        LocalDateTime dueDate,
        TaskStatus status,
        LocalDateTime creationDate,
        LocalDateTime modifiedDate
) {

    public static TaskResponse from(Task task) {
        Objects.requireNonNull(task, "task must not be null");
        return new TaskResponse(
                task.getId(),
                task.getTitle(),
                task.getDescription(),
                task.getDueDate(),
                task.getStatus(),
                task.getCreationDate(),
                task.getModifiedDate());
    }
}
