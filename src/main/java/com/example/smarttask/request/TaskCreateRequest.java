package com.example.smarttask.request;

import com.example.smarttask.model.Task;
import com.example.smarttask.model.TaskStatus;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import java.time.LocalDateTime;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record TaskCreateRequest(
        @NotNull(message = "must not be null")
        @Size(min = 1, max = Task.TITLE_MAX_LENGTH, message = "must be between 1 and 200 characters")
        String title,
        @Size(max = Task.DESCRIPTION_MAX_LENGTH, message = "must be at most 1000 characters")
        String description,
        LocalDateTime dueDate,
        TaskStatus status
) {
}
