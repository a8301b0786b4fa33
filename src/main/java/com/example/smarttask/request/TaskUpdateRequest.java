package com.example.smarttask.request;

import com.example.smarttask.model.Task;
import com.example.smarttask.model.TaskStatus;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.Size;
import java.time.LocalDateTime;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * Partial update. Only fields present in the payload are applied; the {@code *Provided} flags
 * record presence so an explicit {@code null} (e.g. clearing the description) is honoured.
 */
@Getter
@NoArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class TaskUpdateRequest {

    @Size(min = 1, max = Task.TITLE_MAX_LENGTH, message = "must be between 1 and 200 characters")
    private String title;

    @Size(max = Task.DESCRIPTION_MAX_LENGTH, message = "must be at most 1000 characters")
    private String description;

    private LocalDateTime dueDate;

    private TaskStatus status;

    @JsonIgnore
    private boolean titleProvided;

    @JsonIgnore
    private boolean descriptionProvided;

    @JsonIgnore
    private boolean dueDateProvided;

    @JsonIgnore
    private boolean statusProvided;

    public TaskUpdateRequest setTitle(String title) {
        this.title = title;
        this.titleProvided = true;
        return this;
    }

    public TaskUpdateRequest setDescription(String description) {
        this.description = description;
        this.descriptionProvided = true;
        return this;
    }

    public TaskUpdateRequest setDueDate(LocalDateTime dueDate) {
        this.dueDate = dueDate;
        this.dueDateProvided = true;
        return this;
    }

    public TaskUpdateRequest setStatus(TaskStatus status) {
        this.status = status;
        this.statusProvided = true;
        return this;
    }
}
