package com.example.smarttask.validation;

import com.example.smarttask.model.TaskStatus;
import java.time.LocalDateTime;
import lombok.Builder;
import lombok.Getter;

/**
 * The task fields a validator may inspect. For updates the {@code *Provided} flags tell an
 * explicit {@code null} apart from an absent field; for creates every field counts as provided.
 */
@Getter
@Builder
public class ValidationContext {

  private final TaskOperation operation;
  private final String title;
  private final boolean titleProvided;
  private final LocalDateTime dueDate;
  private final TaskStatus status;
  private final boolean statusProvided;
}
