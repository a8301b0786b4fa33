package com.example.smarttask.validation;

import java.time.Clock;
import java.time.LocalDateTime;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/** A due date, when given, must not lie before the current UTC time. */
@Component
@RequiredArgsConstructor
public class DueDateNotInPastValidator implements Validator {

  static final String FIELD = "due_date";
  static final String MESSAGE = "Due date cannot be in the past";

  private final Clock clock;

  @Override
  public ValidationStage stage() {
    return ValidationStage.TEMPORAL;
  }

  @Override
  public void validate(ValidationContext context) {
    LocalDateTime dueDate = context.getDueDate();
    if (dueDate != null && dueDate.isBefore(LocalDateTime.now(clock))) {
      throw new ValidationException(FIELD, MESSAGE);
    }
  }
}
