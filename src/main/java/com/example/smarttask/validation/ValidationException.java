package com.example.smarttask.validation;

import java.util.List;
import java.util.stream.Collectors;

/** Thrown when a task payload breaks a domain rule. Carries one violation per offending field. */
public class ValidationException extends RuntimeException {

  private final List<FieldViolation> violations;

  public ValidationException(String field, String message) {
    this(List.of(new FieldViolation(field, message)));
  }

  public ValidationException(List<FieldViolation> violations) {
    super(describe(violations));
    this.violations = List.copyOf(violations);
  }

  public List<FieldViolation> getViolations() {
    return violations;
  }

  private static String describe(List<FieldViolation> violations) {
    if (violations.isEmpty()) {
      throw new IllegalArgumentException("at least one violation is required");
    }
    return violations.stream().map(FieldViolation::describe).collect(Collectors.joining("; "));
  }
}
