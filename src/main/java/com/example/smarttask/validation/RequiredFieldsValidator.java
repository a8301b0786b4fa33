package com.example.smarttask.validation;

import java.util.ArrayList;
import java.util.List;
import org.springframework.stereotype.Component;

/** Title and status may be omitted from an update, but never set to null. */
@Component
public class RequiredFieldsValidator implements Validator {

  static final String NOT_NULL = "must not be null";

  @Override
  public ValidationStage stage() {
    return ValidationStage.FIELD;
  }

  @Override
  public void validate(ValidationContext context) {
    List<FieldViolation> violations = new ArrayList<>();
    boolean creating = context.getOperation() == TaskOperation.CREATE;
    if ((creating || context.isTitleProvided()) && context.getTitle() == null) {
      violations.add(new FieldViolation("title", NOT_NULL));
    }
    if (!creating && context.isStatusProvided() && context.getStatus() == null) {
      violations.add(new FieldViolation("status", NOT_NULL));
    }
    if (!violations.isEmpty()) {
      throw new ValidationException(violations);
    }
  }
}
