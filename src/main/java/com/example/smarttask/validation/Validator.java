package com.example.smarttask.validation;

/** Contract for domain rules applied to a task payload before it reaches the store. */
public interface Validator {

  /** The stage in which the validator should be executed. */
  ValidationStage stage();

  /** Checks the payload; throws {@link ValidationException} on a violation. */
  void validate(ValidationContext context);
}
