package com.example.smarttask.validation;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.example.smarttask.model.TaskStatus;
import org.junit.jupiter.api.Test;

class RequiredFieldsValidatorTest {

  private final RequiredFieldsValidator validator = new RequiredFieldsValidator();

  @Test
  void createRequiresTitle() {
    ValidationContext context = ValidationContext.builder()
        .operation(TaskOperation.CREATE)
        .titleProvided(true)
        .build();

    assertThatThrownBy(() -> validator.validate(context))
        .isInstanceOf(ValidationException.class)
        .hasMessage("title: must not be null");
  }

  @Test
  void updateMayOmitTitleAndStatus() {
    ValidationContext context = ValidationContext.builder().operation(TaskOperation.UPDATE).build();

    assertThatCode(() -> validator.validate(context)).doesNotThrowAnyException();
  }

  @Test
  void updateReportsEveryExplicitNull() {
    ValidationContext context = ValidationContext.builder()
        .operation(TaskOperation.UPDATE)
        .titleProvided(true)
        .statusProvided(true)
        .build();

    assertThatThrownBy(() -> validator.validate(context))
        .isInstanceOfSatisfying(ValidationException.class, ex -> assertThat(ex.getViolations())
            .containsExactly(
                new FieldViolation("title", "must not be null"),
                new FieldViolation("status", "must not be null")));
  }

  @Test
  void updateWithValuesPasses() {
    ValidationContext context = ValidationContext.builder()
        .operation(TaskOperation.UPDATE)
        .title("Renamed")
        .titleProvided(true)
        .status(TaskStatus.COMPLETED)
        .statusProvided(true)
        .build();

    assertThatCode(() -> validator.validate(context)).doesNotThrowAnyException();
  }
}
