package com.example.smarttask.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class TaskStatusTest {

  @Test
  void resolvesWireValues() {
    assertThat(TaskStatus.fromValue("pending")).isEqualTo(TaskStatus.PENDING);
    assertThat(TaskStatus.fromValue("in_progress")).isEqualTo(TaskStatus.IN_PROGRESS);
    assertThat(TaskStatus.fromValue("completed")).isEqualTo(TaskStatus.COMPLETED);
  }

  @Test
  void rejectsConstantNamesAndPaddedValues() {
    assertThatThrownBy(() -> TaskStatus.fromValue("IN_PROGRESS"))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessage("Unsupported task status: IN_PROGRESS");
    assertThatThrownBy(() -> TaskStatus.fromValue(" pending"))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> TaskStatus.fromValue(""))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
