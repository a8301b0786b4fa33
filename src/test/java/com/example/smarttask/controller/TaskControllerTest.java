package com.example.smarttask.controller;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.example.smarttask.model.Task;
import com.example.smarttask.model.TaskStatus;
import com.example.smarttask.model.TaskSuggestion;
import com.example.smarttask.request.TaskCreateRequest;
import com.example.smarttask.request.TaskQuery;
import com.example.smarttask.request.TaskSortField;
import com.example.smarttask.response.MessageResponse;
import com.example.smarttask.response.TaskResponse;
import com.example.smarttask.service.SmartSuggestionService;
import com.example.smarttask.service.TaskService;
import com.example.smarttask.validation.FieldViolation;
import com.example.smarttask.validation.ValidationException;
import java.time.LocalDate;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.data.domain.Sort;
import org.springframework.http.ResponseEntity;

class TaskControllerTest {

  private TaskService taskService;
  private SmartSuggestionService suggestionService;
  private TaskController controller;

  @BeforeEach
  void setUp() {
    taskService = mock(TaskService.class);
    suggestionService = mock(SmartSuggestionService.class);
    controller = new TaskController(taskService, suggestionService);
  }

  private Task task(long id, String title) {
    Task task = new Task();
    task.setId(id);
    task.setTitle(title);
    task.setStatus(TaskStatus.PENDING);
    return task;
  }

  @Test
  void createRespondsWithStoredTask() {
    TaskCreateRequest request = new TaskCreateRequest("Draft roadmap", null, null, null);
    when(taskService.create(request)).thenReturn(task(1L, "Draft roadmap"));

    ResponseEntity<TaskResponse> response = controller.create(request);

    assertThat(response.getStatusCode().value()).isEqualTo(200);
    assertThat(response.getBody()).isNotNull();
    assertThat(response.getBody().id()).isEqualTo(1L);
    assertThat(response.getBody().status()).isEqualTo(TaskStatus.PENDING);
  }

  @Test
  void findAllParsesFiltersAndOrdering() {
    when(taskService.list(any(TaskQuery.class))).thenReturn(List.of(task(2L, "a"), task(1L, "b")));

    List<TaskResponse> result = controller.findAll(
        "in_progress", LocalDate.of(2026, 5, 1), null, "due_date", "asc");

    ArgumentCaptor<TaskQuery> query = ArgumentCaptor.forClass(TaskQuery.class);
    verify(taskService).list(query.capture());
    assertThat(query.getValue().status()).isEqualTo(TaskStatus.IN_PROGRESS);
    assertThat(query.getValue().dueDateFrom()).isEqualTo(LocalDate.of(2026, 5, 1));
    assertThat(query.getValue().sortBy()).isEqualTo(TaskSortField.DUE_DATE);
    assertThat(query.getValue().sortOrder()).isEqualTo(Sort.Direction.ASC);
    assertThat(result).extracting(TaskResponse::id).containsExactly(2L, 1L);
  }

  @Test
  void findAllRejectsUnknownParameters() {
    assertThatThrownBy(() -> controller.findAll("archived", null, null, "creation_date", "desc"))
        .isInstanceOf(ValidationException.class);
    assertThatThrownBy(() -> controller.findAll(null, null, null, "title", "desc"))
        .isInstanceOf(ValidationException.class)
        .hasMessage("sort_by: must be one of creation_date, due_date");
    assertThatThrownBy(() -> controller.findAll(null, null, null, "creation_date", "sideways"))
        .isInstanceOf(ValidationException.class)
        .hasMessage("sort_order: must be one of asc, desc");
  }

  @Test
  void findAllDoesNotFoldCaseOrWhitespace() {
    assertThatThrownBy(() -> controller.findAll(null, null, null, "creation_date", "ASC"))
        .isInstanceOf(ValidationException.class);
    assertThatThrownBy(() -> controller.findAll(null, null, null, " due_date", "desc"))
        .isInstanceOf(ValidationException.class);
    assertThatThrownBy(() -> controller.findAll("In_Progress", null, null, "creation_date", "desc"))
        .isInstanceOfSatisfying(ValidationException.class, ex -> assertThat(ex.getViolations())
            .extracting(FieldViolation::field).containsExactly("status"));
  }

  @Test
  void deleteConfirmsWithMessage() {
    MessageResponse response = controller.delete(5L);

    verify(taskService).delete(5L);
    assertThat(response.message()).isEqualTo("Task with id: 5 deleted successfully");
  }

  @Test
  void suggestionsDelegateToService() {
    List<TaskSuggestion> suggestions = List.of(new TaskSuggestion("Finalize Budget"));
    when(suggestionService.suggest()).thenReturn(suggestions);

    assertThat(controller.suggestions()).isEqualTo(suggestions);
  }
}
