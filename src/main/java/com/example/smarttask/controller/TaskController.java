package com.example.smarttask.controller;

import com.example.smarttask.model.TaskStatistics;
import com.example.smarttask.model.TaskStatus;
import com.example.smarttask.model.TaskSuggestion;
import com.example.smarttask.request.TaskCreateRequest;
import com.example.smarttask.request.TaskQuery;
import com.example.smarttask.request.TaskSortField;
import com.example.smarttask.request.TaskUpdateRequest;
import com.example.smarttask.response.MessageResponse;
import com.example.smarttask.response.TaskResponse;
import com.example.smarttask.service.SmartSuggestionService;
import com.example.smarttask.service.TaskService;
import com.example.smarttask.validation.ValidationException;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import java.time.LocalDate;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.Sort;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/tasks")
@RequiredArgsConstructor
@Tag(name = "Tasks", description = "Task CRUD, statistics and smart suggestions")
public class TaskController {

    private final TaskService taskService;
    private final SmartSuggestionService suggestionService;

    @Operation(summary = "Create a new task",
            description = "Title is required (max 200 characters); description max 1000 characters; "
                    + "due_date must not be in the past.")
    @PostMapping({"", "/"})
    public ResponseEntity<TaskResponse> create(@Valid @RequestBody TaskCreateRequest request) {
        TaskResponse body = TaskResponse.from(taskService.create(request));
        return ResponseEntity.ok(body);
    }

    @Operation(summary = "Get all tasks with filtering and sorting")
    @GetMapping({"", "/"})
    public List<TaskResponse> findAll(
            @RequestParam(value = "status", required = false) String status,
            @RequestParam(value = "due_date_from", required = false)
            @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate dueDateFrom,
            @RequestParam(value = "due_date_to", required = false)
            @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate dueDateTo,
            @RequestParam(value = "sort_by", defaultValue = "creation_date") String sortBy,
            @RequestParam(value = "sort_order", defaultValue = "desc") String sortOrder) {
        TaskQuery query = new TaskQuery(
                parseStatus(status), dueDateFrom, dueDateTo, parseSortField(sortBy), parseSortOrder(sortOrder));
        return taskService.list(query).stream().map(TaskResponse::from).toList();
    }

    @Operation(summary = "Get a specific task")
    @GetMapping("/{id}")
    public TaskResponse findOne(@PathVariable("id") long id) {
        return TaskResponse.from(taskService.get(id));
    }

    @Operation(summary = "Update a specific task", description = "Only provided fields are updated.")
    @PutMapping("/{id}")
    public TaskResponse update(@PathVariable("id") long id, @Valid @RequestBody TaskUpdateRequest request) {
        return TaskResponse.from(taskService.update(id, request));
    }

    @Operation(summary = "Delete a specific task")
    @DeleteMapping("/{id}")
    public MessageResponse delete(@PathVariable("id") long id) {
        taskService.delete(id);
        return new MessageResponse("Task with id: %d deleted successfully".formatted(id));
    }

    @Operation(summary = "Get smart task suggestions",
            description = "Suggests new task titles from the most frequent keywords in existing tasks.")
    @GetMapping("/suggestions/smart")
    public List<TaskSuggestion> suggestions() {
        return suggestionService.suggest();
    }

    @Operation(summary = "Get task statistics")
    @GetMapping("/statistics/overview")
    public TaskStatistics statistics() {
        return taskService.statistics();
    }

    private TaskStatus parseStatus(String raw) {
        if (raw == null) {
            return null;
        }
        try {
            return TaskStatus.fromValue(raw);
        } catch (IllegalArgumentException e) {
            throw new ValidationException("status", e.getMessage());
        }
    }

    private TaskSortField parseSortField(String raw) {
        try {
            return TaskSortField.fromParameter(raw);
        } catch (IllegalArgumentException e) {
            throw new ValidationException("sort_by", e.getMessage());
        }
    }

    private Sort.Direction parseSortOrder(String raw) {
        if (raw == null) {
            throw new ValidationException("sort_order", "must be one of asc, desc");
        }
        return switch (raw) {
            case "asc" -> Sort.Direction.ASC;
            case "desc" -> Sort.Direction.DESC;
            default -> throw new ValidationException("sort_order", "must be one of asc, desc");
        };
    }
}
