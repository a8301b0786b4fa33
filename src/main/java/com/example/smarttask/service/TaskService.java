package com.example.smarttask.service;

import com.example.smarttask.config.TaskProperties;
import com.example.smarttask.dao.TaskRepository;
import com.example.smarttask.dao.TaskSpecifications;
import com.example.smarttask.exception.TaskNotFoundException;
import com.example.smarttask.model.Task;
import com.example.smarttask.model.TaskStatistics;
import com.example.smarttask.model.TaskStatus;
import com.example.smarttask.request.TaskCreateRequest;
import com.example.smarttask.request.TaskQuery;
import com.example.smarttask.request.TaskUpdateRequest;
import com.example.smarttask.validation.TaskOperation;
import com.example.smarttask.validation.ValidationContext;
import com.example.smarttask.validation.ValidationService;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Slf4j
@Service
@RequiredArgsConstructor
@Transactional
public class TaskService {

    private final TaskRepository repository;
    private final ValidationService validationService;
    private final TaskProperties properties;
    private final Clock clock;

    public Task create(TaskCreateRequest request) {
        validationService.validate(ValidationContext.builder()
                .operation(TaskOperation.CREATE)
                .title(request.title())
                .titleProvided(true)
                .dueDate(request.dueDate())
                .status(request.status())
                .statusProvided(request.status() != null)
                .build());

        Task task = new Task();
        task.setTitle(request.title());
        task.setDescription(request.description());
        task.setDueDate(request.dueDate());
        task.setStatus(request.status() == null ? TaskStatus.PENDING : request.status());

        Task saved = repository.save(task);
        log.info("Created task {} with status {}", saved.getId(), saved.getStatus());
        return saved;
    }

    @Transactional(readOnly = true)
    public List<Task> list(TaskQuery query) {
        List<Specification<Task>> filters = new ArrayList<>();
        if (query.status() != null) {
            filters.add(TaskSpecifications.hasStatus(query.status()));
        }
        if (query.dueDateFrom() != null) {
            filters.add(TaskSpecifications.dueOnOrAfter(query.dueDateFrom().atStartOfDay()));
        }
        if (query.dueDateTo() != null) {
            filters.add(TaskSpecifications.dueBefore(query.dueDateTo().plusDays(1).atStartOfDay()));
        }

        Sort sort = Sort.by(query.sortOrder(), query.sortBy().getProperty(), "id");
        List<Task> tasks = repository.findAll(Specification.allOf(filters), sort);
        log.debug("Listed {} tasks for {}", tasks.size(), query);
        return tasks;
    }

    @Transactional(readOnly = true)
    public Task get(long id) {
        return repository.findById(id).orElseThrow(() -> new TaskNotFoundException(id));
    }

    public Task update(long id, TaskUpdateRequest request) {
        Task task = repository.findById(id).orElseThrow(() -> new TaskNotFoundException(id));

        validationService.validate(ValidationContext.builder()
                .operation(TaskOperation.UPDATE)
                .title(request.getTitle())
                .titleProvided(request.isTitleProvided())
                .dueDate(request.isDueDateProvided() ? request.getDueDate() : null)
                .status(request.getStatus())
                .statusProvided(request.isStatusProvided())
                .build());

        if (request.isTitleProvided()) {
            task.setTitle(request.getTitle());
        }
        if (request.isDescriptionProvided()) {
            task.setDescription(request.getDescription());
        }
        if (request.isDueDateProvided()) {
            task.setDueDate(request.getDueDate());
        }
        if (request.isStatusProvided()) {
            task.setStatus(request.getStatus());
        }
        return repository.saveAndFlush(task);
    }

    public void delete(long id) {
        Task task = repository.findById(id).orElseThrow(() -> new TaskNotFoundException(id));
        repository.delete(task);
        log.info("Deleted task {}", id);
    }

    @Transactional(readOnly = true)
    public TaskStatistics statistics() {
        long total = repository.count();
        long pending = repository.countByStatus(TaskStatus.PENDING);
        long inProgress = repository.countByStatus(TaskStatus.IN_PROGRESS);
        long completed = repository.countByStatus(TaskStatus.COMPLETED);

        LocalDateTime now = LocalDateTime.now(clock);
        LocalDateTime windowEnd = now.plus(properties.getStatistics().getDueSoonWindow());
        long dueSoon = repository.countByDueDateBetweenAndStatusNot(now, windowEnd, TaskStatus.COMPLETED);

        return TaskStatistics.builder()
                .totalTasks(total)
                .pendingTasks(pending)
                .inProgressTasks(inProgress)
                .completedTasks(completed)
                .tasksDueSoon(dueSoon)
                .completionRate(total > 0 ? (double) completed / total : 0.0)
                .build();
    }
}
