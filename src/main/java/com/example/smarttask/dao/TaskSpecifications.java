package com.example.smarttask.dao;

import com.example.smarttask.model.Task;
import com.example.smarttask.model.TaskStatus;
import java.time.LocalDateTime;
import org.springframework.data.jpa.domain.Specification;

public final class TaskSpecifications {

    private TaskSpecifications() {}

    public static Specification<Task> hasStatus(TaskStatus status) {
        return (root, query, cb) -> cb.equal(root.get("status"), status);
    }

    public static Specification<Task> dueOnOrAfter(LocalDateTime from) {
        return (root, query, cb) -> cb.greaterThanOrEqualTo(root.get("dueDate"), from);
    }

    /** Exclusive upper bound. */
    public static Specification<Task> dueBefore(LocalDateTime to) {
        return (root, query, cb) -> cb.lessThan(root.get("dueDate"), to);
    }
}
