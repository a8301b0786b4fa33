package com.example.smarttask.dao;

import com.example.smarttask.model.Task;
import com.example.smarttask.model.TaskStatus;
import java.time.LocalDateTime;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.stereotype.Repository;

@Repository
public interface TaskRepository extends JpaRepository<Task, Long>, JpaSpecificationExecutor<Task> {

    long countByStatus(TaskStatus status);

    /**
     * Tasks due inside {@code [from, to]} (both inclusive) whose status differs from {@code excluded}.
     */
    long countByDueDateBetweenAndStatusNot(LocalDateTime from, LocalDateTime to, TaskStatus excluded);
}
