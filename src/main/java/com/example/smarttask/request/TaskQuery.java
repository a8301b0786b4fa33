package com.example.smarttask.request;

import com.example.smarttask.model.TaskStatus;
import java.time.LocalDate;
import org.springframework.data.domain.Sort;

/** Filter and ordering for task listings; {@code null} filters are ignored. */
public record TaskQuery(
        TaskStatus status,
        LocalDate dueDateFrom,
        LocalDate dueDateTo,
        TaskSortField sortBy,
        Sort.Direction sortOrder
) {

    public TaskQuery {
        sortBy = sortBy == null ? TaskSortField.CREATION_DATE : sortBy;
        sortOrder = sortOrder == null ? Sort.Direction.DESC : sortOrder;
    }

    public static TaskQuery unfiltered() {
        return new TaskQuery(null, null, null, null, null);
    }
}
