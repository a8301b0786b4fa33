package com.example.smarttask.exception;

public class TaskNotFoundException extends RuntimeException {

    private final long taskId;

    public TaskNotFoundException(long taskId) {
        super("Task %d not found".formatted(taskId));
        this.taskId = taskId;
    }

    public long getTaskId() {
        return taskId;
    }
}
