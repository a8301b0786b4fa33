package com.example.smarttask.validation;

public enum TaskOperation {
  CREATE,
  UPDATE
}
