package com.example.smarttask.validation;

/** A rule broken by one wire field, e.g. {@code due_date}. */
public record FieldViolation(String field, String message) {

  /** The {@code "<field>: <message>"} line returned to API clients. */
  public String describe() {
    return field + ": " + message;
  }
}
