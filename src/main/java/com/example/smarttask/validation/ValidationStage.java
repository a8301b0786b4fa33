package com.example.smarttask.validation;

/** Identifies the order in which task validators run. */
public enum ValidationStage {
  /** Presence and shape of individual fields. */
  FIELD,
  /** Rules that depend on the current time. */
  TEMPORAL
}
