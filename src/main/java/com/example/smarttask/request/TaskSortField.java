package com.example.smarttask.request;

public enum TaskSortField {
    CREATION_DATE("creation_date", "creationDate"),
    DUE_DATE("due_date", "dueDate");

    private final String parameter;
    private final String property;

    TaskSortField(String parameter, String property) {
        this.parameter = parameter;
        this.property = property;
    }

    public String getParameter() {
        return parameter;
    }

    /** Entity attribute to sort on. */
    public String getProperty() {
        return property;
    }

    /** Exact match on the query value; no trimming or case folding. */
    public static TaskSortField fromParameter(String raw) {
        for (TaskSortField field : values()) {
            if (field.parameter.equals(raw)) {
                return field;
            }
        }
        throw new IllegalArgumentException("must be one of creation_date, due_date");
    }
}
