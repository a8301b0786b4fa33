package com.example.smarttask.response;

import java.util.List;

/**
 * Error body. {@code detail} is a single message for lookups and a list of reasons for
 * rejected payloads.
 */
public record ErrorResponse(Object detail) {

    public static ErrorResponse of(String message) {
        return new ErrorResponse(message);
    }

    public static ErrorResponse of(List<String> reasons) {
        return new ErrorResponse(List.copyOf(reasons));
    }
}
