package com.example.smarttask.response;

public record MessageResponse(String message) {
}
