package com.example.awardcertificates.controller.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotNull;

import java.time.LocalDateTime;

public record DeadlineRequest(
        @NotNull
        @Schema(description = "New submission deadline, local time", example = "2026-12-31T23:59:59")
        LocalDateTime deadline) {
}
