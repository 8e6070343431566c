package com.example.awardcertificates.controller.dto;

import com.example.awardcertificates.model.Deadline;
import io.swagger.v3.oas.annotations.media.Schema;

import java.time.LocalDateTime;

public record DeadlineResponse(
        @Schema(description = "Current submission deadline, local time")
        LocalDateTime deadline,
        @Schema(description = "Whether uploads, edits and submissions are still accepted")
        boolean open) {

    public static DeadlineResponse of(Deadline deadline, LocalDateTime now) {
        return new DeadlineResponse(deadline.timestamp(), !deadline.hasPassed(now));
    }
}
