package com.example.awardcertificates.controller.dto;

import com.example.awardcertificates.model.FieldChanges;
import io.swagger.v3.oas.annotations.media.Schema;

import java.util.Map;

public record FieldChangesRequest(
        @Schema(description = "Field values keyed by wire name; an empty string clears the field",
                example = "{\"advisor\": \"李老师\", \"award_level\": \"一等奖\"}")
        Map<String, String> fields) {

    public FieldChanges toChanges() {
        return FieldChanges.fromWire(fields);
    }
}
