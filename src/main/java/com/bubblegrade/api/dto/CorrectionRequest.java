package com.bubblegrade.api.dto;

import com.bubblegrade.model.FieldCorrection;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.Size;

public record CorrectionRequest(
        @Schema(description = "Corrected student name", example = "GOMEZ PEREZ ANA")
        @Size(max = 200)
        String nombre,
        @Schema(description = "Corrected CURP; must match the 18 character CURP format", example = "GOPA980314MJCMRN07")
        @Size(max = 18)
        String curp,
        @Schema(description = "Reviewer applying the correction", example = "reviewer01")
        @Size(max = 100)
        String correctedBy) {

    static final String DEFAULT_REVIEWER = "user";

    public FieldCorrection toCorrection() {
        return new FieldCorrection(nombre, curp);
    }

    public String reviewer() {
        return correctedBy == null || correctedBy.isBlank() ? DEFAULT_REVIEWER : correctedBy.trim();
    }
}
