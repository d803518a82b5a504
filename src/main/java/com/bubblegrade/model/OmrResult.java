package com.bubblegrade.model;

import io.swagger.v3.oas.annotations.media.ArraySchema;
import io.swagger.v3.oas.annotations.media.Schema;
import java.util.Collections;
import java.util.List;

@Schema(description = "Optical mark recognition outcome")
public record OmrResult(
        @Schema(description = "Number of correct answers", example = "7") int score,
        @ArraySchema(arraySchema = @Schema(description = "Per-question correctness, in sheet order"))
        List<Boolean> answers,
        @Schema(description = "Number of graded questions", example = "10") int total,
        @ArraySchema(arraySchema = @Schema(description = "Marked choice letter per question; empty in detection-count mode"))
        List<String> choices) {

    private static final OmrResult EMPTY = new OmrResult(0, List.of(), 0, List.of());

    public OmrResult {
        if (score < 0) {
            throw new IllegalArgumentException("Score must not be negative");
        }
        if (total < 0) {
            throw new IllegalArgumentException("Total must not be negative");
        }
        answers = answers == null ? List.of() : List.copyOf(answers);
        choices = choices == null ? List.of() : List.copyOf(choices);
    }

    public static OmrResult empty() {
        return EMPTY;
    }

    public static OmrResult detectionCount(int detected) {
        return new OmrResult(detected, Collections.nCopies(detected, Boolean.TRUE), detected, List.of());
    }
}
