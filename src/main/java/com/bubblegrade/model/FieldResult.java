package com.bubblegrade.model;

import io.swagger.v3.oas.annotations.media.Schema;
import java.time.Instant;

@Schema(description = "OCR outcome for a single sheet field")
public record FieldResult(
        @Schema(description = "Recognized or corrected text", example = "GOMEZ PEREZ ANA") String text,
        @Schema(description = "Normalized confidence in [0, 1]", example = "0.87") double confidence,
        @Schema(description = "Whether a human must confirm the value") boolean needsReview,
        @Schema(description = "Reviewer that corrected the value") String correctedBy,
        @Schema(description = "When the value was corrected") Instant correctedAt) {

    private static final FieldResult EMPTY = new FieldResult("", 0.0, true, null, null);

    public FieldResult {
        text = text == null ? "" : text;
        if (Double.isNaN(confidence) || confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("Confidence must be within [0, 1] but was " + confidence);
        }
    }

    public static FieldResult extracted(String text, double confidence) {
        return new FieldResult(text, confidence, false, null, null);
    }

    public static FieldResult empty() {
        return EMPTY;
    }

    public FieldResult withNeedsReview(boolean review) {
        return new FieldResult(text, confidence, review, correctedBy, correctedAt);
    }

    public FieldResult correctedTo(String value, double verifiedConfidence, String reviewer, Instant at) {
        return new FieldResult(value, verifiedConfidence, false, reviewer, at);
    }

    public boolean isCorrected() {
        return correctedAt != null;
    }
}
