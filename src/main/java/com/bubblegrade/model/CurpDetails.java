package com.bubblegrade.model;

import io.swagger.v3.oas.annotations.media.Schema;
import java.time.LocalDate;

@Schema(description = "Attributes decoded from a well-formed CURP")
public record CurpDetails(
        @Schema(description = "Birth date encoded in positions 5-10", example = "1998-03-14") LocalDate birthDate,
        @Schema(description = "Sex marker, H or M", example = "H") String sex,
        @Schema(description = "Federal entity of birth", example = "JALISCO") String federalEntity,
        @Schema(description = "Whether the 18th character matches the computed check digit") boolean checkDigitValid) {
}
