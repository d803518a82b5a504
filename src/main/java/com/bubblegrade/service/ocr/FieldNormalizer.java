package com.bubblegrade.service.ocr;

import com.bubblegrade.model.FieldResult;
import com.bubblegrade.model.RegionName;
import com.bubblegrade.service.parser.CurpValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Turns raw OCR output into a field result, whichever engine produced it. A CURP that does not
 * match the registry format always carries zero confidence.
 */
@Component
public class FieldNormalizer {

    private static final Logger log = LoggerFactory.getLogger(FieldNormalizer.class);

    private final CurpValidator curpValidator;

    public FieldNormalizer(CurpValidator curpValidator) {
        this.curpValidator = curpValidator;
    }

    public FieldResult normalize(RegionName region, String rawText, double rawConfidence) {
        String text = rawText == null ? "" : rawText.trim();
        double confidence = clamp(rawConfidence);
        if (region == RegionName.CURP) {
            text = text.replaceAll("\\s+", "");
            if (!curpValidator.matchesFormat(text)) {
                log.debug("CURP '{}' does not match the expected format; confidence reset from {}", text, confidence);
                confidence = 0.0;
            }
        }
        return FieldResult.extracted(text, confidence);
    }

    private static double clamp(double confidence) {
        if (!Double.isFinite(confidence)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, confidence));
    }
}
