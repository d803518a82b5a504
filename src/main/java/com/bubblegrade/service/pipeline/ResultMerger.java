package com.bubblegrade.service.pipeline;

import com.bubblegrade.config.GradingProperties;
import com.bubblegrade.config.GradingProperties.ReviewProperties;
import com.bubblegrade.model.FieldResult;
import com.bubblegrade.model.OmrResult;
import com.bubblegrade.model.ScanResult;
import com.bubblegrade.model.ScanStatus;
import com.bubblegrade.service.parser.CurpValidator;
import java.time.Instant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Combines the grading outputs into the final record and decides whether a reviewer has to look
 * at it. Low confidence, a malformed CURP or a sheet without a single recognized mark all lead to
 * {@link ScanStatus#NEEDS_REVIEW}; none of them is treated as an error.
 */
@Component
public class ResultMerger {

    private static final Logger log = LoggerFactory.getLogger(ResultMerger.class);

    private final ReviewProperties review;
    private final CurpValidator curpValidator;

    public ResultMerger(GradingProperties properties, CurpValidator curpValidator) {
        this.review = properties.review();
        this.curpValidator = curpValidator;
    }

    public ScanStatus merge(ScanResult scan, OmrResult omr, FieldResult nombre, FieldResult curp, Instant processedAt) {
        FieldResult reviewedNombre = nombre.withNeedsReview(nombre.confidence() < review.nombreConfidenceThreshold());
        boolean wellFormed = curpValidator.matchesFormat(curp.text());
        FieldResult reviewedCurp = curp.withNeedsReview(
                curp.confidence() < review.curpConfidenceThreshold() || !wellFormed);

        scan.setOmr(omr);
        scan.setNombre(reviewedNombre);
        scan.setCurp(reviewedCurp);
        scan.setCurpDetails(curpValidator.inspect(curp.text()).orElse(null));

        ScanStatus status = resolveStatus(reviewedNombre, reviewedCurp, omr);
        scan.complete(status, processedAt);
        log.debug("Merged scan {}: score={}/{} nombreReview={} curpReview={} status={}",
                scan.getId(), omr.score(), omr.total(), reviewedNombre.needsReview(), reviewedCurp.needsReview(), status);
        return status;
    }

    static ScanStatus resolveStatus(FieldResult nombre, FieldResult curp, OmrResult omr) {
        if (nombre.needsReview() || curp.needsReview() || omr.score() == 0) {
            return ScanStatus.NEEDS_REVIEW;
        }
        return ScanStatus.COMPLETED;
    }
}
