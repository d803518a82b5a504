package com.bubblegrade.service.review;

import com.bubblegrade.exception.ScanNotFoundException;
import com.bubblegrade.exception.ScanStateException;
import com.bubblegrade.model.FieldCorrection;
import com.bubblegrade.model.ScanResult;
import com.bubblegrade.model.ScanStatus;
import com.bubblegrade.model.ScanStatusEvent;
import com.bubblegrade.repository.ScanRepository;
import com.bubblegrade.service.notification.ScanEventPublisher;
import com.bubblegrade.service.parser.CurpValidator;
import java.time.Clock;
import java.time.Instant;
import java.util.Locale;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Applies reviewer corrections to a finished scan. A corrected field counts as verified by a human,
 * so it no longer needs review and carries full confidence.
 */
@Service
public class CorrectionService {

    private static final Logger log = LoggerFactory.getLogger(CorrectionService.class);

    static final double VERIFIED_CONFIDENCE = 1.0;

    private final ScanRepository repository;
    private final ScanEventPublisher publisher;
    private final CurpValidator curpValidator;
    private final Clock clock;

    public CorrectionService(ScanRepository repository, ScanEventPublisher publisher,
            CurpValidator curpValidator, Clock clock) {
        this.repository = repository;
        this.publisher = publisher;
        this.curpValidator = curpValidator;
        this.clock = clock;
    }

    /**
     * @throws ScanNotFoundException when no scan has the given id
     * @throws IllegalArgumentException when nothing is corrected or the corrected CURP is malformed
     * @throws ScanStateException when the scan has not finished processing or ended in error
     */
    public ScanResult applyCorrections(UUID scanId, FieldCorrection correction, String correctedBy) {
        if (correction == null || correction.isEmpty()) {
            throw new IllegalArgumentException("At least one of nombre or curp must be corrected");
        }
        Instant now = clock.instant();
        ScanResult scan = repository.modify(scanId, current -> correct(current, correction, correctedBy, now))
                .orElseThrow(() -> new ScanNotFoundException(scanId));
        publisher.publish(ScanStatusEvent.corrected(scan, now));
        log.info("Scan {} corrected by {}; status {}", scanId, correctedBy, scan.getStatus());
        return scan;
    }

    private ScanResult correct(ScanResult scan, FieldCorrection correction, String correctedBy, Instant now) {
        if (scan.getStatus() != ScanStatus.NEEDS_REVIEW && scan.getStatus() != ScanStatus.COMPLETED) {
            throw new ScanStateException(scan.getId(), scan.getStatus(), "corrected");
        }
        if (correction.nombre() != null) {
            scan.setNombre(scan.getNombre().correctedTo(correction.nombre().trim(), VERIFIED_CONFIDENCE, correctedBy, now));
        }
        if (correction.curp() != null) {
            String curp = correction.curp().trim().toUpperCase(Locale.ROOT);
            if (!curpValidator.matchesFormat(curp)) {
                throw new IllegalArgumentException("Corrected CURP '" + curp + "' does not match the CURP format");
            }
            scan.setCurp(scan.getCurp().correctedTo(curp, VERIFIED_CONFIDENCE, correctedBy, now));
            scan.setCurpDetails(curpValidator.inspect(curp).orElse(null));
        }

        boolean reviewPending = scan.getNombre().needsReview() || scan.getCurp().needsReview();
        scan.resolveReview(reviewPending ? ScanStatus.NEEDS_REVIEW : ScanStatus.COMPLETED);
        return scan;
    }
}
