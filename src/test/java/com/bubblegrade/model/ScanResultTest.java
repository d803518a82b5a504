package com.bubblegrade.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Instant;
import org.junit.jupiter.api.Test;

class ScanResultTest {

    private static final Instant UPLOADED = Instant.parse("2024-05-06T10:00:00Z");
    private static final Instant PROCESSED = Instant.parse("2024-05-06T10:00:04Z");

    @Test
    void startsQueuedWithEmptyResults() {
        ScanResult scan = ScanResult.queued("sheet.jpg", UPLOADED);

        assertThat(scan.getStatus()).isEqualTo(ScanStatus.QUEUED);
        assertThat(scan.getOmr()).isEqualTo(OmrResult.empty());
        assertThat(scan.getNombre().text()).isEmpty();
        assertThat(scan.getCurp().confidence()).isZero();
        assertThat(scan.getProcessedTime()).isNull();
    }

    @Test
    void errorKeepsPartialState() {
        ScanResult scan = ScanResult.queued("sheet.jpg", UPLOADED);
        scan.markProcessing();
        RegionSet regions = new RegionSet(
                new RegionBoundingBox(0, 30, 90, 70),
                new RegionBoundingBox(0, 5, 90, 10),
                new RegionBoundingBox(0, 17, 90, 10));
        scan.setRegions(regions, true);

        scan.markError(ErrorKind.EXTRACTION_ERROR, "Tesseract failed", PROCESSED);

        assertThat(scan.getStatus()).isEqualTo(ScanStatus.ERROR);
        assertThat(scan.getErrorKind()).isEqualTo(ErrorKind.EXTRACTION_ERROR);
        assertThat(scan.getRegions()).isEqualTo(regions);
        assertThat(scan.isRegionFallback()).isTrue();
        assertThat(scan.getProcessedTime()).isEqualTo(PROCESSED);
    }

    @Test
    void enforcesProcessingTransitions() {
        ScanResult scan = ScanResult.queued("sheet.jpg", UPLOADED);

        assertThatThrownBy(() -> scan.complete(ScanStatus.COMPLETED, PROCESSED)).isInstanceOf(IllegalStateException.class);
        scan.markProcessing();
        assertThatThrownBy(scan::markProcessing).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> scan.complete(ScanStatus.ERROR, PROCESSED)).isInstanceOf(IllegalArgumentException.class);
        scan.complete(ScanStatus.NEEDS_REVIEW, PROCESSED);
        assertThatThrownBy(() -> scan.markError(ErrorKind.DECODE_ERROR, "late", PROCESSED))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void errorIsTerminalForReview() {
        ScanResult scan = ScanResult.queued("sheet.jpg", UPLOADED);
        scan.markProcessing();
        scan.markError(ErrorKind.DECODE_ERROR, "Unable to decode image payload", PROCESSED);

        assertThatThrownBy(() -> scan.resolveReview(ScanStatus.COMPLETED)).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void copyIsIndependent() {
        ScanResult scan = ScanResult.queued("sheet.jpg", UPLOADED);
        ScanResult copy = scan.copy();

        scan.markProcessing();

        assertThat(copy.getStatus()).isEqualTo(ScanStatus.QUEUED);
        assertThat(copy.getId()).isEqualTo(scan.getId());
    }
}
