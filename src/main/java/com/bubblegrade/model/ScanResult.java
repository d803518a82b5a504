package com.bubblegrade.model;

import io.swagger.v3.oas.annotations.media.Schema;
import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * Grading record of one uploaded sheet. Created as {@link ScanStatus#QUEUED}, mutated by the
 * processing pipeline and afterwards only by the correction workflow.
 */
@Schema(description = "Grading record of one uploaded answer sheet")
public class ScanResult {

    private final UUID id;
    private final String filename;
    private final Instant uploadTime;
    private ScanStatus status;
    private RegionSet regions;
    private boolean regionFallback;
    private OmrResult omr = OmrResult.empty();
    private FieldResult nombre = FieldResult.empty();
    private FieldResult curp = FieldResult.empty();
    private CurpDetails curpDetails;
    private ImageQuality imageQuality;
    private Instant processedTime;
    private String errorMessage;
    private ErrorKind errorKind;

    public ScanResult(UUID id, String filename, ScanStatus status, Instant uploadTime) {
        this.id = Objects.requireNonNull(id, "id");
        this.filename = Objects.requireNonNull(filename, "filename");
        this.status = Objects.requireNonNull(status, "status");
        this.uploadTime = Objects.requireNonNull(uploadTime, "uploadTime");
    }

    public static ScanResult queued(String filename, Instant uploadTime) {
        return new ScanResult(UUID.randomUUID(), filename, ScanStatus.QUEUED, uploadTime);
    }

    public ScanResult copy() {
        ScanResult copy = new ScanResult(id, filename, status, uploadTime);
        copy.regions = regions;
        copy.regionFallback = regionFallback;
        copy.omr = omr;
        copy.nombre = nombre;
        copy.curp = curp;
        copy.curpDetails = curpDetails;
        copy.imageQuality = imageQuality;
        copy.processedTime = processedTime;
        copy.errorMessage = errorMessage;
        copy.errorKind = errorKind;
        return copy;
    }

    public void markProcessing() {
        if (status != ScanStatus.QUEUED) {
            throw new IllegalStateException("Scan " + id + " cannot start processing from status " + status);
        }
        status = ScanStatus.PROCESSING;
    }

    public void markError(ErrorKind kind, String message, Instant at) {
        requireProcessing();
        status = ScanStatus.ERROR;
        errorKind = kind;
        errorMessage = message;
        processedTime = at;
    }

    public void complete(ScanStatus finalStatus, Instant at) {
        requireProcessing();
        if (finalStatus != ScanStatus.COMPLETED && finalStatus != ScanStatus.NEEDS_REVIEW) {
            throw new IllegalArgumentException("Processing can only finish as COMPLETED or NEEDS_REVIEW");
        }
        status = finalStatus;
        processedTime = at;
    }

    /**
     * Status change driven by the correction workflow once processing has finished.
     */
    public void resolveReview(ScanStatus reviewedStatus) {
        if (status != ScanStatus.NEEDS_REVIEW && status != ScanStatus.COMPLETED) {
            throw new IllegalStateException("Scan " + id + " in status " + status + " cannot be reviewed");
        }
        status = reviewedStatus;
    }

    private void requireProcessing() {
        if (status != ScanStatus.PROCESSING) {
            throw new IllegalStateException("Scan " + id + " is not processing but " + status);
        }
    }

    public UUID getId() {
        return id;
    }

    public String getFilename() {
        return filename;
    }

    public Instant getUploadTime() {
        return uploadTime;
    }

    public ScanStatus getStatus() {
        return status;
    }

    public RegionSet getRegions() {
        return regions;
    }

    public void setRegions(RegionSet regions, boolean fallback) {
        this.regions = regions;
        this.regionFallback = fallback;
    }

    public boolean isRegionFallback() {
        return regionFallback;
    }

    public OmrResult getOmr() {
        return omr;
    }

    public void setOmr(OmrResult omr) {
        this.omr = Objects.requireNonNull(omr, "omr");
    }

    public FieldResult getNombre() {
        return nombre;
    }

    public void setNombre(FieldResult nombre) {
        this.nombre = Objects.requireNonNull(nombre, "nombre");
    }

    public FieldResult getCurp() {
        return curp;
    }

    public void setCurp(FieldResult curp) {
        this.curp = Objects.requireNonNull(curp, "curp");
    }

    public CurpDetails getCurpDetails() {
        return curpDetails;
    }

    public void setCurpDetails(CurpDetails curpDetails) {
        this.curpDetails = curpDetails;
    }

    public ImageQuality getImageQuality() {
        return imageQuality;
    }

    public void setImageQuality(ImageQuality imageQuality) {
        this.imageQuality = imageQuality;
    }

    public Instant getProcessedTime() {
        return processedTime;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    public ErrorKind getErrorKind() {
        return errorKind;
    }

    @Override
    public String toString() {
        return "ScanResult{id=" + id + ", filename='" + filename + "', status=" + status + '}';
    }
}
