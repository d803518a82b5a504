package com.bubblegrade.service.pipeline;

import com.bubblegrade.exception.PipelineBusyException;
import com.bubblegrade.exception.ScanProcessingException;
import com.bubblegrade.model.AnswerKey;
import com.bubblegrade.model.ErrorKind;
import com.bubblegrade.model.FieldResult;
import com.bubblegrade.model.ImageQuality;
import com.bubblegrade.model.OmrResult;
import com.bubblegrade.model.RegionName;
import com.bubblegrade.model.RegionSet;
import com.bubblegrade.model.ScanResult;
import com.bubblegrade.model.ScanStatusEvent;
import com.bubblegrade.repository.ScanRepository;
import com.bubblegrade.service.backend.GradingBackend;
import com.bubblegrade.service.detection.DetectedRegions;
import com.bubblegrade.service.detection.RegionDetector;
import com.bubblegrade.service.notification.ScanEventPublisher;
import com.bubblegrade.service.preprocessing.ImageEnhancer;
import com.bubblegrade.service.preprocessing.ImageQualityAnalyzer;
import java.time.Clock;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import org.bytedeco.opencv.opencv_core.Mat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Runs one uploaded sheet through decoding, enhancement, region detection and grading, then
 * stores and announces the outcome. The record is persisted after every step that adds state,
 * so a scan that fails late still shows its regions and quality metrics.
 */
@Service
public class ScanPipeline {

    private static final Logger log = LoggerFactory.getLogger(ScanPipeline.class);

    static final String MDC_SCAN_ID = "scanId";

    private final ImageEnhancer enhancer;
    private final ImageQualityAnalyzer qualityAnalyzer;
    private final RegionDetector regionDetector;
    private final GradingBackend backend;
    private final ResultMerger merger;
    private final ScanRepository repository;
    private final ScanEventPublisher publisher;
    private final Executor scanExecutor;
    private final Executor gradingExecutor;
    private final Clock clock;

    public ScanPipeline(ImageEnhancer enhancer,
                        ImageQualityAnalyzer qualityAnalyzer,
                        RegionDetector regionDetector,
                        GradingBackend backend,
                        ResultMerger merger,
                        ScanRepository repository,
                        ScanEventPublisher publisher,
                        @Qualifier("scanExecutor") Executor scanExecutor,
                        @Qualifier("gradingExecutor") Executor gradingExecutor,
                        Clock clock) {
        this.enhancer = enhancer;
        this.qualityAnalyzer = qualityAnalyzer;
        this.regionDetector = regionDetector;
        this.backend = backend;
        this.merger = merger;
        this.repository = repository;
        this.publisher = publisher;
        this.scanExecutor = scanExecutor;
        this.gradingExecutor = gradingExecutor;
        this.clock = clock;
    }

    /**
     * Processes a sheet in the calling thread and returns the final record.
     *
     * @param answerKey expected choices, or {@code null} for detection-count grading
     * @throws com.bubblegrade.exception.PersistenceException when the record cannot be stored
     */
    public ScanResult process(byte[] imageBytes, String filename, AnswerKey answerKey) {
        ScanResult scan = ScanResult.queued(filename, clock.instant());
        repository.create(scan);
        return run(scan, imageBytes, answerKey);
    }

    /**
     * Registers the sheet and schedules its processing. Returns the queued record immediately.
     *
     * @throws PipelineBusyException when the scan queue is full; the record is then stored as
     *         {@link ErrorKind#PIPELINE_BUSY}
     */
    public ScanResult submit(byte[] imageBytes, String filename, AnswerKey answerKey) {
        ScanResult scan = ScanResult.queued(filename, clock.instant());
        repository.create(scan);
        ScanResult snapshot = scan.copy();
        try {
            scanExecutor.execute(() -> {
                try {
                    run(scan, imageBytes, answerKey);
                } catch (RuntimeException ex) {
                    log.error("Background processing of scan {} aborted", scan.getId(), ex);
                }
            });
        } catch (RejectedExecutionException ex) {
            scan.markProcessing();
            scan.markError(ErrorKind.PIPELINE_BUSY, "Scan queue is full", clock.instant());
            repository.update(scan);
            publisher.publish(ScanStatusEvent.of(scan, clock.instant()));
            throw new PipelineBusyException("Too many scans in progress, retry later", ex);
        }
        log.info("Queued scan {} for {}", scan.getId(), filename);
        return snapshot;
    }

    private ScanResult run(ScanResult scan, byte[] imageBytes, AnswerKey answerKey) {
        MDC.put(MDC_SCAN_ID, scan.getId().toString());
        try {
            scan.markProcessing();
            repository.update(scan);
            publisher.publish(ScanStatusEvent.of(scan, clock.instant()));

            StepResult<Mat> enhanced = StepResult.attempt("decode", () -> enhancer.decode(imageBytes))
                    .then("enhance", this::enhanceAndRelease);
            if (enhanced.failed()) {
                return fail(scan, enhanced.failure());
            }
            Mat image = enhanced.value();
            try {
                return grade(scan, image, answerKey);
            } finally {
                image.close();
            }
        } finally {
            MDC.remove(MDC_SCAN_ID);
        }
    }

    private Mat enhanceAndRelease(Mat decoded) {
        try {
            return enhancer.enhance(decoded);
        } finally {
            decoded.close();
        }
    }

    private ScanResult grade(ScanResult scan, Mat image, AnswerKey answerKey) {
        StepResult<ImageQuality> quality = StepResult.attempt("quality analysis", () -> qualityAnalyzer.analyze(image));
        if (quality.failed()) {
            log.warn("Image quality analysis failed: {}", quality.failure().getMessage());
        } else {
            scan.setImageQuality(quality.value());
        }

        StepResult<DetectedRegions> detected = StepResult.attempt("region detection", () -> regionDetector.detect(image));
        if (detected.failed()) {
            return fail(scan, detected.failure());
        }
        RegionSet regions = detected.value().regions();
        scan.setRegions(regions, detected.value().fallback());
        repository.update(scan);

        StepResult<Grading> grading = StepResult.attempt("grading", () -> gradeRegions(image, regions, answerKey));
        if (grading.failed()) {
            return fail(scan, grading.failure());
        }
        Grading outcome = grading.value();
        merger.merge(scan, outcome.omr(), outcome.nombre(), outcome.curp(), clock.instant());
        repository.update(scan);
        publisher.publish(ScanStatusEvent.of(scan, clock.instant()));
        log.info("Scan {} finished as {} with score {}/{}", scan.getId(), scan.getStatus(),
                outcome.omr().score(), outcome.omr().total());
        return scan.copy();
    }

    /**
     * Grades the three regions concurrently. Waits for every task before returning, also when one
     * of them fails, since all of them read the same image.
     */
    private Grading gradeRegions(Mat image, RegionSet regions, AnswerKey answerKey) {
        CompletableFuture<OmrResult> omr = CompletableFuture.supplyAsync(
                () -> backend.gradeOmr(image, regions.get(RegionName.OMR), answerKey), gradingExecutor);
        CompletableFuture<FieldResult> nombre = CompletableFuture.supplyAsync(
                () -> backend.extractField(image, regions.get(RegionName.NOMBRE), RegionName.NOMBRE), gradingExecutor);
        CompletableFuture<FieldResult> curp = CompletableFuture.supplyAsync(
                () -> backend.extractField(image, regions.get(RegionName.CURP), RegionName.CURP), gradingExecutor);
        CompletableFuture.allOf(omr, nombre, curp).join();
        return new Grading(omr.join(), nombre.join(), curp.join());
    }

    private ScanResult fail(ScanResult scan, ScanProcessingException failure) {
        log.error("Scan {} failed with {}: {}", scan.getId(), failure.kind(), failure.getMessage());
        scan.markError(failure.kind(), failure.getMessage(), clock.instant());
        repository.update(scan);
        publisher.publish(ScanStatusEvent.of(scan, clock.instant()));
        return scan.copy();
    }

    private record Grading(OmrResult omr, FieldResult nombre, FieldResult curp) {
    }
}
