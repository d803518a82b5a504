package com.bubblegrade.service.pipeline;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.bubblegrade.config.GradingProperties;
import com.bubblegrade.exception.BackendUnavailableException;
import com.bubblegrade.exception.ExtractionException;
import com.bubblegrade.exception.PersistenceException;
import com.bubblegrade.exception.PipelineBusyException;
import com.bubblegrade.model.AnswerKey;
import com.bubblegrade.model.ErrorKind;
import com.bubblegrade.model.FieldResult;
import com.bubblegrade.model.ImageQuality;
import com.bubblegrade.model.OmrResult;
import com.bubblegrade.model.RegionBoundingBox;
import com.bubblegrade.model.RegionName;
import com.bubblegrade.model.RegionSet;
import com.bubblegrade.model.ScanResult;
import com.bubblegrade.model.ScanStatus;
import com.bubblegrade.model.ScanStatusEvent;
import com.bubblegrade.repository.InMemoryScanRepository;
import com.bubblegrade.repository.ScanRepository;
import com.bubblegrade.service.backend.GradingBackend;
import com.bubblegrade.service.detection.DetectedRegions;
import com.bubblegrade.service.detection.RegionDetector;
import com.bubblegrade.service.notification.ScanEventPublisher;
import com.bubblegrade.service.parser.CurpValidator;
import com.bubblegrade.service.preprocessing.ImageEnhancer;
import com.bubblegrade.service.preprocessing.ImageQualityAnalyzer;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import org.bytedeco.opencv.global.opencv_core;
import org.bytedeco.opencv.opencv_core.Mat;
import org.bytedeco.opencv.opencv_core.Scalar;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

class ScanPipelineTest {

    private static final byte[] IMAGE = {1, 2, 3};
    private static final String VALID_CURP = "GOPA980314MJCMRN07";
    private static final RegionSet REGIONS = new RegionSet(
            new RegionBoundingBox(5, 30, 90, 70),
            new RegionBoundingBox(5, 5, 90, 10),
            new RegionBoundingBox(5, 17, 90, 10));

    private final Clock clock = Clock.fixed(Instant.parse("2024-05-06T10:15:30Z"), ZoneOffset.UTC);
    private final Executor direct = Runnable::run;

    private ImageEnhancer enhancer;
    private ImageQualityAnalyzer qualityAnalyzer;
    private RegionDetector detector;
    private GradingBackend backend;
    private ScanRepository repository;
    private ScanEventPublisher publisher;
    private ScanPipeline pipeline;

    @BeforeEach
    void setUp() {
        enhancer = mock(ImageEnhancer.class);
        qualityAnalyzer = mock(ImageQualityAnalyzer.class);
        detector = mock(RegionDetector.class);
        backend = mock(GradingBackend.class);
        repository = new InMemoryScanRepository();
        publisher = mock(ScanEventPublisher.class);
        pipeline = pipeline(enhancer, repository);

        when(enhancer.decode(IMAGE)).thenAnswer(invocation -> image());
        when(enhancer.enhance(any(Mat.class))).thenAnswer(invocation -> image());
        when(qualityAnalyzer.analyze(any(Mat.class))).thenReturn(new ImageQuality(100, 100, 350.0, 0.4));
        when(detector.detect(any(Mat.class))).thenReturn(new DetectedRegions(REGIONS,
                new RegionBoundingBox(0, 0, 100, 100), false));
    }

    @Test
    void completesConfidentScan() {
        stubGrading(OmrResult.detectionCount(7), FieldResult.extracted("GOMEZ PEREZ ANA", 0.85),
                FieldResult.extracted(VALID_CURP, 0.95));

        ScanResult result = pipeline.process(IMAGE, "sheet.jpg", null);

        assertThat(result.getStatus()).isEqualTo(ScanStatus.COMPLETED);
        assertThat(result.getRegions()).isEqualTo(REGIONS);
        assertThat(result.isRegionFallback()).isFalse();
        assertThat(result.getImageQuality().clarity()).isEqualTo(350.0);
        assertThat(result.getProcessedTime()).isEqualTo(clock.instant());
        assertThat(repository.get(result.getId())).hasValueSatisfying(stored ->
                assertThat(stored.getStatus()).isEqualTo(ScanStatus.COMPLETED));
        assertThat(publishedEvents()).extracting(ScanStatusEvent::type)
                .containsExactly(ScanStatusEvent.SCAN_UPDATE, ScanStatusEvent.SCAN_COMPLETE);
        assertThat(publishedEvents().get(1).score()).isEqualTo(7);
    }

    @Test
    void malformedBytesFailBeforeRegionDetection() {
        ScanPipeline realDecoding = pipeline(new ImageEnhancer(GradingProperties.defaults()), repository);

        ScanResult result = realDecoding.process("not an image".getBytes(StandardCharsets.UTF_8), "broken.jpg", null);

        assertThat(result.getStatus()).isEqualTo(ScanStatus.ERROR);
        assertThat(result.getErrorKind()).isEqualTo(ErrorKind.DECODE_ERROR);
        assertThat(result.getErrorMessage()).isNotBlank();
        assertThat(result.getRegions()).isNull();
        verify(detector, never()).detect(any(Mat.class));
        verify(backend, never()).gradeOmr(any(), any(), any());
        assertThat(publishedEvents()).extracting(ScanStatusEvent::type)
                .containsExactly(ScanStatusEvent.SCAN_UPDATE, ScanStatusEvent.SCAN_ERROR);
    }

    @Test
    void extractionFailureKeepsDetectedRegions() {
        when(backend.gradeOmr(any(Mat.class), any(RegionBoundingBox.class), isNull()))
                .thenReturn(OmrResult.detectionCount(4));
        when(backend.extractField(any(Mat.class), any(RegionBoundingBox.class), eq(RegionName.NOMBRE)))
                .thenReturn(FieldResult.extracted("ANA", 0.9));
        when(backend.extractField(any(Mat.class), any(RegionBoundingBox.class), eq(RegionName.CURP)))
                .thenThrow(new ExtractionException("Tesseract failed", null));

        ScanResult result = pipeline.process(IMAGE, "sheet.jpg", null);

        assertThat(result.getStatus()).isEqualTo(ScanStatus.ERROR);
        assertThat(result.getErrorKind()).isEqualTo(ErrorKind.EXTRACTION_ERROR);
        assertThat(result.getErrorMessage()).contains("Tesseract failed");
        assertThat(result.getRegions()).isEqualTo(REGIONS);
        assertThat(result.getImageQuality()).isNotNull();
        assertThat(repository.get(result.getId())).hasValueSatisfying(stored -> {
            assertThat(stored.getStatus()).isEqualTo(ScanStatus.ERROR);
            assertThat(stored.getRegions()).isEqualTo(REGIONS);
        });
    }

    @Test
    void unavailableBackendEndsInError() {
        when(backend.gradeOmr(any(Mat.class), any(RegionBoundingBox.class), any()))
                .thenThrow(new BackendUnavailableException("OMR service unavailable", null));
        when(backend.extractField(any(Mat.class), any(RegionBoundingBox.class), any(RegionName.class)))
                .thenReturn(FieldResult.extracted("ANA", 0.9));

        ScanResult result = pipeline.process(IMAGE, "sheet.jpg", null);

        assertThat(result.getStatus()).isEqualTo(ScanStatus.ERROR);
        assertThat(result.getErrorKind()).isEqualTo(ErrorKind.BACKEND_UNAVAILABLE);
    }

    @Test
    void unexpectedDetectorFailureIsCapturedAsExtractionError() {
        when(detector.detect(any(Mat.class))).thenThrow(new IllegalStateException("contour buffer exhausted"));

        ScanResult result = pipeline.process(IMAGE, "sheet.jpg", null);

        assertThat(result.getStatus()).isEqualTo(ScanStatus.ERROR);
        assertThat(result.getErrorKind()).isEqualTo(ErrorKind.EXTRACTION_ERROR);
        assertThat(result.getErrorMessage()).contains("contour buffer exhausted");
    }

    @Test
    void qualityAnalysisFailureIsNotFatal() {
        when(qualityAnalyzer.analyze(any(Mat.class))).thenThrow(new IllegalStateException("no lines"));
        stubGrading(OmrResult.detectionCount(3), FieldResult.extracted("ANA", 0.9),
                FieldResult.extracted(VALID_CURP, 0.95));

        ScanResult result = pipeline.process(IMAGE, "sheet.jpg", null);

        assertThat(result.getStatus()).isEqualTo(ScanStatus.COMPLETED);
        assertThat(result.getImageQuality()).isNull();
    }

    @Test
    void flagsRegionFallback() {
        when(detector.detect(any(Mat.class))).thenReturn(new DetectedRegions(REGIONS,
                new RegionBoundingBox(0, 0, 100, 100), true));
        stubGrading(OmrResult.detectionCount(3), FieldResult.extracted("ANA", 0.9),
                FieldResult.extracted(VALID_CURP, 0.95));

        ScanResult result = pipeline.process(IMAGE, "sheet.jpg", null);

        assertThat(result.isRegionFallback()).isTrue();
        assertThat(result.getStatus()).isEqualTo(ScanStatus.COMPLETED);
    }

    @Test
    void passesAnswerKeyToOmrGrading() {
        AnswerKey key = AnswerKey.parse("A,B");
        when(backend.gradeOmr(any(Mat.class), eq(REGIONS.omr()), eq(key)))
                .thenReturn(new OmrResult(1, List.of(true, false), 2, List.of("A", "C")));
        when(backend.extractField(any(Mat.class), any(RegionBoundingBox.class), any(RegionName.class)))
                .thenReturn(FieldResult.extracted(VALID_CURP, 0.95));

        ScanResult result = pipeline.process(IMAGE, "sheet.jpg", key);

        assertThat(result.getOmr().choices()).containsExactly("A", "C");
        verify(backend).extractField(any(Mat.class), eq(REGIONS.nombre()), eq(RegionName.NOMBRE));
        verify(backend).extractField(any(Mat.class), eq(REGIONS.curp()), eq(RegionName.CURP));
    }

    @Test
    void submitReturnsQueuedSnapshotAndProcessesInBackground() {
        stubGrading(OmrResult.detectionCount(0), FieldResult.extracted("ANA", 0.9),
                FieldResult.extracted(VALID_CURP, 0.95));

        ScanResult queued = pipeline.submit(IMAGE, "sheet.jpg", null);

        assertThat(queued.getStatus()).isEqualTo(ScanStatus.QUEUED);
        assertThat(repository.get(queued.getId())).hasValueSatisfying(stored ->
                assertThat(stored.getStatus()).isEqualTo(ScanStatus.NEEDS_REVIEW));
    }

    @Test
    void submitToFullQueueFailsFastAndRecordsError() {
        Executor full = task -> {
            throw new RejectedExecutionException("queue full");
        };
        ResultMerger merger = new ResultMerger(GradingProperties.defaults(), new CurpValidator());
        ScanPipeline busy = new ScanPipeline(enhancer, qualityAnalyzer, detector, backend, merger, repository,
                publisher, full, direct, clock);

        assertThatThrownBy(() -> busy.submit(IMAGE, "sheet.jpg", null))
                .isInstanceOf(PipelineBusyException.class);

        ScanStatusEvent event = publishedEvents().get(0);
        assertThat(event.type()).isEqualTo(ScanStatusEvent.SCAN_ERROR);
        assertThat(repository.get(event.scanId())).hasValueSatisfying(stored -> {
            assertThat(stored.getStatus()).isEqualTo(ScanStatus.ERROR);
            assertThat(stored.getErrorKind()).isEqualTo(ErrorKind.PIPELINE_BUSY);
        });
        verify(enhancer, never()).decode(any());
    }

    @Test
    void persistenceFailureSurfacesToCaller() {
        ScanRepository failing = mock(ScanRepository.class);
        doThrow(new PersistenceException("disk full")).when(failing).update(any(ScanResult.class));
        ScanPipeline withFailingStorage = pipeline(enhancer, failing);

        assertThatThrownBy(() -> withFailingStorage.process(IMAGE, "sheet.jpg", null))
                .isInstanceOf(PersistenceException.class)
                .hasMessage("disk full");
        verify(failing, times(1)).create(any(ScanResult.class));
    }

    private ScanPipeline pipeline(ImageEnhancer imageEnhancer, ScanRepository scanRepository) {
        ResultMerger merger = new ResultMerger(GradingProperties.defaults(), new CurpValidator());
        return new ScanPipeline(imageEnhancer, qualityAnalyzer, detector, backend, merger, scanRepository,
                publisher, direct, direct, clock);
    }

    private void stubGrading(OmrResult omr, FieldResult nombre, FieldResult curp) {
        when(backend.gradeOmr(any(Mat.class), any(RegionBoundingBox.class), any())).thenReturn(omr);
        when(backend.extractField(any(Mat.class), any(RegionBoundingBox.class), eq(RegionName.NOMBRE)))
                .thenReturn(nombre);
        when(backend.extractField(any(Mat.class), any(RegionBoundingBox.class), eq(RegionName.CURP)))
                .thenReturn(curp);
    }

    private List<ScanStatusEvent> publishedEvents() {
        ArgumentCaptor<ScanStatusEvent> captor = ArgumentCaptor.forClass(ScanStatusEvent.class);
        verify(publisher, atLeastOnce()).publish(captor.capture());
        return captor.getAllValues();
    }

    private static Mat image() {
        return new Mat(100, 100, opencv_core.CV_8UC3, new Scalar(255, 255, 255, 0));
    }
}
