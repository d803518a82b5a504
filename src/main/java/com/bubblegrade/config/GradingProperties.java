package com.bubblegrade.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "bubblegrade")
public record GradingProperties(
        EnhancementProperties enhancement,
        LayoutProperties layout,
        OmrProperties omr,
        OcrProperties ocr,
        ReviewProperties review,
        BackendProperties backend,
        PipelineProperties pipeline) {

    public GradingProperties {
        enhancement = enhancement != null ? enhancement : EnhancementProperties.defaults();
        layout = layout != null ? layout : LayoutProperties.defaults();
        omr = omr != null ? omr : OmrProperties.defaults();
        ocr = ocr != null ? ocr : OcrProperties.defaults();
        review = review != null ? review : ReviewProperties.defaults();
        backend = backend != null ? backend : BackendProperties.defaults();
        pipeline = pipeline != null ? pipeline : PipelineProperties.defaults();
    }

    public static GradingProperties defaults() {
        return new GradingProperties(null, null, null, null, null, null, null);
    }

    public record EnhancementProperties(
            int bilateralDiameter,
            double bilateralSigmaColor,
            double bilateralSigmaSpace,
            double claheClipLimit,
            int claheTileSize) {

        public static EnhancementProperties defaults() {
            return new EnhancementProperties(9, 75, 75, 2.0, 8);
        }
    }

    /**
     * Proportions of the printed sheet template, relative to the detected document boundary.
     */
    public record LayoutProperties(
            double marginRatio,
            double widthRatio,
            double nombreTopRatio,
            double nombreHeightRatio,
            double curpTopRatio,
            double curpHeightRatio,
            double omrTopRatio,
            double approximationEpsilon,
            double cannyLowThreshold,
            double cannyHighThreshold) {

        public static LayoutProperties defaults() {
            return new LayoutProperties(0.05, 0.90, 0.05, 0.10, 0.17, 0.10, 0.30, 0.02, 50, 150);
        }
    }

    public record OmrProperties(
            double inverseResolution,
            double minDistance,
            double cannyThreshold,
            double accumulatorThreshold,
            int minRadius,
            int maxRadius,
            double relativeMarkThreshold,
            double absoluteMarkThreshold,
            double tieMargin) {

        public static OmrProperties defaults() {
            return new OmrProperties(1.2, 20, 50, 30, 10, 20, 25.0, 180.0, 15.0);
        }
    }

    public record OcrProperties(
            String language,
            String datapath,
            int pageSegMode,
            int engineMode) {

        public static OcrProperties defaults() {
            return new OcrProperties("spa", null, 7, 1);
        }
    }

    public record ReviewProperties(
            double nombreConfidenceThreshold,
            double curpConfidenceThreshold) {

        public static ReviewProperties defaults() {
            return new ReviewProperties(0.8, 0.9);
        }
    }

    public record BackendProperties(
            BackendMode mode,
            String omrUrl,
            String ocrUrl,
            Duration timeout) {

        public BackendProperties {
            mode = mode != null ? mode : BackendMode.LOCAL;
            timeout = timeout != null ? timeout : Duration.ofSeconds(60);
        }

        public static BackendProperties defaults() {
            return new BackendProperties(BackendMode.LOCAL, "http://omr:8090", "http://ocr:8100", Duration.ofSeconds(60));
        }
    }

    public record PipelineProperties(
            int scanThreads,
            int gradingThreads,
            int queueCapacity,
            long maxUploadBytes) {

        public static PipelineProperties defaults() {
            return new PipelineProperties(2, 3, 16, 10L * 1024 * 1024);
        }
    }

    public enum BackendMode {
        LOCAL,
        REMOTE
    }
}
