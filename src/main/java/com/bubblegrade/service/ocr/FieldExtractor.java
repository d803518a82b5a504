package com.bubblegrade.service.ocr;

import com.bubblegrade.config.GradingProperties;
import com.bubblegrade.config.GradingProperties.EnhancementProperties;
import com.bubblegrade.exception.ExtractionException;
import com.bubblegrade.model.FieldResult;
import com.bubblegrade.model.RegionBoundingBox;
import com.bubblegrade.model.RegionName;
import com.bubblegrade.service.ocr.TesseractOcrEngine.OcrResult;
import com.bubblegrade.util.ImageUtils;
import org.bytedeco.opencv.global.opencv_imgproc;
import org.bytedeco.opencv.opencv_core.Mat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Reads the handwritten name and the printed CURP. The name is smoothed with an edge preserving
 * filter so pen strokes survive; the CURP is binarized with Otsu's threshold since it is printed
 * on a uniform background.
 */
@Component
@ConditionalOnProperty(prefix = "bubblegrade.backend", name = "mode", havingValue = "local", matchIfMissing = true)
public class FieldExtractor {

    private static final Logger log = LoggerFactory.getLogger(FieldExtractor.class);

    private final TesseractOcrEngine ocrEngine;
    private final FieldNormalizer normalizer;
    private final EnhancementProperties enhancement;

    public FieldExtractor(TesseractOcrEngine ocrEngine, FieldNormalizer normalizer, GradingProperties properties) {
        this.ocrEngine = ocrEngine;
        this.normalizer = normalizer;
        this.enhancement = properties.enhancement();
    }

    public FieldResult extract(Mat enhanced, RegionBoundingBox region, RegionName field) {
        if (field == RegionName.OMR) {
            throw new IllegalArgumentException("The OMR region holds no text field");
        }
        try (Mat crop = ImageUtils.crop(enhanced, region); Mat prepared = prepare(crop, field)) {
            OcrResult raw = ocrEngine.recognize(prepared);
            FieldResult result = normalizer.normalize(field, raw.text(), raw.confidence());
            log.debug("Extracted {} '{}' with confidence {}", field.key(), result.text(), result.confidence());
            return result;
        } catch (ExtractionException ex) {
            throw ex;
        } catch (RuntimeException ex) {
            throw new ExtractionException("Failed to extract " + field.key() + ": " + ex.getMessage(), ex);
        }
    }

    Mat prepare(Mat crop, RegionName field) {
        try (Mat gray = ImageUtils.toGray(crop)) {
            Mat prepared = new Mat();
            if (field == RegionName.NOMBRE) {
                opencv_imgproc.bilateralFilter(gray, prepared, enhancement.bilateralDiameter(),
                        enhancement.bilateralSigmaColor(), enhancement.bilateralSigmaSpace());
            } else {
                opencv_imgproc.threshold(gray, prepared, 0, 255,
                        opencv_imgproc.THRESH_BINARY | opencv_imgproc.THRESH_OTSU);
            }
            return prepared;
        }
    }
}
