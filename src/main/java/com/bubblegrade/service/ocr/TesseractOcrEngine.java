package com.bubblegrade.service.ocr;

import com.bubblegrade.exception.ExtractionException;
import com.bubblegrade.util.ImageUtils;
import java.awt.image.BufferedImage;
import java.util.List;
import java.util.Objects;
import java.util.OptionalDouble;
import net.sourceforge.tess4j.ITessAPI;
import net.sourceforge.tess4j.ITesseract;
import net.sourceforge.tess4j.TesseractException;
import net.sourceforge.tess4j.Word;
import org.bytedeco.opencv.opencv_core.Mat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Single-line OCR over a preprocessed field image. The underlying engine keeps native state and
 * is not thread safe, so recognition is serialized on this instance.
 */
@Component
@ConditionalOnProperty(prefix = "bubblegrade.backend", name = "mode", havingValue = "local", matchIfMissing = true)
public class TesseractOcrEngine {

    private static final Logger log = LoggerFactory.getLogger(TesseractOcrEngine.class);

    private final ITesseract tesseract;

    public TesseractOcrEngine(ITesseract tesseract) {
        this.tesseract = Objects.requireNonNull(tesseract, "tesseract");
    }

    public synchronized OcrResult recognize(Mat fieldImage) {
        BufferedImage image = ImageUtils.matToBufferedImage(fieldImage);
        String text;
        try {
            text = tesseract.doOCR(image);
        } catch (TesseractException ex) {
            throw new ExtractionException("Tesseract failed: " + ex.getMessage(), ex);
        }
        String trimmed = text == null ? "" : text.trim();
        double confidence = readConfidence(image);
        log.debug("OCR recognized '{}' with confidence {}", trimmed, confidence);
        return new OcrResult(trimmed, confidence);
    }

    private double readConfidence(BufferedImage image) {
        try {
            List<Word> words = tesseract.getWords(image, ITessAPI.TessPageIteratorLevel.RIL_WORD);
            if (words == null || words.isEmpty()) {
                return 0.0;
            }
            OptionalDouble average = words.stream()
                    .mapToDouble(Word::getConfidence)
                    .filter(value -> value >= 0)
                    .average();
            if (average.isEmpty()) {
                return 0.0;
            }
            double scaled = average.getAsDouble() / 100.0;
            if (!Double.isFinite(scaled)) {
                return 0.0;
            }
            return Math.max(0.0, Math.min(1.0, scaled));
        } catch (RuntimeException ex) {
            throw new ExtractionException("Tesseract confidence retrieval failed: " + ex.getMessage(), ex);
        }
    }

    public record OcrResult(String text, double confidence) {
    }
}
