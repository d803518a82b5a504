package com.bubblegrade.service.omr;

import com.bubblegrade.config.GradingProperties;
import com.bubblegrade.config.GradingProperties.OmrProperties;
import com.bubblegrade.exception.ExtractionException;
import com.bubblegrade.model.AnswerKey;
import com.bubblegrade.model.OmrResult;
import com.bubblegrade.model.RegionBoundingBox;
import com.bubblegrade.service.omr.BubbleGrid.Circle;
import com.bubblegrade.util.ImageUtils;
import java.util.ArrayList;
import java.util.List;
import org.bytedeco.opencv.global.opencv_core;
import org.bytedeco.opencv.global.opencv_imgproc;
import org.bytedeco.opencv.opencv_core.Mat;
import org.bytedeco.opencv.opencv_core.Rect;
import org.bytedeco.opencv.opencv_core.Size;
import org.bytedeco.opencv.opencv_imgproc.Vec3fVector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Detects the bubbles of the answer grid with a Hough circle transform. Without an answer key every
 * detected bubble counts as one answered question; with a key, each question row is read and
 * compared against the expected choice.
 */
@Component
public class OmrGrader {

    private static final Logger log = LoggerFactory.getLogger(OmrGrader.class);

    private final OmrProperties properties;

    public OmrGrader(GradingProperties properties) {
        this.properties = properties.omr();
    }

    /**
     * @param answerKey expected choices, or {@code null} to grade in detection-count mode
     */
    public OmrResult grade(Mat enhanced, RegionBoundingBox region, AnswerKey answerKey) {
        try (Mat crop = ImageUtils.crop(enhanced, region);
                Mat gray = ImageUtils.toGray(crop);
                Mat blurred = new Mat()) {
            opencv_imgproc.GaussianBlur(gray, blurred, new Size(5, 5), 0);
            List<Circle> circles = detectCircles(blurred);
            if (answerKey == null) {
                log.debug("Detected {} bubbles in OMR region", circles.size());
                return OmrResult.detectionCount(circles.size());
            }
            return gradeAgainstKey(gray, circles, answerKey);
        } catch (RuntimeException ex) {
            throw new ExtractionException("OMR grading failed: " + ex.getMessage(), ex);
        }
    }

    private List<Circle> detectCircles(Mat blurred) {
        List<Circle> circles = new ArrayList<>();
        try (Vec3fVector detected = new Vec3fVector()) {
            opencv_imgproc.HoughCircles(blurred, detected, opencv_imgproc.HOUGH_GRADIENT,
                    properties.inverseResolution(), properties.minDistance(),
                    properties.cannyThreshold(), properties.accumulatorThreshold(),
                    properties.minRadius(), properties.maxRadius());
            for (long i = 0; i < detected.size(); i++) {
                circles.add(new Circle(detected.get(i).get(0), detected.get(i).get(1), detected.get(i).get(2)));
            }
        }
        return circles;
    }

    private OmrResult gradeAgainstKey(Mat gray, List<Circle> circles, AnswerKey answerKey) {
        List<List<Circle>> rows = BubbleGrid.rows(circles);
        if (rows.size() != answerKey.size()) {
            log.warn("Answer key has {} questions but {} bubble rows were found", answerKey.size(), rows.size());
        }
        List<String> choices = new ArrayList<>(answerKey.size());
        List<Boolean> answers = new ArrayList<>(answerKey.size());
        int score = 0;
        for (int question = 0; question < answerKey.size(); question++) {
            String choice = BubbleGrid.NO_ANSWER;
            if (question < rows.size()) {
                List<Circle> row = rows.get(question);
                double[] intensities = new double[row.size()];
                for (int i = 0; i < row.size(); i++) {
                    intensities[i] = meanIntensity(gray, row.get(i));
                }
                choice = BubbleGrid.markedChoice(intensities, properties.relativeMarkThreshold(),
                        properties.absoluteMarkThreshold(), properties.tieMargin());
            }
            boolean correct = answerKey.isCorrect(question, choice);
            if (correct) {
                score++;
            }
            choices.add(choice);
            answers.add(correct);
        }
        log.debug("Graded {} questions against answer key, {} correct", answerKey.size(), score);
        return new OmrResult(score, answers, answerKey.size(), choices);
    }

    private double meanIntensity(Mat gray, Circle circle) {
        int radius = (int) Math.ceil(circle.radius());
        int x0 = Math.max((int) circle.x() - radius, 0);
        int y0 = Math.max((int) circle.y() - radius, 0);
        int width = Math.min(radius * 2, gray.cols() - x0);
        int height = Math.min(radius * 2, gray.rows() - y0);
        if (width <= 0 || height <= 0) {
            return 255.0;
        }
        try (Mat bubble = new Mat(gray, new Rect(x0, y0, width, height))) {
            return opencv_core.mean(bubble).get(0);
        }
    }
}
