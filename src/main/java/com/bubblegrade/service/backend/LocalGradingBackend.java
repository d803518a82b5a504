package com.bubblegrade.service.backend;

import com.bubblegrade.model.AnswerKey;
import com.bubblegrade.model.FieldResult;
import com.bubblegrade.model.OmrResult;
import com.bubblegrade.model.RegionBoundingBox;
import com.bubblegrade.model.RegionName;
import com.bubblegrade.service.ocr.FieldExtractor;
import com.bubblegrade.service.omr.OmrGrader;
import org.bytedeco.opencv.opencv_core.Mat;

/**
 * Grades in process with OpenCV and Tesseract.
 */
public class LocalGradingBackend implements GradingBackend {

    private final OmrGrader omrGrader;
    private final FieldExtractor fieldExtractor;

    public LocalGradingBackend(OmrGrader omrGrader, FieldExtractor fieldExtractor) {
        this.omrGrader = omrGrader;
        this.fieldExtractor = fieldExtractor;
    }

    @Override
    public OmrResult gradeOmr(Mat enhanced, RegionBoundingBox region, AnswerKey answerKey) {
        return omrGrader.grade(enhanced, region, answerKey);
    }

    @Override
    public FieldResult extractField(Mat enhanced, RegionBoundingBox region, RegionName field) {
        return fieldExtractor.extract(enhanced, region, field);
    }
}
