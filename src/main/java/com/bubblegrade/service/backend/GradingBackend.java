package com.bubblegrade.service.backend;

import com.bubblegrade.model.AnswerKey;
import com.bubblegrade.model.FieldResult;
import com.bubblegrade.model.OmrResult;
import com.bubblegrade.model.RegionBoundingBox;
import com.bubblegrade.model.RegionName;
import org.bytedeco.opencv.opencv_core.Mat;

/**
 * Grading capabilities the pipeline relies on. Implementations must be safe to call concurrently
 * for different regions of the same enhanced image and must not modify that image.
 */
public interface GradingBackend {

    /**
     * @param answerKey expected choices, or {@code null} for detection-count grading
     */
    OmrResult gradeOmr(Mat enhanced, RegionBoundingBox region, AnswerKey answerKey);

    FieldResult extractField(Mat enhanced, RegionBoundingBox region, RegionName field);
}
