package com.bubblegrade.service.omr;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.bubblegrade.config.GradingProperties;
import com.bubblegrade.exception.ExtractionException;
import com.bubblegrade.model.AnswerKey;
import com.bubblegrade.model.OmrResult;
import com.bubblegrade.model.RegionBoundingBox;
import org.bytedeco.opencv.global.opencv_core;
import org.bytedeco.opencv.global.opencv_imgproc;
import org.bytedeco.opencv.opencv_core.Mat;
import org.bytedeco.opencv.opencv_core.Point;
import org.bytedeco.opencv.opencv_core.Scalar;
import org.junit.jupiter.api.Test;

class OmrGraderTest {

    private static final Scalar WHITE = new Scalar(255, 255, 255, 0);
    private static final Scalar BLACK = new Scalar(0, 0, 0, 0);

    private final OmrGrader grader = new OmrGrader(GradingProperties.defaults());

    @Test
    void blankRegionScoresZero() {
        Mat sheet = new Mat(300, 400, opencv_core.CV_8UC3, WHITE);

        OmrResult result = grader.grade(sheet, new RegionBoundingBox(0, 0, 400, 300), null);

        assertThat(result.score()).isZero();
        assertThat(result.total()).isZero();
        assertThat(result.answers()).isEmpty();
        assertThat(result.choices()).isEmpty();
    }

    @Test
    void countsDetectedBubblesWithoutAnswerKey() {
        Mat sheet = new Mat(300, 400, opencv_core.CV_8UC3, WHITE);
        for (int i = 0; i < 4; i++) {
            opencv_imgproc.circle(sheet, new Point(60 + i * 80, 150), 15, BLACK, opencv_imgproc.FILLED, opencv_imgproc.LINE_AA, 0);
        }

        OmrResult result = grader.grade(sheet, new RegionBoundingBox(0, 0, 400, 300), null);

        assertThat(result.score()).isPositive();
        assertThat(result.total()).isEqualTo(result.score());
        assertThat(result.answers()).hasSize(result.total()).containsOnly(true);
        assertThat(result.choices()).isEmpty();
    }

    @Test
    void gradesAgainstAnswerKeyWhenSupplied() {
        Mat sheet = new Mat(300, 400, opencv_core.CV_8UC3, WHITE);
        AnswerKey key = AnswerKey.parse("A,B,C");

        OmrResult result = grader.grade(sheet, new RegionBoundingBox(0, 0, 400, 300), key);

        assertThat(result.total()).isEqualTo(3);
        assertThat(result.score()).isZero();
        assertThat(result.answers()).containsExactly(false, false, false);
        assertThat(result.choices()).containsExactly("", "", "");
    }

    @Test
    void readsMarkedChoicesFromDrawnGrid() {
        // rows: A filled, C filled, B and D filled, nothing filled
        Mat sheet = answerGrid(new int[][] {{0}, {2}, {1, 3}, {}});
        AnswerKey key = AnswerKey.parse("A,C,B,D");

        OmrResult result = grader.grade(sheet, new RegionBoundingBox(0, 0, 400, 380), key);

        assertThat(result.choices()).containsExactly("A", "C", "", "");
        assertThat(result.answers()).containsExactly(true, true, false, false);
        assertThat(result.score()).isEqualTo(2);
        assertThat(result.total()).isEqualTo(4);
    }

    @Test
    void countsEveryBubbleOfDrawnGridWithoutAnswerKey() {
        Mat sheet = answerGrid(new int[][] {{0}, {2}, {1, 3}, {}});

        OmrResult result = grader.grade(sheet, new RegionBoundingBox(0, 0, 400, 380), null);

        assertThat(result.total()).isEqualTo(16);
        assertThat(result.score()).isEqualTo(16);
    }

    private static Mat answerGrid(int[][] filledPerRow) {
        Mat sheet = new Mat(380, 400, opencv_core.CV_8UC3, WHITE);
        for (int row = 0; row < filledPerRow.length; row++) {
            for (int column = 0; column < 4; column++) {
                Point centre = new Point(60 + column * 80, 60 + row * 80);
                opencv_imgproc.circle(sheet, centre, 15, BLACK, 2, opencv_imgproc.LINE_8, 0);
                for (int filled : filledPerRow[row]) {
                    if (filled == column) {
                        opencv_imgproc.circle(sheet, centre, 15, BLACK, opencv_imgproc.FILLED, opencv_imgproc.LINE_8, 0);
                    }
                }
            }
        }
        return sheet;
    }

    @Test
    void wrapsRegionOutsideImageAsExtractionFailure() {
        Mat sheet = new Mat(100, 100, opencv_core.CV_8UC3, WHITE);

        assertThatThrownBy(() -> grader.grade(sheet, new RegionBoundingBox(200, 200, 10, 10), null))
                .isInstanceOf(ExtractionException.class);
    }
}
