package com.bubblegrade.service.preprocessing;

import com.bubblegrade.model.ImageQuality;
import com.bubblegrade.util.ImageUtils;
import org.bytedeco.javacpp.indexer.DoubleIndexer;
import org.bytedeco.opencv.global.opencv_core;
import org.bytedeco.opencv.global.opencv_imgproc;
import org.bytedeco.opencv.opencv_core.Mat;
import org.bytedeco.opencv.opencv_imgproc.Vec2fVector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Computes diagnostic quality metrics of an enhanced sheet: resolution, sharpness as the variance
 * of the Laplacian and skew as the mean angle of the near-horizontal Hough lines.
 */
@Component
public class ImageQualityAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(ImageQualityAnalyzer.class);

    private static final double NEAR_HORIZONTAL_DEGREES = 10.0;

    public ImageQuality analyze(Mat image) {
        try (Mat gray = ImageUtils.toGray(image)) {
            double clarity = laplacianVariance(gray);
            double skew = skewDegrees(gray);
            ImageQuality quality = new ImageQuality(image.cols(), image.rows(), clarity, skew);
            log.debug("Image quality {}", quality);
            return quality;
        }
    }

    private double laplacianVariance(Mat gray) {
        try (Mat laplacian = new Mat(); Mat mean = new Mat(); Mat stddev = new Mat()) {
            opencv_imgproc.Laplacian(gray, laplacian, opencv_core.CV_64F);
            opencv_core.meanStdDev(laplacian, mean, stddev);
            try (DoubleIndexer indexer = stddev.createIndexer()) {
                double deviation = indexer.get(0);
                return deviation * deviation;
            }
        }
    }

    /**
     * Only lines whose Hough angle lies within ten degrees of the axis are counted. Each angle is
     * folded into [-90, 90] before averaging.
     */
    private double skewDegrees(Mat gray) {
        try (Mat edges = new Mat(); Vec2fVector lines = new Vec2fVector()) {
            opencv_imgproc.Canny(gray, edges, 50, 150);
            opencv_imgproc.HoughLines(edges, lines, 1, Math.PI / 180, 100, 0, 0, 0, Math.PI);
            double sum = 0.0;
            int count = 0;
            for (long i = 0; i < lines.size(); i++) {
                double degrees = Math.toDegrees(lines.get(i).get(1));
                double deviation = degrees > 90 ? degrees - 180 : degrees;
                if (Math.abs(deviation) < NEAR_HORIZONTAL_DEGREES) {
                    sum += deviation;
                    count++;
                }
            }
            return count == 0 ? 0.0 : sum / count;
        }
    }
}
