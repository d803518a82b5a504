package com.bubblegrade.service.detection;

import com.bubblegrade.config.GradingProperties;
import com.bubblegrade.config.GradingProperties.LayoutProperties;
import com.bubblegrade.model.RegionBoundingBox;
import com.bubblegrade.util.ImageUtils;
import org.bytedeco.opencv.global.opencv_imgproc;
import org.bytedeco.opencv.opencv_core.Mat;
import org.bytedeco.opencv.opencv_core.MatVector;
import org.bytedeco.opencv.opencv_core.Rect;
import org.bytedeco.opencv.opencv_core.Size;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Locates the sheet inside the photograph through edge detection and polygon approximation of the
 * dominant contour, then splits it into the template regions.
 */
@Component
public class RegionDetector {

    private static final Logger log = LoggerFactory.getLogger(RegionDetector.class);

    private final LayoutProperties layout;
    private final RegionLayout regionLayout;

    public RegionDetector(GradingProperties properties, RegionLayout regionLayout) {
        this.layout = properties.layout();
        this.regionLayout = regionLayout;
    }

    public DetectedRegions detect(Mat enhanced) {
        int imageWidth = enhanced.cols();
        int imageHeight = enhanced.rows();
        Rect boundary = findDocumentBoundary(enhanced);
        boolean fallback = boundary == null;
        if (fallback) {
            log.warn("No four-cornered document boundary found in {}x{} image; using the full frame",
                    imageWidth, imageHeight);
            boundary = new Rect(0, 0, imageWidth, imageHeight);
        } else {
            log.debug("Document boundary at x={} y={} w={} h={}",
                    boundary.x(), boundary.y(), boundary.width(), boundary.height());
        }
        RegionBoundingBox boundaryBox = RegionLayout.clip(boundary.x(), boundary.y(),
                boundary.width(), boundary.height(), imageWidth, imageHeight);
        return new DetectedRegions(
                regionLayout.partition(boundary.x(), boundary.y(), boundary.width(), boundary.height(),
                        imageWidth, imageHeight),
                boundaryBox,
                fallback);
    }

    private Rect findDocumentBoundary(Mat enhanced) {
        try (Mat gray = ImageUtils.toGray(enhanced);
                Mat blurred = new Mat();
                Mat edges = new Mat();
                Mat hierarchy = new Mat();
                MatVector contours = new MatVector()) {
            opencv_imgproc.GaussianBlur(gray, blurred, new Size(5, 5), 0);
            opencv_imgproc.Canny(blurred, edges, layout.cannyLowThreshold(), layout.cannyHighThreshold());
            opencv_imgproc.findContours(edges, contours, hierarchy,
                    opencv_imgproc.RETR_EXTERNAL, opencv_imgproc.CHAIN_APPROX_SIMPLE);
            if (contours.size() == 0) {
                return null;
            }

            Mat largest = null;
            double largestArea = -1;
            for (long i = 0; i < contours.size(); i++) {
                Mat contour = contours.get(i);
                double area = opencv_imgproc.contourArea(contour);
                if (area > largestArea) {
                    largestArea = area;
                    largest = contour;
                }
            }

            try (Mat approx = new Mat()) {
                double perimeter = opencv_imgproc.arcLength(largest, true);
                opencv_imgproc.approxPolyDP(largest, approx, layout.approximationEpsilon() * perimeter, true);
                if (approx.total() != 4) {
                    log.debug("Largest contour approximates to {} vertices", approx.total());
                    return null;
                }
                return opencv_imgproc.boundingRect(approx);
            }
        }
    }
}
