package com.bubblegrade.service.preprocessing;

import com.bubblegrade.config.GradingProperties;
import com.bubblegrade.config.GradingProperties.EnhancementProperties;
import com.bubblegrade.exception.DecodeException;
import com.bubblegrade.util.ImageUtils;
import org.bytedeco.opencv.global.opencv_core;
import org.bytedeco.opencv.global.opencv_imgproc;
import org.bytedeco.opencv.opencv_core.Mat;
import org.bytedeco.opencv.opencv_core.MatVector;
import org.bytedeco.opencv.opencv_core.Size;
import org.bytedeco.opencv.opencv_imgproc.CLAHE;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Normalizes a photographed sheet before any region is located. Edge preserving smoothing removes
 * sensor noise from paper texture while local contrast equalization on the lightness channel
 * compensates for uneven lighting without shifting the ink colours.
 */
@Component
public class ImageEnhancer {

    private static final Logger log = LoggerFactory.getLogger(ImageEnhancer.class);

    private final EnhancementProperties properties;

    public ImageEnhancer(GradingProperties properties) {
        this.properties = properties.enhancement();
    }

    /**
     * Decodes an uploaded payload into a three channel BGR image.
     *
     * @throws DecodeException when the payload is missing or not a supported image format
     */
    public Mat decode(byte[] imageBytes) {
        if (imageBytes == null || imageBytes.length == 0) {
            throw new DecodeException("Image payload is empty");
        }
        Mat decoded;
        try {
            decoded = ImageUtils.readImage(imageBytes);
        } catch (RuntimeException ex) {
            throw new DecodeException("Unable to decode image payload", ex);
        }
        if (decoded == null || decoded.empty()) {
            throw new DecodeException("Unable to decode image payload");
        }
        log.debug("Decoded {}x{} image with {} channels", decoded.cols(), decoded.rows(), decoded.channels());
        return decoded;
    }

    /**
     * Bilateral filtering followed by CLAHE on the L channel of the Lab representation. Returns a
     * new image of the same size and channel count; the input is left untouched.
     */
    public Mat enhance(Mat image) {
        Mat denoised = new Mat();
        opencv_imgproc.bilateralFilter(image, denoised, properties.bilateralDiameter(),
                properties.bilateralSigmaColor(), properties.bilateralSigmaSpace());

        Mat lab = new Mat();
        opencv_imgproc.cvtColor(denoised, lab, opencv_imgproc.COLOR_BGR2Lab);
        denoised.close();

        MatVector channels = new MatVector();
        opencv_core.split(lab, channels);
        Mat lightness = channels.get(0);
        Mat equalized = new Mat();
        int tile = properties.claheTileSize();
        try (CLAHE clahe = opencv_imgproc.createCLAHE(properties.claheClipLimit(), new Size(tile, tile))) {
            clahe.apply(lightness, equalized);
        }
        channels.put(0, equalized);

        Mat merged = new Mat();
        opencv_core.merge(channels, merged);
        lab.close();

        Mat result = new Mat();
        opencv_imgproc.cvtColor(merged, result, opencv_imgproc.COLOR_Lab2BGR);
        merged.close();
        channels.close();
        log.debug("Enhanced {}x{} image", result.cols(), result.rows());
        return result;
    }
}
