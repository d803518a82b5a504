package com.bubblegrade.util;

import com.bubblegrade.model.RegionBoundingBox;
import java.awt.image.BufferedImage;
import java.awt.image.DataBufferByte;
import org.bytedeco.javacpp.BytePointer;
import org.bytedeco.opencv.global.opencv_imgcodecs;
import org.bytedeco.opencv.global.opencv_imgproc;
import org.bytedeco.opencv.opencv_core.Mat;
import org.bytedeco.opencv.opencv_core.Rect;

public final class ImageUtils {

    private ImageUtils() {
    }

    public static Mat readImage(byte[] data) {
        try (Mat buffer = new Mat(data)) {
            return opencv_imgcodecs.imdecode(buffer, opencv_imgcodecs.IMREAD_COLOR);
        }
    }

    public static byte[] encode(Mat image, String extension) {
        try (BytePointer buffer = new BytePointer()) {
            boolean encoded = opencv_imgcodecs.imencode(extension, image, buffer);
            if (!encoded) {
                throw new IllegalStateException("Failed to encode image as " + extension);
            }
            byte[] bytes = new byte[(int) buffer.limit()];
            buffer.get(bytes);
            return bytes;
        }
    }

    public static BufferedImage matToBufferedImage(Mat mat) {
        Mat source = mat.isContinuous() ? mat : mat.clone();
        int type = BufferedImage.TYPE_3BYTE_BGR;
        if (source.channels() == 1) {
            type = BufferedImage.TYPE_BYTE_GRAY;
        }
        int bufferSize = source.channels() * source.cols() * source.rows();
        byte[] buffer = new byte[bufferSize];
        source.data().get(buffer);
        BufferedImage image = new BufferedImage(source.cols(), source.rows(), type);
        byte[] target = ((DataBufferByte) image.getRaster().getDataBuffer()).getData();
        System.arraycopy(buffer, 0, target, 0, buffer.length);
        if (source != mat) {
            source.close();
        }
        return image;
    }

    /**
     * Copies the region out of the source so the crop does not share pixels with it.
     */
    public static Mat crop(Mat source, RegionBoundingBox box) {
        Rect rect = clipRect(new Rect(box.x(), box.y(), box.width(), box.height()), source);
        if (rect.width() <= 0 || rect.height() <= 0) {
            throw new IllegalArgumentException("Region " + box + " lies outside the image");
        }
        try (Mat view = new Mat(source, rect)) {
            return view.clone();
        }
    }

    public static Mat toGray(Mat input) {
        Mat gray = new Mat();
        if (input.channels() == 3) {
            opencv_imgproc.cvtColor(input, gray, opencv_imgproc.COLOR_BGR2GRAY);
        } else {
            input.copyTo(gray);
        }
        return gray;
    }

    public static Rect clipRect(Rect rect, Mat bounds) {
        int x = Math.max(rect.x(), 0);
        int y = Math.max(rect.y(), 0);
        int w = Math.min(rect.width(), bounds.cols() - x);
        int h = Math.min(rect.height(), bounds.rows() - y);
        return new Rect(x, y, Math.max(w, 0), Math.max(h, 0));
    }
}
