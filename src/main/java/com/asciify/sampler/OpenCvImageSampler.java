package com.asciify.sampler;

import com.asciify.pipeline.PixelBuffer;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.bytedeco.javacpp.BytePointer;
import org.bytedeco.opencv.opencv_core.Mat;
import org.bytedeco.opencv.opencv_core.Size;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.IOException;

import static org.bytedeco.opencv.global.opencv_core.CV_16U;
import static org.bytedeco.opencv.global.opencv_core.CV_8U;
import static org.bytedeco.opencv.global.opencv_core.CV_8UC1;
import static org.bytedeco.opencv.global.opencv_core.CV_8UC4;
import static org.bytedeco.opencv.global.opencv_imgcodecs.IMREAD_UNCHANGED;
import static org.bytedeco.opencv.global.opencv_imgcodecs.imdecode;
import static org.bytedeco.opencv.global.opencv_imgproc.COLOR_BGR2RGBA;
import static org.bytedeco.opencv.global.opencv_imgproc.COLOR_BGRA2RGBA;
import static org.bytedeco.opencv.global.opencv_imgproc.COLOR_GRAY2RGBA;
import static org.bytedeco.opencv.global.opencv_imgproc.INTER_AREA;
import static org.bytedeco.opencv.global.opencv_imgproc.cvtColor;
import static org.bytedeco.opencv.global.opencv_imgproc.resize;

/**
 * Decodes encoded image bytes (PNG, JPEG, BMP, WebP...) with OpenCV and area-resamples them to the cell grid.
 * Formats OpenCV cannot read, such as GIF, are decoded with ImageIO instead.
 * Alpha is kept when the source has it, otherwise every sample is opaque.
 */
@Slf4j
@Getter
public class OpenCvImageSampler implements ImageSampler<byte[]> {
    private final double charAspect;

    public OpenCvImageSampler() {
        this(DEFAULT_CHAR_ASPECT);
    }

    public OpenCvImageSampler(double charAspect) {
        this.charAspect = charAspect;
    }

    @Override
    public PixelBuffer sample(byte[] encoded, int width) throws ImageLoadException {
        if (encoded == null || encoded.length == 0) {
            throw new ImageLoadException("Empty image data");
        }
        try (BytePointer bytes = new BytePointer(encoded);
             Mat raw = new Mat(1, encoded.length, CV_8UC1, bytes);
             Mat decoded = imdecode(raw, IMREAD_UNCHANGED)) {
            if (decoded == null || decoded.empty()) {
                // no GIF codec in OpenCV; ImageIO reads the first frame
                return sampleWithImageIO(encoded, width);
            }
            log.debug("Decoded {}x{} image with {} channel(s)", decoded.cols(), decoded.rows(), decoded.channels());
            try (Mat rgba = toRgba(decoded)) {
                return resizeToCells(rgba, width);
            }
        }
    }

    private PixelBuffer sampleWithImageIO(byte[] encoded, int width) throws ImageLoadException {
        BufferedImage image;
        try {
            image = ImageIO.read(new ByteArrayInputStream(encoded));
        } catch (IOException e) {
            throw new ImageLoadException("Unsupported or corrupt image data (" + encoded.length + " bytes)", e);
        }
        if (image == null) {
            throw new ImageLoadException("Unsupported or corrupt image data (" + encoded.length + " bytes)");
        }
        int w = image.getWidth();
        int h = image.getHeight();
        byte[] rgbaBytes = new byte[w * h * PixelBuffer.CHANNELS];
        int i = 0;
        for (int y = 0; y < h; y++) {
            for (int x = 0; x < w; x++) {
                int argb = image.getRGB(x, y);
                rgbaBytes[i++] = (byte) (argb >> 16);
                rgbaBytes[i++] = (byte) (argb >> 8);
                rgbaBytes[i++] = (byte) argb;
                rgbaBytes[i++] = (byte) (argb >>> 24);
            }
        }
        log.debug("Decoded {}x{} image through ImageIO", w, h);
        try (BytePointer pixels = new BytePointer(rgbaBytes);
             Mat rgba = new Mat(h, w, CV_8UC4, pixels)) {
            return resizeToCells(rgba, width);
        }
    }

    private PixelBuffer resizeToCells(Mat rgba, int width) {
        int height = ImageSampler.rowsFor(rgba.cols(), rgba.rows(), width, charAspect);
        ImageSampler.checkCellCount(width, height);
        try (Mat resized = new Mat()) {
            resize(rgba, resized, new Size(width, height), 0, 0, INTER_AREA);
            byte[] out = new byte[width * height * PixelBuffer.CHANNELS];
            resized.data().get(out);
            return new PixelBuffer(width, height, out);
        }
    }

    private static Mat toRgba(Mat decoded) throws ImageLoadException {
        Mat eightBit = decoded;
        if (decoded.depth() == CV_16U) {
            eightBit = new Mat();
            decoded.convertTo(eightBit, CV_8U, 1.0 / 257, 0);
        } else if (decoded.depth() != CV_8U) {
            throw new ImageLoadException("Unsupported sample depth: " + decoded.depth());
        }

        Mat rgba = new Mat();
        switch (eightBit.channels()) {
            case 1:
                cvtColor(eightBit, rgba, COLOR_GRAY2RGBA);
                break;
            case 3:
                cvtColor(eightBit, rgba, COLOR_BGR2RGBA);
                break;
            case 4:
                cvtColor(eightBit, rgba, COLOR_BGRA2RGBA);
                break;
            default:
                rgba.close();
                throw new ImageLoadException("Unsupported channel count: " + eightBit.channels());
        }
        if (eightBit != decoded) {
            eightBit.close();
        }
        return rgba;
    }
}
