package com.ssau.auditor.service;

import org.bytedeco.opencv.global.opencv_core;
import org.bytedeco.opencv.global.opencv_imgcodecs;
import org.bytedeco.opencv.opencv_core.Mat;
import org.bytedeco.opencv.opencv_core.Scalar;

import lombok.extern.slf4j.Slf4j;

import com.ssau.pipeline.model.Frame;
import com.ssau.pipeline.step.Step;

/**
 * Decodes the frame payload and reports its dimensions and mean colour.
 */
@Slf4j
public class ImageStatsStep implements Step {

    private static final long serialVersionUID = 1L;

    @Override
    public Frame process(Frame frame) {
        byte[] content = frame.getContent();
        if (content == null || content.length == 0) {
            throw new IllegalArgumentException("empty image " + frame.getFilename());
        }

        Mat buffer = new Mat(1, content.length, opencv_core.CV_8UC1);
        Mat image = null;
        try {
            buffer.data().put(content);
            image = opencv_imgcodecs.imdecode(buffer, opencv_imgcodecs.IMREAD_COLOR);
            if (image == null || image.empty()) {
                throw new IllegalArgumentException("cannot decode image " + frame.getFilename());
            }

            Scalar mean = opencv_core.mean(image);
            frame.getReport().put("ImageWidth", image.cols());
            frame.getReport().put("ImageHeight", image.rows());
            // OpenCV decodes to BGR
            frame.getReport().put("MeanRed", mean.get(2));
            frame.getReport().put("MeanGreen", mean.get(1));
            frame.getReport().put("MeanBlue", mean.get(0));
            log.debug("Image {} is {}x{}", frame.getFilename(), image.cols(), image.rows());
            return frame;
        } finally {
            if (image != null) {
                image.release();
            }
            buffer.release();
        }
    }
}
