package com.ssau.pipeline.model;

import java.io.Serializable;
import java.util.LinkedHashMap;
import java.util.Map;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One file of a timestream flowing through a pipeline. Steps read the payload and
 * accumulate metrics in {@link #report}, which the driver records once the frame
 * comes back from the workers.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class Frame implements Serializable {

    private static final long serialVersionUID = 1L;

    private String filename;
    private FrameInstant instant;
    private byte[] content;
    private Map<String, Object> report = new LinkedHashMap<>();

    public static Frame of(String filename, byte[] content) {
        return of(FrameInstant.fromPath(filename), filename, content);
    }

    public static Frame of(FrameInstant instant, String filename, byte[] content) {
        return new Frame(filename, instant, content, new LinkedHashMap<>());
    }
}
