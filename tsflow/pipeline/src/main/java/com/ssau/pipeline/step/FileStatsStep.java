package com.ssau.pipeline.step;

import com.ssau.pipeline.model.Frame;

public class FileStatsStep implements Step {

    private static final long serialVersionUID = 1L;

    @Override
    public Frame process(Frame frame) {
        String name = frame.getFilename();
        int slash = Math.max(name.lastIndexOf('/'), name.lastIndexOf('\\'));
        frame.getReport().put("FileName", name.substring(slash + 1));
        frame.getReport().put("FileSize", frame.getContent() == null ? 0 : frame.getContent().length);
        return frame;
    }
}
