package com.ssau.pipeline.sink;

import java.io.IOException;
import java.io.Serializable;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

import lombok.extern.slf4j.Slf4j;

import com.ssau.pipeline.model.Frame;

/**
 * Writes frame payloads as plain files into one directory, keyed by the frame's
 * base file name.
 */
@Slf4j
public class DirectoryFrameSink implements FrameSink, Serializable {

    private static final long serialVersionUID = 1L;

    private final String outputDir;

    public DirectoryFrameSink(Path outputDir) {
        this.outputDir = outputDir.toAbsolutePath().normalize().toString();
    }

    @Override
    public void write(Frame frame) throws IOException {
        Path dirPath = Paths.get(outputDir);
        Files.createDirectories(dirPath);

        Path filePath = dirPath.resolve(Paths.get(frame.getFilename()).getFileName());
        Files.write(filePath, frame.getContent());
        log.debug("Wrote {} ({} bytes)", filePath, frame.getContent().length);
    }

    public Path getOutputDir() {
        return Paths.get(outputDir);
    }
}
