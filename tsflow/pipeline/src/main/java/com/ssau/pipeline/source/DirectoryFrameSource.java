package com.ssau.pipeline.source;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import com.ssau.pipeline.exception.MalformedTimestampException;
import com.ssau.pipeline.exception.NoTimestampInPathException;
import com.ssau.pipeline.model.Frame;
import com.ssau.pipeline.model.FrameInstant;

/**
 * Reads every timestamped file under a directory tree, ordered by path. File
 * contents are loaded only when the iterator reaches them.
 */
@Slf4j
public class DirectoryFrameSource implements FrameSource {

    @Getter
    private final Path root;

    public DirectoryFrameSource(Path root) {
        this.root = root;
    }

    @Override
    public Iterator<Frame> iterator() {
        List<Path> files = listFrameFiles();
        log.info("Found {} frame files under {}", files.size(), root.toAbsolutePath());
        Iterator<Path> paths = files.iterator();

        return new Iterator<>() {
            @Override
            public boolean hasNext() {
                return paths.hasNext();
            }

            @Override
            public Frame next() {
                if (!paths.hasNext()) {
                    throw new NoSuchElementException();
                }
                Path path = paths.next();
                try {
                    return Frame.of(FrameInstant.fromPath(path.toString()), path.toString(), Files.readAllBytes(path));
                } catch (IOException e) {
                    throw new UncheckedIOException("Failed to read frame " + path, e);
                }
            }
        };
    }

    private List<Path> listFrameFiles() {
        try (Stream<Path> walk = Files.walk(root)) {
            return walk
                .filter(Files::isRegularFile)
                .filter(DirectoryFrameSource::hasTimestamp)
                .sorted()
                .collect(Collectors.toList());
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to list frames under " + root, e);
        }
    }

    private static boolean hasTimestamp(Path path) {
        try {
            FrameInstant.fromPath(path.getFileName().toString());
            return true;
        } catch (NoTimestampInPathException e) {
            log.debug("Skipping {}: {}", path, e.getMessage());
            return false;
        } catch (MalformedTimestampException e) {
            log.warn("Skipping {}: {}", path, e.getMessage());
            return false;
        }
    }
}
