package org.javai.errata.storage;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Text storage the pipeline and the config loader read from.
 * Failures surface as {@link IOException}; callers cross into outcome-space through a
 * {@link org.javai.errata.boundary.Boundary}.
 */
public interface Storage {

    /**
     * Reads the whole text at {@code path}.
     *
     * @throws java.nio.file.NoSuchFileException if nothing is stored at {@code path}
     * @throws IOException on any other read failure
     */
    String readText(Path path) throws IOException;

    /**
     * Replaces the text at {@code path} with {@code content}.
     */
    void writeText(Path path, String content) throws IOException;
}
