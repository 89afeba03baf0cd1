package org.javai.errata.storage;

import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * {@link Storage} backed by the default filesystem.
 */
public final class FileStorage implements Storage {

    private final Charset charset;

    public FileStorage() {
        this(StandardCharsets.UTF_8);
    }

    public FileStorage(Charset charset) {
        this.charset = Objects.requireNonNull(charset, "charset must not be null");
    }

    @Override
    public String readText(Path path) throws IOException {
        Objects.requireNonNull(path, "path must not be null");
        return Files.readString(path, charset);
    }

    @Override
    public void writeText(Path path, String content) throws IOException {
        Objects.requireNonNull(path, "path must not be null");
        Objects.requireNonNull(content, "content must not be null");
        Files.writeString(path, content, charset);
    }
}
