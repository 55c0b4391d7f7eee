package io.shuttle.core.body;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * One field of a {@link MultipartFormBody}: either a text value or a file upload.
 */
public final class Part {

    private final String name;
    private final String filename;
    private final String contentType;
    private final byte[] content;

    private Part(String name, String filename, String contentType, byte[] content) {
        this.name = Objects.requireNonNull(name, "name");
        this.filename = filename;
        this.contentType = contentType;
        this.content = Objects.requireNonNull(content, "content");
    }

    public static Part text(String name, String value) {
        return new Part(name, null, null, Objects.requireNonNull(value, "value").getBytes(StandardCharsets.UTF_8));
    }

    public static Part file(String name, String filename, String contentType, byte[] content) {
        return new Part(name, Objects.requireNonNull(filename, "filename"), contentType, content.clone());
    }

    /**
     * Reads {@code file} eagerly; the upload uses the file's own name.
     *
     * @throws UncheckedIOException if the file cannot be read
     */
    public static Part file(String name, Path file, String contentType) {
        try {
            return file(name, file.getFileName().toString(), contentType, Files.readAllBytes(file));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read upload " + file, e);
        }
    }

    public String name() { return name; }
    public String filename() { return filename; }
    public String contentType() { return contentType; }
    public boolean isFile() { return filename != null; }

    byte[] content() {
        return content;
    }
}
