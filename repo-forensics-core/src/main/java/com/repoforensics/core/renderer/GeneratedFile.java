package com.repoforensics.core.renderer;

import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * A report ready to be written or printed.
 *
 * @param fileName file name relative to the output directory (e.g. "myrepo_developer_ranking.json")
 * @param content report content
 * @param contentType MIME type of the content, may be null
 */
public record GeneratedFile(
    String fileName,
    String content,
    String contentType
) {
    public GeneratedFile {
        Objects.requireNonNull(fileName, "fileName must not be null");
        Objects.requireNonNull(content, "content must not be null");
        if (fileName.isBlank()) {
            throw new IllegalArgumentException("fileName must not be blank");
        }
    }

    /**
     * Returns the size of the content once encoded as UTF-8.
     *
     * @return size in bytes
     */
    public int sizeInBytes() {
        return content.getBytes(StandardCharsets.UTF_8).length;
    }

    /**
     * Returns whether the file has the given content type.
     *
     * @param type MIME type
     * @return true if the content type matches, ignoring case
     */
    public boolean hasContentType(String type) {
        return contentType != null && contentType.equalsIgnoreCase(type);
    }
}
