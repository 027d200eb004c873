package com.splitttr.gateway.contents;

import java.time.Instant;

/**
 * A durable resource as seen by the contents store. {@code content} is {@code null} when the
 * model was fetched without content.
 */
public record ContentModel(
    String path,
    String name,
    String format,      // "text", "json", "base64"
    String type,        // "file", "notebook"
    String content,
    Instant lastModified
) {

    public static ContentModel of(String format, String type, String content) {
        return new ContentModel(null, null, format, type, content, null);
    }

    public ContentModel withContent(String newContent) {
        return new ContentModel(path, name, format, type, newContent, lastModified);
    }
}
