package com.splitttr.gateway.contents;

/**
 * Durable storage of file-like resources addressed by a relative path.
 */
public interface ContentsStore {

    /**
     * @throws ContentNotFoundException if nothing exists at {@code path}
     * @throws StorageException on any other read failure
     */
    ContentModel get(String path, String format, String type, boolean includeContent);

    /**
     * Writes {@code model.content()} to {@code path} and returns the stored model, whose
     * {@code lastModified} reflects this write.
     *
     * @throws StorageException on write failure
     */
    ContentModel save(String path, ContentModel model);

    boolean exists(String path);
}
