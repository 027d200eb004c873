package com.splitttr.gateway.contents;

import java.util.Optional;

/**
 * Assigns stable identifiers to stored resources. An id keeps pointing at its resource when the
 * resource is moved through {@link #move(String, String)}.
 */
public interface FileIdManager {

    Optional<String> getId(String path);

    /**
     * Returns the id of {@code path}, creating one if needed; empty when no resource exists at
     * {@code path}.
     */
    Optional<String> index(String path);

    Optional<String> getPath(String fileId);

    void move(String oldPath, String newPath);
}
