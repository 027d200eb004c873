package com.splitttr.gateway.ydoc;

/**
 * Creates empty {@link SharedDocument} replicas for a document type.
 */
@FunctionalInterface
public interface DocumentEngine {

    SharedDocument create(String fileType);
}
