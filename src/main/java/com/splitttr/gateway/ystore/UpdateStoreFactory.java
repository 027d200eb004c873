package com.splitttr.gateway.ystore;

/**
 * Opens the update log belonging to a document.
 */
@FunctionalInterface
public interface UpdateStoreFactory {

    /**
     * @param documentPath path of the document in the contents store
     * @param fileType     document type, part of the log name so that two views of one file do
     *                     not share a log
     */
    UpdateStore open(String documentPath, String fileType);
}
