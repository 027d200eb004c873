package com.splitttr.gateway.ystore;

import com.splitttr.gateway.contents.StorageException;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Places each update log next to its document as a hidden {@code .<type>:<name>.y} file.
 */
public final class FileUpdateStoreFactory implements UpdateStoreFactory {

    private final Path root;

    public FileUpdateStoreFactory(Path root) {
        this.root = Objects.requireNonNull(root, "root").toAbsolutePath().normalize();
    }

    @Override
    public UpdateStore open(String documentPath, String fileType) {
        return new FileUpdateStore(logPath(documentPath, fileType));
    }

    public Path logPath(String documentPath, String fileType) {
        String relative = documentPath.startsWith("/") ? documentPath.substring(1) : documentPath;
        Path document = root.resolve(relative).normalize();
        if (!document.startsWith(root) || document.equals(root)) {
            throw new StorageException("Path '" + documentPath + "' is outside of the update log root");
        }
        return document.resolveSibling("." + fileType + ":" + document.getFileName() + ".y");
    }
}
