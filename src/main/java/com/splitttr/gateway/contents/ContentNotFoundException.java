package com.splitttr.gateway.contents;

public class ContentNotFoundException extends StorageException {

    private final String path;

    public ContentNotFoundException(String path) {
        super("File '" + path + "' does not exist");
        this.path = path;
    }

    public String path() {
        return path;
    }
}
