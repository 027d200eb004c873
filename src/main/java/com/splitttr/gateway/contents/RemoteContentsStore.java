package com.splitttr.gateway.contents;

import com.splitttr.gateway.client.ContentsClient;
import com.splitttr.gateway.client.ContentsPayload;
import jakarta.ws.rs.ProcessingException;
import jakarta.ws.rs.WebApplicationException;

import java.util.Objects;

/**
 * {@link ContentsStore} delegating to a remote contents service through {@link ContentsClient}.
 */
public final class RemoteContentsStore implements ContentsStore {

    private static final int NOT_FOUND = 404;

    private final ContentsClient client;

    public RemoteContentsStore(ContentsClient client) {
        this.client = Objects.requireNonNull(client, "client");
    }

    @Override
    public ContentModel get(String path, String format, String type, boolean includeContent) {
        try {
            return toModel(path, client.get(path, format, type, includeContent ? 1 : 0));
        } catch (WebApplicationException e) {
            if (e.getResponse() != null && e.getResponse().getStatus() == NOT_FOUND) {
                throw new ContentNotFoundException(path);
            }
            throw new StorageException("Contents service refused to read '" + path + "'", e);
        } catch (ProcessingException e) {
            throw new StorageException("Contents service unreachable while reading '" + path + "'", e);
        }
    }

    @Override
    public ContentModel save(String path, ContentModel model) {
        ContentsPayload body = new ContentsPayload(model.name(), path, model.type(), model.format(), model.content(), null);
        try {
            return toModel(path, client.save(path, body));
        } catch (WebApplicationException | ProcessingException e) {
            throw new StorageException("Failed to write '" + path + "' to the contents service", e);
        }
    }

    @Override
    public boolean exists(String path) {
        try {
            get(path, null, null, false);
            return true;
        } catch (ContentNotFoundException e) {
            return false;
        }
    }

    private static ContentModel toModel(String path, ContentsPayload payload) {
        if (payload == null) {
            throw new StorageException("Contents service returned no model for '" + path + "'");
        }
        return new ContentModel(
                payload.path() != null ? payload.path() : path,
                payload.name(),
                payload.format(),
                payload.type(),
                payload.content(),
                payload.lastModified());
    }
}
