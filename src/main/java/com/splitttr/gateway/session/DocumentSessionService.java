package com.splitttr.gateway.session;

import com.splitttr.gateway.contents.ContentNotFoundException;
import com.splitttr.gateway.contents.FileIdManager;
import org.jboss.logging.Logger;

import java.util.Objects;
import java.util.Optional;

/**
 * Hands out document sessions, indexing documents on first request.
 */
public class DocumentSessionService {

    private static final Logger LOG = Logger.getLogger(DocumentSessionService.class);

    public record Outcome(DocumentSession session, boolean created) {}

    private final FileIdManager fileIdManager;
    private final SessionIssuer sessionIssuer;

    public DocumentSessionService(FileIdManager fileIdManager, SessionIssuer sessionIssuer) {
        this.fileIdManager = Objects.requireNonNull(fileIdManager, "fileIdManager");
        this.sessionIssuer = Objects.requireNonNull(sessionIssuer, "sessionIssuer");
    }

    /**
     * @throws ContentNotFoundException if nothing exists at {@code path}
     */
    public Outcome open(String path, String format, String type) {
        Optional<String> existing = fileIdManager.getId(path);
        if (existing.isPresent()) {
            LOG.infof("Request for Y document '%s' with room ID: %s", path, existing.get());
            return new Outcome(session(format, type, existing.get()), false);
        }

        String fileId = fileIdManager.index(path)
                .orElseThrow(() -> new ContentNotFoundException(path));
        LOG.infof("Request for Y document '%s' with room ID: %s", path, fileId);
        return new Outcome(session(format, type, fileId), true);
    }

    private DocumentSession session(String format, String type, String fileId) {
        return new DocumentSession(format, type, fileId, sessionIssuer.current());
    }
}
