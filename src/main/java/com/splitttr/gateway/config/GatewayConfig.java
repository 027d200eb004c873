package com.splitttr.gateway.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

import java.time.Duration;
import java.util.Optional;

/**
 * Configuration of the collaboration gateway.
 *
 * <p>Configure via application.properties:
 * <pre>
 * collab.document-cleanup-delay=60s
 * collab.document-save-delay=1s
 * collab.file-poll-interval=1s
 * collab.contents.root=/srv/documents
 * </pre>
 * Leaving {@code document-cleanup-delay} or {@code file-poll-interval} empty disables room
 * cleanup or the file watcher.
 */
@ConfigMapping(prefix = "collab")
public interface GatewayConfig {

    /**
     * Grace period before an empty document room is destroyed.
     */
    Optional<Duration> documentCleanupDelay();

    /**
     * Quiet period after the last edit before a document is written back.
     */
    @WithDefault("1s")
    Duration documentSaveDelay();

    /**
     * Period of the out-of-band change watcher.
     */
    Optional<Duration> filePollInterval();

    @WithDefault("2")
    int schedulerThreads();

    Contents contents();

    UpdateLog updateLog();

    interface Contents {

        /**
         * Directory served by the file system backend.
         */
        @WithDefault(".")
        String root();
    }

    interface UpdateLog {

        /**
         * Directory of the update logs, the contents root when absent.
         */
        Optional<String> root();
    }
}
