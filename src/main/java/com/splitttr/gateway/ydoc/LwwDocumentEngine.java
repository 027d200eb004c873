package com.splitttr.gateway.ydoc;

import java.util.concurrent.ThreadLocalRandom;

/**
 * Default engine: every document type is held in a {@link LwwTextDocument}.
 */
public final class LwwDocumentEngine implements DocumentEngine {

    // client ids stay below 2^53 to fit the varuint range
    private static final long MAX_CLIENT_ID = 1L << 53;

    @Override
    public SharedDocument create(String fileType) {
        return new LwwTextDocument(ThreadLocalRandom.current().nextLong(1, MAX_CLIENT_ID));
    }
}
