package com.splitttr.gateway.ystore;

import com.splitttr.gateway.contents.StorageException;
import org.jboss.logging.Logger;

import java.io.BufferedInputStream;
import java.io.DataInputStream;
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * {@link UpdateStore} writing one file of length-prefixed records.
 *
 * <p>Storage layout:
 * <pre>
 *   [int32 length][length bytes] ...
 * </pre>
 * The channel is opened in append mode on the first write. A record cut short by a crash is
 * dropped on replay.
 */
public final class FileUpdateStore implements UpdateStore {

    private static final Logger LOG = Logger.getLogger(FileUpdateStore.class);
    private static final int LENGTH_BYTES = Integer.BYTES;

    private final Path path;
    private FileChannel channel;
    private boolean closed;

    public FileUpdateStore(Path path) {
        this.path = Objects.requireNonNull(path, "path");
    }

    public Path path() {
        return path;
    }

    @Override
    public synchronized void append(byte[] update) {
        if (closed) {
            throw new StorageException("Update log " + path + " is closed");
        }
        try {
            FileChannel ch = open();
            ByteBuffer buffer = ByteBuffer.allocate(LENGTH_BYTES + update.length);
            buffer.putInt(update.length).put(update).flip();
            while (buffer.hasRemaining()) {
                ch.write(buffer);
            }
        } catch (IOException e) {
            throw new StorageException("Failed to append to update log " + path, e);
        }
    }

    @Override
    public synchronized List<byte[]> replay() {
        List<byte[]> updates = new ArrayList<>();
        try (InputStream file = Files.newInputStream(path);
             DataInputStream in = new DataInputStream(new BufferedInputStream(file))) {
            while (true) {
                int length;
                try {
                    length = in.readInt();
                } catch (EOFException end) {
                    break;
                }
                if (length < 0) {
                    LOG.warnf("Corrupted record in update log %s, ignoring the rest", path);
                    break;
                }
                byte[] update = new byte[length];
                try {
                    in.readFully(update);
                } catch (EOFException truncated) {
                    LOG.warnf("Truncated record at the end of update log %s, ignoring it", path);
                    break;
                }
                updates.add(update);
            }
        } catch (NoSuchFileException e) {
            return List.of();
        } catch (IOException e) {
            throw new StorageException("Failed to read update log " + path, e);
        }
        return updates;
    }

    @Override
    public synchronized void close() {
        if (closed) {
            return;
        }
        closed = true;
        if (channel != null) {
            try {
                channel.close();
            } catch (IOException e) {
                LOG.warnf(e, "Failed to close update log %s", path);
            }
            channel = null;
        }
    }

    private FileChannel open() throws IOException {
        if (channel == null) {
            Path parent = path.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            channel = FileChannel.open(path, StandardOpenOption.CREATE, StandardOpenOption.WRITE, StandardOpenOption.APPEND);
        }
        return channel;
    }
}
