package org.matchreminder.recipients;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.matchreminder.exception.RecipientStoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.CopyOption;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Recipient registry kept in a JSON array on disk, so subscriptions survive restarts.
 */
public class JsonFileRecipientRegistry implements RecipientRegistry {
    private static final Logger log = LoggerFactory.getLogger(JsonFileRecipientRegistry.class);

    @FunctionalInterface
    interface FileMover {
        void move(Path source, Path target, CopyOption... options) throws IOException;
    }

    private final Path file;
    private final FileMover mover;
    private final ObjectMapper objectMapper = new ObjectMapper();
    private final Set<String> recipients = new LinkedHashSet<>();

    public JsonFileRecipientRegistry(Path file) {
        this(file, Files::move);
    }

    JsonFileRecipientRegistry(Path file, FileMover mover) {
        this.file = file;
        this.mover = mover;
        if (Files.exists(file)) {
            try {
                Set<String> stored = objectMapper.readValue(file.toFile(), new TypeReference<LinkedHashSet<String>>() {
                });
                if (stored != null) {
                    recipients.addAll(stored);
                }
            } catch (IOException e) {
                throw new RecipientStoreException("Cannot read recipients from " + file, e);
            }
        }
        log.info("Loaded {} recipients from {}", recipients.size(), file);
    }

    @Override
    public synchronized boolean add(String recipientId) {
        if (!recipients.add(recipientId)) {
            return false;
        }
        try {
            save();
        } catch (RecipientStoreException e) {
            recipients.remove(recipientId);
            throw e;
        }
        return true;
    }

    @Override
    public synchronized boolean remove(String recipientId) {
        if (!recipients.remove(recipientId)) {
            return false;
        }
        try {
            save();
        } catch (RecipientStoreException e) {
            recipients.add(recipientId);
            throw e;
        }
        return true;
    }

    @Override
    public synchronized Set<String> list() {
        return Set.copyOf(recipients);
    }

    private void save() {
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Path tmp = file.resolveSibling(file.getFileName() + ".tmp");
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(tmp.toFile(), recipients);
            try {
                mover.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                log.debug("Atomic move not supported for {}, replacing in place", file);
                mover.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            throw new RecipientStoreException("Cannot write recipients to " + file, e);
        }
    }
}
