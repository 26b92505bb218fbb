package com.questrail.kiosk.payment.internal.receipt;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * The pending customer ticket: a single file the kiosk prints after a sale.
 *
 * <p>{@link #clear()} runs at the start of every payment so that a ticket from
 * an earlier sale is never printed for the current one. A failure to clear is
 * reported to the caller. A failure to write is logged only: the payment
 * outcome stands whether or not a ticket could be produced.</p>
 */
public final class TicketStore
{
    private static final Logger log = LoggerFactory.getLogger(TicketStore.class);

    private final Path path;

    public TicketStore(Path path) {
        this.path = Objects.requireNonNull(path, "path");
    }

    public Path path() {
        return path;
    }

    /**
     * Deletes the pending ticket if present. Idempotent.
     */
    public void clear() throws IOException {
        if (Files.deleteIfExists(path)) {
            log.debug("Removed stale customer ticket {}", path);
        }
    }

    /**
     * Replaces the pending ticket with {@code content}.
     *
     * @return {@code true} if the ticket was written
     */
    public boolean write(String content) {
        Objects.requireNonNull(content, "content");
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(path, content, StandardCharsets.UTF_8);
            log.info("Persisting customer ticket to {}", path);
            return true;
        } catch (IOException | RuntimeException e) {
            log.error("Error persisting customer ticket to {}", path, e);
            return false;
        }
    }

    public boolean exists() {
        return Files.exists(path);
    }
}
