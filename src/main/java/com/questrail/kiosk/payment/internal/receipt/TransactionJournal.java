package com.questrail.kiosk.payment.internal.receipt;

import com.questrail.kiosk.payment.internal.time.WallClock;
import com.questrail.kiosk.payment.model.TransactionResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.Objects;
import java.util.Optional;

/**
 * TransactionJournal
 * =============================================================================
 * Append-only audit trail of terminal decisions.
 *
 * <p>Each persisted response becomes one file named
 * {@code <yyyyMMddHHmmssSSS>_ticket.txt} in the journal directory. Files are
 * created exclusively and never overwritten: when a name is already taken the
 * journal appends {@code _1}, {@code _2}, ... before the extension.</p>
 *
 * <h2>Failure policy</h2>
 * <p>Persistence never changes a payment outcome. I/O failures are logged and
 * reported as an empty result.</p>
 */
public final class TransactionJournal
{
    private static final Logger log = LoggerFactory.getLogger(TransactionJournal.class);

    static final DateTimeFormatter FILE_STAMP = DateTimeFormatter.ofPattern("yyyyMMddHHmmssSSS");
    static final String SUFFIX = "_ticket";
    static final String EXTENSION = ".txt";
    private static final int MAX_COLLISIONS = 1000;

    private final Path directory;
    private final WallClock clock;
    private final ZoneId zone;

    public TransactionJournal(Path directory, WallClock clock) {
        this(directory, clock, ZoneId.systemDefault());
    }

    public TransactionJournal(Path directory, WallClock clock, ZoneId zone) {
        this.directory = Objects.requireNonNull(directory, "directory");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.zone = Objects.requireNonNull(zone, "zone");
    }

    public Path directory() {
        return directory;
    }

    /**
     * Writes one journal record for {@code response}.
     *
     * @return the file written, or empty if the record could not be persisted
     */
    public Optional<Path> persist(TransactionResponse response) {
        Objects.requireNonNull(response, "response");
        try {
            Files.createDirectories(directory);
            String stamp = FILE_STAMP.format(clock.now().atZone(zone));
            byte[] content = ReceiptFormatter.journalRecord(response).getBytes(StandardCharsets.UTF_8);

            for (int attempt = 0; attempt <= MAX_COLLISIONS; attempt++) {
                String name = stamp + SUFFIX + (attempt == 0 ? "" : "_" + attempt) + EXTENSION;
                Path target = directory.resolve(name);
                try {
                    Files.write(target, content, StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE);
                    log.info("Persisting customer and merchant ticket to {}", target);
                    return Optional.of(target);
                } catch (FileAlreadyExistsException e) {
                    log.debug("Journal file {} already exists", target);
                }
            }
            log.error("Could not find a free journal file name for stamp {} in {}", stamp, directory);
        } catch (IOException | RuntimeException e) {
            log.error("Persist transaction to {} failed", directory, e);
        }
        return Optional.empty();
    }
}
