package com.questrail.kiosk.payment.internal.receipt;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class TicketStoreTest {

    @TempDir
    Path dir;

    @Test
    void writeReplacesThePendingTicket() throws IOException {
        TicketStore store = new TicketStore(dir.resolve("ticket"));

        assertTrue(store.write("first"));
        assertTrue(store.write("second"));

        assertEquals("second", Files.readString(store.path()));
    }

    @Test
    void writeCreatesMissingParentDirectories() {
        TicketStore store = new TicketStore(dir.resolve("kiosk").resolve("print").resolve("ticket"));

        assertTrue(store.write("receipt"));
        assertTrue(store.exists());
    }

    @Test
    void clearIsIdempotent() throws IOException {
        TicketStore store = new TicketStore(dir.resolve("ticket"));
        store.write("receipt");

        store.clear();
        store.clear();

        assertFalse(store.exists());
    }

    @Test
    void writeFailureIsReportedNotThrown() throws IOException {
        Path blocker = dir.resolve("blocker");
        Files.writeString(blocker, "not a directory");
        TicketStore store = new TicketStore(blocker.resolve("ticket"));

        assertFalse(store.write("receipt"));
    }

    @Test
    void clearFailureIsThrown() throws IOException {
        Path occupied = dir.resolve("ticket");
        Files.createDirectories(occupied.resolve("child"));
        TicketStore store = new TicketStore(occupied);

        assertThrows(IOException.class, store::clear);
    }
}
