package com.geoledger.service.store;

import com.geoledger.stages.api.StorageException;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.util.List;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Logger;

/**
 * Record store backed by an append-only JSON-lines journal. Every change is written to the journal
 * before it becomes visible; the journal is replayed on startup. The file lock is held only for
 * the single line write and is always taken after a key lock.
 */
public class JournalRecordStore extends InMemoryRecordStore {
    private static final Logger LOGGER = Logger.getLogger(JournalRecordStore.class.getName());

    private final Path file;
    private final ReentrantLock fileLock = new ReentrantLock();

    public JournalRecordStore(Path file) {
        this(file, Clock.systemUTC());
    }

    public JournalRecordStore(Path file, Clock clock) {
        super(clock);
        this.file = file;
        replay();
    }

    public Path file() {
        return file;
    }

    @Override
    protected void beforeCommit(JournalEntry entry) {
        fileLock.lock();
        try {
            if (file.getParent() != null) {
                Files.createDirectories(file.getParent());
            }
            if (entry.operation() == JournalEntry.Operation.CLEAR) {
                Files.write(file, new byte[0]);
                return;
            }
            try (BufferedWriter writer = Files.newBufferedWriter(
                    file,
                    StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE,
                    StandardOpenOption.APPEND
            )) {
                writer.write(RecordCodec.toJsonLine(entry));
                writer.newLine();
            }
        } catch (IOException e) {
            throw new StorageException("Failed writing journal " + file, e);
        } finally {
            fileLock.unlock();
        }
    }

    private void replay() {
        if (!Files.exists(file)) {
            return;
        }
        List<String> lines;
        try {
            lines = Files.readAllLines(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new StorageException("Failed reading journal " + file, e);
        }
        int applied = 0;
        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i);
            if (line.isBlank()) {
                continue;
            }
            JournalEntry entry;
            try {
                entry = RecordCodec.fromJsonLine(line);
            } catch (RuntimeException decodeError) {
                if (i == lines.size() - 1) {
                    LOGGER.warning("Ignoring torn last journal line " + (i + 1) + " in " + file);
                    continue;
                }
                throw new StorageException("Invalid journal entry at line " + (i + 1) + " in " + file, decodeError);
            }
            apply(entry);
            applied++;
        }
        LOGGER.info("Replayed " + applied + " journal entries from " + file);
    }

    private void apply(JournalEntry entry) {
        switch (entry.operation()) {
            case PUT -> applyRestore(entry.record(), false);
            case LOCK -> applyLock(entry.ticketKey(), entry.reason(), entry.actor(), entry.at(), false);
            case UNLOCK -> applyUnlock(entry.ticketKey(), entry.at(), false);
            case CLEAR -> LOGGER.fine("Skipping CLEAR entry in " + file);
        }
    }
}
