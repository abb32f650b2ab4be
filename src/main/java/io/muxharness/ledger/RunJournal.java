package io.muxharness.ledger;

import io.muxharness.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Appends one compact JSON line per ledger entry, so a run can be inspected while it
 * is still going and after the console scrolled away. The first failed write disables
 * the journal; counting and console output never depend on it.
 */
public final class RunJournal {
    private static final Logger log = LoggerFactory.getLogger(RunJournal.class);

    private final Path journalFile;
    private final String runId;
    private boolean disabled;

    public RunJournal(Path journalFile, String runId) {
        this.journalFile = journalFile;
        this.runId = runId == null || runId.isBlank() ? "run" : runId.trim();
        try {
            if (journalFile.getParent() != null) {
                Files.createDirectories(journalFile.getParent());
            }
            if (!Files.exists(journalFile)) {
                try {
                    Files.createFile(journalFile);
                } catch (FileAlreadyExistsException ignored) {
                    // Created concurrently between exists() and createFile().
                }
            }
        } catch (IOException e) {
            throw new RuntimeException("Failed to initialize run journal: " + journalFile, e);
        }
    }

    public synchronized void append(LedgerEntry entry) {
        if (disabled) {
            return;
        }
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("timestamp", entry.recordedAt().toString());
        row.put("run_id", runId);
        row.put("seq", entry.seq());
        row.put("verdict", entry.verdict().name());
        row.put("scenario", entry.scenario());
        row.put("message", entry.message());
        String line = Jsons.toCompactJson(row) + System.lineSeparator();
        try {
            Files.writeString(journalFile, line, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE);
        } catch (IOException e) {
            disabled = true;
            log.warn("run journal {} disabled after write failure: {}", journalFile, e.toString());
        }
    }

    public synchronized boolean disabled() {
        return disabled;
    }

    public Path file() {
        return journalFile;
    }
}
