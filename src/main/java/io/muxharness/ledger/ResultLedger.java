package io.muxharness.ledger;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Process-wide pass/fail/skip accounting. All three counters, the entry list, the
 * console line and the journal line of one record are updated under a single lock,
 * so concurrent scenario workers can neither lose an increment nor split a line.
 */
public final class ResultLedger {
    private final ConsoleReporter reporter;
    private final RunJournal journal;
    private final List<LedgerEntry> entries = new ArrayList<>();
    private long passed;
    private long failed;
    private long skipped;
    private volatile String scenario = "";

    public ResultLedger(ConsoleReporter reporter, RunJournal journal) {
        this.reporter = reporter;
        this.journal = journal;
    }

    public void recordPass(String message) {
        record(Verdict.PASS, message);
    }

    public void recordFail(String message) {
        record(Verdict.FAIL, message);
    }

    public void recordSkip(String message) {
        record(Verdict.SKIP, message);
    }

    /** Records pass or fail depending on {@code ok}. */
    public void check(boolean ok, String passMessage, String failMessage) {
        if (ok) {
            recordPass(passMessage);
        } else {
            recordFail(failMessage);
        }
    }

    public synchronized void record(Verdict verdict, String message) {
        switch (verdict) {
            case PASS -> passed++;
            case FAIL -> failed++;
            case SKIP -> skipped++;
        }
        LedgerEntry entry = new LedgerEntry(
                entries.size() + 1L,
                verdict,
                scenario,
                message == null ? "" : message,
                Instant.now()
        );
        entries.add(entry);
        if (reporter != null) {
            reporter.verdict(verdict, entry.message());
        }
        if (journal != null) {
            journal.append(entry);
        }
    }

    public void beginScenario(String scenarioId) {
        this.scenario = scenarioId == null ? "" : scenarioId;
    }

    public synchronized LedgerSnapshot snapshot() {
        return new LedgerSnapshot(passed, failed, skipped);
    }

    public synchronized List<LedgerEntry> entries() {
        return List.copyOf(entries);
    }
}
