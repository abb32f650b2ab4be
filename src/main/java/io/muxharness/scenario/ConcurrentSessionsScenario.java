package io.muxharness.scenario;

import io.muxharness.concurrent.BatchResult;
import io.muxharness.concurrent.QuorumRule;
import io.muxharness.config.HarnessSettings;
import io.muxharness.process.Outcome;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Callable;

final class ConcurrentSessionsScenario implements Scenario {
    @Override
    public String id() {
        return "concurrent-sessions";
    }

    @Override
    public String title() {
        return "CONCURRENT SESSION TESTS";
    }

    @Override
    public List<String> sessionNames(HarnessSettings settings) {
        List<String> names = new ArrayList<>(settings.concurrentSessions());
        for (int i = 0; i < settings.concurrentSessions(); i++) {
            names.add(settings.sessionPrefix() + "concurrent_" + i);
        }
        return names;
    }

    @Override
    public void run(ScenarioContext ctx) {
        List<String> names = sessionNames(ctx.settings());
        int total = names.size();
        try {
            ctx.test("Create " + total + " sessions concurrently");
            List<Callable<Boolean>> units = new ArrayList<>(total);
            for (String name : names) {
                units.add(() -> ctx.sessions().create(name) && ctx.probe().exists(name));
            }
            BatchResult created = ctx.concurrency().runAll(units);
            ctx.ledger().check(created.passed(),
                    "Created " + created.successes() + "/" + total + " sessions concurrently",
                    "Only created " + created.successes() + "/" + total + " sessions");

            ctx.test("Verify all sessions in list");
            Outcome listing = ctx.mux("ls");
            if (listing.timedOut()) {
                ctx.ledger().recordSkip("ls timed out, listing not verified");
                return;
            }
            int found = countListed(listing.stdout(), names);
            QuorumRule quorum = ctx.concurrency().quorum();
            ctx.ledger().check(quorum.accepts(found, total),
                    "Found " + found + "/" + total + " sessions in list",
                    "Only found " + found + "/" + total + " sessions");
        } finally {
            ctx.sessions().cleanupMany(names);
        }
    }

    /** Counts names that start an {@code ls} line as {@code NAME:}, so prefixes of longer names do not match. */
    static int countListed(String listing, List<String> names) {
        Set<String> listed = new HashSet<>();
        for (String line : listing.split("\\R")) {
            String trimmed = line.strip();
            int colon = trimmed.indexOf(':');
            if (colon > 0) {
                listed.add(trimmed.substring(0, colon));
            }
        }
        int found = 0;
        for (String name : names) {
            if (listed.contains(name)) {
                found++;
            }
        }
        return found;
    }
}
