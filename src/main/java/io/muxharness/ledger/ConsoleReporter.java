package io.muxharness.ledger;

import picocli.CommandLine.Help.Ansi;

import java.io.PrintStream;
import java.util.Locale;

/**
 * Line-oriented console output. Every method writes complete lines under the
 * reporter's monitor, so lines from concurrent callers never interleave.
 */
public final class ConsoleReporter {
    private static final int RULE_WIDTH = 70;

    private final PrintStream out;
    private final Ansi ansi;

    public ConsoleReporter(PrintStream out, Ansi ansi) {
        this.out = out;
        this.ansi = ansi == null ? Ansi.AUTO : ansi;
    }

    // Messages may carry target output, so they stay outside the ANSI markup.
    public synchronized void verdict(Verdict verdict, String message) {
        out.println(styled(verdict.style(), verdict.tag()) + " " + message);
    }

    public synchronized void info(String message) {
        out.println(styled("cyan", "[INFO]") + " " + message);
    }

    public synchronized void test(String message) {
        out.println(styled("white", "[TEST]") + " " + message);
    }

    public synchronized void section(String title) {
        String rule = "=".repeat(RULE_WIDTH);
        out.println();
        out.println(styled("magenta", rule));
        out.println(styled("magenta", "  " + title));
        out.println(styled("magenta", rule));
    }

    public synchronized void banner(String... lines) {
        String rule = "=".repeat(RULE_WIDTH);
        out.println();
        out.println(styled("cyan", rule));
        for (String line : lines) {
            out.println(styled("cyan", "  " + line));
        }
        out.println(styled("cyan", rule));
        out.println();
    }

    public synchronized void summary(LedgerSnapshot snapshot) {
        double rate = snapshot.passRate();
        String rateStyle = rate >= 80.0d ? "green" : (rate >= 60.0d ? "yellow" : "red");
        out.println("  Total Tests: " + snapshot.total());
        out.println(styled("green", "  Passed:    " + snapshot.passed()));
        out.println(styled("red", "  Failed:    " + snapshot.failed()));
        out.println(styled("yellow", "  Skipped:   " + snapshot.skipped()));
        out.println();
        out.println(styled(rateStyle, String.format(Locale.ROOT, "  Pass Rate: %.1f%%", rate)));
        out.println();
        if (snapshot.clean()) {
            out.println(styled("green", "All checks passed."));
        } else {
            out.println(styled("yellow", "Some checks failed. Review the output above."));
        }
    }

    private String styled(String style, String text) {
        if (!ansi.enabled()) {
            return text;
        }
        return ansi.string("@|" + style + " " + escapeMarkup(text) + "|@");
    }

    private static String escapeMarkup(String text) {
        return text.replace("@|", "@ |").replace("|@", "| @");
    }
}
