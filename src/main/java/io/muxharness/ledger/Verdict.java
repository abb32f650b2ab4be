package io.muxharness.ledger;

public enum Verdict {
    PASS("[PASS]", "green"),
    FAIL("[FAIL]", "red"),
    SKIP("[SKIP]", "yellow");

    private final String tag;
    private final String style;

    Verdict(String tag, String style) {
        this.tag = tag;
        this.style = style;
    }

    public String tag() {
        return tag;
    }

    String style() {
        return style;
    }
}
