package com.initialone.jmigrate.model;

public final class RewriteResult {

    private final String originalText;
    private final String rewrittenText;

    public RewriteResult(String originalText, String rewrittenText) {
        this.originalText = originalText;
        this.rewrittenText = rewrittenText;
    }

    public String originalText() { return originalText; }

    public String rewrittenText() { return rewrittenText; }

    public boolean changed() { return !rewrittenText.equals(originalText); }
}
