package com.deerbot.server.ai;

import com.fasterxml.jackson.annotation.JsonIgnore;

public class GenerationResult {
    private static final GenerationResult EMPTY = new GenerationResult("", 0.0);

    private final String text;
    private final double score;

    public GenerationResult(String text, double score) {
        this.text = text;
        this.score = score;
    }

    public static GenerationResult empty() {
        return EMPTY;
    }

    public String getText() {
        return text;
    }

    public double getScore() {
        return score;
    }

    @JsonIgnore
    public boolean isEmpty() {
        return text.isEmpty() && score == 0.0;
    }

    @Override
    public String toString() {
        return "GenerationResult{" +
                "score=" + String.format("%.4f", score) +
                ", text='" + text + '\'' +
                '}';
    }
}
