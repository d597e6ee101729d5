package com.deerbot.server.ai;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

/**
 * Context of a chain: the most recent tokens, at most {@code order} of them.
 * Nodes are looked up by {@link #key()}, the lowercase concatenation of the
 * tokens without a separator, so tails with equal keys share a node.
 */
public final class Tail {

    public static final Tail EMPTY = new Tail(Collections.emptyList());

    private final List<String> tokens;
    private final String key;

    private Tail(List<String> tokens) {
        this.tokens = tokens;
        StringBuilder sb = new StringBuilder();
        for (String token : tokens) {
            sb.append(token);
        }
        this.key = sb.toString().toLowerCase(Locale.ROOT);
    }

    /**
     * Returns the tail after {@code token} has been observed, dropping the
     * oldest token when the tail would exceed {@code order} tokens.
     */
    public Tail push(String token, int order) {
        List<String> next = new ArrayList<>(tokens.size() + 1);
        next.addAll(tokens);
        next.add(token);
        while (next.size() > order) {
            next.remove(0);
        }
        return new Tail(Collections.unmodifiableList(next));
    }

    public String key() {
        return key;
    }

    @Override
    public String toString() {
        return "Tail{'" + key + "'}";
    }
}
