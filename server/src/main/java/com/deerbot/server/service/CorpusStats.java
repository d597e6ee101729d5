package com.deerbot.server.service;

import java.util.List;

public class CorpusStats {
    private final String language;
    private final int order;
    private final int tails;
    private final List<String> sources;

    public CorpusStats(String language, int order, int tails, List<String> sources) {
        this.language = language;
        this.order = order;
        this.tails = tails;
        this.sources = sources;
    }

    public String getLanguage() {
        return language;
    }

    public int getOrder() {
        return order;
    }

    public int getTails() {
        return tails;
    }

    public List<String> getSources() {
        return sources;
    }
}
