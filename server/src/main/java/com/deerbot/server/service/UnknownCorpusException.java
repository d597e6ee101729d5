package com.deerbot.server.service;

public class UnknownCorpusException extends RuntimeException {
    private final String language;

    public UnknownCorpusException(String language) {
        super("No text has been analyzed for language: " + language);
        this.language = language;
    }

    public String getLanguage() {
        return language;
    }
}
