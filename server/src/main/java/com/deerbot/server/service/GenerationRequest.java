package com.deerbot.server.service;

import java.util.ArrayList;
import java.util.List;

/**
 * Keywords plus optional overrides of the configured generation settings.
 */
public class GenerationRequest {
    public List<String> keywords = new ArrayList<>();
    public Integer length;
    public Integer sampleCount;
    public Double alpha;
    public Double beta;
    public Long seed;

    public GenerationRequest() {
    }

    public GenerationRequest(List<String> keywords) {
        this.keywords = keywords;
    }
}
