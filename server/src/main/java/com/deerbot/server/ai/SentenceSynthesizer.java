package com.deerbot.server.ai;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.Random;

/**
 * Best-of-N sampling over {@link ChainModel#generateOnce}. Single attempts
 * vary a lot, so several are drawn and the highest scoring one is kept.
 */
public class SentenceSynthesizer {
    private static final Logger logger = LoggerFactory.getLogger(SentenceSynthesizer.class);

    private final ChainModel model;
    private final Random random;

    public SentenceSynthesizer(ChainModel model, Random random) {
        this.model = model;
        this.random = random;
    }

    /**
     * Runs {@code sampleCount} attempts with the same parameters and returns
     * the first one with the strictly highest score, or the empty result when
     * no attempt scored above 0.
     */
    public GenerationResult generate(int targetLength, int maxLength, Collection<String> keywords,
            int sampleCount, double alpha, double beta) {
        logger.debug("Generating a sentence about: {}", String.join(" ", keywords));
        long startTime = System.currentTimeMillis();

        GenerationResult best = GenerationResult.empty();
        int successful = 0;

        for (int i = 0; i < sampleCount; i++) {
            GenerationResult result = model.generateOnce(targetLength, maxLength, keywords, alpha, beta, random);
            if (result.getScore() > 0) {
                successful++;
            }
            if (result.getScore() > best.getScore()) {
                best = result;
            }
        }

        long duration = System.currentTimeMillis() - startTime;
        logger.debug("Best of {}/{} scoring attempts in {} ms: {}", successful, sampleCount, duration, best);
        return best;
    }
}
