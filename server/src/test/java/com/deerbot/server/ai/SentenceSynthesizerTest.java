package com.deerbot.server.ai;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class SentenceSynthesizerTest {

    private static ChainModel petsModel() {
        ChainModel model = new ChainModel(2);
        model.analyze(List.of("I", " ", "like", " ", "cats", "."));
        model.analyze(List.of("I", " ", "like", " ", "cats", "."));
        model.analyze(List.of("I", " ", "like", " ", "dogs", "."));
        model.analyze(List.of("Dogs", " ", "like", " ", "bones", "."));
        return model;
    }

    @Test
    void testBestOfNKeepsHighestAttempt() {
        ChainModel model = petsModel();
        List<String> keywords = List.of("like");
        int samples = 25;

        GenerationResult best = new SentenceSynthesizer(model, new Random(42))
                .generate(3, 20, keywords, samples, 2.0, 1.5);

        // replay the same draws one attempt at a time
        Random replay = new Random(42);
        double maxScore = 0.0;
        for (int i = 0; i < samples; i++) {
            GenerationResult single = model.generateOnce(3, 20, keywords, 2.0, 1.5, replay);
            assertTrue(best.getScore() >= single.getScore());
            maxScore = Math.max(maxScore, single.getScore());
        }

        assertEquals(maxScore, best.getScore());
        assertTrue(best.getScore() > 0.0);
        assertFalse(best.getText().isEmpty());
    }

    @Test
    void testNoScoringAttemptYieldsEmptyResult() {
        ChainModel model = petsModel();

        GenerationResult result = new SentenceSynthesizer(model, new Random(1))
                .generate(3, 20, List.of("giraffe"), 10, 2.0, 1.5);

        assertEquals("", result.getText());
        assertEquals(0.0, result.getScore());
    }

    @Test
    void testUntrainedModelYieldsEmptyResult() {
        GenerationResult result = new SentenceSynthesizer(new ChainModel(4), new Random(1))
                .generate(10, 20, List.of("anything"), 5, 2.0, 1.5);

        assertTrue(result.isEmpty());
    }

    @Test
    void testZeroSamplesYieldsEmptyResult() {
        GenerationResult result = new SentenceSynthesizer(petsModel(), new Random(1))
                .generate(3, 20, List.of("like"), 0, 2.0, 1.5);

        assertTrue(result.isEmpty());
    }
}
