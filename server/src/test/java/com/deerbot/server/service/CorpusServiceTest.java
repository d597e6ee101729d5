package com.deerbot.server.service;

import com.deerbot.server.ai.GenerationResult;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CorpusServiceTest {

    private static final String TEXT = "The quick brown fox jumps over the lazy dog.\n" +
            "A lazy cat sleeps in the warm sun all day.\n" +
            "fragments in lower case are skipped.";

    private static CorpusService inMemoryService() {
        GenerationSettings settings = GenerationSettings.defaults();
        settings.persistenceEnabled = false;
        CorpusService service = new CorpusService(settings, null);
        service.load();
        return service;
    }

    private static GenerationRequest request(long seed, String... keywords) {
        GenerationRequest request = new GenerationRequest(List.of(keywords));
        // long enough for both sentences to reach their exits
        request.length = 12;
        request.sampleCount = 50;
        request.seed = seed;
        return request;
    }

    @Test
    void testAnalyzeCountsTokensOnce() {
        CorpusService service = inMemoryService();

        assertEquals(38, service.analyze("en", "Animals", TEXT));
        assertEquals(-1, service.analyze("en", "Animals", TEXT));
        assertEquals(0, service.analyze("en", "Nothing", "no sentences here"));

        CorpusStats stats = service.stats("en");
        assertEquals(4, stats.getOrder());
        assertEquals(List.of("Animals", "Nothing"), stats.getSources());
        assertTrue(stats.getTails() > 0);
        assertEquals(java.util.Set.of("en"), service.languages());
    }

    @Test
    void testRejectsInvalidSources() {
        CorpusService service = inMemoryService();

        assertThrows(IllegalArgumentException.class, () -> service.analyze("xx", "Animals", TEXT));
        assertThrows(IllegalArgumentException.class, () -> service.analyze("en", "Ani|mals", TEXT));
        assertThrows(IllegalArgumentException.class, () -> service.analyze("en", " ", TEXT));
        assertThrows(IllegalArgumentException.class, () -> service.analyze("en", "Animals", null));
    }

    @Test
    void testGenerateFromUnknownCorpus() {
        CorpusService service = inMemoryService();
        assertThrows(UnknownCorpusException.class, () -> service.generate("en", request(1, "fox")));
        assertThrows(UnknownCorpusException.class, () -> service.stats("fi"));
    }

    @Test
    void testGenerateIsSeededAndKeywordDriven() {
        CorpusService service = inMemoryService();
        service.analyze("en", "Animals", TEXT);

        GenerationResult first = service.generate("en", request(7, "FOX", " "));
        GenerationResult second = service.generate("en", request(7, "FOX", " "));

        assertTrue(first.getScore() > 0.0);
        assertTrue(first.getText().contains("fox"));
        assertEquals(first.getText(), second.getText());
        assertEquals(first.getScore(), second.getScore());
    }

    @Test
    void testRejectsInvalidGenerationParameters() {
        CorpusService service = inMemoryService();
        service.analyze("en", "Animals", TEXT);

        GenerationRequest badAlpha = request(1, "fox");
        badAlpha.alpha = Double.NaN;
        assertThrows(IllegalArgumentException.class, () -> service.generate("en", badAlpha));

        GenerationRequest badLength = request(1, "fox");
        badLength.length = 0;
        assertThrows(IllegalArgumentException.class, () -> service.generate("en", badLength));

        GenerationRequest hugeLength = request(1, "fox");
        hugeLength.length = 1_500_000_000;
        assertThrows(IllegalArgumentException.class, () -> service.generate("en", hugeLength));

        GenerationRequest badSamples = request(1, "fox");
        badSamples.sampleCount = -3;
        assertThrows(IllegalArgumentException.class, () -> service.generate("en", badSamples));
    }

    @Test
    void testSaveAndReload(@TempDir Path dir) {
        String dbPath = dir.resolve("corpora.db").toString();
        GenerationSettings settings = GenerationSettings.defaults();

        CorpusService service = new CorpusService(settings, dbPath);
        service.load();
        service.analyze("en", "Animals", TEXT);
        service.analyze("fi", "Kissa", "Kissa istuu matolla ja katsoo ulos.");
        assertEquals(2, service.save());

        CorpusService reloaded = new CorpusService(settings, dbPath);
        reloaded.load();

        assertEquals(service.languages(), reloaded.languages());
        assertEquals(service.snapshot("en").orElseThrow(), reloaded.snapshot("en").orElseThrow());
        assertEquals(service.snapshot("fi").orElseThrow(), reloaded.snapshot("fi").orElseThrow());
        assertEquals(-1, reloaded.analyze("en", "Animals", TEXT));

        GenerationResult before = service.generate("en", request(3, "cat"));
        GenerationResult after = reloaded.generate("en", request(3, "cat"));
        assertEquals(before.getText(), after.getText());
        assertEquals(before.getScore(), after.getScore());
    }

    @Test
    void testSaveWithoutPersistence() {
        CorpusService service = inMemoryService();
        service.analyze("en", "Animals", TEXT);
        assertEquals(0, service.save());
    }
}
