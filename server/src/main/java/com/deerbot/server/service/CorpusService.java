package com.deerbot.server.service;

import com.deerbot.db.AnalyzedSourceDao;
import com.deerbot.db.ChainSnapshotDao;
import com.deerbot.db.SqliteInitializer;
import com.deerbot.server.ai.ChainModel;
import com.deerbot.server.ai.GenerationResult;
import com.deerbot.server.ai.SentenceSynthesizer;
import com.deerbot.server.ai.snapshot.ChainSnapshot;
import com.deerbot.server.text.TextSegmenter;
import com.deerbot.server.text.WordTokenizer;
import com.deerbot.server.util.DataPathResolver;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Random;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Keeps one chain per language and the sources analyzed into it. Analysis
 * of a language excludes every other access to that language's chain;
 * generation and export only share a read lock.
 */
@Service
public class CorpusService {

    private static final Logger logger = LoggerFactory.getLogger(CorpusService.class);

    private static class Corpus {
        final ChainModel model;
        final Set<String> sources;
        final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

        Corpus(ChainModel model, Set<String> sources) {
            this.model = model;
            this.sources = sources;
        }
    }

    private final GenerationSettings settings;
    private final String dbPath;
    private final Map<String, Corpus> corpora = new ConcurrentHashMap<>();
    private final TextSegmenter segmenter;
    private final WordTokenizer tokenizer = new WordTokenizer();

    private final ChainSnapshotDao snapshotDao;
    private final AnalyzedSourceDao sourceDao;

    public CorpusService() {
        this(GenerationSettings.loadOrDefault());
    }

    public CorpusService(GenerationSettings settings) {
        this(settings, settings.persistenceEnabled ? DataPathResolver.resolveDbPath(settings) : null);
    }

    /**
     * @param dbPath SQLite file to persist to, or null to keep everything in
     *               memory
     */
    public CorpusService(GenerationSettings settings, String dbPath) {
        this.settings = settings;
        this.dbPath = dbPath;
        this.segmenter = new TextSegmenter(settings.minInputLength);
        this.snapshotDao = dbPath != null ? new ChainSnapshotDao(dbPath) : null;
        this.sourceDao = dbPath != null ? new AnalyzedSourceDao(dbPath) : null;
    }

    @PostConstruct
    public void load() {
        if (dbPath == null) {
            logger.info("Persistence disabled, starting with empty corpora");
            return;
        }

        try {
            Path parent = Paths.get(dbPath).toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            SqliteInitializer.initialize(dbPath);
            logger.info("Initialized SQLite store at {}", dbPath);

            for (String language : snapshotDao.listLanguages()) {
                Optional<ChainSnapshot> snapshot = snapshotDao.loadSnapshot(language);
                if (snapshot.isEmpty()) {
                    continue;
                }
                ChainModel model = ChainModel.fromSnapshot(snapshot.get());
                Set<String> sources = sourceDao.listSources(language);
                corpora.put(language, new Corpus(model, sources));
                logger.info("Loaded corpus '{}': order={}, tails={}, sources={}", language, model.getOrder(),
                        model.size(), sources.size());
            }
        } catch (SQLException | IOException e) {
            logger.error("Failed to load corpora from {}", dbPath, e);
            throw new IllegalStateException("Failed to load corpora from " + dbPath, e);
        }
    }

    @PreDestroy
    public void shutdown() {
        if (dbPath != null && !corpora.isEmpty()) {
            save();
        }
    }

    /**
     * Persists every corpus.
     *
     * @return number of corpora written
     */
    public int save() {
        if (dbPath == null) {
            logger.warn("Persistence disabled, nothing saved");
            return 0;
        }

        int saved = 0;
        for (Map.Entry<String, Corpus> e : corpora.entrySet()) {
            String language = e.getKey();
            Corpus corpus = e.getValue();

            ChainSnapshot snapshot;
            List<String> sources;
            corpus.lock.readLock().lock();
            try {
                snapshot = corpus.model.toSnapshot();
                sources = new ArrayList<>(corpus.sources);
            } finally {
                corpus.lock.readLock().unlock();
            }

            try {
                snapshotDao.saveCorpus(language, snapshot, sources);
            } catch (SQLException | IOException ex) {
                logger.error("Failed to save corpus '{}'", language, ex);
                throw new IllegalStateException("Failed to save corpus " + language, ex);
            }
            logger.info("Saved corpus '{}' with {} tails", language, snapshot.graph.size());
            saved++;
        }
        return saved;
    }

    /**
     * Analyzes a text into the chain of {@code language}.
     *
     * @return number of tokens analyzed, or -1 if {@code sourceId} was already
     *         analyzed for this language
     */
    public int analyze(String language, String sourceId, String text) {
        checkParameter("language", language);
        checkParameter("sourceId", sourceId);
        if (!settings.supportsLanguage(language)) {
            throw new IllegalArgumentException("Unsupported language: " + language);
        }
        if (text == null) {
            throw new IllegalArgumentException("No text given");
        }

        Corpus corpus = corpora.computeIfAbsent(language, l -> {
            logger.info("Creating corpus '{}' with order {}", l, settings.graphOrder);
            return new Corpus(new ChainModel(settings.graphOrder), new LinkedHashSet<>());
        });

        corpus.lock.writeLock().lock();
        try {
            if (corpus.sources.contains(sourceId)) {
                logger.debug("Source '{}' already analyzed for '{}'", sourceId, language);
                return -1;
            }

            List<String> segments = segmenter.segment(text);
            logger.debug("Source '{}' split into {} segments", sourceId, segments.size());

            int count = 0;
            for (String segment : segments) {
                List<String> words = tokenizer.tokenize(segment);
                if (logger.isTraceEnabled()) {
                    logger.trace("Analyzing words: {} {}...", words.size(), words.subList(0, Math.min(5, words.size())));
                }
                corpus.model.analyze(words);
                count += words.size();
            }

            corpus.sources.add(sourceId);
            logger.info("Analyzed {} tokens from '{}' into '{}'", count, sourceId, language);
            return count;
        } finally {
            corpus.lock.writeLock().unlock();
        }
    }

    public GenerationResult generate(String language, GenerationRequest request) {
        Corpus corpus = corpora.get(language);
        if (corpus == null) {
            throw new UnknownCorpusException(language);
        }

        int length = positive("length", request.length != null ? request.length : settings.sentenceLength);
        int samples = positive("sampleCount",
                request.sampleCount != null ? request.sampleCount : settings.sampleCount);
        double alpha = positiveFinite("alpha", request.alpha != null ? request.alpha : settings.alpha);
        double beta = positiveFinite("beta", request.beta != null ? request.beta : settings.beta);
        int maxLength;
        try {
            maxLength = Math.multiplyExact(length, 2);
        } catch (ArithmeticException e) {
            throw new IllegalArgumentException("Invalid length: " + length, e);
        }

        List<String> keywords = new ArrayList<>();
        if (request.keywords != null) {
            for (String keyword : request.keywords) {
                if (keyword != null && !keyword.isBlank()) {
                    keywords.add(keyword.trim());
                }
            }
        }

        Random random = request.seed != null ? new Random(request.seed) : new Random();

        corpus.lock.readLock().lock();
        try {
            SentenceSynthesizer synthesizer = new SentenceSynthesizer(corpus.model, random);
            return synthesizer.generate(length, maxLength, keywords, samples, alpha, beta);
        } finally {
            corpus.lock.readLock().unlock();
        }
    }

    public Set<String> languages() {
        return new TreeSet<>(corpora.keySet());
    }

    public CorpusStats stats(String language) {
        Corpus corpus = corpora.get(language);
        if (corpus == null) {
            throw new UnknownCorpusException(language);
        }
        corpus.lock.readLock().lock();
        try {
            return new CorpusStats(language, corpus.model.getOrder(), corpus.model.size(),
                    new ArrayList<>(corpus.sources));
        } finally {
            corpus.lock.readLock().unlock();
        }
    }

    /**
     * Copy of a language's chain, safe to use while analysis continues.
     */
    public Optional<ChainSnapshot> snapshot(String language) {
        Corpus corpus = corpora.get(language);
        if (corpus == null) {
            return Optional.empty();
        }
        corpus.lock.readLock().lock();
        try {
            return Optional.of(corpus.model.toSnapshot());
        } finally {
            corpus.lock.readLock().unlock();
        }
    }

    private static void checkParameter(String name, String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("No " + name + " specified.");
        }
        if (value.indexOf('|') != -1) {
            throw new IllegalArgumentException("Illegal characters in " + name + ": " + value);
        }
    }

    private static int positive(String name, int value) {
        if (value <= 0) {
            throw new IllegalArgumentException("Invalid " + name + ": " + value);
        }
        return value;
    }

    private static double positiveFinite(String name, double value) {
        if (!Double.isFinite(value) || value <= 0.0) {
            throw new IllegalArgumentException("Invalid " + name + ": " + value);
        }
        return value;
    }
}
