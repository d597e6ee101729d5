package com.deerbot.server.ai;

import com.deerbot.server.ai.snapshot.ChainSnapshot;
import com.deerbot.server.ai.snapshot.NodeRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Random;

/**
 * Markov chain of the given order over opaque tokens. Each tail maps to the
 * words observed after it and how often, plus how often the tail closed an
 * analyzed sequence.
 *
 * <p>
 * Not thread safe. Generation only reads the graph, so concurrent
 * {@link #generateOnce} calls are fine as long as no {@link #analyze} runs at
 * the same time.
 */
public class ChainModel {
    private static final Logger logger = LoggerFactory.getLogger(ChainModel.class);

    private final int order;
    // tail key -> node, in creation order
    private final Map<String, ChainNode> graph;

    public ChainModel(int order) {
        this(order, new LinkedHashMap<>());
    }

    private ChainModel(int order, Map<String, ChainNode> graph) {
        this.order = Math.max(1, order);
        this.graph = graph;
    }

    public static ChainModel fromSnapshot(ChainSnapshot snapshot) {
        Map<String, ChainNode> graph = new LinkedHashMap<>();
        if (snapshot.graph != null) {
            for (Map.Entry<String, NodeRecord> e : snapshot.graph.entrySet()) {
                NodeRecord rec = e.getValue();
                if (rec == null || rec.links == null || rec.freqs == null) {
                    throw new IllegalArgumentException("Incomplete node record for tail '" + e.getKey() + "'");
                }
                graph.put(e.getKey(), new ChainNode(rec.links, rec.freqs, rec.weight, rec.isExit));
            }
        }
        ChainModel model = new ChainModel(snapshot.order, graph);
        logger.debug("Restored chain of order {} with {} tails", model.order, graph.size());
        return model;
    }

    public ChainSnapshot toSnapshot() {
        Map<String, NodeRecord> records = new LinkedHashMap<>();
        for (Map.Entry<String, ChainNode> e : graph.entrySet()) {
            ChainNode node = e.getValue();
            records.put(e.getKey(), new NodeRecord(
                    new ArrayList<>(node.getLinks()),
                    new ArrayList<>(node.getFreqs()),
                    node.getWeight(),
                    node.isExit()));
        }
        return new ChainSnapshot(order, records);
    }

    /**
     * Analyzes a sequence of tokens representing one or more sentences. The
     * tail reached after the last token is marked as an exit.
     */
    public void analyze(List<String> tokens) {
        if (tokens.isEmpty()) {
            return;
        }

        Tail tail = Tail.EMPTY;
        for (String token : tokens) {
            nodeAt(tail).record(token);
            tail = tail.push(token, order);
        }

        nodeAt(tail).markExit();

        if (logger.isTraceEnabled()) {
            logger.trace("Analyzed {} tokens, exit at '{}', {} tails total", tokens.size(), tail.key(), graph.size());
        }
    }

    /**
     * Makes one attempt at a sentence of about {@code targetLength} tokens.
     *
     * @param targetLength steps to take before the walk may stop at an exit
     * @param maxLength    steps after which the attempt is given up
     * @param keywords     keywords to steer towards, matched case-insensitively
     *                     as substrings of words
     * @param alpha        power applied to edge unlikeliness, clamped to
     *                     [0.0625, 16.0]
     * @param beta         power applied to the keyword match count, clamped to
     *                     [0.0625, 16.0]
     * @param random       source of the draws
     * @return the sentence and its score, or the empty result when the walk
     *         reached an unknown tail or ran out of steps
     */
    public GenerationResult generateOnce(int targetLength, int maxLength, Collection<String> keywords,
            double alpha, double beta, Random random) {
        alpha = SamplingUtil.clampExponent(alpha);
        beta = SamplingUtil.clampExponent(beta);

        LinkedHashSet<String> unique = new LinkedHashSet<>();
        for (String keyword : keywords) {
            unique.add(keyword.toLowerCase(Locale.ROOT));
        }
        List<String> allKeywords = new ArrayList<>(unique);
        List<String> remaining = new ArrayList<>(allKeywords);
        List<String> found = new ArrayList<>();

        StringBuilder sentence = new StringBuilder();
        Tail tail = Tail.EMPTY;
        double score = 0.0;

        for (int i = 0; i < maxLength; i++) {
            ChainNode node = graph.get(tail.key());

            if (node == null || node.getWeight() == 0) {
                break;
            } else if (i >= targetLength && node.isExit()) {
                return finish(sentence, score, found.size(), beta);
            }

            if (!remaining.isEmpty()) {
                ChainNode matches = node.keywordView(remaining, found);
                if (matches.getWeight() > 0) {
                    node = matches;
                }
            }

            SamplingUtil.Draw draw = SamplingUtil.sample(node, random);
            score += SamplingUtil.edgeScore(draw.getChance(), alpha);

            if (draw.isEnd()) {
                if (i < targetLength) {
                    // too short to stop, start a new clause
                    sentence.append(' ');
                    tail = Tail.EMPTY;
                    continue;
                }
                return finish(sentence, score, found.size(), beta);
            }

            String word = draw.getWord();
            tail = tail.push(word, order);
            sentence.append(word);

            int matchIndex = indexOfMatch(remaining, word.toLowerCase(Locale.ROOT));
            if (matchIndex != -1 && !found.contains(word)) {
                found.add(word);
                remaining.remove(matchIndex);
                if (remaining.isEmpty()) {
                    remaining = new ArrayList<>(allKeywords);
                }
            }
        }

        return GenerationResult.empty();
    }

    private static GenerationResult finish(CharSequence sentence, double score, int foundCount, double beta) {
        return new GenerationResult(sentence.toString(), score * Math.pow(foundCount, beta));
    }

    private static int indexOfMatch(List<String> keywords, String lowercaseWord) {
        for (int k = 0; k < keywords.size(); k++) {
            if (lowercaseWord.contains(keywords.get(k))) {
                return k;
            }
        }
        return -1;
    }

    private ChainNode nodeAt(Tail tail) {
        return graph.computeIfAbsent(tail.key(), k -> new ChainNode());
    }

    public Optional<ChainNode> findNode(String tailKey) {
        return Optional.ofNullable(graph.get(tailKey));
    }

    public int getOrder() {
        return order;
    }

    /**
     * @return number of tails in the graph
     */
    public int size() {
        return graph.size();
    }
}
