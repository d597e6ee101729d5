package com.deerbot.server.ai;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Outgoing transitions of one tail. Links and frequencies are index aligned.
 * The weight is the sum of the frequencies plus one for every time the tail
 * ended an analyzed sequence.
 */
public class ChainNode {

    private final List<String> links = new ArrayList<>();
    private final List<Integer> freqs = new ArrayList<>();
    // word -> position in links
    private final Map<String, Integer> index = new HashMap<>();
    private int weight;
    private boolean exit;

    public ChainNode() {
    }

    ChainNode(List<String> links, List<Integer> freqs, int weight, boolean exit) {
        if (links.size() != freqs.size()) {
            throw new IllegalArgumentException(
                    "Links and freqs differ in length: " + links.size() + " vs " + freqs.size());
        }
        long sum = 0;
        for (int i = 0; i < links.size(); i++) {
            String word = links.get(i);
            Integer freq = freqs.get(i);
            if (word == null) {
                throw new IllegalArgumentException("Null link at " + i);
            }
            if (freq == null || freq < 0) {
                throw new IllegalArgumentException("Invalid frequency " + freq + " for link: " + word);
            }
            if (index.putIfAbsent(word, i) != null) {
                throw new IllegalArgumentException("Duplicate link: " + word);
            }
            this.links.add(word);
            this.freqs.add(freq);
            sum += freq;
        }
        if (weight < 0 || weight < sum) {
            throw new IllegalArgumentException("Weight " + weight + " is below the frequency sum " + sum);
        }
        this.weight = weight;
        this.exit = exit;
    }

    /**
     * Records one observed transition to {@code word}.
     */
    void record(String word) {
        Integer i = index.get(word);
        if (i == null) {
            index.put(word, links.size());
            links.add(word);
            freqs.add(1);
        } else {
            freqs.set(i, freqs.get(i) + 1);
        }
        weight++;
    }

    /**
     * Records that an analyzed sequence ended at this node.
     */
    void markExit() {
        weight++;
        exit = true;
    }

    /**
     * Builds a detached node holding only the links that contain one of the
     * {@code keywords} (lowercase) and are not in {@code found}. The view is
     * never an exit, so its weight is the sum of the included frequencies.
     */
    public ChainNode keywordView(Collection<String> keywords, Collection<String> found) {
        ChainNode view = new ChainNode();
        for (int i = 0; i < links.size(); i++) {
            String word = links.get(i);
            if (found.contains(word)) {
                continue;
            }
            String lowercase = word.toLowerCase(Locale.ROOT);
            for (String keyword : keywords) {
                if (lowercase.contains(keyword)) {
                    int freq = freqs.get(i);
                    view.index.put(word, view.links.size());
                    view.links.add(word);
                    view.freqs.add(freq);
                    view.weight += freq;
                    break;
                }
            }
        }
        return view;
    }

    public int size() {
        return links.size();
    }

    public String linkAt(int i) {
        return links.get(i);
    }

    public int freqAt(int i) {
        return freqs.get(i);
    }

    /**
     * @return frequency of {@code word}, 0 when it is not a link
     */
    public int frequencyOf(String word) {
        Integer i = index.get(word);
        return i == null ? 0 : freqs.get(i);
    }

    public List<String> getLinks() {
        return Collections.unmodifiableList(links);
    }

    public List<Integer> getFreqs() {
        return Collections.unmodifiableList(freqs);
    }

    public int getWeight() {
        return weight;
    }

    public boolean isExit() {
        return exit;
    }

    @Override
    public String toString() {
        return "ChainNode{links=" + links.size() + ", weight=" + weight + ", exit=" + exit + "}";
    }
}
