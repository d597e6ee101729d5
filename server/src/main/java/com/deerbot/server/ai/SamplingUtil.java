package com.deerbot.server.ai;

import java.util.Random;

public class SamplingUtil {

    public static final double MIN_EXPONENT = 0.0625;
    public static final double MAX_EXPONENT = 16.0;

    /**
     * Outcome of one weighted draw. A null word means the draw ended the
     * sentence, either by landing on the exit share of the node or because
     * the node had no weight at all.
     */
    public static class Draw {
        private final String word;
        private final double chance;

        public Draw(String word, double chance) {
            this.word = word;
            this.chance = chance;
        }

        public String getWord() {
            return word;
        }

        public double getChance() {
            return chance;
        }

        public boolean isEnd() {
            return word == null;
        }
    }

    /**
     * Clamps a scoring exponent to [0.0625, 16.0]. NaN clamps to the minimum.
     */
    public static double clampExponent(double value) {
        if (Double.isNaN(value)) {
            return MIN_EXPONENT;
        }
        return Math.max(MIN_EXPONENT, Math.min(MAX_EXPONENT, value));
    }

    /**
     * Picks uniformly in [0, weight) and walks the frequencies in link order.
     * The chance of the picked edge is its frequency over the node weight.
     * Picks that fall past the last edge are exits and keep a chance of 1.0.
     */
    public static Draw sample(ChainNode node, Random random) {
        int weight = node.getWeight();
        if (weight <= 0) {
            return new Draw(null, 1.0);
        }

        int pick = random.nextInt(weight);
        for (int edge = 0; edge < node.size(); edge++) {
            int freq = node.freqAt(edge);
            if (pick < freq) {
                return new Draw(node.linkAt(edge), (double) freq / weight);
            }
            pick -= freq;
        }
        return new Draw(null, 1.0);
    }

    /**
     * Score contributed by an edge picked with probability {@code chance}:
     * (1 / chance) ^ alpha, or 0 for a non-positive chance.
     */
    public static double edgeScore(double chance, double alpha) {
        if (chance <= 0.0) {
            return 0.0;
        }
        return Math.pow(1.0 / chance, alpha);
    }
}
