package com.congruence.core.coordination;

import com.congruence.core.model.Algorithm;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Congruence thresholds and MC-STC class policy, bound from {@code congruence.coordination.*}.
 */
@Component
@ConfigurationProperties(prefix = "congruence.coordination")
public class CoordinationProperties {

    /** Scores computed after each mining run. */
    private List<Algorithm> algorithms = new ArrayList<>(List.of(Algorithm.STC, Algorithm.MC_STC));

    private final Thresholds thresholds = new Thresholds();
    private final Classes classes = new Classes();

    public List<Algorithm> getAlgorithms() { return algorithms; }
    public void setAlgorithms(List<Algorithm> algorithms) { this.algorithms = algorithms; }

    public Thresholds getThresholds() { return thresholds; }

    public Classes getClasses() { return classes; }

    public static class Thresholds {
        /** Edits a contributor needs on a file for it to count towards CA. */
        private int minEditsPerFile = 1;
        /** Shared files needed before two contributors get a CA edge. */
        private int minSharedFiles = 1;
        /** Shared files from which a CA edge counts as CO_EDIT rather than SAME_FILE. */
        private int coEditSharedFiles = 3;

        public int getMinEditsPerFile() { return minEditsPerFile; }
        public void setMinEditsPerFile(int minEditsPerFile) { this.minEditsPerFile = minEditsPerFile; }

        public int getMinSharedFiles() { return minSharedFiles; }
        public void setMinSharedFiles(int minSharedFiles) { this.minSharedFiles = minSharedFiles; }

        public int getCoEditSharedFiles() { return coEditSharedFiles; }
        public void setCoEditSharedFiles(int coEditSharedFiles) { this.coEditSharedFiles = coEditSharedFiles; }
    }

    public static class Classes {
        /** Below this many modifications a contributor is OCCASIONAL. */
        private int minModifications = 10;
        /** Class name to login keywords; a keyword match wins over every other rule. */
        private Map<String, List<String>> keywords = new LinkedHashMap<>(Map.of(
                "BOT", List.of("[bot]", "dependabot", "renovate")));
        /** Weight per class pair, keyed {@code A|B} in either order. */
        private Map<String, Double> pairWeights = new LinkedHashMap<>();
        private double defaultPairWeight = 1.0;
        /** Weight of every pair involving OCCASIONAL unless listed in {@link #pairWeights}. */
        private double occasionalPairWeight = 0.5;

        public int getMinModifications() { return minModifications; }
        public void setMinModifications(int minModifications) { this.minModifications = minModifications; }

        public Map<String, List<String>> getKeywords() { return keywords; }
        public void setKeywords(Map<String, List<String>> keywords) { this.keywords = keywords; }

        public Map<String, Double> getPairWeights() { return pairWeights; }
        public void setPairWeights(Map<String, Double> pairWeights) { this.pairWeights = pairWeights; }

        public double getDefaultPairWeight() { return defaultPairWeight; }
        public void setDefaultPairWeight(double defaultPairWeight) { this.defaultPairWeight = defaultPairWeight; }

        public double getOccasionalPairWeight() { return occasionalPairWeight; }
        public void setOccasionalPairWeight(double occasionalPairWeight) { this.occasionalPairWeight = occasionalPairWeight; }
    }
}
