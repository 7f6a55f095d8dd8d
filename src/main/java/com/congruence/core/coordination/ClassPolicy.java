package com.congruence.core.coordination;

import com.congruence.core.model.FunctionalRole;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Partitions contributors into functional classes for MC-STC and weighs class pairs.
 * <ol>
 *   <li>a configured keyword found in the login selects its class;</li>
 *   <li>otherwise fewer than {@code minModifications} gives {@link #OCCASIONAL};</li>
 *   <li>otherwise the functional role names the class.</li>
 * </ol>
 */
public class ClassPolicy {

    public static final String OCCASIONAL = "OCCASIONAL";

    private final Map<String, List<String>> keywords;
    private final int minModifications;
    private final Map<String, Double> pairWeights;
    private final double defaultPairWeight;
    private final double occasionalPairWeight;

    public ClassPolicy(Map<String, List<String>> keywords, int minModifications, Map<String, Double> pairWeights,
                       double defaultPairWeight, double occasionalPairWeight) {
        this.keywords = new LinkedHashMap<>(keywords);
        this.minModifications = minModifications;
        this.pairWeights = new LinkedHashMap<>();
        pairWeights.forEach((key, weight) -> {
            String[] parts = key.split("\\|", 2);
            if (parts.length != 2) {
                throw new IllegalArgumentException("Class pair weight key must look like A|B: " + key);
            }
            this.pairWeights.put(pairKey(parts[0].trim(), parts[1].trim()), weight);
        });
        this.defaultPairWeight = defaultPairWeight;
        this.occasionalPairWeight = occasionalPairWeight;
    }

    public static ClassPolicy from(CoordinationProperties.Classes classes) {
        return new ClassPolicy(classes.getKeywords(), classes.getMinModifications(), classes.getPairWeights(),
                classes.getDefaultPairWeight(), classes.getOccasionalPairWeight());
    }

    public String classify(String login, int totalModifications, FunctionalRole role) {
        String normalized = login == null ? "" : login.toLowerCase(Locale.ROOT);
        for (Map.Entry<String, List<String>> entry : keywords.entrySet()) {
            for (String keyword : entry.getValue()) {
                if (!keyword.isBlank() && normalized.contains(keyword.toLowerCase(Locale.ROOT))) {
                    return entry.getKey().toUpperCase(Locale.ROOT);
                }
            }
        }
        if (totalModifications < minModifications) {
            return OCCASIONAL;
        }
        return (role == null ? FunctionalRole.UNCLASSIFIED : role).name();
    }

    public double pairWeight(String classA, String classB) {
        Double configured = pairWeights.get(pairKey(classA, classB));
        if (configured != null) {
            return configured;
        }
        if (OCCASIONAL.equals(classA) || OCCASIONAL.equals(classB)) {
            return occasionalPairWeight;
        }
        return defaultPairWeight;
    }

    /**
     * Order-independent key of a class pair.
     */
    public static String pairKey(String classA, String classB) {
        return classA.compareTo(classB) <= 0 ? classA + "|" + classB : classB + "|" + classA;
    }

    /**
     * Settings in a form stored with each MC-STC run.
     */
    public Map<String, Object> describe() {
        var description = new LinkedHashMap<String, Object>();
        description.put("keywords", keywords);
        description.put("minModifications", minModifications);
        description.put("pairWeights", pairWeights);
        description.put("defaultPairWeight", defaultPairWeight);
        description.put("occasionalPairWeight", occasionalPairWeight);
        return description;
    }
}
