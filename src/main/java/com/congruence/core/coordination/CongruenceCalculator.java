package com.congruence.core.coordination;

import com.congruence.core.model.CaEdge;
import com.congruence.core.model.CrEdge;
import com.congruence.core.model.Evidence;
import com.congruence.core.model.TaEntry;
import com.congruence.core.model.TdEdge;
import com.congruence.core.model.UnorderedPair;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.function.BiFunction;
import java.util.function.Function;

/**
 * Graph arithmetic behind STC and MC-STC. Holds no state besides its thresholds,
 * so every method is a pure function of its arguments.
 */
public class CongruenceCalculator {

    private final CoordinationProperties.Thresholds thresholds;
    private final CrWeightingPolicy weightingPolicy;

    public CongruenceCalculator(CoordinationProperties.Thresholds thresholds, CrWeightingPolicy weightingPolicy) {
        this.thresholds = thresholds;
        this.weightingPolicy = weightingPolicy;
    }

    /**
     * Undirected TD edges from a {@code {fileX: {fileY: weight}}} matrix already resolved to file ids.
     * Self pairs and non-positive weights are dropped; when both directions are present the larger
     * weight wins.
     */
    public List<TdEdge> technicalDependencies(Map<Long, Map<Long, Double>> matrix) {
        Map<UnorderedPair<Long>, Double> edges = new HashMap<>();
        matrix.forEach((x, row) -> row.forEach((y, weight) -> {
            if (x.equals(y) || weight == null || weight <= 0) {
                return;
            }
            edges.merge(UnorderedPair.of(x, y), weight, Math::max);
        }));
        return sorted(edges, TdEdge::new, TdEdge::files);
    }

    /**
     * Contributors sharing files they both edited at least {@code minEditsPerFile} times.
     * Weight is the number of shared files.
     */
    public List<CaEdge> communicationActivity(List<TaEntry> ta) {
        Map<Long, List<Long>> byFile = new TreeMap<>();
        for (TaEntry entry : ta) {
            if (entry.editCount() >= thresholds.getMinEditsPerFile()) {
                byFile.computeIfAbsent(entry.fileId(), f -> new ArrayList<>()).add(entry.contributorId());
            }
        }
        Map<UnorderedPair<Long>, Integer> shared = new HashMap<>();
        for (List<Long> editors : byFile.values()) {
            List<Long> distinct = editors.stream().distinct().sorted().toList();
            for (int i = 0; i < distinct.size(); i++) {
                for (int j = i + 1; j < distinct.size(); j++) {
                    shared.merge(new UnorderedPair<>(distinct.get(i), distinct.get(j)), 1, Integer::sum);
                }
            }
        }
        List<CaEdge> edges = new ArrayList<>();
        shared.forEach((pair, count) -> {
            if (count >= thresholds.getMinSharedFiles()) {
                Evidence evidence = count >= thresholds.getCoEditSharedFiles() ? Evidence.CO_EDIT : Evidence.SAME_FILE;
                edges.add(new CaEdge(pair, count, evidence));
            }
        });
        edges.sort(Comparator.comparing((CaEdge e) -> e.contributors().first())
                .thenComparing(e -> e.contributors().second()));
        return edges;
    }

    /**
     * Coordination requirements: A touches X, B touches Y, X and Y depend on each other, A is not B.
     */
    public List<CrEdge> coordinationRequirements(List<TaEntry> ta, List<TdEdge> td) {
        Map<Long, Map<Long, Integer>> touches = new HashMap<>();
        for (TaEntry entry : ta) {
            if (entry.editCount() > 0) {
                touches.computeIfAbsent(entry.fileId(), f -> new HashMap<>())
                        .merge(entry.contributorId(), entry.editCount(), Integer::sum);
            }
        }
        Map<UnorderedPair<Long>, Double> requirements = new HashMap<>();
        for (TdEdge edge : td) {
            Map<Long, Integer> onX = touches.getOrDefault(edge.files().first(), Map.of());
            Map<Long, Integer> onY = touches.getOrDefault(edge.files().second(), Map.of());
            for (Map.Entry<Long, Integer> a : onX.entrySet()) {
                for (Map.Entry<Long, Integer> b : onY.entrySet()) {
                    if (a.getKey().equals(b.getKey())) {
                        continue;
                    }
                    double weight = weightingPolicy.weight(a.getValue(), b.getValue(), edge.weight());
                    if (weight > 0) {
                        requirements.merge(UnorderedPair.of(a.getKey(), b.getKey()), weight, Double::sum);
                    }
                }
            }
        }
        return sorted(requirements, CrEdge::new, CrEdge::contributors);
    }

    /**
     * CR edges with no CA edge between the same contributors.
     */
    public int diffCount(List<CrEdge> cr, List<CaEdge> ca) {
        Set<UnorderedPair<Long>> actual = caPairs(ca);
        return (int) cr.stream().filter(e -> !actual.contains(e.contributors())).count();
    }

    /**
     * {@code |CR ∩ CA| / |CR|}, 1.0 when nothing is required. Rounded to three decimals.
     */
    public double stc(List<CrEdge> cr, List<CaEdge> ca) {
        if (cr.isEmpty()) {
            return 1.0;
        }
        int matched = cr.size() - diffCount(cr, ca);
        return round((double) matched / cr.size());
    }

    /**
     * Per class-pair congruence for the given contributor classes. Contributors without a
     * class count as {@code UNCLASSIFIED}.
     */
    public List<ClassPairScore> classPairScores(List<CrEdge> cr, List<CaEdge> ca, Map<Long, String> classes,
                                                ClassPolicy policy) {
        Set<UnorderedPair<Long>> actual = caPairs(ca);
        Map<String, int[]> counts = new TreeMap<>();
        for (CrEdge edge : cr) {
            String a = classes.getOrDefault(edge.contributors().first(), "UNCLASSIFIED");
            String b = classes.getOrDefault(edge.contributors().second(), "UNCLASSIFIED");
            int[] c = counts.computeIfAbsent(ClassPolicy.pairKey(a, b), k -> new int[2]);
            c[0]++;
            if (actual.contains(edge.contributors())) {
                c[1]++;
            }
        }
        List<ClassPairScore> scores = new ArrayList<>();
        counts.forEach((key, c) -> {
            String[] parts = key.split("\\|", 2);
            scores.add(new ClassPairScore(key, c[0], c[1], round((double) c[1] / c[0]),
                    policy.pairWeight(parts[0], parts[1])));
        });
        return scores;
    }

    /**
     * {@code Σ w·|CR_p|·ratio_p / Σ w·|CR_p|}, 1.0 when nothing weighs in. Rounded to three decimals.
     */
    public double mcStc(List<ClassPairScore> scores) {
        double numerator = 0;
        double denominator = 0;
        for (ClassPairScore score : scores) {
            numerator += score.weight() * score.matched();
            denominator += score.weight() * score.crCount();
        }
        if (denominator <= 0) {
            return 1.0;
        }
        return round(Math.min(1.0, numerator / denominator));
    }

    static double round(double value) {
        return BigDecimal.valueOf(value).setScale(3, RoundingMode.HALF_UP).doubleValue();
    }

    private static Set<UnorderedPair<Long>> caPairs(List<CaEdge> ca) {
        Set<UnorderedPair<Long>> pairs = new HashSet<>();
        for (CaEdge edge : ca) {
            pairs.add(edge.contributors());
        }
        return pairs;
    }

    private static <E> List<E> sorted(Map<UnorderedPair<Long>, Double> weights,
                                      BiFunction<UnorderedPair<Long>, Double, E> factory,
                                      Function<E, UnorderedPair<Long>> pairOf) {
        List<E> edges = new ArrayList<>();
        weights.forEach((pair, weight) -> edges.add(factory.apply(pair, weight)));
        edges.sort(Comparator.comparing((E e) -> pairOf.apply(e).first()).thenComparing(e -> pairOf.apply(e).second()));
        return edges;
    }
}
