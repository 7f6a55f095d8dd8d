package com.congruence.core.ingest;

import com.congruence.core.model.FunctionalRole;
import org.springframework.stereotype.Component;

/**
 * Suggests a functional role from modification statistics.
 */
@Component
public class RoleClassifier {

    static final int CORE_MODIFICATIONS = 100;

    public record Assessment(FunctionalRole role, double confidence) {}

    /**
     * First matching row wins:
     * <pre>
     * mods >= 100, files >= 10, avg &gt; 5   CODER        0.8
     * mods >= 100, files >= 10, avg &lt;= 5  REVIEWER     0.7
     * mods >= 50                          CODER        0.6
     * mods >= 10                          REVIEWER     0.5
     * otherwise                           UNCLASSIFIED 0.3
     * </pre>
     */
    public Assessment classify(int totalModifications, int filesCount, double avgModificationsPerFile) {
        if (totalModifications >= 100 && filesCount >= 10) {
            return avgModificationsPerFile > 5
                    ? new Assessment(FunctionalRole.CODER, 0.8)
                    : new Assessment(FunctionalRole.REVIEWER, 0.7);
        }
        if (totalModifications >= 50) {
            return new Assessment(FunctionalRole.CODER, 0.6);
        }
        if (totalModifications >= 10) {
            return new Assessment(FunctionalRole.REVIEWER, 0.5);
        }
        return new Assessment(FunctionalRole.UNCLASSIFIED, 0.3);
    }

    public boolean isCore(int totalModifications) {
        return totalModifications >= CORE_MODIFICATIONS;
    }
}
