package org.compacttz.rules;

import org.compacttz.core.id.TimezoneId;

import java.util.List;
import java.util.Objects;

/**
 * Immutable table of compact rule sets indexed by catalog index.
 *
 * <p>Built once from embedded data; reads need no synchronization.</p>
 */
public final class CompactRuleRegistry {

    private final CompactRuleSet[] rulesByIndex;

    /**
     * Creates a registry from rule sets in catalog order.
     *
     * @param rules one rule set per canonical zone.
     */
    public CompactRuleRegistry(List<CompactRuleSet> rules) {
        Objects.requireNonNull(rules, "rules");
        this.rulesByIndex = new CompactRuleSet[rules.size()];
        for (int i = 0; i < rulesByIndex.length; i++) {
            rulesByIndex[i] = Objects.requireNonNull(rules.get(i), "rules[" + i + "]");
        }
    }

    /**
     * Returns the rule set of a catalog zone. Total over every id of the matching catalog.
     *
     * @param id canonical zone id.
     * @return compact rule set.
     */
    public CompactRuleSet get(TimezoneId id) {
        Objects.requireNonNull(id, "id");
        return get(id.getIndex());
    }

    /**
     * Returns the rule set stored at a catalog index.
     *
     * @throws IndexOutOfBoundsException If the index is invalid.
     */
    public CompactRuleSet get(int index) {
        if (index < 0 || index >= rulesByIndex.length) {
            throw new IndexOutOfBoundsException("Catalog index out of bounds: " + index);
        }
        return rulesByIndex[index];
    }

    /**
     * Returns number of registered zones.
     */
    public int size() {
        return rulesByIndex.length;
    }

    /**
     * Returns number of zones flagged always-historical.
     */
    public int alwaysHistoricalCount() {
        int count = 0;
        for (CompactRuleSet rules : rulesByIndex) {
            if (rules.isAlwaysHistorical()) {
                count++;
            }
        }
        return count;
    }
}
