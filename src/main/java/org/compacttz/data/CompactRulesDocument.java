package org.compacttz.data;

import lombok.Value;
import org.compacttz.core.id.NameCatalog;
import org.compacttz.rules.CompactRuleRegistry;
import org.compacttz.rules.CompactRuleSet;

import java.util.List;
import java.util.Map;

/**
 * Decoded compact-rules resource: the name catalog plus one rule set per canonical zone.
 */
@Value
public class CompactRulesDocument {
    /** Canonical names in catalog order. */
    List<String> canonicalNames;
    /** Alias name -> canonical name. */
    Map<String, String> aliases;
    /** Rule sets aligned with {@link #canonicalNames}. */
    List<CompactRuleSet> rules;

    /**
     * Builds the immutable name catalog.
     */
    public NameCatalog toCatalog() {
        return NameCatalog.createImmutable(canonicalNames, aliases);
    }

    /**
     * Builds the immutable compact rule registry.
     */
    public CompactRuleRegistry toRegistry() {
        return new CompactRuleRegistry(rules);
    }
}
