package org.compacttz.core.id;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Lookup contract between IANA zone names (canonical or alias) and canonical {@link TimezoneId}s.
 */
public interface NameCatalog {

    /**
     * Resolves a canonical or alias name to its canonical zone id.
     *
     * <p>Matching is exact and case-sensitive. {@code null} and unknown names resolve to empty.</p>
     *
     * @param name zone name.
     * @return canonical zone id, or empty when the name is not known.
     */
    Optional<TimezoneId> resolve(String name);

    /**
     * Returns the canonical zone id stored at a catalog index.
     *
     * @param index dense catalog index.
     * @return canonical zone id.
     * @throws IndexOutOfBoundsException If the index is invalid.
     */
    TimezoneId id(int index);

    /**
     * Returns all canonical names in their fixed catalog order.
     *
     * @return immutable ordered name list.
     */
    List<String> canonicalNames();

    /**
     * Checks whether the name is a legacy alias of a canonical zone.
     *
     * @param name zone name to test.
     * @return true when the name is a registered alias.
     */
    boolean isAlias(String name);

    /**
     * Returns number of canonical zones.
     *
     * @return canonical zone count.
     */
    int size();

    /**
     * Returns number of registered aliases.
     *
     * @return alias count.
     */
    int aliasCount();

    /**
     * Returns the sorted alias names that resolve to the given canonical zone.
     *
     * @param id canonical zone id.
     * @return alias names, empty when the zone has none.
     */
    List<String> aliasesOf(TimezoneId id);

    /**
     * Factory method to create the default immutable implementation.
     *
     * @param canonicalNames canonical names in catalog order.
     * @param aliases alias name -> canonical name.
     * @return An immutable catalog instance.
     */
    static NameCatalog createImmutable(List<String> canonicalNames, Map<String, String> aliases) {
        return new FastUtilNameCatalog(canonicalNames, aliases);
    }
}
