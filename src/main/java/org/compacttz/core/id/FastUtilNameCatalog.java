package org.compacttz.core.id;

import it.unimi.dsi.fastutil.objects.Object2IntMap;
import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Name catalog backed by a fastutil open-hash map for allocation-free string lookups.
 *
 * <p>Canonical names and aliases share one forward map (name -> canonical index). The instance
 * is immutable and thread-safe for concurrent reads.</p>
 */
public class FastUtilNameCatalog implements NameCatalog {

    // Name (canonical or alias) -> canonical index.
    private final Object2IntOpenHashMap<String> forward;
    // Canonical index -> id. Zero allocation read.
    private final TimezoneId[] reverse;
    private final List<String> canonicalNames;
    private final int aliasCount;

    /**
     * Builds the catalog from canonical names and an alias table.
     *
     * @param canonicalNames canonical names; list position becomes the catalog index.
     * @param aliases alias name -> canonical name.
     */
    public FastUtilNameCatalog(List<String> canonicalNames, Map<String, String> aliases) {
        if (canonicalNames == null) {
            throw new IllegalArgumentException("Canonical names cannot be null");
        }
        if (aliases == null) {
            throw new IllegalArgumentException("Aliases cannot be null");
        }
        int size = canonicalNames.size();

        this.forward = new Object2IntOpenHashMap<>(size + aliases.size());
        this.forward.defaultReturnValue(-1); // Sentinel value
        this.reverse = new TimezoneId[size];

        List<String> names = new ArrayList<>(size);
        for (int i = 0; i < size; i++) {
            String name = requireName(canonicalNames.get(i), "canonical name");
            if (forward.containsKey(name)) {
                throw new IllegalArgumentException("Duplicate canonical name: " + name);
            }
            forward.put(name, i);
            reverse[i] = new TimezoneId(i, name);
            names.add(name);
        }

        for (Map.Entry<String, String> entry : aliases.entrySet()) {
            String alias = requireName(entry.getKey(), "alias name");
            String target = requireName(entry.getValue(), "alias target");
            if (forward.containsKey(alias)) {
                throw new IllegalArgumentException("Alias collides with an existing name: " + alias);
            }
            int targetIndex = forward.getInt(target);
            if (targetIndex < 0 || !reverse[targetIndex].getName().equals(target)) {
                throw new IllegalArgumentException("Alias " + alias + " targets unknown canonical name: " + target);
            }
            forward.put(alias, targetIndex);
        }

        this.canonicalNames = Collections.unmodifiableList(names);
        this.aliasCount = aliases.size();
        // Trim to ensure minimal memory usage
        this.forward.trim();
    }

    private static String requireName(String name, String fieldName) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException(fieldName + " must be non-blank");
        }
        return name;
    }

    @Override
    public Optional<TimezoneId> resolve(String name) {
        if (name == null) {
            return Optional.empty();
        }
        // getInt avoids auto-boxing/unboxing
        int index = forward.getInt(name);
        if (index == -1) {
            return Optional.empty();
        }
        return Optional.of(reverse[index]);
    }

    @Override
    public TimezoneId id(int index) {
        try {
            return reverse[index];
        } catch (ArrayIndexOutOfBoundsException e) {
            throw new IndexOutOfBoundsException("Catalog index out of bounds: " + index);
        }
    }

    @Override
    public List<String> canonicalNames() {
        return canonicalNames;
    }

    @Override
    public boolean isAlias(String name) {
        if (name == null) {
            return false;
        }
        int index = forward.getInt(name);
        return index != -1 && !reverse[index].getName().equals(name);
    }

    @Override
    public int size() {
        return reverse.length;
    }

    @Override
    public int aliasCount() {
        return aliasCount;
    }

    @Override
    public List<String> aliasesOf(TimezoneId id) {
        Objects.requireNonNull(id, "id");
        List<String> aliases = new ArrayList<>();
        for (Object2IntMap.Entry<String> entry : forward.object2IntEntrySet()) {
            if (entry.getIntValue() == id.getIndex() && !entry.getKey().equals(id.getName())) {
                aliases.add(entry.getKey());
            }
        }
        Collections.sort(aliases);
        return aliases;
    }
}
