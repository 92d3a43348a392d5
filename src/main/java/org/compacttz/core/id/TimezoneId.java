package org.compacttz.core.id;

import lombok.Value;

/**
 * Canonical IANA zone identity: the catalog name plus its dense catalog index.
 *
 * <p>The index addresses the zone's compact rule set and historical section.</p>
 */
@Value
public class TimezoneId {
    int index;
    String name;

    @Override
    public String toString() {
        return name;
    }
}
