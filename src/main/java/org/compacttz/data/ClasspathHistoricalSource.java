package org.compacttz.data;

import org.compacttz.core.id.TimezoneId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Historical data source backed by a classpath resource.
 *
 * <p>The container is read and validated on the first section request, so a process that never
 * queries pre-rule instants never touches it. A failed read is not remembered and the next
 * request retries.</p>
 */
public final class ClasspathHistoricalSource implements TzDataSource {
    private static final Logger log = LoggerFactory.getLogger(ClasspathHistoricalSource.class);

    private final ClassLoader loader;
    private final String resource;
    private final int expectedZoneCount;
    private volatile HistoricalBlob blob;

    /**
     * Creates a lazy classpath source.
     *
     * @param loader loader used to locate the resource.
     * @param resource classpath location of the container.
     * @param expectedZoneCount catalog size the container must match.
     */
    public ClasspathHistoricalSource(ClassLoader loader, String resource, int expectedZoneCount) {
        this.loader = Objects.requireNonNull(loader, "loader");
        this.resource = Objects.requireNonNull(resource, "resource");
        this.expectedZoneCount = expectedZoneCount;
    }

    @Override
    public byte[] compressedBytesFor(TimezoneId zone) {
        return container().compressedBytesFor(zone);
    }

    /**
     * Returns {@code true} once the container has been read.
     */
    public boolean isOpened() {
        return blob != null;
    }

    private HistoricalBlob container() {
        HistoricalBlob current = blob;
        if (current != null) {
            return current;
        }
        synchronized (this) {
            if (blob == null) {
                HistoricalBlob parsed = HistoricalBlob.parse(ClasspathResources.read(loader, resource), expectedZoneCount);
                log.debug("Opened historical container {} ({} zones, {} bytes)", resource, parsed.zoneCount(), parsed.sizeBytes());
                blob = parsed;
            }
            return blob;
        }
    }
}
