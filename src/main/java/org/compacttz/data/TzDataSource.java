package org.compacttz.data;

import org.compacttz.core.id.TimezoneId;

/**
 * Supplies the compressed historical section of a zone.
 *
 * <p>Decouples table decompression from where the bytes live (classpath resource, file, test
 * fixture).</p>
 */
public interface TzDataSource {

    /**
     * Returns the zstd-compressed historical section of a zone.
     *
     * @param zone canonical zone id.
     * @return compressed bytes; the caller owns the returned array.
     * @throws CorruptEmbeddedDataException If the section cannot be located.
     */
    byte[] compressedBytesFor(TimezoneId zone);
}
