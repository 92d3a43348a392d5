package org.compacttz.data;

import lombok.experimental.UtilityClass;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Objects;

/**
 * Reads whole classpath resources.
 */
@UtilityClass
final class ClasspathResources {

    /**
     * Reads a resource fully.
     *
     * @throws CorruptEmbeddedDataException With {@code MISSING_RESOURCE} when the resource is absent.
     */
    static byte[] read(ClassLoader loader, String resource) {
        Objects.requireNonNull(loader, "loader");
        Objects.requireNonNull(resource, "resource");
        try (InputStream in = loader.getResourceAsStream(resource)) {
            if (in == null) {
                throw new CorruptEmbeddedDataException(
                        CorruptEmbeddedDataException.REASON_MISSING_RESOURCE,
                        "embedded resource not found on classpath: " + resource
                );
            }
            return in.readAllBytes();
        } catch (IOException ex) {
            throw new UncheckedIOException("failed to read embedded resource " + resource, ex);
        }
    }
}
