package io.gridsweep.store;

import java.io.IOException;
import java.nio.file.Path;

public interface ThumbnailGenerator {
    /**
     * Writes a reduced copy of {@code source} to {@code target}.
     *
     * @return {@code false} when the source format cannot be decoded
     */
    boolean generate(Path source, Path target) throws IOException;
}
