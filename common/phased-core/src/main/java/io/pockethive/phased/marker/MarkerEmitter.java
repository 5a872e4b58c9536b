package io.pockethive.phased.marker;

import io.pockethive.phased.snapshot.ContextSnapshot;
import io.pockethive.phased.snapshot.SnapshotCodec;
import java.util.Objects;

/**
 * Writes the in-place marker for a deferred block:
 * {@code DELIM + literal + DELIM + encodedSnapshot + DELIM}.
 * <p>
 * The literal is not checked for the delimiter. Keeping the delimiter out of rendered content is
 * a configuration contract.
 */
public final class MarkerEmitter {

    private final String delimiter;
    private final SnapshotCodec codec;

    public MarkerEmitter(String delimiter, SnapshotCodec codec) {
        this.delimiter = Objects.requireNonNull(delimiter, "delimiter");
        this.codec = Objects.requireNonNull(codec, "codec");
    }

    public String emit(String literal, ContextSnapshot snapshot) {
        Objects.requireNonNull(literal, "literal");
        String encoded = codec.encode(snapshot);
        return new StringBuilder(literal.length() + encoded.length() + delimiter.length() * 3)
            .append(delimiter)
            .append(literal)
            .append(delimiter)
            .append(encoded)
            .append(delimiter)
            .toString();
    }

    public String delimiter() {
        return delimiter;
    }
}
