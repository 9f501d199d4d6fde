package io.fleetcontroller.store;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Deletion of a key lock row, applied only if the row is still at {@code expectedRevision}.
 */
@Data
@AllArgsConstructor
public class KeyRelease {
    private final String cluster;
    private final String key;
    private final long expectedRevision;
}
