package io.fleetcontroller.store;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * A stored value together with the etcd mod revision it was read at.
 * Revision 0 stands for an absent key.
 */
@Data
@AllArgsConstructor
public class Versioned<T> {
    private final T value;
    private final long revision;
}
