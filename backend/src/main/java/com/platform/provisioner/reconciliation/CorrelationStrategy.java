package com.platform.provisioner.reconciliation;

import java.util.List;
import java.util.Optional;

/**
 * Pairs declared child resources with their remote counterparts.
 *
 * @param <T> resource kind
 */
public interface CorrelationStrategy<T> {
    
    /**
     * Remote counterpart of the declared item at {@code position} (0-based), if any.
     */
    Optional<T> match(List<T> remote, T declared, int position);
    
    /**
     * The declared item carrying the identity it is inserted or patched under.
     */
    T assignIdentity(T declared, int position);
}
