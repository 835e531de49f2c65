package com.platform.provisioner.reconciliation;

import java.util.List;
import java.util.Optional;
import java.util.function.BiFunction;

/**
 * Correlates by list position: the n-th declared item corresponds to the n-th remote item.
 * Reordering the declared list therefore changes which remote item each entry updates.
 */
public class PositionalCorrelation<T> implements CorrelationStrategy<T> {
    
    private final BiFunction<T, Integer, T> identityForPosition;
    
    /**
     * @param identityForPosition derives the identity of an item from its 1-based position
     */
    public PositionalCorrelation(BiFunction<T, Integer, T> identityForPosition) {
        this.identityForPosition = identityForPosition;
    }
    
    @Override
    public Optional<T> match(List<T> remote, T declared, int position) {
        return position < remote.size() ? Optional.ofNullable(remote.get(position)) : Optional.empty();
    }
    
    @Override
    public T assignIdentity(T declared, int position) {
        return identityForPosition.apply(declared, position + 1);
    }
}
