package com.platform.provisioner.model;

/**
 * A child resource whose remote identity is derived from its position in the declared list.
 */
public interface PositionalResource<T extends PositionalResource<T>> {
    
    String id();
    
    T withId(String id);
}
