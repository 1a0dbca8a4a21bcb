package com.starscape.mediavault.common.domain;

import java.io.Serializable;
import java.util.Objects;

/**
 * Base class for entities with identity-based equality.
 */
public abstract class Entity<ID extends Serializable> {
    
    protected Entity() {
    }
    
    public abstract ID getId();
    
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Entity<?> other = (Entity<?>) o;
        return getId() != null && Objects.equals(getId(), other.getId());
    }
    
    @Override
    public int hashCode() {
        return getClass().hashCode();
    }
}
