package com.starscape.mediavault.features.metadata.domain;

import com.starscape.mediavault.common.domain.ValueObject;

/**
 * Reverse-geocoded place names. Any part may be null.
 */
public record Place(
    String city,
    String state,
    String country
) implements ValueObject {
    
    public boolean isEmpty() {
        return city == null && state == null && country == null;
    }
}
