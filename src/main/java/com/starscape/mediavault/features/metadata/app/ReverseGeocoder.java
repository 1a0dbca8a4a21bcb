package com.starscape.mediavault.features.metadata.app;

import com.starscape.mediavault.features.metadata.domain.Place;

import java.util.Optional;

/**
 * Resolves coordinates to place names. Implementations swallow lookup
 * failures and return empty.
 */
public interface ReverseGeocoder {
    
    boolean isEnabled();
    
    Optional<Place> lookup(double latitude, double longitude);
}
