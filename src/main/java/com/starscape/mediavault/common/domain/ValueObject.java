package com.starscape.mediavault.common.domain;

/**
 * Marker for immutable value types compared by their attributes.
 */
public interface ValueObject {
}
