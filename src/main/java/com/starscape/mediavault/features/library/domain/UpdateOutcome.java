package com.starscape.mediavault.features.library.domain;

/**
 * Result of applying a {@link MediaPatch}.
 * @param metadataChanged whether any enrichment field changed
 * @param tagsLinked number of keyword tags newly linked to the row
 */
public record UpdateOutcome(boolean metadataChanged, int tagsLinked) {
}
