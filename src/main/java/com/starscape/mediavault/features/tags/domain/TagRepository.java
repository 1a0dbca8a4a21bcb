package com.starscape.mediavault.features.tags.domain;

import java.util.List;
import java.util.Optional;

/**
 * Repository interface for Tag domain entity.
 */
public interface TagRepository {
    Tag save(Tag tag);
    Optional<Tag> findByLabel(String label);
    List<Tag> findAllByOrderByLabelAsc();
}
