package com.starscape.mediavault.features.tags.infra;

import com.starscape.mediavault.features.tags.domain.Tag;
import com.starscape.mediavault.features.tags.domain.TagRepository;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

/**
 * JPA repository implementation for Tag entity.
 */
@Repository
public interface JpaTagRepository extends JpaRepository<Tag, String>, TagRepository {
    
    @Override
    Optional<Tag> findByLabel(String label);
    
    @Override
    List<Tag> findAllByOrderByLabelAsc();
}
