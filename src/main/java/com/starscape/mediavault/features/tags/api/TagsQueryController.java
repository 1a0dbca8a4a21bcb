package com.starscape.mediavault.features.tags.api;

import com.starscape.mediavault.features.tags.api.dto.TagsResponse;
import com.starscape.mediavault.features.tags.domain.Tag;
import com.starscape.mediavault.features.tags.domain.TagRepository;
import org.springframework.http.ResponseEntity;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Lists the tags created from embedded keywords.
 */
@RestController
@RequestMapping("/queries/tags")
public class TagsQueryController {
    
    private final TagRepository tagRepository;
    
    public TagsQueryController(TagRepository tagRepository) {
        this.tagRepository = tagRepository;
    }
    
    /**
     * GET /queries/tags
     */
    @GetMapping
    @Transactional(readOnly = true)
    public ResponseEntity<TagsResponse> listTags() {
        return ResponseEntity.ok(new TagsResponse(
            tagRepository.findAllByOrderByLabelAsc().stream().map(Tag::getLabel).toList()
        ));
    }
}
