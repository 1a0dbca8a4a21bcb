package com.starscape.mediavault.features.tags.app;

import com.starscape.mediavault.features.tags.domain.MediaTag;
import com.starscape.mediavault.features.tags.domain.MediaTagRepository;
import com.starscape.mediavault.features.tags.domain.Tag;
import com.starscape.mediavault.features.tags.domain.TagRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.LinkedHashSet;
import java.util.Set;
import java.util.UUID;

/**
 * Turns a row's comma-separated keywords into tags.
 * Creates each tag if it doesn't exist, then links it to the media item.
 */
@Service
public class KeywordTagLinker {
    
    private static final Logger log = LoggerFactory.getLogger(KeywordTagLinker.class);
    
    private final TagRepository tagRepository;
    private final MediaTagRepository mediaTagRepository;
    
    public KeywordTagLinker(TagRepository tagRepository, MediaTagRepository mediaTagRepository) {
        this.tagRepository = tagRepository;
        this.mediaTagRepository = mediaTagRepository;
    }
    
    /**
     * @return number of tags newly linked to the media item
     */
    @Transactional
    public int link(Long mediaId, String keywords) {
        int linked = 0;
        for (String label : parseKeywords(keywords)) {
            Tag tag = tagRepository.findByLabel(label)
                    .orElseGet(() -> {
                        String tagId = "tag_" + UUID.randomUUID().toString().replace("-", "");
                        return tagRepository.save(new Tag(tagId, label));
                    });
            
            if (!mediaTagRepository.existsByMediaIdAndTagId(mediaId, tag.getTagId())) {
                mediaTagRepository.save(new MediaTag(mediaId, tag.getTagId()));
                linked++;
            }
        }
        return linked;
    }
    
    /**
     * Split, trim and de-duplicate keywords, dropping blank and over-long entries.
     */
    public static Set<String> parseKeywords(String keywords) {
        Set<String> labels = new LinkedHashSet<>();
        if (keywords == null || keywords.isBlank()) {
            return labels;
        }
        for (String raw : keywords.split(",")) {
            String label = Tag.normalizeLabel(raw);
            if (label.isEmpty()) {
                continue;
            }
            if (label.length() > Tag.MAX_LABEL_LENGTH) {
                log.debug("Skipping keyword longer than {} characters", Tag.MAX_LABEL_LENGTH);
                continue;
            }
            labels.add(label);
        }
        return labels;
    }
}
