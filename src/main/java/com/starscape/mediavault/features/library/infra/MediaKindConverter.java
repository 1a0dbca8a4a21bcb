package com.starscape.mediavault.features.library.infra;

import com.starscape.mediavault.common.domain.MediaKind;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

/**
 * Stores {@link MediaKind} as the lower-case values the media table constrains to.
 */
@Converter(autoApply = true)
public class MediaKindConverter implements AttributeConverter<MediaKind, String> {
    
    @Override
    public String convertToDatabaseColumn(MediaKind kind) {
        return kind == null ? null : kind.value();
    }
    
    @Override
    public MediaKind convertToEntityAttribute(String value) {
        return value == null ? null : MediaKind.fromValue(value);
    }
}
