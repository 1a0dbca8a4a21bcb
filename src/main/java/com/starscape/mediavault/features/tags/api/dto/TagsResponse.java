package com.starscape.mediavault.features.tags.api.dto;

import java.util.List;

public record TagsResponse(
    List<String> tags
) {}
