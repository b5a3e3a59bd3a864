package com.omnioracle.api.dto;

import com.omnioracle.domain.FeedSource;

public record SourceResponse(String id, String kind, String endpointRef, int weight, long maxStalenessSeconds,
                             boolean active, String extra) {

    public static SourceResponse from(FeedSource s) {
        return new SourceResponse(s.id(), s.kind().name(), s.endpointRef(), s.weight(), s.maxStalenessSeconds(),
                s.active(), s.extra());
    }
}
