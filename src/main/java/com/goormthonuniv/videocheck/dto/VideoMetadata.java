package com.goormthonuniv.videocheck.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record VideoMetadata(
        String creationDate,
        String deviceInfo,
        String location,
        List<String> compressionHistory   // "H264", "MP4", "TRANSCODED" ...
) {
    public VideoMetadata {
        compressionHistory = compressionHistory == null ? List.of() : List.copyOf(compressionHistory);
    }

    public static VideoMetadata empty() {
        return new VideoMetadata(null, null, null, List.of());
    }
}
