package com.example.videodata.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record Thumbnails(
        @JsonProperty("default") Thumbnail defaultThumbnail,
        Thumbnail medium,
        Thumbnail high) {
}
