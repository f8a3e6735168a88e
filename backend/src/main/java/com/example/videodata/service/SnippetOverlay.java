package com.example.videodata.service;

import com.example.videodata.model.Thumbnails;

public record SnippetOverlay(String channelId, String channelTitle, Thumbnails thumbnails, boolean includesChannel) {

    public static SnippetOverlay fromSearch(String channelId, String channelTitle, Thumbnails thumbnails) {
        return new SnippetOverlay(channelId, channelTitle, thumbnails, true);
    }

    public static SnippetOverlay thumbnailsOnly(Thumbnails thumbnails) {
        return new SnippetOverlay(null, null, thumbnails, false);
    }
}
