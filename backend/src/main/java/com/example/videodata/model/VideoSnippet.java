package com.example.videodata.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public record VideoSnippet(
        String channelId,
        String channelTitle,
        String publishedAt,
        String title,
        String description,
        Thumbnails thumbnails,
        List<String> tags) {

    public VideoSnippet {
        tags = tags == null ? null : Collections.unmodifiableList(new ArrayList<>(tags));
    }

    public static VideoSnippet empty() {
        return new VideoSnippet(null, null, null, null, null, null, null);
    }

    public VideoSnippet withChannel(String newChannelId, String newChannelTitle) {
        return new VideoSnippet(newChannelId, newChannelTitle, publishedAt, title, description, thumbnails, tags);
    }

    public VideoSnippet withThumbnails(Thumbnails newThumbnails) {
        return new VideoSnippet(channelId, channelTitle, publishedAt, title, description, newThumbnails, tags);
    }
}
