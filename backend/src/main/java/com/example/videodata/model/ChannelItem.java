package com.example.videodata.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

public record ChannelItem(
        String id,
        Snippet snippet,
        ContentDetails contentDetails,
        Statistics statistics) {

    @JsonIgnore
    public String uploadsPlaylistId() {
        if (contentDetails == null || contentDetails.relatedPlaylists() == null) {
            return null;
        }
        String uploads = contentDetails.relatedPlaylists().uploads();
        return uploads == null || uploads.isBlank() ? null : uploads;
    }

    public record Snippet(
            String publishedAt,
            String title,
            String description,
            String customUrl,
            String channelTitle,
            Thumbnails thumbnails,
            Localized localized,
            String country) {
    }

    public record Localized(String title, String description) {
    }

    public record ContentDetails(RelatedPlaylists relatedPlaylists) {
    }

    public record RelatedPlaylists(String likes, String uploads) {
    }

    public record Statistics(
            String viewCount,
            String subscriberCount,
            Boolean hiddenSubscriberCount,
            String videoCount) {
    }
}
