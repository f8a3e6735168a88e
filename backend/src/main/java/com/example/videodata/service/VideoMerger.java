package com.example.videodata.service;

import com.example.videodata.exception.DataIntegrityException;
import com.example.videodata.model.Video;
import com.example.videodata.model.VideoSnippet;
import com.example.videodata.model.VideoStatistics;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

public final class VideoMerger {

    public static final long DEFAULT_MIN_VIEWS = 1000L;

    private VideoMerger() {
    }

    public static List<Video> merge(List<Video> videos, Map<String, SnippetOverlay> overlays) {
        List<Video> merged = new ArrayList<>(videos.size());
        for (Video video : videos) {
            SnippetOverlay overlay = video == null ? null : overlays.get(video.id());
            if (overlay == null) {
                merged.add(video);
                continue;
            }
            VideoSnippet snippet = video.snippet() != null ? video.snippet() : VideoSnippet.empty();
            if (overlay.includesChannel()) {
                snippet = snippet.withChannel(overlay.channelId(), overlay.channelTitle());
            }
            merged.add(video.withSnippet(snippet.withThumbnails(overlay.thumbnails())));
        }
        return merged;
    }

    /**
     * Keeps videos whose view count is strictly greater than {@code minViews}.
     *
     * @throws DataIntegrityException if any video lacks a parsable view count; nothing is returned
     */
    public static List<Video> filterByMinViews(List<Video> videos, long minViews) {
        List<Video> kept = new ArrayList<>();
        for (Video video : videos) {
            if (parseViewCount(video) > minViews) {
                kept.add(video);
            }
        }
        return kept;
    }

    static long parseViewCount(Video video) {
        VideoStatistics statistics = video == null ? null : video.statistics();
        String viewCount = statistics == null ? null : statistics.viewCount();
        String videoId = video == null ? null : video.id();
        if (viewCount == null || viewCount.isEmpty()) {
            throw new DataIntegrityException("Missing view count for video " + videoId);
        }
        try {
            return Long.parseLong(viewCount);
        } catch (NumberFormatException ex) {
            throw new DataIntegrityException("Invalid view count '" + viewCount + "' for video " + videoId, ex);
        }
    }
}
