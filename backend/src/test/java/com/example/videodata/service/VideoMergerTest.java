package com.example.videodata.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.example.videodata.exception.DataIntegrityException;
import com.example.videodata.model.Thumbnail;
import com.example.videodata.model.Thumbnails;
import com.example.videodata.model.Video;
import com.example.videodata.model.VideoSnippet;
import com.example.videodata.model.VideoStatistics;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class VideoMergerTest {

    private static final Thumbnails SEARCH_THUMBNAILS = new Thumbnails(
            new Thumbnail("https://i.ytimg.com/vi/a/default.jpg", 120, 90),
            new Thumbnail("https://i.ytimg.com/vi/a/mqdefault.jpg", 320, 180),
            null);

    @Test
    void mergeOverwritesChannelAndThumbnailsForIndexedVideos() {
        Video indexed = video("a", "100");
        Video untouched = video("b", "200");

        List<Video> merged = VideoMerger.merge(List.of(indexed, untouched), Map.of(
                "a", SnippetOverlay.fromSearch("UC-channel", "Channel Title", SEARCH_THUMBNAILS)));

        assertThat(merged).hasSize(2);
        VideoSnippet snippet = merged.get(0).snippet();
        assertThat(snippet.channelId()).isEqualTo("UC-channel");
        assertThat(snippet.channelTitle()).isEqualTo("Channel Title");
        assertThat(snippet.thumbnails()).isEqualTo(SEARCH_THUMBNAILS);
        assertThat(snippet.title()).isEqualTo("Title a");
        assertThat(snippet.tags()).containsExactly("tag-a");
        assertThat(merged.get(0).statistics()).isEqualTo(indexed.statistics());
        assertThat(merged.get(1)).isSameAs(untouched);
    }

    @Test
    void thumbnailOnlyOverlayKeepsChannelFields() {
        Video video = new Video("a",
                new VideoSnippet("UC-original", "Original", "2024-01-01T00:00:00Z", "Title", "", null, null),
                new VideoStatistics("10", null, null, null, null));

        List<Video> merged = VideoMerger.merge(List.of(video), Map.of(
                "a", SnippetOverlay.thumbnailsOnly(SEARCH_THUMBNAILS)));

        assertThat(merged.get(0).snippet().channelId()).isEqualTo("UC-original");
        assertThat(merged.get(0).snippet().channelTitle()).isEqualTo("Original");
        assertThat(merged.get(0).snippet().thumbnails()).isEqualTo(SEARCH_THUMBNAILS);
    }

    @Test
    void mergeCreatesSnippetWhenLookupHadNone() {
        Video bare = new Video("a", null, new VideoStatistics("10", null, null, null, null));

        List<Video> merged = VideoMerger.merge(List.of(bare), Map.of(
                "a", SnippetOverlay.fromSearch("UC-channel", "Channel Title", null)));

        assertThat(merged.get(0).snippet().channelTitle()).isEqualTo("Channel Title");
    }

    @Test
    void filterKeepsVideosAboveThresholdInOrder() {
        Video low = video("low", "500");
        Video mid = video("mid", "1500");
        Video high = video("high", "2000");

        List<Video> kept = VideoMerger.filterByMinViews(List.of(low, mid, high), 1000);

        assertThat(kept).containsExactly(mid, high);
    }

    @Test
    void filterExcludesVideoAtExactThreshold() {
        assertThat(VideoMerger.filterByMinViews(List.of(video("edge", "1000")), 1000)).isEmpty();
    }

    @Test
    void emptyViewCountFailsWholeFilter() {
        List<Video> videos = List.of(video("ok", "5000"), video("blank", ""));

        assertThatThrownBy(() -> VideoMerger.filterByMinViews(videos, 1000))
                .isInstanceOf(DataIntegrityException.class)
                .hasMessageContaining("blank");
    }

    @Test
    void unparsableViewCountFailsWholeFilter() {
        List<Video> videos = List.of(video("bad", "abc"), video("ok", "5000"));

        assertThatThrownBy(() -> VideoMerger.filterByMinViews(videos, 1000))
                .isInstanceOf(DataIntegrityException.class)
                .hasMessageContaining("abc");
    }

    @Test
    void missingStatisticsFailsWholeFilter() {
        Video noStats = new Video("none", null, null);

        assertThatThrownBy(() -> VideoMerger.filterByMinViews(List.of(noStats), 1000))
                .isInstanceOf(DataIntegrityException.class);
    }

    private static Video video(String id, String viewCount) {
        return new Video(id,
                new VideoSnippet(null, null, "2024-01-01T00:00:00Z", "Title " + id, "Description " + id,
                        null, List.of("tag-" + id)),
                new VideoStatistics(viewCount, "1", null, null, "0"));
    }
}
