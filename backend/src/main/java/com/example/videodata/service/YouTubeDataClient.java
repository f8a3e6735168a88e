package com.example.videodata.service;

import com.example.videodata.model.ChannelInfo;
import com.example.videodata.model.Thumbnails;
import com.example.videodata.model.VideoResults;
import java.util.List;

/**
 * One decoded page per call against the YouTube Data API. A blank page token requests the first
 * page. Implementations throw {@link com.example.videodata.exception.UpstreamTransportException}
 * or {@link com.example.videodata.exception.UpstreamDecodeException} and never retry.
 */
public interface YouTubeDataClient {

    SearchResponse searchVideos(String query, String pageToken);

    VideoResults fetchVideos(String commaJoinedIds, String pageToken);

    ChannelInfo fetchChannel(String channelId);

    PlaylistItemsResponse fetchPlaylistItems(String playlistId, String pageToken);

    record SearchResponse(List<SearchItem> items, String nextPageToken) {
    }

    record SearchItem(SearchId id, SearchSnippet snippet) {
    }

    record SearchId(String videoId) {
    }

    record SearchSnippet(
            String publishedAt,
            String title,
            String description,
            String channelTitle,
            String channelId,
            Thumbnails thumbnails) {
    }

    record PlaylistItemsResponse(List<PlaylistItem> items, PageInfo pageInfo, String nextPageToken) {
    }

    record PlaylistItem(String id, PlaylistSnippet snippet, PlaylistContentDetails contentDetails) {
    }

    record PlaylistSnippet(
            String publishedAt,
            String title,
            String description,
            Thumbnails thumbnails,
            String channelTitle) {
    }

    record PlaylistContentDetails(String videoId, String videoPublishedAt) {
    }

    record PageInfo(Integer totalResults) {
    }
}
