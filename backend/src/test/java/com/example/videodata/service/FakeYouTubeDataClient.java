package com.example.videodata.service;

import com.example.videodata.model.ChannelInfo;
import com.example.videodata.model.VideoResults;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Scripted upstream keyed by request arguments; records every call made through it.
 */
class FakeYouTubeDataClient implements YouTubeDataClient {

    final List<String> calls = new ArrayList<>();

    private final Map<String, Supplier<SearchResponse>> searchPages = new HashMap<>();
    private final Map<String, Supplier<VideoResults>> videoPages = new HashMap<>();
    private final Map<String, Supplier<ChannelInfo>> channels = new HashMap<>();
    private final Map<String, Supplier<PlaylistItemsResponse>> playlistPages = new HashMap<>();

    FakeYouTubeDataClient search(String query, String pageToken, SearchResponse response) {
        searchPages.put(query + "|" + pageToken, () -> response);
        return this;
    }

    FakeYouTubeDataClient searchFail(String query, String pageToken, RuntimeException failure) {
        searchPages.put(query + "|" + pageToken, () -> {
            throw failure;
        });
        return this;
    }

    FakeYouTubeDataClient videos(String ids, String pageToken, VideoResults response) {
        videoPages.put(ids + "|" + pageToken, () -> response);
        return this;
    }

    FakeYouTubeDataClient videosFail(String ids, String pageToken, RuntimeException failure) {
        videoPages.put(ids + "|" + pageToken, () -> {
            throw failure;
        });
        return this;
    }

    FakeYouTubeDataClient channel(String channelId, ChannelInfo response) {
        channels.put(channelId, () -> response);
        return this;
    }

    FakeYouTubeDataClient channelFail(String channelId, RuntimeException failure) {
        channels.put(channelId, () -> {
            throw failure;
        });
        return this;
    }

    FakeYouTubeDataClient playlist(String playlistId, String pageToken, PlaylistItemsResponse response) {
        playlistPages.put(playlistId + "|" + pageToken, () -> response);
        return this;
    }

    long callsTo(String endpoint) {
        return calls.stream().filter(call -> call.startsWith(endpoint + ":")).count();
    }

    @Override
    public SearchResponse searchVideos(String query, String pageToken) {
        return answer("search", query + "|" + pageToken, searchPages);
    }

    @Override
    public VideoResults fetchVideos(String commaJoinedIds, String pageToken) {
        return answer("videos", commaJoinedIds + "|" + pageToken, videoPages);
    }

    @Override
    public ChannelInfo fetchChannel(String channelId) {
        return answer("channels", channelId, channels);
    }

    @Override
    public PlaylistItemsResponse fetchPlaylistItems(String playlistId, String pageToken) {
        return answer("playlistItems", playlistId + "|" + pageToken, playlistPages);
    }

    private <T> T answer(String endpoint, String key, Map<String, Supplier<T>> scripted) {
        calls.add(endpoint + ":" + key);
        Supplier<T> supplier = scripted.get(key);
        if (supplier == null) {
            throw new AssertionError("Unexpected " + endpoint + " request " + key);
        }
        return supplier.get();
    }
}
