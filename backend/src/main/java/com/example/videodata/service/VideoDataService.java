package com.example.videodata.service;

import com.example.videodata.cache.VideoDataCache;
import com.example.videodata.exception.DataIntegrityException;
import com.example.videodata.exception.NotFoundException;
import com.example.videodata.model.ChannelInfo;
import com.example.videodata.model.ChannelItem;
import com.example.videodata.model.Video;
import com.example.videodata.model.VideoResults;
import com.example.videodata.util.IdBatcher;
import com.example.videodata.util.Paginator;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class VideoDataService {

    private static final Logger log = LoggerFactory.getLogger(VideoDataService.class);

    public static final int DEFAULT_SEARCH_PAGES = 1;
    public static final int MAX_SEARCH_PAGES = 5;
    public static final int PLAYLIST_PAGE_SIZE = 50;

    private final YouTubeDataClient client;
    private final VideoDataCache cache;

    public VideoDataService(YouTubeDataClient client, VideoDataCache cache) {
        this.client = client;
        this.cache = cache;
        log.info("Video data service using cache '{}'", cache.serviceName());
    }

    public VideoResults searchAndRetrieveTags(String query) {
        return searchAndRetrieveTags(query, DEFAULT_SEARCH_PAGES);
    }

    /**
     * Searches videos by keyword, enriches them with statistics and keeps those with more than
     * {@value VideoMerger#DEFAULT_MIN_VIEWS} views.
     *
     * <p>Results are cached under the raw query only: a later call with a different page count
     * returns whatever was cached first.
     *
     * @throws DataIntegrityException if any looked-up video has an unparsable view count
     */
    public VideoResults searchAndRetrieveTags(String query, int pageCount) {
        return findTags(query, clampSearchPages(pageCount));
    }

    static int clampSearchPages(int requested) {
        if (requested < DEFAULT_SEARCH_PAGES) {
            return DEFAULT_SEARCH_PAGES;
        }
        return Math.min(requested, MAX_SEARCH_PAGES);
    }

    private VideoResults findTags(String query, int pages) {
        Optional<VideoResults> cached = cache.getVideo(query);
        if (cached.isPresent()) {
            return cached.get();
        }

        List<YouTubeDataClient.SearchItem> found = Paginator.collect(pageToken -> {
            YouTubeDataClient.SearchResponse response = client.searchVideos(query, pageToken);
            return new Paginator.Page<>(response.items(), response.nextPageToken());
        }, pages);

        List<String> videoIds = new ArrayList<>();
        Map<String, SnippetOverlay> overlays = new LinkedHashMap<>();
        for (YouTubeDataClient.SearchItem item : found) {
            if (item == null || item.id() == null || item.id().videoId() == null) {
                continue;
            }
            String videoId = item.id().videoId();
            videoIds.add(videoId);
            YouTubeDataClient.SearchSnippet snippet = item.snippet();
            overlays.put(videoId, snippet == null
                    ? SnippetOverlay.fromSearch(null, null, null)
                    : SnippetOverlay.fromSearch(snippet.channelId(), snippet.channelTitle(), snippet.thumbnails()));
        }

        VideoResults details = getVideosByIds(videoIds);
        List<Video> filtered = VideoMerger.filterByMinViews(
                VideoMerger.merge(details.items(), overlays), VideoMerger.DEFAULT_MIN_VIEWS);
        VideoResults results = VideoResults.of(filtered);

        log.debug("Search '{}' kept {} of {} videos", query, filtered.size(), details.items().size());
        cache.setVideo(query, results);
        return results;
    }

    public ChannelInfo getChannelInfo(String channelId) {
        Optional<ChannelInfo> cached = cache.getChannel(channelId);
        if (cached.isPresent()) {
            return cached.get();
        }

        ChannelInfo channelInfo = client.fetchChannel(channelId);
        if (channelInfo == null || channelInfo.isEmpty()) {
            throw new NotFoundException("No channel available for id " + channelId);
        }

        cache.setChannel(channelId, channelInfo);
        return channelInfo;
    }

    // A channel without an uploads playlist caches the no-result marker, so repeats fail without an upstream call.
    public VideoResults getChannelPlaylist(ChannelItem item, int desiredCount) {
        String uploadsPlaylistId = item.uploadsPlaylistId();
        String cacheKey = (uploadsPlaylistId != null ? uploadsPlaylistId : item.id()) + "-" + desiredCount;

        Optional<VideoResults> cached = cache.getPlaylist(cacheKey);
        if (cached.isPresent()) {
            if (cached.get().isNoResult()) {
                throw missingUploads(item);
            }
            return cached.get();
        }

        if (uploadsPlaylistId == null) {
            cache.setPlaylist(cacheKey, VideoResults.noResult());
            throw missingUploads(item);
        }

        int pages = Paginator.pagesNeeded(desiredCount, PLAYLIST_PAGE_SIZE);
        List<YouTubeDataClient.PlaylistItem> listed = Paginator.collect(pageToken -> {
            YouTubeDataClient.PlaylistItemsResponse response =
                    client.fetchPlaylistItems(uploadsPlaylistId, pageToken);
            return new Paginator.Page<>(response.items(), response.nextPageToken());
        }, pages);

        List<String> videoIds = new ArrayList<>();
        Map<String, SnippetOverlay> overlays = new LinkedHashMap<>();
        for (YouTubeDataClient.PlaylistItem playlistItem : listed) {
            if (playlistItem == null || playlistItem.contentDetails() == null
                    || playlistItem.contentDetails().videoId() == null) {
                continue;
            }
            String videoId = playlistItem.contentDetails().videoId();
            videoIds.add(videoId);
            overlays.put(videoId, SnippetOverlay.thumbnailsOnly(
                    playlistItem.snippet() == null ? null : playlistItem.snippet().thumbnails()));
        }

        VideoResults details = getVideosByIds(videoIds);
        VideoResults results = VideoResults.of(VideoMerger.merge(details.items(), overlays));

        cache.setPlaylist(cacheKey, results);
        return results;
    }

    public VideoResults getVideosByIds(List<String> videoIds) {
        String cacheKey = String.join(",", videoIds);
        Optional<VideoResults> cached = cache.getVideoDetail(cacheKey);
        if (cached.isPresent()) {
            return cached.get();
        }

        List<Video> videos = new ArrayList<>();
        for (String batch : IdBatcher.batch(videoIds)) {
            List<Video> batchVideos = Paginator.collectAll(pageToken -> {
                VideoResults page = client.fetchVideos(batch, pageToken);
                return new Paginator.Page<>(page.items(), page.nextPageToken());
            });
            videos.addAll(batchVideos);
        }

        VideoResults results = VideoResults.of(videos);
        cache.setVideoDetail(cacheKey, results);
        return results;
    }

    public int videoCount(ChannelItem item) {
        String videoCount = item.statistics() == null ? null : item.statistics().videoCount();
        if (videoCount == null) {
            throw new DataIntegrityException("Missing video count for channel " + item.id());
        }
        try {
            return Integer.parseInt(videoCount);
        } catch (NumberFormatException ex) {
            throw new DataIntegrityException(
                    "Invalid video count '" + videoCount + "' for channel " + item.id(), ex);
        }
    }

    private NotFoundException missingUploads(ChannelItem item) {
        return new NotFoundException("Channel " + item.id() + " has no uploads playlist");
    }
}
