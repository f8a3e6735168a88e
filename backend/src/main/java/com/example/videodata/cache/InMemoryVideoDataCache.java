package com.example.videodata.cache;

import com.example.videodata.model.ChannelInfo;
import com.example.videodata.model.VideoResults;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class InMemoryVideoDataCache implements VideoDataCache {

    public static final String SERVICE_NAME = "memory-cache";

    private static final Logger log = LoggerFactory.getLogger(InMemoryVideoDataCache.class);

    private final Map<String, VideoResults> videoCache = new ConcurrentHashMap<>();
    private final Map<String, ChannelInfo> channelCache = new ConcurrentHashMap<>();
    private final Map<String, VideoResults> playlistCache = new ConcurrentHashMap<>();
    private final Map<String, VideoResults> videoDetailsCache = new ConcurrentHashMap<>();

    @Override
    public Optional<VideoResults> getVideo(String key) {
        return lookup(videoCache, "video", key);
    }

    @Override
    public void setVideo(String key, VideoResults results) {
        store(videoCache, "video", key, results);
    }

    @Override
    public Optional<ChannelInfo> getChannel(String key) {
        return lookup(channelCache, "channel", key);
    }

    @Override
    public void setChannel(String key, ChannelInfo channel) {
        store(channelCache, "channel", key, channel);
    }

    @Override
    public Optional<VideoResults> getPlaylist(String key) {
        return lookup(playlistCache, "playlist", key);
    }

    @Override
    public void setPlaylist(String key, VideoResults playlist) {
        store(playlistCache, "playlist", key, playlist);
    }

    @Override
    public Optional<VideoResults> getVideoDetail(String key) {
        return lookup(videoDetailsCache, "video-detail", key);
    }

    @Override
    public void setVideoDetail(String key, VideoResults detail) {
        store(videoDetailsCache, "video-detail", key, detail);
    }

    @Override
    public String serviceName() {
        return SERVICE_NAME;
    }

    private <T> Optional<T> lookup(Map<String, T> partition, String name, String key) {
        if (key == null) {
            return Optional.empty();
        }
        T value = partition.get(key);
        log.debug("{} cache {} for key {}", name, value == null ? "miss" : "hit", key);
        return Optional.ofNullable(value);
    }

    private <T> void store(Map<String, T> partition, String name, String key, T value) {
        if (key == null || value == null) {
            log.warn("Ignoring {} cache write with null key or value", name);
            return;
        }
        partition.put(key, value);
    }
}
