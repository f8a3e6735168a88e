package com.example.videodata.cache;

import com.example.videodata.model.ChannelInfo;
import com.example.videodata.model.VideoResults;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Duration;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.redis.core.StringRedisTemplate;

/**
 * Cache backed by a Redis server. Every value is stored as a JSON string under
 * {@code <prefix>:<partition>:<key>}.
 *
 * <p>Values that fail to (de)serialize are logged and treated as absent. Connection failures are
 * not caught and reach the caller as Spring Data exceptions.
 */
public class RedisVideoDataCache implements VideoDataCache {

    public static final String SERVICE_NAME = "redis-cache";

    private static final Logger log = LoggerFactory.getLogger(RedisVideoDataCache.class);

    private final StringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;
    private final String keyPrefix;
    private final Duration ttl;

    public RedisVideoDataCache(StringRedisTemplate redisTemplate,
                               ObjectMapper objectMapper,
                               String keyPrefix,
                               Duration ttl) {
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper;
        this.keyPrefix = keyPrefix == null || keyPrefix.isBlank() ? "videodata" : keyPrefix.trim();
        this.ttl = ttl == null || ttl.isZero() || ttl.isNegative() ? null : ttl;
    }

    @Override
    public Optional<VideoResults> getVideo(String key) {
        return read("video", key, VideoResults.class);
    }

    @Override
    public void setVideo(String key, VideoResults results) {
        write("video", key, results);
    }

    @Override
    public Optional<ChannelInfo> getChannel(String key) {
        return read("channel", key, ChannelInfo.class);
    }

    @Override
    public void setChannel(String key, ChannelInfo channel) {
        write("channel", key, channel);
    }

    @Override
    public Optional<VideoResults> getPlaylist(String key) {
        return read("playlist", key, VideoResults.class);
    }

    @Override
    public void setPlaylist(String key, VideoResults playlist) {
        write("playlist", key, playlist);
    }

    @Override
    public Optional<VideoResults> getVideoDetail(String key) {
        return read("video-detail", key, VideoResults.class);
    }

    @Override
    public void setVideoDetail(String key, VideoResults detail) {
        write("video-detail", key, detail);
    }

    @Override
    public String serviceName() {
        return SERVICE_NAME;
    }

    String redisKey(String partition, String key) {
        return keyPrefix + ":" + partition + ":" + key;
    }

    private <T> Optional<T> read(String partition, String key, Class<T> type) {
        if (key == null) {
            return Optional.empty();
        }
        String redisKey = redisKey(partition, key);
        String json = redisTemplate.opsForValue().get(redisKey);
        if (json == null) {
            log.debug("{} cache miss for key {}", partition, key);
            return Optional.empty();
        }
        try {
            log.debug("{} cache hit for key {}", partition, key);
            return Optional.of(objectMapper.readValue(json, type));
        } catch (JsonProcessingException e) {
            log.warn("Discarding unreadable {} cache entry {}: {}", partition, redisKey, e.getOriginalMessage());
            return Optional.empty();
        }
    }

    private void write(String partition, String key, Object value) {
        if (key == null || value == null) {
            log.warn("Ignoring {} cache write with null key or value", partition);
            return;
        }
        String redisKey = redisKey(partition, key);
        String json;
        try {
            json = objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            log.warn("Skipping {} cache write for {}: {}", partition, redisKey, e.getOriginalMessage());
            return;
        }
        if (ttl == null) {
            redisTemplate.opsForValue().set(redisKey, json);
        } else {
            redisTemplate.opsForValue().set(redisKey, json, ttl);
        }
    }
}
