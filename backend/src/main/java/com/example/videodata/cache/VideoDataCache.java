package com.example.videodata.cache;

import com.example.videodata.model.ChannelInfo;
import com.example.videodata.model.VideoResults;
import java.util.Optional;

/**
 * Response cache split into four partitions. Setting a key replaces the previous value wholesale.
 * The playlist partition may hold {@link VideoResults#noResult()}.
 */
public interface VideoDataCache {

    Optional<VideoResults> getVideo(String key);

    void setVideo(String key, VideoResults results);

    Optional<ChannelInfo> getChannel(String key);

    void setChannel(String key, ChannelInfo channel);

    Optional<VideoResults> getPlaylist(String key);

    void setPlaylist(String key, VideoResults playlist);

    Optional<VideoResults> getVideoDetail(String key);

    void setVideoDetail(String key, VideoResults detail);

    String serviceName();
}
