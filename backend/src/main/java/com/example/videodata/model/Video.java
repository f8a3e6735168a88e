package com.example.videodata.model;

public record Video(String id, VideoSnippet snippet, VideoStatistics statistics) {

    public Video withSnippet(VideoSnippet newSnippet) {
        return new Video(id, newSnippet, statistics);
    }
}
