package com.example.videodata.model;

public record VideoStatistics(
        String viewCount,
        String likeCount,
        String dislikeCount,
        String favoriteCount,
        String commentCount) {
}
