package com.example.videodata.model;

public record Thumbnail(String url, Integer width, Integer height) {
}
