package com.example.videodata.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * {@link #noResult()} is the marker cached for channels without an uploads playlist; it is the
 * only instance whose {@code items} is {@code null}.
 */
public record VideoResults(List<Video> items, String nextPageToken) {

    public VideoResults {
        items = items == null ? null : Collections.unmodifiableList(new ArrayList<>(items));
    }

    public static VideoResults of(List<Video> items) {
        return new VideoResults(items, "");
    }

    public static VideoResults noResult() {
        return new VideoResults(null, null);
    }

    @JsonIgnore
    public boolean isNoResult() {
        return items == null;
    }
}
