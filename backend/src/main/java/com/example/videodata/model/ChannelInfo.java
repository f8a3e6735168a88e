package com.example.videodata.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public record ChannelInfo(List<ChannelItem> items, String nextPageToken) {

    public ChannelInfo {
        items = items == null ? null : Collections.unmodifiableList(new ArrayList<>(items));
    }

    @JsonIgnore
    public boolean isEmpty() {
        return items == null || items.isEmpty();
    }
}
