package com.example.videodata.util;

import java.util.ArrayList;
import java.util.List;

public final class IdBatcher {

    public static final int BATCH_SIZE = 50;

    private IdBatcher() {
    }

    public static List<String> batch(List<String> ids) {
        return batch(ids, BATCH_SIZE);
    }

    public static List<String> batch(List<String> ids, int batchSize) {
        if (batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be positive: " + batchSize);
        }
        if (ids == null || ids.isEmpty()) {
            return List.of();
        }
        List<String> batches = new ArrayList<>((ids.size() + batchSize - 1) / batchSize);
        for (int start = 0; start < ids.size(); start += batchSize) {
            int end = Math.min(start + batchSize, ids.size());
            batches.add(String.join(",", ids.subList(start, end)));
        }
        return batches;
    }
}
