package com.example.videodata.util;

import java.util.ArrayList;
import java.util.List;

public final class Paginator {

    private Paginator() {
    }

    /**
     * Fetches pages starting from an empty token until a page comes back without a next token or
     * {@code maxPages} pages have been fetched. A failing fetch propagates and nothing is returned.
     */
    public static <T> List<T> collect(PageFetcher<T> fetcher, int maxPages) {
        List<T> accumulated = new ArrayList<>();
        String pageToken = "";
        for (int page = 0; page < maxPages; page++) {
            Page<T> result = fetcher.fetch(pageToken);
            if (result == null) {
                break;
            }
            if (result.items() != null) {
                accumulated.addAll(result.items());
            }
            if (!result.hasNext()) {
                break;
            }
            pageToken = result.nextPageToken();
        }
        return accumulated;
    }

    public static <T> List<T> collectAll(PageFetcher<T> fetcher) {
        return collect(fetcher, Integer.MAX_VALUE);
    }

    public static int pagesNeeded(int itemCount, int pageSize) {
        if (itemCount <= 0) {
            return 0;
        }
        return itemCount / pageSize + (itemCount % pageSize > 0 ? 1 : 0);
    }

    @FunctionalInterface
    public interface PageFetcher<T> {

        Page<T> fetch(String pageToken);
    }

    public record Page<T>(List<T> items, String nextPageToken) {

        public boolean hasNext() {
            return nextPageToken != null && !nextPageToken.isEmpty();
        }
    }
}
