package com.example.videodata.service;

import com.example.videodata.exception.UpstreamDecodeException;
import com.example.videodata.exception.UpstreamTransportException;
import com.example.videodata.model.ChannelInfo;
import com.example.videodata.model.VideoResults;
import java.net.URI;
import java.util.HashMap;
import java.util.Map;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;
import org.springframework.web.util.UriBuilder;

@Component
public class YouTubeApiDataClient implements YouTubeDataClient {

    private static final Logger log = LoggerFactory.getLogger(YouTubeApiDataClient.class);

    static final String VIDEO_FIELDS =
            "items(snippet(title,publishedAt,description,tags),id,statistics),nextPageToken";

    private final RestClient restClient;
    private final String apiKey;

    public YouTubeApiDataClient(RestClient.Builder restClientBuilder,
                                @Value("${app.youtube.base-url:https://www.googleapis.com/youtube/v3}") String baseUrl,
                                @Value("${app.youtube.api-key:}") String apiKey) {
        this.restClient = restClientBuilder
                .baseUrl(baseUrl)
                .build();
        this.apiKey = apiKey == null ? "" : apiKey.trim();
        if (this.apiKey.isBlank()) {
            log.warn("YouTube API key is not configured; upstream requests will be rejected.");
        }
    }

    @Override
    public SearchResponse searchVideos(String query, String pageToken) {
        Map<String, Object> variables = variables(pageToken);
        variables.put("q", query);
        return get("search for '" + query + "'", uriBuilder -> withPageToken(uriBuilder
                        .path("/search")
                        .queryParam("part", "snippet")
                        .queryParam("maxResults", 100)
                        .queryParam("q", "{q}")
                        .queryParam("type", "video")
                        .queryParam("order", "date")
                        .queryParam("relevanceLanguage", "en")
                        .queryParam("key", "{key}"), pageToken)
                        .build(variables),
                SearchResponse.class);
    }

    @Override
    public VideoResults fetchVideos(String commaJoinedIds, String pageToken) {
        Map<String, Object> variables = variables(pageToken);
        variables.put("id", commaJoinedIds);
        return get("video lookup", uriBuilder -> withPageToken(uriBuilder
                        .path("/videos")
                        .queryParam("key", "{key}")
                        .queryParam("fields", VIDEO_FIELDS)
                        .queryParam("part", "snippet,statistics")
                        .queryParam("id", "{id}")
                        .queryParam("order", "date"), pageToken)
                        .build(variables),
                VideoResults.class);
    }

    @Override
    public ChannelInfo fetchChannel(String channelId) {
        Map<String, Object> variables = variables(null);
        variables.put("id", channelId);
        return get("channel " + channelId, uriBuilder -> uriBuilder
                        .path("/channels")
                        .queryParam("part", "snippet,contentDetails,statistics")
                        .queryParam("id", "{id}")
                        .queryParam("maxResults", 50)
                        .queryParam("key", "{key}")
                        .build(variables),
                ChannelInfo.class);
    }

    @Override
    public PlaylistItemsResponse fetchPlaylistItems(String playlistId, String pageToken) {
        Map<String, Object> variables = variables(pageToken);
        variables.put("playlistId", playlistId);
        return get("playlist " + playlistId, uriBuilder -> withPageToken(uriBuilder
                        .path("/playlistItems")
                        .queryParam("part", "snippet,contentDetails")
                        .queryParam("maxResults", 50)
                        .queryParam("playlistId", "{playlistId}")
                        .queryParam("key", "{key}"), pageToken)
                        .build(variables),
                PlaylistItemsResponse.class);
    }

    // Caller-supplied values go through URI variables so braces and reserved characters are encoded.
    private Map<String, Object> variables(String pageToken) {
        Map<String, Object> variables = new HashMap<>();
        variables.put("key", apiKey);
        if (hasPageToken(pageToken)) {
            variables.put("pageToken", pageToken);
        }
        return variables;
    }

    private UriBuilder withPageToken(UriBuilder uriBuilder, String pageToken) {
        if (hasPageToken(pageToken)) {
            uriBuilder.queryParam("pageToken", "{pageToken}");
        }
        return uriBuilder;
    }

    private static boolean hasPageToken(String pageToken) {
        return pageToken != null && !pageToken.isBlank();
    }

    private <T> T get(String description, Function<UriBuilder, URI> uriFunction, Class<T> type) {
        log.debug("Requesting YouTube {}", description);
        T body;
        try {
            body = restClient.get()
                    .uri(uriFunction)
                    .retrieve()
                    .body(type);
        } catch (RestClientResponseException ex) {
            throw new UpstreamTransportException(
                    "YouTube " + description + " failed with status " + ex.getStatusCode().value(),
                    ex.getStatusCode().value(), ex);
        } catch (RestClientException ex) {
            if (ex.getCause() instanceof HttpMessageNotReadableException) {
                throw new UpstreamDecodeException("Malformed YouTube response for " + description, ex);
            }
            throw new UpstreamTransportException("YouTube " + description + " failed: " + ex.getMessage(), ex);
        }
        if (body == null) {
            throw new UpstreamDecodeException("Empty YouTube response for " + description, null);
        }
        return body;
    }
}
