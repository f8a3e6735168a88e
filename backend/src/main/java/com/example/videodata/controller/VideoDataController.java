package com.example.videodata.controller;

import com.example.videodata.model.ChannelInfo;
import com.example.videodata.model.VideoResults;
import com.example.videodata.service.VideoDataService;
import java.util.Arrays;
import java.util.List;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/youtube")
public class VideoDataController {

    private final VideoDataService videoDataService;

    public VideoDataController(VideoDataService videoDataService) {
        this.videoDataService = videoDataService;
    }

    @GetMapping("/search")
    public VideoResults search(@RequestParam("q") String query,
                               @RequestParam(value = "pages", defaultValue = "1") int pages) {
        return videoDataService.searchAndRetrieveTags(query, pages);
    }

    @GetMapping("/channels/{channelId}")
    public ChannelInfo channel(@PathVariable("channelId") String channelId) {
        return videoDataService.getChannelInfo(channelId);
    }

    @GetMapping("/channels/{channelId}/videos")
    public VideoResults channelVideos(@PathVariable("channelId") String channelId,
                                      @RequestParam(value = "count", defaultValue = "50") int count) {
        if (count < 1) {
            throw new IllegalArgumentException("count must be at least 1");
        }
        ChannelInfo channelInfo = videoDataService.getChannelInfo(channelId);
        return videoDataService.getChannelPlaylist(channelInfo.items().get(0), count);
    }

    @GetMapping("/videos")
    public VideoResults videos(@RequestParam("ids") String ids) {
        List<String> videoIds = Arrays.stream(ids.split(","))
                .map(String::trim)
                .filter(id -> !id.isEmpty())
                .toList();
        if (videoIds.isEmpty()) {
            throw new IllegalArgumentException("ids must name at least one video");
        }
        return videoDataService.getVideosByIds(videoIds);
    }
}
