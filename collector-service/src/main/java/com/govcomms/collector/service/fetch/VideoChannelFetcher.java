package com.govcomms.collector.service.fetch;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.govcomms.collector.config.CollectorProperties;
import com.govcomms.collector.dto.CandidateItem;
import com.govcomms.collector.entity.Source;
import com.govcomms.collector.entity.SourceKind;
import com.govcomms.collector.exception.PermanentFetchException;
import com.govcomms.collector.exception.SourceCycleFailedException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.util.UriComponentsBuilder;

import java.time.DateTimeException;
import java.time.Duration;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.function.Consumer;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Lists a channel's videos through the YouTube Data API v3.
 *
 * The uploads playlist is paged first, then (unless uploads-only) every playlist of the channel.
 * Unknown video ids of each page are enriched with title, publish time and duration.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class VideoChannelFetcher implements ItemFetcher {

    static final String VIA_CHANNEL = "channel";
    static final String VIA_PLAYLIST_PREFIX = "playlist:";

    private static final Pattern CHANNEL_URL = Pattern.compile("/channel/(UC[0-9A-Za-z_-]{10,})");
    private static final Pattern HANDLE_URL = Pattern.compile("/(@[0-9A-Za-z_.\\-]+)");

    private final PageClient pageClient;
    private final RetryExecutor retryExecutor;
    private final ObjectMapper objectMapper;
    private final CollectorProperties properties;

    @Override
    public SourceKind kind() {
        return SourceKind.VIDEO;
    }

    @Override
    public Stream<CandidateItem> fetchCandidates(Source source, FetchContext context) {
        return StreamSupport.stream(new ChannelSpliterator(source, context), false);
    }

    /**
     * Channel id from the source row, a {@code /channel/UC...} URL, or a {@code forHandle} lookup.
     */
    String resolveChannelId(Source source, ApiCaller api) {
        if (source.getChannelId() != null && !source.getChannelId().isBlank()) {
            return source.getChannelId().trim();
        }
        String url = source.getUrl() == null ? "" : source.getUrl();
        Matcher channel = CHANNEL_URL.matcher(url);
        if (channel.find()) {
            return channel.group(1);
        }
        Matcher handle = HANDLE_URL.matcher(url);
        if (handle.find()) {
            JsonNode response = api.get("channels", Map.of("part", "id", "forHandle", handle.group(1)));
            String id = response.path("items").path(0).path("id").asText("");
            if (!id.isBlank()) {
                log.info("Resolved handle {} of source #{} to channel {}", handle.group(1), source.getId(), id);
                return id;
            }
        }
        throw new SourceCycleFailedException("Missing channel id for source #" + source.getId() + " (" + url + ")");
    }

    static LocalDateTime parsePublishedAt(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return OffsetDateTime.parse(value.trim()).withOffsetSameInstant(ZoneOffset.UTC).toLocalDateTime();
        } catch (DateTimeException e) {
            return null;
        }
    }

    static Long parseDurationSeconds(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return Duration.parse(value.trim()).getSeconds();
        } catch (DateTimeException e) {
            return null;
        }
    }

    /**
     * Issues API requests with the source's retry policy and pacing.
     */
    final class ApiCaller {

        private final FetchContext context;
        private int requests;

        ApiCaller(FetchContext context) {
            this.context = context;
        }

        JsonNode get(String endpoint, Map<String, String> params) {
            CollectorProperties.Video video = properties.getVideo();
            if (video.getApiKey() == null || video.getApiKey().isBlank()) {
                throw new SourceCycleFailedException("collector.video.api-key is not configured");
            }
            UriComponentsBuilder builder = UriComponentsBuilder.fromUriString(video.getApiBaseUrl())
                    .pathSegment(endpoint);
            params.forEach(builder::queryParam);
            builder.queryParam("key", video.getApiKey());
            String url = builder.encode().build().toUriString();

            if (requests++ > 0) {
                retryExecutor.pause(context.getRetryPolicy());
            }
            String body = retryExecutor.call(endpoint + " " + params, context.getRetryPolicy(),
                    () -> pageClient.get(url));
            try {
                return objectMapper.readTree(body.isEmpty() ? "{}" : body);
            } catch (JsonProcessingException e) {
                throw new SourceCycleFailedException("Malformed " + endpoint + " response", e);
            }
        }
    }

    private static final class PlaylistCursor {
        private final String playlistId;
        private final String discoveredVia;
        private String pageToken;

        PlaylistCursor(String playlistId, String discoveredVia) {
            this.playlistId = playlistId;
            this.discoveredVia = discoveredVia;
        }
    }

    private final class ChannelSpliterator extends Spliterators.AbstractSpliterator<CandidateItem> {

        private final Source source;
        private final FetchContext context;
        private final ApiCaller api;
        private final Deque<CandidateItem> buffer = new ArrayDeque<>();
        private final Deque<PlaylistCursor> playlists = new ArrayDeque<>();
        private final Set<String> seen = new HashSet<>();
        private String channelId;
        private boolean initialized;
        private boolean playlistsListed;
        private int emitted;

        ChannelSpliterator(Source source, FetchContext context) {
            super(Long.MAX_VALUE, Spliterator.ORDERED | Spliterator.NONNULL);
            this.source = source;
            this.context = context;
            this.api = new ApiCaller(context);
        }

        @Override
        public boolean tryAdvance(Consumer<? super CandidateItem> action) {
            while (true) {
                if (context.limitReached(emitted)) {
                    return false;
                }
                if (!buffer.isEmpty()) {
                    emitted++;
                    action.accept(buffer.poll());
                    return true;
                }
                if (!initialized) {
                    initialize();
                    continue;
                }
                PlaylistCursor cursor = playlists.peek();
                if (cursor == null) {
                    if (context.isUploadsOnly() || playlistsListed) {
                        return false;
                    }
                    listChannelPlaylists();
                    continue;
                }
                if (!fetchPage(cursor)) {
                    playlists.poll();
                }
            }
        }

        private void initialize() {
            initialized = true;
            channelId = resolveChannelId(source, api);
            JsonNode response = api.get("channels", Map.of("part", "contentDetails", "id", channelId));
            String uploads = response.path("items").path(0)
                    .path("contentDetails").path("relatedPlaylists").path("uploads").asText("");
            if (uploads.isBlank()) {
                log.warn("No uploads playlist found for channel {} (source #{})", channelId, source.getId());
            } else {
                playlists.add(new PlaylistCursor(uploads, VIA_CHANNEL));
            }
        }

        private void listChannelPlaylists() {
            playlistsListed = true;
            String pageToken = null;
            do {
                Map<String, String> params = new HashMap<>();
                params.put("part", "id,snippet");
                params.put("channelId", channelId);
                params.put("maxResults", String.valueOf(properties.getVideo().getPageSize()));
                if (pageToken != null) {
                    params.put("pageToken", pageToken);
                }
                JsonNode response = api.get("playlists", params);
                for (JsonNode item : response.path("items")) {
                    String id = item.path("id").asText("");
                    if (!id.isBlank()) {
                        playlists.add(new PlaylistCursor(id, VIA_PLAYLIST_PREFIX + id));
                    }
                }
                pageToken = textOrNull(response.path("nextPageToken"));
            } while (pageToken != null);
            log.debug("Channel {} has {} playlists", channelId, playlists.size());
        }

        /**
         * Fetch one page of a playlist into the buffer.
         *
         * @return {@code false} when the playlist is exhausted
         */
        private boolean fetchPage(PlaylistCursor cursor) {
            Map<String, String> params = new HashMap<>();
            params.put("part", "contentDetails");
            params.put("playlistId", cursor.playlistId);
            params.put("maxResults", String.valueOf(properties.getVideo().getPageSize()));
            if (cursor.pageToken != null) {
                params.put("pageToken", cursor.pageToken);
            }

            JsonNode response;
            try {
                response = api.get("playlistItems", params);
            } catch (PermanentFetchException e) {
                if (e.isNotFound()) {
                    log.warn("Playlist not found, skipping: {}", cursor.playlistId);
                    return false;
                }
                throw e;
            }

            List<String> fresh = new ArrayList<>();
            int onPage = 0;
            for (JsonNode item : response.path("items")) {
                String videoId = item.path("contentDetails").path("videoId").asText("");
                if (videoId.isBlank()) {
                    continue;
                }
                onPage++;
                if (!context.isKnown(videoId) && seen.add(videoId)) {
                    fresh.add(videoId);
                }
            }

            if (!fresh.isEmpty()) {
                enrich(fresh, cursor.discoveredVia);
            }

            cursor.pageToken = textOrNull(response.path("nextPageToken"));
            if (onPage > 0 && fresh.isEmpty()) {
                log.debug("Playlist {} reached a page of already-stored videos", cursor.playlistId);
                return false;
            }
            return cursor.pageToken != null;
        }

        private void enrich(List<String> videoIds, String discoveredVia) {
            JsonNode response = api.get("videos", Map.of(
                    "part", "snippet,contentDetails",
                    "id", String.join(",", videoIds),
                    "maxResults", String.valueOf(videoIds.size())));

            Map<String, JsonNode> byId = new HashMap<>();
            for (JsonNode item : response.path("items")) {
                String id = item.path("id").asText("");
                if (!id.isBlank()) {
                    byId.put(id, item);
                }
            }

            for (String videoId : videoIds) {
                JsonNode video = byId.get(videoId);
                if (video == null) {
                    log.debug("Video {} has no metadata (private or deleted), skipping", videoId);
                    continue;
                }
                JsonNode snippet = video.path("snippet");
                LocalDateTime publishedAt = parsePublishedAt(textOrNull(snippet.path("publishedAt")));
                if (publishedAt == null) {
                    buffer.add(CandidateItem.malformed(videoId,
                            "unparseable publishedAt '" + snippet.path("publishedAt").asText("") + "'"));
                    continue;
                }
                if (context.getSince() != null && publishedAt.toLocalDate().isBefore(context.getSince())) {
                    continue;
                }
                buffer.add(CandidateItem.builder()
                        .externalId(videoId)
                        .title(textOrNull(snippet.path("title")))
                        .publishedAt(publishedAt)
                        .discoveredVia(discoveredVia)
                        .durationSeconds(parseDurationSeconds(textOrNull(video.path("contentDetails").path("duration"))))
                        .build());
            }
        }
    }

    private static String textOrNull(JsonNode node) {
        if (node == null || node.isMissingNode() || node.isNull()) {
            return null;
        }
        String text = node.asText("");
        return text.isBlank() ? null : text;
    }
}
