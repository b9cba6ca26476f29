package com.govcomms.collector.service.fetch;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.govcomms.collector.dto.CandidateItem;
import com.govcomms.collector.entity.Source;
import com.govcomms.collector.entity.SourceKind;
import com.govcomms.collector.exception.SourceCycleFailedException;
import com.govcomms.collector.service.fetch.BlogPageParser.BlogPage;
import com.rometools.rome.feed.synd.SyndEntry;
import com.rometools.rome.feed.synd.SyndFeed;
import com.rometools.rome.io.FeedException;
import com.rometools.rome.io.SyndFeedInput;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.StringReader;
import java.util.HashSet;
import java.util.Optional;
import java.util.Set;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.function.Consumer;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Walks a blog backwards through its "previous post" links, one item per page.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class BlogChainFetcher implements ItemFetcher {

    private static final String WP_LATEST_POST_PATH = "/wp-json/wp/v2/posts?per_page=1&_fields=link,date";

    private final PageClient pageClient;
    private final RetryExecutor retryExecutor;
    private final BlogPageParser parser;
    private final ObjectMapper objectMapper;

    @Override
    public SourceKind kind() {
        return SourceKind.BLOG;
    }

    @Override
    public Stream<CandidateItem> fetchCandidates(Source source, FetchContext context) {
        return StreamSupport.stream(new ChainSpliterator(source, context), false);
    }

    /**
     * Lazily fetches one page per {@code tryAdvance}. A page is only requested when the consumer asks for it.
     */
    private final class ChainSpliterator extends Spliterators.AbstractSpliterator<CandidateItem> {

        private final Source source;
        private final FetchContext context;
        private final Set<String> visited = new HashSet<>();
        private String nextUrl;
        private boolean started;
        private boolean finished;
        private int emitted;
        private int requests;

        ChainSpliterator(Source source, FetchContext context) {
            super(Long.MAX_VALUE, Spliterator.ORDERED | Spliterator.NONNULL);
            this.source = source;
            this.context = context;
        }

        @Override
        public boolean tryAdvance(Consumer<? super CandidateItem> action) {
            if (finished) {
                return false;
            }
            if (!started) {
                started = true;
                nextUrl = resolveStartUrl();
                log.debug("Source #{} starting chain at {}", source.getId(), nextUrl);
            }
            if (nextUrl == null) {
                return finish("no previous link");
            }
            if (context.limitReached(emitted)) {
                return finish("max items " + context.getMaxItems() + " reached");
            }
            if (!visited.add(nextUrl)) {
                log.warn("Link cycle detected for source #{} at {}", source.getId(), nextUrl);
                return finish("link cycle");
            }
            if (context.isKnown(nextUrl)) {
                log.info("Source #{} hit already-known post; stopping at {}", source.getId(), nextUrl);
                return finish("known post");
            }

            String url = nextUrl;
            BlogPage page = parser.parse(request(url), url);

            if (context.getSince() != null && page.publishedAt() != null
                    && page.publishedAt().toLocalDate().isBefore(context.getSince())) {
                return finish("post published before " + context.getSince());
            }

            nextUrl = page.previousUrl();
            emitted++;
            if (page.isEmpty()) {
                action.accept(CandidateItem.malformed(url, "page has neither title nor published date"));
            } else {
                action.accept(CandidateItem.builder()
                        .externalId(url)
                        .title(page.title())
                        .publishedAt(page.publishedAt())
                        .previousUrl(page.previousUrl())
                        .nextUrl(page.nextUrl())
                        .build());
            }
            return true;
        }

        private boolean finish(String reason) {
            finished = true;
            log.debug("Source #{} chain finished after {} pages: {}", source.getId(), emitted, reason);
            return false;
        }

        private String request(String url) {
            if (requests++ > 0) {
                retryExecutor.pause(context.getRetryPolicy());
            }
            return retryExecutor.call("GET " + url, context.getRetryPolicy(), () -> pageClient.get(url));
        }

        private String resolveStartUrl() {
            if (context.getStartUrl() != null && !context.getStartUrl().isBlank()) {
                return context.getStartUrl().trim();
            }
            String homeUrl = source.getUrl().endsWith("/") ? source.getUrl() : source.getUrl() + "/";
            String homeHtml = request(homeUrl);

            Optional<String> fromHome = parser.latestPostLink(homeHtml, homeUrl);
            if (fromHome.isPresent()) {
                return fromHome.get();
            }

            Optional<String> fromFeed = latestFromFeed(parser.feedUrl(homeHtml, homeUrl));
            if (fromFeed.isPresent()) {
                return fromFeed.get();
            }

            return latestFromWordPressApi(BlogPageParser.resolve(homeUrl, WP_LATEST_POST_PATH))
                    .orElseThrow(() -> new SourceCycleFailedException(
                            "Could not locate latest post URL on home page " + homeUrl));
        }

        private Optional<String> latestFromFeed(String feedUrl) {
            try {
                SyndFeed feed = new SyndFeedInput().build(new StringReader(request(feedUrl)));
                return feed.getEntries().stream()
                        .map(SyndEntry::getLink)
                        .filter(link -> link != null && !link.isBlank())
                        .map(String::trim)
                        .findFirst();
            } catch (SourceCycleFailedException | FeedException | IllegalArgumentException e) {
                log.debug("Feed fallback failed for {}: {}", feedUrl, e.getMessage());
                return Optional.empty();
            }
        }

        private Optional<String> latestFromWordPressApi(String apiUrl) {
            try {
                JsonNode posts = objectMapper.readTree(request(apiUrl));
                if (posts != null && posts.isArray() && !posts.isEmpty()) {
                    String link = posts.get(0).path("link").asText("");
                    return link.isBlank() ? Optional.empty() : Optional.of(link);
                }
                return Optional.empty();
            } catch (SourceCycleFailedException | JsonProcessingException e) {
                log.debug("WP JSON fallback failed for {}: {}", apiUrl, e.getMessage());
                return Optional.empty();
            }
        }
    }
}
