package com.govcomms.collector.service.fetch;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.govcomms.collector.dto.CandidateItem;
import com.govcomms.collector.entity.Source;
import com.govcomms.collector.exception.SourceCycleFailedException;
import com.govcomms.collector.exception.TransientFetchException;
import com.govcomms.collector.support.FakePageClient;
import com.govcomms.collector.support.TestSources;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;

import static com.govcomms.collector.service.fetch.BlogFixtures.HOME;
import static com.govcomms.collector.service.fetch.BlogFixtures.postUrl;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BlogChainFetcherTest {

    private FakePageClient pageClient;
    private AtomicInteger pauses;
    private BlogChainFetcher fetcher;
    private Source source;
    private Set<String> known;

    @BeforeEach
    void setUp() {
        pageClient = new FakePageClient();
        pauses = new AtomicInteger();
        fetcher = new BlogChainFetcher(pageClient, new RetryExecutor(delay -> pauses.incrementAndGet()),
                new BlogPageParser(), new ObjectMapper());
        source = TestSources.blog(1L, "https://blog.example.gov.uk");
        known = new HashSet<>();
    }

    private FetchContext.FetchContextBuilder context() {
        return FetchContext.builder()
                .isKnown(known::contains)
                .retryPolicy(RetryPolicy.immediate(3));
    }

    private List<CandidateItem> fetch(FetchContext context) {
        return fetcher.fetchCandidates(source, context).toList();
    }

    @Nested
    @DisplayName("Chain walking")
    class ChainWalking {

        @Test
        @DisplayName("5 new pages followed by stored pages yield exactly 5 items and the first known page is never fetched")
        void stopsAtFirstKnownPage() {
            // given
            BlogFixtures.chain(8).register(pageClient);
            known.addAll(List.of(postUrl(1), postUrl(2), postUrl(3)));

            // when
            List<CandidateItem> items = fetch(context().build());

            // then
            assertThat(items).extracting(CandidateItem::externalId)
                    .containsExactly(postUrl(8), postUrl(7), postUrl(6), postUrl(5), postUrl(4));
            assertThat(pageClient.wasRequested(postUrl(3))).isFalse();
        }

        @Test
        @DisplayName("Item carries title, UTC timestamp and link chain")
        void extractsMetadata() {
            // given
            BlogFixtures.chain(2).register(pageClient);

            // when
            List<CandidateItem> items = fetch(context().build());

            // then
            CandidateItem newest = items.get(0);
            assertThat(newest.title()).isEqualTo("Post number 2");
            assertThat(newest.publishedAt()).isEqualTo(LocalDateTime.of(2024, 1, 2, 9, 0));
            assertThat(newest.previousUrl()).isEqualTo(postUrl(1));
            assertThat(newest.isMalformed()).isFalse();
        }

        @Test
        @DisplayName("Chain ends when the oldest post has no previous link")
        void endsAtOldestPost() {
            BlogFixtures.chain(3).register(pageClient);

            assertThat(fetch(context().build())).hasSize(3);
        }

        @Test
        @DisplayName("Already-known newest post yields nothing")
        void knownNewestPost() {
            BlogFixtures.chain(3).register(pageClient);
            known.add(postUrl(3));

            assertThat(fetch(context().build())).isEmpty();
            assertThat(pageClient.requested()).containsExactly(HOME);
        }

        @Test
        @DisplayName("Link cycle is detected and ends the chain")
        void detectsCycle() {
            // given
            pageClient.page(HOME, BlogFixtures.homeLinkingTo(postUrl(2)))
                    .page(postUrl(2), BlogFixtures.post("Two", "2024-01-02", postUrl(1)))
                    .page(postUrl(1), BlogFixtures.post("One", "2024-01-01", postUrl(2)));

            // when
            List<CandidateItem> items = fetch(context().build());

            // then
            assertThat(items).hasSize(2);
            assertThat(pageClient.requestCount("post-2")).isEqualTo(1);
        }

        @Test
        @DisplayName("maxItems limits the walk")
        void respectsMaxItems() {
            BlogFixtures.chain(8).register(pageClient);

            List<CandidateItem> items = fetch(context().maxItems(2).build());

            assertThat(items).hasSize(2);
            assertThat(pageClient.wasRequested(postUrl(6))).isFalse();
        }

        @Test
        @DisplayName("since stops at the first post published before it")
        void respectsSince() {
            BlogFixtures.chain(8).register(pageClient);

            List<CandidateItem> items = fetch(context().since(LocalDate.of(2024, 1, 6)).build());

            assertThat(items).extracting(CandidateItem::externalId)
                    .containsExactly(postUrl(8), postUrl(7), postUrl(6));
        }

        @Test
        @DisplayName("Page without title and date becomes a malformed candidate and the chain continues")
        void malformedPage() {
            // given
            pageClient.page(HOME, BlogFixtures.homeLinkingTo(postUrl(2)))
                    .page(postUrl(2), "<html><body><a rel=\"prev\" href=\"" + postUrl(1) + "\">x</a></body></html>")
                    .page(postUrl(1), BlogFixtures.post("One", "2024-01-01", null));

            // when
            List<CandidateItem> items = fetch(context().build());

            // then
            assertThat(items).hasSize(2);
            assertThat(items.get(0).isMalformed()).isTrue();
            assertThat(items.get(0).externalId()).isEqualTo(postUrl(2));
            assertThat(items.get(1).isMalformed()).isFalse();
        }

        @Test
        @DisplayName("Pages are requested lazily, one per consumed item")
        void lazy() {
            BlogFixtures.chain(8).register(pageClient);

            fetcher.fetchCandidates(source, context().build()).findFirst();

            assertThat(pageClient.requested()).containsExactly(HOME, postUrl(8));
        }

        @Test
        @DisplayName("Inter-request delay is applied between successive requests")
        void pausesBetweenRequests() {
            BlogFixtures.chain(3).register(pageClient);
            RetryPolicy policy = new RetryPolicy(1, Duration.ZERO, Duration.ZERO, Duration.ofMillis(10));

            fetch(context().retryPolicy(policy).build());

            // home + 3 posts
            assertThat(pauses.get()).isEqualTo(3);
        }
    }

    @Nested
    @DisplayName("Start page discovery")
    class StartPage {

        @Test
        @DisplayName("Explicit start URL skips the home page")
        void explicitStartUrl() {
            BlogFixtures.chain(4).register(pageClient);

            List<CandidateItem> items = fetch(context().startUrl(postUrl(2)).build());

            assertThat(items).extracting(CandidateItem::externalId).containsExactly(postUrl(2), postUrl(1));
            assertThat(pageClient.wasRequested(HOME)).isFalse();
        }

        @Test
        @DisplayName("Falls back to the newest entry of the advertised feed")
        void feedFallback() {
            // given
            pageClient.page(HOME, "<html><head><link rel=\"alternate\" type=\"application/rss+xml\" "
                            + "href=\"/feed/\"></head><body><p>Welcome</p></body></html>")
                    .page(HOME + "feed/", """
                            <?xml version="1.0" encoding="UTF-8"?>
                            <rss version="2.0"><channel><title>Example</title>
                            <link>https://blog.example.gov.uk/</link><description>d</description>
                            <item><title>One</title><link>https://blog.example.gov.uk/post-1</link></item>
                            </channel></rss>
                            """)
                    .page(postUrl(1), BlogFixtures.post("One", "2024-01-01", null));

            // when
            List<CandidateItem> items = fetch(context().build());

            // then
            assertThat(items).extracting(CandidateItem::externalId).containsExactly(postUrl(1));
        }

        @Test
        @DisplayName("Falls back to the WordPress JSON API when no feed is available")
        void wordPressFallback() {
            // given
            pageClient.page(HOME, "<html><body><p>Welcome</p></body></html>")
                    .page(HOME + "wp-json/wp/v2/posts?per_page=1&_fields=link,date",
                            "[{\"link\":\"https://blog.example.gov.uk/post-1\",\"date\":\"2024-01-01T09:00:00\"}]")
                    .page(postUrl(1), BlogFixtures.post("One", "2024-01-01", null));

            // when
            List<CandidateItem> items = fetch(context().build());

            // then
            assertThat(items).extracting(CandidateItem::externalId).containsExactly(postUrl(1));
            assertThat(pageClient.wasRequested(HOME + "feed/")).isTrue();
        }

        @Test
        @DisplayName("No discoverable start page fails the source cycle")
        void noStartPage() {
            pageClient.page(HOME, "<html><body><p>Welcome</p></body></html>");

            assertThatThrownBy(() -> fetch(context().build()))
                    .isInstanceOf(SourceCycleFailedException.class)
                    .hasMessageContaining("latest post");
        }
    }

    @Nested
    @DisplayName("Transient failures")
    class TransientFailures {

        @Test
        @DisplayName("A transient failure followed by success yields the page")
        void retriesTransientFailure() {
            BlogFixtures.chain(2).register(pageClient);
            pageClient.failNext(postUrl(2), new TransientFetchException(503, "HTTP 503"));

            List<CandidateItem> items = fetch(context().build());

            assertThat(items).hasSize(2);
            assertThat(pageClient.requestCount("post-2")).isEqualTo(2);
        }

        @Test
        @DisplayName("Persistent transient failures end the source cycle")
        void exhaustsRetries() {
            BlogFixtures.chain(2).register(pageClient);
            pageClient.failNext(postUrl(1),
                    new TransientFetchException(429, "HTTP 429"),
                    new TransientFetchException(429, "HTTP 429"),
                    new TransientFetchException(429, "HTTP 429"));

            assertThatThrownBy(() -> fetch(context().build()))
                    .isInstanceOf(SourceCycleFailedException.class);
            assertThat(pageClient.requestCount("post-1")).isEqualTo(3);
        }
    }
}
