package com.govcomms.collector.service.fetch;

import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts post metadata and navigation links from blog HTML with jsoup.
 * Selectors cover WordPress and the GOV.UK blog platform.
 */
@Component
@Slf4j
public class BlogPageParser {

    private static final List<String> TITLE_SELECTORS = List.of(
            "h1.entry-title",
            "article h1",
            "header h1",
            "h1"
    );

    // selector -> attribute
    private static final List<String[]> DATE_SELECTORS = List.of(
            new String[]{"meta[property=article:published_time]", "content"},
            new String[]{"meta[name=pubdate]", "content"},
            new String[]{"time[datetime]", "datetime"}
    );

    private static final List<String> PREVIOUS_LINK_SELECTORS = List.of(
            "a[rel=prev]",
            "nav.post-navigation a[rel=prev]",
            ".post-navigation .nav-previous a",
            "a.previous-post",
            "a.prev-post"
    );

    private static final List<String> NEXT_LINK_SELECTORS = List.of(
            "a[rel=next]",
            "nav.post-navigation a[rel=next]",
            ".post-navigation .nav-next a",
            "a.next-post"
    );

    private static final List<String> LATEST_POST_SELECTORS = List.of(
            "h2.entry-title a[href]",
            "article header h2 a[href]",
            "main a[href]"
    );

    private static final String SHARE_MARKER = "share this page";
    private static final int SHARE_WINDOW_BEFORE = 2000;
    private static final int SHARE_WINDOW_AFTER = 1000;

    private static final DateTimeFormatter SPACE_SEPARATED = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");
    private static final Pattern LEADING_DATE = Pattern.compile("^(\\d{4}-\\d{2}-\\d{2})");

    public BlogPage parse(String html, String pageUrl) {
        Document doc = Jsoup.parse(html, pageUrl);
        String previous = firstLink(doc, PREVIOUS_LINK_SELECTORS);
        String next = firstLink(doc, NEXT_LINK_SELECTORS);

        if (previous == null || next == null) {
            NavigationLinks guessed = guessNavigationNearShareBlock(html, pageUrl);
            previous = previous != null ? previous : guessed.previous();
            next = next != null ? next : guessed.next();
        }
        return new BlogPage(extractTitle(doc), extractPublishedAt(doc), previous, next);
    }

    /**
     * Newest post link on a blog home page, if any listing anchor is present.
     */
    public Optional<String> latestPostLink(String homeHtml, String homeUrl) {
        Document doc = Jsoup.parse(homeHtml, homeUrl);
        for (String selector : LATEST_POST_SELECTORS) {
            for (Element anchor : doc.select(selector)) {
                String url = normalizeUrl(anchor);
                if (url != null) {
                    return Optional.of(url);
                }
            }
        }
        return Optional.empty();
    }

    /**
     * RSS/Atom link advertised in the page head, else the WordPress default {@code /feed/}.
     */
    public String feedUrl(String homeHtml, String homeUrl) {
        Document doc = Jsoup.parse(homeHtml, homeUrl);
        for (Element link : doc.select("link[rel~=(?i)alternate][href]")) {
            String type = link.attr("type").toLowerCase(Locale.ROOT);
            if (type.contains("rss") || type.contains("atom") || type.contains("xml")) {
                String url = normalizeUrl(link);
                if (url != null) {
                    return url;
                }
            }
        }
        return resolve(homeUrl, "/feed/");
    }

    String extractTitle(Document doc) {
        for (String selector : TITLE_SELECTORS) {
            Element el = doc.selectFirst(selector);
            if (el != null && !el.text().isBlank()) {
                return el.text().trim();
            }
        }
        String title = doc.title();
        return title == null || title.isBlank() ? null : title.trim();
    }

    LocalDateTime extractPublishedAt(Document doc) {
        for (String[] selector : DATE_SELECTORS) {
            Element el = doc.selectFirst(selector[0]);
            if (el != null) {
                LocalDateTime parsed = parseDate(el.attr(selector[1]));
                if (parsed != null) {
                    return parsed;
                }
            }
        }
        for (Element time : doc.select("time")) {
            String value = time.hasAttr("datetime") ? time.attr("datetime") : time.text();
            LocalDateTime parsed = parseDate(value);
            if (parsed != null) {
                return parsed;
            }
        }
        return null;
    }

    /**
     * Parse a date as found in blog markup. Offsets are converted to UTC.
     *
     * @return {@code null} when nothing date-like can be read
     */
    public static LocalDateTime parseDate(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String s = value.trim();
        try {
            return OffsetDateTime.parse(s).withOffsetSameInstant(ZoneOffset.UTC).toLocalDateTime();
        } catch (DateTimeParseException ignored) {
            // try the next format
        }
        try {
            return LocalDateTime.parse(s);
        } catch (DateTimeParseException ignored) {
            // try the next format
        }
        try {
            return LocalDateTime.parse(s, SPACE_SEPARATED);
        } catch (DateTimeParseException ignored) {
            // try the next format
        }
        Matcher matcher = LEADING_DATE.matcher(s);
        if (matcher.find()) {
            try {
                return LocalDate.parse(matcher.group(1)).atStartOfDay();
            } catch (DateTimeParseException e) {
                log.debug("Unparseable date '{}'", s);
            }
        }
        return null;
    }

    private String firstLink(Document doc, List<String> selectors) {
        for (String selector : selectors) {
            Element anchor = doc.selectFirst(selector);
            if (anchor != null) {
                String url = normalizeUrl(anchor);
                if (url != null) {
                    return url;
                }
            }
        }
        return null;
    }

    /**
     * GOV.UK blogs render "Previous"/"Next" links around the "Share this page" block without rel attributes.
     */
    private NavigationLinks guessNavigationNearShareBlock(String html, String pageUrl) {
        int idx = html.toLowerCase(Locale.ROOT).indexOf(SHARE_MARKER);
        if (idx < 0) {
            return new NavigationLinks(null, null);
        }
        String window = html.substring(Math.max(0, idx - SHARE_WINDOW_BEFORE),
                Math.min(html.length(), idx + SHARE_WINDOW_AFTER));
        Document fragment = Jsoup.parseBodyFragment(window, pageUrl);

        String previous = null;
        String next = null;
        for (Element anchor : fragment.select("a[href]")) {
            String text = anchor.text().trim().toLowerCase(Locale.ROOT);
            if (previous == null && (text.contains("previous") || text.contains("older") || text.contains("←"))) {
                previous = normalizeUrl(anchor);
            }
            if (next == null && (text.contains("next") || text.contains("newer") || text.contains("→"))) {
                next = normalizeUrl(anchor);
            }
            if (previous != null && next != null) {
                break;
            }
        }
        return new NavigationLinks(previous, next);
    }

    /**
     * Absolute http(s) URL of the element's href without fragment, or {@code null} for in-page anchors.
     */
    private static String normalizeUrl(Element element) {
        String href = element.attr("href").trim();
        if (href.isEmpty() || href.startsWith("#")) {
            return null;
        }
        String absolute = element.absUrl("href");
        if (!absolute.startsWith("http://") && !absolute.startsWith("https://")) {
            return null;
        }
        int fragment = absolute.indexOf('#');
        return fragment >= 0 ? absolute.substring(0, fragment) : absolute;
    }

    static String resolve(String baseUrl, String path) {
        try {
            return java.net.URI.create(baseUrl).resolve(path).toString();
        } catch (IllegalArgumentException e) {
            return baseUrl;
        }
    }

    /**
     * Metadata of one blog post page.
     */
    public record BlogPage(String title, LocalDateTime publishedAt, String previousUrl, String nextUrl) {

        public boolean isEmpty() {
            return (title == null || title.isBlank()) && publishedAt == null;
        }
    }

    private record NavigationLinks(String previous, String next) {
    }
}
