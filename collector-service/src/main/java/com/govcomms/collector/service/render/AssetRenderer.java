package com.govcomms.collector.service.render;

import com.govcomms.collector.dto.DailyAverage;
import com.govcomms.collector.dto.MonthlyCount;
import com.govcomms.collector.dto.WordFrequency;
import com.govcomms.collector.entity.Item;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.YearMonth;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import java.util.regex.Pattern;

/**
 * Computes the analytics artifacts of a scope from its raw items.
 *
 * Items without a published timestamp are ignored. Output depends only on the input items.
 */
@Component
public class AssetRenderer {

    public static final Set<String> DEFAULT_STOPWORDS = Set.of(
            "gds", "gov", "govuk", "gov.uk", "uk",
            "blog", "week", "weeks", "new", "day", "s",
            "and", "the", "for", "with", "from", "into", "our", "we",
            "in", "a", "an", "of", "to", "too", "on", "at", "by", "as",
            "is", "are", "was", "were", "be", "been", "being",
            "it", "its", "this", "that", "these", "those",
            "not", "no", "or", "but", "than", "then", "there", "here",
            "out", "up", "down", "over", "under",
            "what", "how"
    );

    private static final Pattern APOSTROPHES = Pattern.compile("[‘’´`']");
    private static final Pattern NON_WORD = Pattern.compile("[^a-z0-9\\s\\-.]");
    private static final Pattern SHORT_NUMBER = Pattern.compile("\\b\\d{1,4}\\b");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final int MIN_TOKEN_LENGTH = 3;

    /**
     * Items per calendar month from the first to the last item month, gaps filled with zero.
     */
    public List<MonthlyCount> monthlyCounts(Collection<Item> items) {
        TreeMap<YearMonth, Long> counts = new TreeMap<>();
        for (LocalDate date : publishedDates(items)) {
            counts.merge(YearMonth.from(date), 1L, Long::sum);
        }
        if (counts.isEmpty()) {
            return List.of();
        }

        List<MonthlyCount> result = new ArrayList<>();
        for (YearMonth month = counts.firstKey(); !month.isAfter(counts.lastKey()); month = month.plusMonths(1)) {
            result.add(new MonthlyCount(month, counts.getOrDefault(month, 0L)));
        }
        return result;
    }

    /**
     * Trailing {@code windowDays} mean of items per day.
     *
     * Every day from the earliest to the latest item date takes part, empty days as zero. A day's
     * value is the window sum divided by the number of span days the window covers. Days covered
     * by fewer than {@code min(windowDays, max(5, windowDays / 6))} span days emit nothing.
     */
    public List<DailyAverage> rollingAverage(Collection<Item> items, int windowDays) {
        if (windowDays < 1) {
            throw new IllegalArgumentException("windowDays must be >= 1");
        }
        TreeMap<LocalDate, Integer> perDay = new TreeMap<>();
        for (LocalDate date : publishedDates(items)) {
            perDay.merge(date, 1, Integer::sum);
        }
        if (perDay.isEmpty()) {
            return List.of();
        }

        LocalDate first = perDay.firstKey();
        int spanDays = (int) ChronoUnit.DAYS.between(first, perDay.lastKey()) + 1;
        int[] daily = new int[spanDays];
        perDay.forEach((date, count) -> daily[(int) ChronoUnit.DAYS.between(first, date)] = count);

        int minPeriods = Math.min(windowDays, Math.max(5, windowDays / 6));
        List<DailyAverage> result = new ArrayList<>();
        long windowSum = 0;
        for (int day = 0; day < spanDays; day++) {
            windowSum += daily[day];
            if (day >= windowDays) {
                windowSum -= daily[day - windowDays];
            }
            int covered = Math.min(day + 1, windowDays);
            if (covered >= minPeriods) {
                result.add(new DailyAverage(first.plusDays(day), (double) windowSum / covered));
            }
        }
        return result;
    }

    /**
     * Title word counts, most frequent first, ties broken alphabetically.
     */
    public List<WordFrequency> wordFrequencies(Collection<Item> items, Collection<String> extraStopwords, int maxWords) {
        Set<String> stopwords = new HashSet<>(DEFAULT_STOPWORDS);
        if (extraStopwords != null) {
            extraStopwords.stream()
                    .filter(Objects::nonNull)
                    .map(word -> word.trim().toLowerCase(Locale.ROOT))
                    .forEach(stopwords::add);
        }

        Map<String, Long> counts = new HashMap<>();
        for (Item item : items) {
            if (item.getPublishedAt() == null || item.getTitle() == null) {
                continue;
            }
            for (String token : tokenize(item.getTitle())) {
                if (token.length() >= MIN_TOKEN_LENGTH && !stopwords.contains(token)) {
                    counts.merge(token, 1L, Long::sum);
                }
            }
        }

        return counts.entrySet().stream()
                .map(entry -> new WordFrequency(entry.getKey(), entry.getValue()))
                .sorted(Comparator.comparingLong(WordFrequency::count).reversed()
                        .thenComparing(WordFrequency::word))
                .limit(Math.max(0, maxWords))
                .toList();
    }

    static List<String> tokenize(String title) {
        String text = title.toLowerCase(Locale.ROOT);
        text = APOSTROPHES.matcher(text).replaceAll(" ");
        text = NON_WORD.matcher(text).replaceAll(" ");
        text = SHORT_NUMBER.matcher(text).replaceAll(" ");
        text = WHITESPACE.matcher(text).replaceAll(" ").trim();
        if (text.isEmpty()) {
            return List.of();
        }

        List<String> tokens = new ArrayList<>();
        for (String raw : text.split(" ")) {
            String token = stripEdges(raw);
            if (!token.isEmpty()) {
                tokens.add(token);
            }
        }
        return tokens;
    }

    private static String stripEdges(String token) {
        int start = 0;
        int end = token.length();
        while (start < end && isEdgeChar(token.charAt(start))) {
            start++;
        }
        while (end > start && isEdgeChar(token.charAt(end - 1))) {
            end--;
        }
        return token.substring(start, end);
    }

    private static boolean isEdgeChar(char c) {
        return c == '-' || c == '.';
    }

    private static List<LocalDate> publishedDates(Collection<Item> items) {
        List<LocalDate> dates = new ArrayList<>();
        for (Item item : items) {
            LocalDateTime publishedAt = item.getPublishedAt();
            if (publishedAt != null) {
                dates.add(publishedAt.toLocalDate());
            }
        }
        return dates;
    }
}
