package com.chapterharvest.crawl.extract;

import com.chapterharvest.config.CrawlerProperties;
import com.chapterharvest.crawl.model.ChapterTask;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Enumerates {@code /novel/<slug>/chapter-<n>} links on a table-of-contents page. Relative links resolve
 * against the index URL, or the configured site origin when there is none.
 */
@Component
public class ChapterIndexParser {
    private static final Pattern CHAPTER_LINK = Pattern.compile("/novel/[^/]+/chapter[-_](\\d+)", Pattern.CASE_INSENSITIVE);

    private final CrawlerProperties properties;

    public ChapterIndexParser(CrawlerProperties properties) {
        this.properties = properties;
    }

    public List<ChapterTask> parse(String html, String indexUrl) {
        if (html == null || html.isBlank()) {
            return List.of();
        }
        String baseUrl = indexUrl == null || indexUrl.isBlank() ? properties.getSiteOrigin() : indexUrl;
        Document document = Jsoup.parse(html, baseUrl);
        Map<String, Integer> byUrl = new LinkedHashMap<>();
        for (Element anchor : document.select("a[href]")) {
            String href = anchor.attr("href");
            Matcher matcher = CHAPTER_LINK.matcher(href);
            if (!matcher.find()) {
                continue;
            }
            int number;
            try {
                number = Integer.parseInt(matcher.group(1));
            } catch (NumberFormatException e) {
                continue;
            }
            String absolute = anchor.absUrl("href");
            if (absolute.isBlank()) {
                absolute = ChapterUrls.resolve(baseUrl, href);
            }
            if (absolute == null) {
                continue;
            }
            byUrl.merge(absolute, number, Math::min);
        }
        List<ChapterTask> candidates = new ArrayList<>();
        for (Map.Entry<String, Integer> entry : byUrl.entrySet()) {
            candidates.add(new ChapterTask(entry.getValue(), entry.getKey()));
        }
        candidates.sort(Comparator.comparingInt(ChapterTask::index));
        // One task per chapter number; the first link in page order wins.
        List<ChapterTask> tasks = new ArrayList<>();
        Set<Integer> seen = new HashSet<>();
        for (ChapterTask task : candidates) {
            if (seen.add(task.index())) {
                tasks.add(task);
            }
        }
        return tasks;
    }
}
