package com.chapterharvest.crawl.extract;

import com.chapterharvest.crawl.model.ChapterPage;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

@Component
public class JsoupChapterExtractor implements ChapterExtractor {
    private static final Logger log = LoggerFactory.getLogger(JsoupChapterExtractor.class);
    private static final List<String> NEXT_TITLES = List.of(
        "Read Next chapter",
        "Next Chapter",
        "Read Next Chapter",
        "Next"
    );
    private static final Pattern NEXT_WORD = Pattern.compile("\\bnext\\b");
    private static final String CONTENT_SELECTOR = "#article, .txt, .txt-article, .read-content, .chapter-content";
    private static final String UNTITLED = "Untitled Chapter";

    @Override
    public ChapterPage extract(String html, String pageUrl) {
        if (html == null || html.isBlank()) {
            return ChapterPage.empty("No content found");
        }
        Document document = pageUrl == null ? Jsoup.parse(html) : Jsoup.parse(html, pageUrl);
        String nextUrl = findNextUrl(document, pageUrl);

        Element container = document.selectFirst("div.m-read");
        if (container == null) {
            container = document.selectFirst("div#article");
        }
        if (container == null) {
            container = document.selectFirst(CONTENT_SELECTOR);
        }
        if (container == null) {
            log.debug("Chapter content container not found on {}", pageUrl);
            return ChapterPage.empty(nextUrl, "No content found");
        }

        Element article = "article".equals(container.id()) ? container : container.selectFirst("div#article");
        List<String> paragraphs = new ArrayList<>();
        for (Element paragraph : (article != null ? article : container).select("p")) {
            String text = paragraph.text().trim();
            if (!text.isEmpty()) {
                paragraphs.add(text);
            }
        }

        String title = findTitle(container, article, paragraphs);
        String text = String.join("\n\n", paragraphs);
        if (text.isBlank()) {
            return ChapterPage.empty(title);
        }
        return new ChapterPage(nextUrl, title, text);
    }

    private String findNextUrl(Document document, String pageUrl) {
        for (String title : NEXT_TITLES) {
            for (Element anchor : document.select("a[title][href]")) {
                if (title.equals(anchor.attr("title"))) {
                    return absolute(anchor, pageUrl);
                }
            }
        }
        for (Element anchor : document.select("a[rel][href]")) {
            for (String rel : anchor.attr("rel").toLowerCase(Locale.ROOT).split("\\s+")) {
                if ("next".equals(rel)) {
                    return absolute(anchor, pageUrl);
                }
            }
        }
        for (Element anchor : document.select("a[href]")) {
            if (NEXT_WORD.matcher(anchor.text().trim().toLowerCase(Locale.ROOT)).find()) {
                return absolute(anchor, pageUrl);
            }
        }
        Integer current = ChapterUrls.chapterNumber(pageUrl);
        if (current != null) {
            Pattern nextHref = Pattern.compile(
                "/chapter[-_](" + (current + 1) + ")(?:\\b|/|$)",
                Pattern.CASE_INSENSITIVE
            );
            for (Element anchor : document.select("a[href]")) {
                if (nextHref.matcher(anchor.attr("href")).find()) {
                    return absolute(anchor, pageUrl);
                }
            }
        }
        return null;
    }

    private String findTitle(Element container, Element article, List<String> paragraphs) {
        Element chapterSpan = container.selectFirst("span.chapter");
        if (chapterSpan != null && !chapterSpan.text().isBlank()) {
            return chapterSpan.text().trim();
        }
        Element heading = container.selectFirst("h1, h2, h3, h4, span");
        if (heading != null && !heading.text().isBlank()) {
            return heading.text().trim();
        }
        if (article != null) {
            Element first = article.selectFirst("p");
            if (first != null && first.text().trim().length() > 5) {
                return shorten(first.text().trim());
            }
        }
        if (!paragraphs.isEmpty() && paragraphs.get(0).length() > 5) {
            return shorten(paragraphs.get(0));
        }
        return UNTITLED;
    }

    private String absolute(Element anchor, String pageUrl) {
        String abs = anchor.absUrl("href");
        if (!abs.isBlank()) {
            return abs;
        }
        return ChapterUrls.resolve(pageUrl, anchor.attr("href"));
    }

    private static String shorten(String text) {
        return text.substring(0, Math.min(60, text.length())) + "...";
    }
}
