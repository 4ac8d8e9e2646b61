package com.chapterharvest.crawl.extract;

import com.chapterharvest.crawl.model.NovelMetadata;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Reads a novel landing page: visible selectors first, then {@code og:} meta tags.
 */
@Component
public class NovelMetadataExtractor {

    public NovelMetadata extract(String html, String pageUrl) {
        Document document = pageUrl == null ? Jsoup.parse(html == null ? "" : html) : Jsoup.parse(html == null ? "" : html, pageUrl);

        String title = firstNonBlank(
            selectText(document, "h1.tit"),
            meta(document, "og:novel:novel_name"),
            meta(document, "og:title"),
            "Unknown Title"
        );
        String author = firstNonBlank(
            selectText(document, ".glyphicon-user + .right a"),
            meta(document, "og:novel:author"),
            "Unknown"
        );
        List<String> genres = new ArrayList<>();
        for (Element genre : document.select(".glyphicon-th-list + .right a")) {
            if (!genre.text().isBlank()) {
                genres.add(genre.text().trim());
            }
        }
        if (genres.isEmpty()) {
            String metaGenres = meta(document, "og:novel:genre");
            if (metaGenres != null) {
                for (String genre : metaGenres.split(",")) {
                    if (!genre.isBlank()) {
                        genres.add(genre.trim());
                    }
                }
            }
        }
        String language = firstNonBlank(
            selectText(document, ".glyphicon-globe + .right a"),
            meta(document, "og:novel:category"),
            "Unknown"
        );
        String status = firstNonBlank(
            selectText(document, ".glyphicon-time + .right"),
            meta(document, "og:novel:status"),
            ""
        );

        String imageUrl = meta(document, "og:image");
        if (imageUrl == null) {
            Element image = document.selectFirst(".m-book1 img");
            if (image != null && !image.attr("src").isBlank()) {
                imageUrl = absolute(image, "src", pageUrl);
            }
        }

        List<String> synopsisParts = new ArrayList<>();
        for (Element paragraph : document.select(".m-desc .txt .inner p")) {
            synopsisParts.add(paragraph.text().trim());
        }
        String synopsis = String.join(" ", synopsisParts).trim();
        if (synopsis.isEmpty()) {
            synopsis = firstNonBlank(meta(document, "og:description"), "");
        }

        String startingUrl = findReadFirstUrl(document, title, pageUrl);
        if (startingUrl == null) {
            throw new NovelMetadataException("Failed to locate 'Read first' chapter URL on " + pageUrl);
        }
        return new NovelMetadata(title, author, List.copyOf(genres), language, status, imageUrl, synopsis, startingUrl);
    }

    private String findReadFirstUrl(Document document, String title, String pageUrl) {
        String fromMeta = meta(document, "og:novel:read_url");
        if (fromMeta != null) {
            return ChapterUrls.resolve(pageUrl, fromMeta);
        }
        for (Element anchor : document.select("a[href]")) {
            String text = anchor.text().trim().toLowerCase(Locale.ROOT);
            if (text.contains("read") && text.contains("first")) {
                return absolute(anchor, "href", pageUrl);
            }
        }
        Pattern byTitle = Pattern.compile("^read\\s+" + Pattern.quote(title) + "\\s+online\\s+free", Pattern.CASE_INSENSITIVE);
        for (Element anchor : document.select("a[href][title]")) {
            if (byTitle.matcher(anchor.attr("title")).find()) {
                return absolute(anchor, "href", pageUrl);
            }
        }
        return null;
    }

    private String selectText(Document document, String selector) {
        Element element = document.selectFirst(selector);
        if (element == null) {
            return null;
        }
        String text = element.text().trim();
        return text.isEmpty() ? null : text;
    }

    private String meta(Document document, String property) {
        Element tag = document.selectFirst("meta[property=\"" + property + "\"]");
        if (tag == null) {
            return null;
        }
        String content = tag.attr("content").trim();
        return content.isEmpty() ? null : content;
    }

    private String absolute(Element element, String attribute, String pageUrl) {
        String abs = element.absUrl(attribute);
        if (!abs.isBlank()) {
            return abs;
        }
        return ChapterUrls.resolve(pageUrl, element.attr(attribute));
    }

    private static String firstNonBlank(String... values) {
        for (String value : values) {
            if (value != null && !value.isBlank()) {
                return value;
            }
        }
        return values.length == 0 ? null : values[values.length - 1];
    }
}
