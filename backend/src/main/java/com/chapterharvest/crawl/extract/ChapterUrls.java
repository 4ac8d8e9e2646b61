package com.chapterharvest.crawl.extract;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public final class ChapterUrls {
    private static final Pattern CHAPTER_NUMBER = Pattern.compile("(/chapter[-_])(\\d+)", Pattern.CASE_INSENSITIVE);

    private ChapterUrls() {
    }

    /**
     * Trailing chapter number of a {@code .../chapter-N} URL, or {@code null}.
     */
    public static Integer chapterNumber(String url) {
        if (url == null) {
            return null;
        }
        Matcher matcher = CHAPTER_NUMBER.matcher(url);
        Integer found = null;
        while (matcher.find()) {
            try {
                found = Integer.parseInt(matcher.group(2));
            } catch (NumberFormatException e) {
                found = null;
            }
        }
        return found;
    }

    /**
     * {@code .../chapter-N} becomes {@code .../chapter-(N+1)}; {@code null} when the URL has no such pattern.
     */
    public static String guessNextUrl(String url) {
        if (url == null) {
            return null;
        }
        Matcher matcher = CHAPTER_NUMBER.matcher(url);
        int start = -1;
        int end = -1;
        String prefix = null;
        String digits = null;
        while (matcher.find()) {
            start = matcher.start();
            end = matcher.end();
            prefix = matcher.group(1);
            digits = matcher.group(2);
        }
        if (digits == null) {
            return null;
        }
        long next;
        try {
            next = Long.parseLong(digits) + 1;
        } catch (NumberFormatException e) {
            return null;
        }
        return url.substring(0, start) + prefix + next + url.substring(end);
    }

    public static String resolve(String base, String href) {
        if (href == null || href.isBlank()) {
            return null;
        }
        try {
            URI target = new URI(href.trim());
            if (target.isAbsolute() || base == null || base.isBlank()) {
                return target.toString();
            }
            return new URI(base.trim()).resolve(target).toString();
        } catch (URISyntaxException | IllegalArgumentException e) {
            return null;
        }
    }
}
