package com.chapterharvest.crawl.model;

import java.util.List;

public record NovelMetadata(
    String title,
    String author,
    List<String> genres,
    String language,
    String status,
    String imageUrl,
    String synopsis,
    String startingUrl
) {
}
