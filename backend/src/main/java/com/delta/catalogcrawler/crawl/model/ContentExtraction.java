package com.delta.catalogcrawler.crawl.model;

import java.time.LocalDate;
import java.util.List;

public record ContentExtraction(
    String title,
    String cleanedText,
    List<String> images,
    LocalDate publishedDate,
    String contentHash,
    int wordCount,
    boolean lowQuality
) {
}
