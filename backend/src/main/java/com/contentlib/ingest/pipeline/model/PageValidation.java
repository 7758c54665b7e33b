package com.contentlib.ingest.pipeline.model;

import java.time.LocalDate;
import java.util.Set;

public record PageValidation(
    boolean isArticle,
    Set<String> schemaTypes,
    LocalDate publishedDate,
    String title,
    int wordCount,
    String reason
) {
}
