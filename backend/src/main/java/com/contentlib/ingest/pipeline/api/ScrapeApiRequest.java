package com.contentlib.ingest.pipeline.api;

import java.util.List;

public record ScrapeApiRequest(List<String> urls) {
}
