package com.contentlib.ingest.pipeline.model;

public enum DiscoveryMethod {
    SITEMAP("sitemap"),
    RSS("rss"),
    MAP("map"),
    PAGINATION("pagination"),
    NONE("none");

    private final String code;

    DiscoveryMethod(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }
}
