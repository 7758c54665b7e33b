package com.contentlib.ingest.pipeline.persistence;

import com.contentlib.ingest.pipeline.model.ExistingFingerprint;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;

@Repository
public class FingerprintJdbcRepository {
    private static final int BATCH_SIZE = 1000;

    private final NamedParameterJdbcTemplate jdbc;

    public FingerprintJdbcRepository(NamedParameterJdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    public List<ExistingFingerprint> findExistingByUrls(String scope, Collection<String> urls) {
        List<ExistingFingerprint> found = new ArrayList<>();
        if (urls == null || urls.isEmpty()) {
            return found;
        }
        List<String> distinct = new ArrayList<>(new LinkedHashSet<>(urls));
        for (int i = 0; i < distinct.size(); i += BATCH_SIZE) {
            List<String> slice = distinct.subList(i, Math.min(distinct.size(), i + BATCH_SIZE));
            MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("scope", scope)
                .addValue("urls", slice);
            found.addAll(jdbc.query(
                """
                    SELECT id, scope, source_url
                    FROM content_fingerprints
                    WHERE scope = :scope
                      AND source_url IN (:urls)
                    """,
                params,
                (rs, rowNum) -> new ExistingFingerprint(
                    rs.getString("id"),
                    rs.getString("scope"),
                    rs.getString("source_url")
                )
            ));
        }
        return found;
    }
}
