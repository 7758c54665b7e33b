package com.contentlib.ingest.pipeline.dedup;

import com.contentlib.ingest.pipeline.model.CheckedUrl;
import com.contentlib.ingest.pipeline.model.DiscoveredUrl;
import com.contentlib.ingest.pipeline.model.DuplicateCheckResult;
import com.contentlib.ingest.pipeline.model.ExistingFingerprint;
import com.contentlib.ingest.pipeline.persistence.FingerprintJdbcRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

@Service
public class DuplicateChecker {
    private static final Logger log = LoggerFactory.getLogger(DuplicateChecker.class);

    private final FingerprintJdbcRepository repository;

    public DuplicateChecker(FingerprintJdbcRepository repository) {
        this.repository = repository;
    }

    public DuplicateCheckResult checkForDuplicates(List<DiscoveredUrl> candidates, String scope) {
        if (candidates.isEmpty()) {
            return new DuplicateCheckResult(List.of(), List.of(), List.of(), new DuplicateCheckResult.Stats(0, 0, 0));
        }
        List<String> urls = new ArrayList<>(candidates.size());
        for (DiscoveredUrl candidate : candidates) {
            urls.add(candidate.url());
        }
        Map<String, String> existingIds = new HashMap<>();
        for (ExistingFingerprint fingerprint : repository.findExistingByUrls(scope, urls)) {
            existingIds.putIfAbsent(fingerprint.sourceUrl(), fingerprint.id());
        }

        List<CheckedUrl> all = new ArrayList<>(candidates.size());
        List<CheckedUrl> fresh = new ArrayList<>();
        List<CheckedUrl> duplicates = new ArrayList<>();
        for (DiscoveredUrl candidate : candidates) {
            CheckedUrl checked = CheckedUrl.of(candidate, existingIds.get(candidate.url()));
            all.add(checked);
            if (checked.isDuplicate()) {
                duplicates.add(checked);
            } else {
                fresh.add(checked);
            }
        }
        log.info("duplicate check scope={} total={} new={} duplicates={}", scope, all.size(), fresh.size(), duplicates.size());
        return new DuplicateCheckResult(
            all,
            fresh,
            duplicates,
            new DuplicateCheckResult.Stats(all.size(), fresh.size(), duplicates.size())
        );
    }
}
