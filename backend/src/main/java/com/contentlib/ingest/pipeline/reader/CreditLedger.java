package com.contentlib.ingest.pipeline.reader;

import com.contentlib.ingest.config.IngestProperties;
import com.contentlib.ingest.pipeline.model.CreditInfo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class CreditLedger {
    private static final Logger log = LoggerFactory.getLogger(CreditLedger.class);

    private final int limit;
    private final int warningThreshold;
    private int used;
    private boolean warned;

    public CreditLedger(IngestProperties.Credits credits) {
        this(credits.getLimit(), credits.getWarningThreshold());
    }

    public CreditLedger(int limit, int warningThreshold) {
        this.limit = Math.max(0, limit);
        this.warningThreshold = Math.min(this.limit, Math.max(0, warningThreshold));
    }

    public synchronized void ensureAvailable(String provider, int cost) {
        if (cost > 0 && used >= limit) {
            throw new ReaderException(
                ReaderErrorCode.CREDITS_EXHAUSTED,
                0,
                provider,
                "credit limit reached used=" + used + " limit=" + limit
            );
        }
    }

    public synchronized void record(String provider, int cost) {
        if (cost <= 0) {
            return;
        }
        used += cost;
        if (!warned && used >= warningThreshold) {
            warned = true;
            log.warn("reader credits running low provider={} used={} limit={}", provider, used, limit);
        }
    }

    public synchronized CreditInfo snapshot() {
        return new CreditInfo(used, limit, warningThreshold);
    }
}
