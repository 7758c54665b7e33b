package com.contentlib.ingest.pipeline.reader;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CreditLedgerTest {

    @Test
    void refusesPaidCallsOnceTheLimitIsReached() {
        CreditLedger ledger = new CreditLedger(3, 2);
        ledger.ensureAvailable("jina", 1);
        ledger.record("jina", 1);
        ledger.record("firecrawl", 2);

        assertThatThrownBy(() -> ledger.ensureAvailable("jina", 1))
            .isInstanceOfSatisfying(ReaderException.class,
                e -> assertThat(e.getCode()).isEqualTo(ReaderErrorCode.CREDITS_EXHAUSTED));
        ledger.ensureAvailable("direct", 0);
        assertThat(ledger.snapshot().used()).isEqualTo(3);
        assertThat(ledger.snapshot().remaining()).isZero();
    }

    @Test
    void freeCallsAreNotRecorded() {
        CreditLedger ledger = new CreditLedger(10, 8);
        ledger.record("direct", 0);

        assertThat(ledger.snapshot().used()).isZero();
        assertThat(ledger.snapshot().warningThreshold()).isEqualTo(8);
    }
}
