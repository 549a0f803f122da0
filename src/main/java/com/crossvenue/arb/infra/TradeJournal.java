package com.crossvenue.arb.infra;

/**
 * Append-only audit trail. Never read back during live operation.
 */
public interface TradeJournal {

    void append(JournalRecord record);

    static TradeJournal noop() {
        return record -> {
        };
    }
}
