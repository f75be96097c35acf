package io.autotrade.service.candle;

/**
 * Successful outcome of a bar ingestion.
 */
public enum IngestResult {
    /** The key was free and the bar is now stored. */
    INSERTED,
    /** An identical bar was already stored; nothing changed. */
    UNCHANGED
}
