package com.sandy.netwatch.monitor.model;

public enum AppendResult {
    /** In memory and persisted. */
    STORED,
    /** In memory only; the backing store write failed after retries. */
    BUFFERED,
    /** Not strictly newer than the latest sample of the key. */
    REJECTED
}
