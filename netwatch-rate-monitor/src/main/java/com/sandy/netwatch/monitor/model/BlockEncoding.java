package com.sandy.netwatch.monitor.model;

public enum BlockEncoding {
    RAW,
    COMPRESSED,
    /** Written by the previous text-list storage format; read-only. */
    LEGACY
}
