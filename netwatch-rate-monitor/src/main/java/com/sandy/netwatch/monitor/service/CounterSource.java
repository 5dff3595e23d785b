package com.sandy.netwatch.monitor.service;

/**
 * Pull interface to the capture side: the count observed for a key since the previous read.
 */
public interface CounterSource {

    /** Announces a key that will be polled. */
    default void register(String key) {
    }

    double read(String key) throws CounterUnavailableException;
}
