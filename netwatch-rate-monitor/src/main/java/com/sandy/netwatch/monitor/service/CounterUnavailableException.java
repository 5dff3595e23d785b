package com.sandy.netwatch.monitor.service;

public class CounterUnavailableException extends Exception {

    public CounterUnavailableException(String message) {
        super(message);
    }
}
