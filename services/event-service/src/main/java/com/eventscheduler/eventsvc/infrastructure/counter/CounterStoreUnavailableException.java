package com.eventscheduler.eventsvc.infrastructure.counter;

public class CounterStoreUnavailableException extends RuntimeException {

    public CounterStoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
