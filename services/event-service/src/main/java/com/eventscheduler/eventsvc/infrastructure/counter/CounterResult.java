package com.eventscheduler.eventsvc.infrastructure.counter;

/**
 * Outcome of a check-and-increment: whether the call was admitted and the counter value after it.
 */
public record CounterResult(boolean admitted, long count) {

    public static CounterResult admitted(long count) {
        return new CounterResult(true, count);
    }

    public static CounterResult rejected(long count) {
        return new CounterResult(false, count);
    }
}
