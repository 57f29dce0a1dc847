package com.eventscheduler.eventsvc.shared.exception;

public final class EventNotFoundException extends EventServiceException {

    private final String slug;

    public EventNotFoundException(String slug) {
        super("Event not found: " + slug);
        this.slug = slug;
    }

    public String getSlug() {
        return slug;
    }

    @Override
    public String getErrorCode() {
        return "EVENT_NOT_FOUND";
    }

    @Override
    public int getHttpStatus() {
        return 404;
    }
}
