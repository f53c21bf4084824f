package xyz.firestige.netdeploy.domain.shared.event;

import java.time.Instant;
import java.util.UUID;

public abstract class DomainEvent {
    private final String eventId;
    private final Instant timestamp;
    private String message;

    protected DomainEvent() {
        this(UUID.randomUUID().toString(), Instant.now(), "");
    }

    protected DomainEvent(String eventId, Instant timestamp, String message) {
        this.eventId = eventId;
        this.timestamp = timestamp;
        this.message = message;
    }

    public String getEventName() {
        return this.getClass().getSimpleName();
    }

    public String getEventId() {
        return eventId;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public void setMessage(String message) {
        this.message = message;
    }

    public String getMessage() {
        return message;
    }
}
