package com.ryuqq.entityservice.testkit.contract;

import com.ryuqq.entityservice.core.model.EventName;
import com.ryuqq.entityservice.core.model.Payload;
import com.ryuqq.entityservice.core.spi.EventPublisher;
import com.ryuqq.entityservice.core.spi.PublishOutcome;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Fake {@link EventPublisher} that records every publish attempt.
 *
 * <p><strong>Modes:</strong></p>
 * <ul>
 *   <li>{@link Mode#DELIVER}: records the event and returns {@link PublishOutcome#ok()}</li>
 *   <li>{@link Mode#FAIL}: records the attempt and returns a failed outcome</li>
 *   <li>{@link Mode#THROW}: records the attempt and throws {@link IllegalStateException}</li>
 * </ul>
 *
 * <p>{@link #attempts()} holds every call; {@link #delivered()} only the accepted ones.</p>
 *
 * @author Entity Service Team
 * @since 1.0.0
 */
public class RecordingEventPublisher implements EventPublisher {

    /**
     * Publish behavior.
     */
    public enum Mode {
        DELIVER,
        FAIL,
        THROW
    }

    /**
     * One publish call.
     *
     * @param name event name
     * @param payload event body
     * @param delivered whether it was accepted
     */
    public record Published(EventName name, Payload payload, boolean delivered) {
    }

    private final List<Published> attempts = new CopyOnWriteArrayList<>();
    private volatile Mode mode = Mode.DELIVER;

    @Override
    public PublishOutcome publish(EventName name, Payload payload) {
        if (name == null) {
            throw new IllegalArgumentException("name cannot be null");
        }
        if (payload == null) {
            throw new IllegalArgumentException("payload cannot be null");
        }
        Mode current = mode;
        attempts.add(new Published(name, payload, current == Mode.DELIVER));
        switch (current) {
            case FAIL:
                return PublishOutcome.failed("publisher in FAIL mode");
            case THROW:
                throw new IllegalStateException("publisher in THROW mode");
            default:
                return PublishOutcome.ok();
        }
    }

    public void setMode(Mode mode) {
        if (mode == null) {
            throw new IllegalArgumentException("mode cannot be null");
        }
        this.mode = mode;
    }

    public List<Published> attempts() {
        return List.copyOf(attempts);
    }

    public List<Published> delivered() {
        return attempts.stream().filter(Published::delivered).toList();
    }

    /**
     * Wire names of delivered events, in order.
     */
    public List<String> deliveredNames() {
        return attempts.stream().filter(Published::delivered).map(p -> p.name().value()).toList();
    }

    public void clear() {
        attempts.clear();
        mode = Mode.DELIVER;
    }
}
