package com.ryuqq.entityservice.adapter.inmemory.bus;

import com.ryuqq.entityservice.core.contract.Command;
import com.ryuqq.entityservice.core.contract.CommandPattern;
import com.ryuqq.entityservice.core.contract.EventMessage;
import com.ryuqq.entityservice.core.contract.InboundMessage;
import com.ryuqq.entityservice.core.contract.ResponseEnvelope;
import com.ryuqq.entityservice.core.model.EventName;
import com.ryuqq.entityservice.core.model.Payload;
import com.ryuqq.entityservice.core.spi.EventPublisher;
import com.ryuqq.entityservice.core.spi.MessageInbox;
import com.ryuqq.entityservice.core.spi.PublishOutcome;

import java.util.ArrayList;
import java.util.List;
import java.util.Queue;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * In-memory implementation of {@link EventPublisher} and {@link MessageInbox} SPIs
 * for testing and reference purposes.
 *
 * <p><strong>Architecture:</strong></p>
 * <ul>
 *   <li><strong>Inbox:</strong> ConcurrentLinkedQueue&lt;InboundMessage&gt; - FIFO commands and events</li>
 *   <li><strong>Pending replies:</strong> ConcurrentHashMap&lt;String, CompletableFuture&gt; - correlationId → requester</li>
 *   <li><strong>Published:</strong> CopyOnWriteArrayList&lt;EventMessage&gt; - every accepted event, in publish order</li>
 * </ul>
 *
 * <p><strong>Features:</strong></p>
 * <ul>
 *   <li>Request/response: {@link #send(Command)} returns a future completed by {@link #reply}</li>
 *   <li>Loopback: published events can be fed back into the inbox so a replica consumes its own events</li>
 *   <li>Failing mode: {@link #setFailing(boolean)} makes every publish return a failed outcome</li>
 * </ul>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * InMemoryMessageBus bus = new InMemoryMessageBus(true);
 *
 * CompletableFuture&lt;ResponseEnvelope&lt;?&gt;&gt; response =
 *     bus.send("create_post", Payload.of("{\"title\":\"t\",\"content\":\"c\",\"authorId\":\"u1\"}"));
 *
 * runtime.pump();                       // polls the command and replies
 * ResponseEnvelope&lt;?&gt; envelope = response.join();
 * </pre>
 *
 * @author Entity Service Team
 * @since 1.0.0
 */
public class InMemoryMessageBus implements EventPublisher, MessageInbox {

    private final Queue<InboundMessage> inbox = new ConcurrentLinkedQueue<>();
    private final ConcurrentHashMap<String, CompletableFuture<ResponseEnvelope<?>>> pendingReplies = new ConcurrentHashMap<>();
    private final List<EventMessage> published = new CopyOnWriteArrayList<>();
    private final boolean loopback;

    private volatile boolean failing;

    /**
     * Creates a bus without loopback.
     */
    public InMemoryMessageBus() {
        this(false);
    }

    /**
     * Creates a bus.
     *
     * @param loopback whether published events are also delivered to this bus's inbox
     */
    public InMemoryMessageBus(boolean loopback) {
        this.loopback = loopback;
    }

    /**
     * Enqueues a command and returns the future reply.
     *
     * @param command the command
     * @return future completed when the command is answered
     * @throws IllegalArgumentException if command is null
     */
    public CompletableFuture<ResponseEnvelope<?>> send(Command command) {
        if (command == null) {
            throw new IllegalArgumentException("command cannot be null");
        }
        String correlationId = UUID.randomUUID().toString();
        CompletableFuture<ResponseEnvelope<?>> reply = new CompletableFuture<>();
        pendingReplies.put(correlationId, reply);
        inbox.add(InboundMessage.ofCommand(correlationId, command));
        return reply;
    }

    /**
     * Enqueues a command given by its wire pattern (e.g. {@code get_posts}).
     *
     * @throws IllegalArgumentException if the pattern cannot be parsed
     */
    public CompletableFuture<ResponseEnvelope<?>> send(String pattern, Payload payload) {
        return send(CommandPattern.parse(pattern, payload));
    }

    /**
     * Enqueues an inbound event.
     *
     * @throws IllegalArgumentException if event is null
     */
    public void emit(EventMessage event) {
        if (event == null) {
            throw new IllegalArgumentException("event cannot be null");
        }
        inbox.add(InboundMessage.ofEvent(event));
    }

    /**
     * {@inheritDoc}
     *
     * <p><strong>Implementation Notes:</strong></p>
     * <ul>
     *   <li>In failing mode nothing is recorded and a failed outcome is returned</li>
     *   <li>Otherwise the event is recorded and, with loopback, enqueued in the inbox</li>
     * </ul>
     */
    @Override
    public PublishOutcome publish(EventName name, Payload payload) {
        if (name == null) {
            throw new IllegalArgumentException("name cannot be null");
        }
        if (payload == null) {
            throw new IllegalArgumentException("payload cannot be null");
        }
        if (failing) {
            return PublishOutcome.failed("bus unavailable");
        }
        EventMessage event = EventMessage.now(name, payload);
        published.add(event);
        if (loopback) {
            inbox.add(InboundMessage.ofEvent(event));
        }
        return PublishOutcome.ok();
    }

    @Override
    public List<InboundMessage> poll(int batchSize) {
        if (batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be positive (current: " + batchSize + ")");
        }
        List<InboundMessage> batch = new ArrayList<>(batchSize);
        for (int i = 0; i < batchSize; i++) {
            InboundMessage message = inbox.poll();
            if (message == null) {
                break;
            }
            batch.add(message);
        }
        return batch;
    }

    @Override
    public void reply(InboundMessage message, ResponseEnvelope<?> response) {
        if (message == null || !message.isCommand()) {
            throw new IllegalArgumentException("message must be a command message");
        }
        if (response == null) {
            throw new IllegalArgumentException("response cannot be null");
        }
        CompletableFuture<ResponseEnvelope<?>> reply = pendingReplies.remove(message.correlationId());
        if (reply != null) {
            reply.complete(response);
        }
    }

    /**
     * Switches failing mode on or off.
     */
    public void setFailing(boolean failing) {
        this.failing = failing;
    }

    /**
     * Events accepted so far, in publish order.
     */
    public List<EventMessage> published() {
        return List.copyOf(published);
    }

    /**
     * Names of accepted events, in publish order.
     */
    public List<String> publishedNames() {
        return published.stream().map(event -> event.name().value()).toList();
    }

    public int queueSize() {
        return inbox.size();
    }

    public int pendingReplyCount() {
        return pendingReplies.size();
    }

    /**
     * Clears the inbox and the published log. Pending requesters are cancelled.
     */
    public void clear() {
        inbox.clear();
        published.clear();
        pendingReplies.values().forEach(reply -> reply.cancel(false));
        pendingReplies.clear();
    }
}
