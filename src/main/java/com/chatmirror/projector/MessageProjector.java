package com.chatmirror.projector;

import com.chatmirror.platform.DirectoryResolver;
import com.chatmirror.store.IndexStore;
import com.chatmirror.store.StorePipeline;
import com.chatmirror.store.StoreUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Projects chat change events onto the mirror held in an {@link IndexStore}.
 *
 * <p>Per message id the states are absent, active and deleted. Every event turns into at most one
 * {@link StorePipeline}, executed atomically, so a failure never leaves a record and its index entries
 * out of step. The projector holds no mutable state and may be shared across pull loops.</p>
 */
public class MessageProjector {
    private static final Logger LOGGER = LoggerFactory.getLogger(MessageProjector.class);

    private final Platform platform;
    private final IndexStore store;
    private final DirectoryResolver directory;
    private final UpdateAfterDeletePolicy updateAfterDelete;
    private final ProjectionMetrics metrics;

    public MessageProjector(Platform platform, IndexStore store, DirectoryResolver directory) {
        this(platform, store, directory, platform.defaultPolicy());
    }

    public MessageProjector(Platform platform, IndexStore store, DirectoryResolver directory,
                            UpdateAfterDeletePolicy updateAfterDelete) {
        this.platform = platform;
        this.store = store;
        this.directory = directory;
        this.updateAfterDelete = updateAfterDelete;
        this.metrics = new ProjectionMetrics(platform);
    }

    public Platform getPlatform() {
        return platform;
    }

    public UpdateAfterDeletePolicy getUpdateAfterDeletePolicy() {
        return updateAfterDelete;
    }

    /**
     * Applies a single event.
     *
     * @throws InvalidEventException      if required fields are missing
     * @throws DataInconsistencyException if the event contradicts the stored state
     * @throws StoreUnavailableException  if the store cannot be read or the pipeline cannot be executed
     */
    public void apply(ChatEvent event) {
        if (event == null || event.changeType() == null) {
            throw new InvalidEventException("Event and its change type are required");
        }
        try {
            boolean written;
            switch (event.changeType()) {
                case CREATED:
                    written = applyCreated(event);
                    break;
                case UPDATED:
                    written = applyUpdated(event);
                    break;
                case DELETED:
                    written = applyDeleted(event);
                    break;
                default:
                    throw new InvalidEventException("Unsupported change type: " + event.changeType());
            }
            if (written) {
                metrics.recordApplied(event.changeType(), 1);
            } else {
                metrics.recordSkipped(1);
            }
        } catch (InvalidEventException e) {
            metrics.recordSkipped(1);
            throw e;
        } catch (RuntimeException e) {
            metrics.recordFailed();
            throw e;
        }
    }

    /**
     * Bulk-creates messages, resolving senders with the projector's own directory.
     *
     * @see #applyBatch(List, DirectoryResolver)
     */
    public BatchResult applyBatch(List<ChatEvent> events) {
        return applyBatch(events, directory);
    }

    /**
     * Queues every creation in {@code events} into one pipeline and executes it once.
     *
     * <p>Invalid events, senders outside the directory, ids already stored and ids repeated within the batch
     * are skipped and counted. Nothing is rolled back across the batch: a pipeline failure is reported as a
     * single {@link StoreUnavailableException} and the caller retries the whole batch.</p>
     *
     * @throws IllegalArgumentException if any event is not a creation
     */
    public BatchResult applyBatch(List<ChatEvent> events, DirectoryResolver resolver) {
        for (ChatEvent event : events) {
            if (event == null || event.changeType() != ChangeType.CREATED) {
                throw new IllegalArgumentException("applyBatch only accepts created events, got "
                        + (event == null ? "null" : event.changeType()));
            }
        }

        int skipped = 0;
        List<PendingCreate> pending = new ArrayList<>();
        Set<String> seenKeys = new HashSet<>();
        for (ChatEvent event : events) {
            try {
                validateCreated(event);
            } catch (InvalidEventException e) {
                LOGGER.warn("skipping invalid event in batch: {}", e.getMessage());
                skipped++;
                continue;
            }
            String handle = resolver.resolveHandle(event.senderId());
            if (handle == null) {
                LOGGER.info("skipping message {}: sender {} is not in the directory", event.messageId(), event.senderId());
                skipped++;
                continue;
            }
            String recordKey = ChatKeys.message(platform, event.channelId(), event.messageId());
            if (!seenKeys.add(recordKey)) {
                LOGGER.debug("skipping repeated message {} within batch", event.messageId());
                skipped++;
                continue;
            }
            pending.add(new PendingCreate(event, handle, recordKey));
        }

        int processed = 0;
        if (!pending.isEmpty()) {
            Map<String, String> existing = store.getAll(seenKeys);
            StorePipeline pipeline = new StorePipeline();
            for (PendingCreate p : pending) {
                if (existing.containsKey(p.recordKey)) {
                    skipped++;
                    continue;
                }
                queueCreate(pipeline, p.event, p.handle, p.recordKey);
                processed++;
            }
            if (!pipeline.isEmpty()) {
                try {
                    store.execute(pipeline);
                } catch (RuntimeException e) {
                    metrics.recordFailed();
                    throw e;
                }
            }
        }

        metrics.recordApplied(ChangeType.CREATED, processed);
        metrics.recordSkipped(skipped);
        LOGGER.info("batch of {} events on {}: processed={}, skipped={}", events.size(), platform, processed, skipped);
        return new BatchResult(processed, skipped);
    }

    private boolean applyCreated(ChatEvent event) {
        validateCreated(event);
        String handle = directory.resolveHandle(event.senderId());
        if (handle == null) {
            LOGGER.info("skipping message {}: sender {} is not in the directory", event.messageId(), event.senderId());
            return false;
        }
        String recordKey = ChatKeys.message(platform, event.channelId(), event.messageId());
        if (store.get(recordKey) != null) {
            LOGGER.debug("message {} already stored, ignoring repeated create", event.messageId());
            return false;
        }
        StorePipeline pipeline = new StorePipeline();
        queueCreate(pipeline, event, handle, recordKey);
        store.execute(pipeline);
        LOGGER.debug("created message {} for {} in channel {}", event.messageId(), handle, event.channelId());
        return true;
    }

    private void queueCreate(StorePipeline pipeline, ChatEvent event, String handle, String recordKey) {
        MessageRecord record = MessageRecord.created(handle, event.conversationId(),
                TextRevision.of(event.text(), event.createdAt()), event.attachments(), event.replyTo());
        pipeline.zadd(ChatKeys.active(platform, event.channelId(), handle), event.messageId(), ChatKeys.score(event.createdAt()))
                .set(recordKey, record.encode());
    }

    private boolean applyUpdated(ChatEvent event) {
        requireIds(event);
        Instant revisedAt = event.modifiedAt() != null ? event.modifiedAt() : event.createdAt();
        if (revisedAt == null) {
            throw new InvalidEventException("Updated event for message " + event.messageId() + " carries no timestamp");
        }

        if (isExternalSender(event)) {
            return false;
        }

        String recordKey = ChatKeys.message(platform, event.channelId(), event.messageId());
        MessageRecord record = loadExisting(recordKey, event);

        boolean changed = record.appendRevision(TextRevision.of(event.text(), revisedAt));
        changed |= record.mergeAttachments(event.attachments());
        changed |= record.updateReplyTo(event.replyTo());

        StorePipeline pipeline = new StorePipeline();
        if (record.isDeleted() && updateAfterDelete == UpdateAfterDeletePolicy.UNDO) {
            String deletedKey = ChatKeys.deleted(platform, event.channelId(), record.getSender());
            Double score = store.score(deletedKey, event.messageId());
            if (score == null) {
                throw new DataInconsistencyException("Message " + event.messageId()
                        + " is marked deleted but missing from " + deletedKey);
            }
            record.setDeleted(false);
            pipeline.zrem(deletedKey, event.messageId())
                    .zadd(ChatKeys.active(platform, event.channelId(), record.getSender()), event.messageId(), score);
            LOGGER.info("undoing deletion of message {} on update", event.messageId());
        } else if (record.isDeleted()) {
            LOGGER.warn("update to deleted message {} recorded, message stays deleted", event.messageId());
        }

        if (!changed && pipeline.isEmpty()) {
            LOGGER.debug("update to message {} changes nothing", event.messageId());
            return false;
        }
        pipeline.set(recordKey, record.encode());
        store.execute(pipeline);
        return true;
    }

    private boolean applyDeleted(ChatEvent event) {
        requireIds(event);
        if (isExternalSender(event)) {
            return false;
        }
        String recordKey = ChatKeys.message(platform, event.channelId(), event.messageId());
        MessageRecord record = loadExisting(recordKey, event);
        if (record.isDeleted()) {
            LOGGER.debug("message {} already deleted", event.messageId());
            return false;
        }

        String activeKey = ChatKeys.active(platform, event.channelId(), record.getSender());
        Double score = store.score(activeKey, event.messageId());
        if (score == null) {
            throw new DataInconsistencyException("Message " + event.messageId() + " is not in " + activeKey);
        }
        record.setDeleted(true);
        store.execute(new StorePipeline()
                .zrem(activeKey, event.messageId())
                .zadd(ChatKeys.deleted(platform, event.channelId(), record.getSender()), event.messageId(), score)
                .set(recordKey, record.encode()));
        LOGGER.debug("deleted message {} keeping score {}", event.messageId(), score);
        return true;
    }

    /**
     * True when the event names a sender the directory cannot resolve. Their creations were never stored,
     * so later changes to those messages have nothing to apply to.
     */
    private boolean isExternalSender(ChatEvent event) {
        if (event.senderId() == null || directory.resolveHandle(event.senderId()) != null) {
            return false;
        }
        LOGGER.info("skipping {} of message {}: sender {} is not in the directory",
                event.changeType().wireName(), event.messageId(), event.senderId());
        return true;
    }

    private MessageRecord loadExisting(String recordKey, ChatEvent event) {
        String raw = store.get(recordKey);
        if (raw == null) {
            throw new DataInconsistencyException("No stored record for message " + event.messageId()
                    + " in channel " + event.channelId() + " on " + event.changeType().wireName() + " event");
        }
        return MessageRecord.decode(raw);
    }

    private static void validateCreated(ChatEvent event) {
        requireIds(event);
        if (isBlank(event.conversationId())) {
            throw new InvalidEventException("Created event for message " + event.messageId() + " has no conversation id");
        }
        if (event.createdAt() == null) {
            throw new InvalidEventException("Created event for message " + event.messageId() + " has no creation time");
        }
    }

    private static void requireIds(ChatEvent event) {
        if (isBlank(event.messageId())) {
            throw new InvalidEventException("Event has no message id");
        }
        if (isBlank(event.channelId())) {
            throw new InvalidEventException("Event for message " + event.messageId() + " has no channel id");
        }
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }

    private record PendingCreate(ChatEvent event, String handle, String recordKey) {
    }
}
