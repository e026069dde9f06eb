package com.chatmirror.projector;

import io.vertx.core.json.DecodeException;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Stored state of one mirrored message. Text revisions are only ever appended.
 */
public class MessageRecord {
    private final String sender;
    private final String conversationId;
    private final List<TextRevision> text;
    private final List<String> attachments;
    private String replyTo;
    private boolean deleted;

    public MessageRecord(String sender, String conversationId, List<TextRevision> text,
                         List<String> attachments, String replyTo, boolean deleted) {
        this.sender = sender;
        this.conversationId = conversationId;
        this.text = new ArrayList<>(text);
        this.attachments = new ArrayList<>(attachments);
        this.replyTo = replyTo;
        this.deleted = deleted;
    }

    public static MessageRecord created(String sender, String conversationId, TextRevision firstRevision,
                                        Collection<String> attachments, String replyTo) {
        MessageRecord record = new MessageRecord(sender, conversationId, List.of(firstRevision), List.of(), replyTo, false);
        record.mergeAttachments(attachments);
        return record;
    }

    public String getSender() {
        return sender;
    }

    public String getConversationId() {
        return conversationId;
    }

    public List<TextRevision> getText() {
        return Collections.unmodifiableList(text);
    }

    public TextRevision currentText() {
        return text.isEmpty() ? null : text.get(text.size() - 1);
    }

    public List<String> getAttachments() {
        return Collections.unmodifiableList(attachments);
    }

    public String getReplyTo() {
        return replyTo;
    }

    public boolean isDeleted() {
        return deleted;
    }

    public void setDeleted(boolean deleted) {
        this.deleted = deleted;
    }

    /**
     * Appends {@code revision} unless it repeats the current one.
     * @return true when the history grew
     */
    public boolean appendRevision(TextRevision revision) {
        if (revision.equals(currentText())) {
            return false;
        }
        text.add(revision);
        return true;
    }

    /**
     * @return true when at least one new reference was added
     */
    public boolean mergeAttachments(Collection<String> references) {
        boolean added = false;
        if (references == null) {
            return false;
        }
        for (String ref : references) {
            if (ref != null && !attachments.contains(ref)) {
                attachments.add(ref);
                added = true;
            }
        }
        return added;
    }

    /**
     * A null {@code newReplyTo} keeps the current value.
     */
    public boolean updateReplyTo(String newReplyTo) {
        if (newReplyTo == null || Objects.equals(newReplyTo, replyTo)) {
            return false;
        }
        replyTo = newReplyTo;
        return true;
    }

    public JsonObject toJson() {
        JsonArray revisions = new JsonArray();
        text.forEach(r -> revisions.add(r.toJson()));
        return new JsonObject()
                .put("sender", sender)
                .put("conversation_id", conversationId)
                .put("text", revisions)
                .put("attachment", new JsonArray(new ArrayList<>(attachments)))
                .put("reply_to", replyTo)
                .put("is_deleted", deleted);
    }

    public String encode() {
        return toJson().encode();
    }

    /**
     * @throws DataInconsistencyException when the stored value is not a message record
     */
    public static MessageRecord decode(String raw) {
        JsonObject json;
        try {
            json = new JsonObject(raw);
        } catch (DecodeException e) {
            throw new DataInconsistencyException("Stored message record is not valid JSON: " + e.getMessage());
        }
        return fromJson(json);
    }

    public static MessageRecord fromJson(JsonObject json) {
        List<TextRevision> revisions = new ArrayList<>();
        JsonArray text = json.getJsonArray("text", new JsonArray());
        for (int i = 0; i < text.size(); i++) {
            revisions.add(TextRevision.fromJson(text.getJsonObject(i)));
        }
        List<String> attachments = new ArrayList<>();
        JsonArray refs = json.getJsonArray("attachment", new JsonArray());
        for (int i = 0; i < refs.size(); i++) {
            attachments.add(refs.getString(i));
        }
        return new MessageRecord(json.getString("sender"), json.getString("conversation_id"), revisions,
                attachments, json.getString("reply_to"), json.getBoolean("is_deleted", false));
    }
}
