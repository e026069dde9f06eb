package com.chatmirror.projector;

import com.chatmirror.store.IndexStore;
import com.chatmirror.store.ScoredMember;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Chronological reads over one (platform, channel, sender) partition of the mirror.
 */
public class ChatMirrorQuery {
    private final IndexStore store;

    public ChatMirrorQuery(IndexStore store) {
        this.store = store;
    }

    public record StoredMessage(String messageId, double score, MessageRecord record) {
    }

    public List<StoredMessage> listActive(Platform platform, String channelId, String senderHandle, Instant from, Instant to) {
        return list(platform, ChatKeys.active(platform, channelId, senderHandle), channelId, from, to);
    }

    public List<StoredMessage> listDeleted(Platform platform, String channelId, String senderHandle, Instant from, Instant to) {
        return list(platform, ChatKeys.deleted(platform, channelId, senderHandle), channelId, from, to);
    }

    /**
     * Messages of the index at {@code indexKey} created within [{@code from}, {@code to}], oldest first.
     * A null bound is open.
     */
    private List<StoredMessage> list(Platform platform, String indexKey, String channelId, Instant from, Instant to) {
        double min = from == null ? Double.NEGATIVE_INFINITY : ChatKeys.score(from);
        double max = to == null ? Double.POSITIVE_INFINITY : ChatKeys.score(to);
        List<ScoredMember> members = store.rangeByScore(indexKey, min, max);
        if (members.isEmpty()) {
            return List.of();
        }

        Set<String> recordKeys = new LinkedHashSet<>();
        for (ScoredMember m : members) {
            recordKeys.add(ChatKeys.message(platform, channelId, m.member()));
        }
        Map<String, String> records = store.getAll(recordKeys);

        List<StoredMessage> result = new ArrayList<>(members.size());
        for (ScoredMember m : members) {
            String raw = records.get(ChatKeys.message(platform, channelId, m.member()));
            if (raw == null) {
                throw new DataInconsistencyException("Index " + indexKey + " lists message " + m.member() + " without a record");
            }
            result.add(new StoredMessage(m.member(), m.score(), MessageRecord.decode(raw)));
        }
        return result;
    }
}
