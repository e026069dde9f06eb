package com.chatmirror.backfill;

import com.chatmirror.platform.ChatPlatformClient;
import com.chatmirror.platform.DirectoryResolver;
import com.chatmirror.platform.MessageContent;
import com.chatmirror.platform.MessagePage;
import com.chatmirror.projector.BatchResult;
import com.chatmirror.projector.ChangeType;
import com.chatmirror.projector.ChatEvent;
import com.chatmirror.projector.MessageProjector;
import com.google.common.base.Stopwatch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Copies the full history of a conversation into the mirror.
 *
 * <p>Pages are read with continuation tokens until the platform returns no page or no token. Every
 * {@code bufferPages} non-empty pages the buffered messages go to {@link MessageProjector#applyBatch} in one call.
 * The directory is captured once per run. Any failure aborts the run; batches already flushed stay written and
 * are skipped as existing on a rerun.</p>
 */
public class HistoryBackfillPipeline {
    private static final Logger LOGGER = LoggerFactory.getLogger(HistoryBackfillPipeline.class);

    private final ChatPlatformClient client;
    private final MessageProjector projector;
    private final DirectoryResolver directory;
    private final int bufferPages;

    public HistoryBackfillPipeline(ChatPlatformClient client, MessageProjector projector, DirectoryResolver directory, int bufferPages) {
        if (bufferPages < 1) {
            throw new IllegalArgumentException("bufferPages must be positive, got " + bufferPages);
        }
        this.client = client;
        this.projector = projector;
        this.directory = directory;
        this.bufferPages = bufferPages;
    }

    public BackfillResult backfill(String conversationId) throws IOException {
        if (conversationId == null || conversationId.isBlank()) {
            throw new IllegalArgumentException("conversation id must be a non-empty string");
        }
        final Stopwatch sw = Stopwatch.createStarted();
        DirectoryResolver snapshot = directory.snapshot();

        List<ChatEvent> buffer = new ArrayList<>();
        int bufferedPages = 0;
        int pages = 0;
        int batches = 0;
        int skippedBeforeBatch = 0;
        BatchResult totals = BatchResult.EMPTY;

        String token = null;
        do {
            MessagePage page = client.fetchPage(conversationId, token);
            if (page == null) {
                break;
            }
            pages++;
            token = page.nextToken();
            if (page.isEmpty()) {
                LOGGER.info("page {} of {} has no messages", pages, conversationId);
                continue;
            }

            for (MessageContent message : page.messages()) {
                if (message.system()) {
                    LOGGER.debug("skipping message {}: sent by system", message.messageId());
                    skippedBeforeBatch++;
                } else if (message.deletedUpstream()) {
                    LOGGER.debug("skipping message {}: already deleted", message.messageId());
                    skippedBeforeBatch++;
                } else {
                    buffer.add(message.toEvent(ChangeType.CREATED));
                }
            }
            bufferedPages++;

            if (bufferedPages >= bufferPages) {
                if (!buffer.isEmpty()) {
                    totals = totals.plus(flush(buffer, snapshot));
                    batches++;
                }
                bufferedPages = 0;
            }
        } while (token != null);

        if (!buffer.isEmpty()) {
            totals = totals.plus(flush(buffer, snapshot));
            batches++;
        }
        totals = totals.plusSkipped(skippedBeforeBatch);

        LOGGER.info("backfill of {} on {} completed in {}ms: pages={}, batches={}, processed={}, skipped={}",
                conversationId, client.platform(), sw.elapsed(TimeUnit.MILLISECONDS), pages, batches,
                totals.processed(), totals.skipped());
        return new BackfillResult(conversationId, totals.processed(), totals.skipped(), pages, batches);
    }

    private BatchResult flush(List<ChatEvent> buffer, DirectoryResolver snapshot) {
        BatchResult result = projector.applyBatch(new ArrayList<>(buffer), snapshot);
        buffer.clear();
        return result;
    }
}
