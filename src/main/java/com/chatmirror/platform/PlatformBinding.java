package com.chatmirror.platform;

import com.chatmirror.backfill.HistoryBackfillPipeline;
import com.chatmirror.projector.MessageProjector;
import com.chatmirror.projector.Platform;

/**
 * Everything wired for one chat platform: its API client, directory, projector, live-event handler and
 * backfill pipeline.
 */
public record PlatformBinding(Platform platform,
                              ChatPlatformClient client,
                              DirectoryResolver directory,
                              MessageProjector projector,
                              ChangeEventHandler handler,
                              HistoryBackfillPipeline backfill) {

    public static PlatformBinding create(ChatPlatformClient client, DirectoryResolver directory,
                                        MessageProjector projector, int bufferPages) {
        return new PlatformBinding(client.platform(), client, directory, projector,
                new ChangeEventHandler(client, projector),
                new HistoryBackfillPipeline(client, projector, directory, bufferPages));
    }
}
