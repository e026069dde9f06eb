package com.chatmirror.platform;

import com.chatmirror.projector.InvalidEventException;
import com.chatmirror.projector.Platform;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Decodes the resource path of a change notification into the channel and message it names.
 */
public interface ResourceDecoder {

    /**
     * @throws InvalidEventException when the resource does not name a message
     */
    MessageRef decode(String resource);

    static ResourceDecoder forPlatform(Platform platform) {
        switch (platform) {
            case MICROSOFT:
                return new PatternDecoder(Pattern.compile("chats\\('(.+?)'\\)/messages\\('(.+?)'\\)"), platform);
            case GOOGLE:
                return new PatternDecoder(Pattern.compile("spaces/([^/]+)/messages/([^/]+)"), platform);
            default:
                throw new IllegalArgumentException("No resource decoder for " + platform);
        }
    }

    final class PatternDecoder implements ResourceDecoder {
        private final Pattern pattern;
        private final Platform platform;

        PatternDecoder(Pattern pattern, Platform platform) {
            this.pattern = pattern;
            this.platform = platform;
        }

        @Override
        public MessageRef decode(String resource) {
            if (resource == null || resource.isBlank()) {
                throw new InvalidEventException("Notification resource is empty");
            }
            Matcher m = pattern.matcher(resource.trim());
            if (!m.find()) {
                throw new InvalidEventException("Unrecognized " + platform + " resource: " + resource);
            }
            return new MessageRef(m.group(1), m.group(2));
        }
    }
}
