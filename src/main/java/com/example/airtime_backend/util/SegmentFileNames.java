package com.example.airtime_backend.util;

import com.example.airtime_backend.model.Channel;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;

/**
 * Builds the stable storage identity of a segment clip. The path only depends on the channel's
 * provider ids and the segment bounds, so re-running ingest for the same audio yields the same key.
 */
public final class SegmentFileNames {
    private static final DateTimeFormatter DAY = DateTimeFormatter.ofPattern("yyyyMMdd").withZone(ZoneOffset.UTC);
    private static final DateTimeFormatter STAMP = DateTimeFormatter.ofPattern("yyyyMMddHHmmss").withZone(ZoneOffset.UTC);

    private SegmentFileNames() {
    }

    public static String fileName(Channel channel, Instant start, int durationSeconds) {
        return "audio_" + channel.getProjectId() + "_" + channel.getAcrChannelId() + "_"
                + STAMP.format(start) + "_" + durationSeconds + ".mp3";
    }

    public static String filePath(Channel channel, Instant start, int durationSeconds) {
        return "media/" + DAY.format(start) + "/" + fileName(channel, start, durationSeconds);
    }
}
