package com.example.airtime_backend.model;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

class SegmentEditLogTest {

    @Test
    void sourceKeyIgnoresInputOrder() {
        UUID a = UUID.fromString("00000000-0000-0000-0000-000000000001");
        UUID b = UUID.fromString("00000000-0000-0000-0000-000000000002");

        assertThat(SegmentEditLog.sourceKey(List.of(b, a))).isEqualTo(SegmentEditLog.sourceKey(List.of(a, b)));
        assertThat(SegmentEditLog.sourceKey(List.of(b, a))).isEqualTo(a + "," + b);
    }
}
