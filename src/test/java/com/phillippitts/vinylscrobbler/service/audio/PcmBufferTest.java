package com.phillippitts.vinylscrobbler.service.audio;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PcmBufferTest {

    @Test
    void samplesAreLittleEndianSigned() {
        PcmBuffer pcm = PcmBuffer.ofSamples(new short[] {1, -1, Short.MAX_VALUE, Short.MIN_VALUE}, 8_000);

        assertThat(pcm.frameCount()).isEqualTo(4);
        assertThat(pcm.data()[0]).isEqualTo((byte) 0x01);
        assertThat(pcm.data()[1]).isEqualTo((byte) 0x00);
        assertThat(pcm.sample(1)).isEqualTo(-1);
        assertThat(pcm.sample(2)).isEqualTo(Short.MAX_VALUE);
        assertThat(pcm.sample(3)).isEqualTo(Short.MIN_VALUE);
    }

    @Test
    void rejectsOddByteCount() {
        assertThatThrownBy(() -> new PcmBuffer(new byte[3], 8_000))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("block aligned");
    }

    @Test
    void concatJoinsInOrder() {
        PcmBuffer a = PcmBuffer.ofSamples(new short[] {1, 2}, 8_000);
        PcmBuffer b = PcmBuffer.ofSamples(new short[] {3}, 8_000);

        PcmBuffer joined = PcmBuffer.concat(List.of(a, b));

        assertThat(joined.frameCount()).isEqualTo(3);
        assertThat(joined.sample(0)).isEqualTo(1);
        assertThat(joined.sample(2)).isEqualTo(3);
    }

    @Test
    void concatRejectsMixedRates() {
        PcmBuffer a = PcmBuffer.empty(8_000);
        PcmBuffer b = PcmBuffer.empty(44_100);

        assertThatThrownBy(() -> PcmBuffer.concat(List.of(a, b)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("mismatch");
    }

    @Test
    void durationFollowsSampleRate() {
        PcmBuffer pcm = new PcmBuffer(new byte[16_000], 8_000);

        assertThat(pcm.durationMs()).isEqualTo(1_000);
        assertThat(PcmBuffer.empty(8_000).isEmpty()).isTrue();
    }
}
