package uk.gegc.creditledger.features.wallet.application.impl;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("LedgerMetadataCodec Tests")
class LedgerMetadataCodecTest {

    private final LedgerMetadataCodec codec = new LedgerMetadataCodec(new ObjectMapper());

    @Test
    @DisplayName("write: null values are dropped and an empty map is stored as null")
    void write_dropsNullValues() {
        Map<String, Object> meta = new HashMap<>();
        meta.put("reason", null);

        assertThat(codec.write(meta)).isNull();
        assertThat(codec.write(Map.of())).isNull();
        assertThat(codec.write(null)).isNull();
    }

    @Test
    @DisplayName("merge: additions overwrite existing keys and keep the rest")
    void merge_overlaysAdditions() {
        String existing = codec.write(Map.of("jobId", "j-1", "topUpDeducted", 4));

        String merged = codec.merge(existing, Map.of("topUpDeducted", 6, "cancellationReason", "timeout"));

        assertThat(codec.read(merged))
                .containsEntry("jobId", "j-1")
                .containsEntry("topUpDeducted", 6)
                .containsEntry("cancellationReason", "timeout");
    }

    @Test
    @DisplayName("read: blank text yields an empty map, malformed JSON fails")
    void read_handlesBlankAndMalformed() {
        assertThat(codec.read(null)).isEmpty();
        assertThat(codec.read("  ")).isEmpty();
        assertThatThrownBy(() -> codec.read("not-json"))
                .isInstanceOf(IllegalStateException.class);
    }
}
