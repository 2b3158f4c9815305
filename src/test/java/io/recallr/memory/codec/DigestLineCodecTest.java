package io.recallr.memory.codec;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.recallr.memory.ErrorCode;
import io.recallr.memory.MemoryException;
import io.recallr.memory.tier2.Digest;
import io.recallr.memory.tier2.DigestEntities;
import io.recallr.memory.tier2.DigestType;
import io.recallr.memory.tier2.PeriodType;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DigestLineCodecTest {

    private static Digest sample() {
        return new Digest("2025-W05-weekly-digest-abcd1234", "ci-1", 1738000000L, PeriodType.WEEKLY, "2025-W05",
                DigestType.PROJECT, 1, 12, "Weekly digest for 2025-W05: 12 interactions archived from Tier 1",
                List.of("deployment"), List.of("pipeline", "staging"),
                new DigestEntities(List.of("src/Main.java"), List.of("retention"), List.of("Ada")),
                List.of("staging is \"flaky\""), List.of("move to blue/green"), 3, false);
    }

    @Test
    void shouldDecodeWhatItEncodes() {
        Digest digest = sample();

        assertEquals(digest, DigestLineCodec.decode(DigestLineCodec.encode(digest)));
    }

    @Test
    void shouldWriteFieldsReadableByJackson() throws Exception {
        JsonNode node = new ObjectMapper().readTree(DigestLineCodec.encode(sample()));

        assertEquals("2025-W05-weekly-digest-abcd1234", node.get("digest_id").asText());
        assertEquals(0, node.get("period_type").asInt());
        assertEquals(2, node.get("digest_type").asInt());
        assertEquals(1, node.get("source_tier").asInt());
        assertEquals("src/Main.java", node.get("entities").get("files").get(0).asText());
        assertEquals("staging is \"flaky\"", node.get("key_insights").get(0).asText());
        assertFalse(node.get("archived").asBoolean());
    }

    @Test
    void shouldStartWithIdentityFields() {
        assertTrue(DigestLineCodec.encode(sample()).startsWith(
                "{\"digest_id\":\"2025-W05-weekly-digest-abcd1234\",\"timestamp\":1738000000,\"period_type\":0,"
                        + "\"period_id\":\"2025-W05\",\"source_tier\":1,\"source_record_count\":12,\"ci_id\":\"ci-1\""));
    }

    @Test
    void shouldRejectLineWithoutDigestId() {
        var e = assertThrows(MemoryException.class, () -> DigestLineCodec.decode("{\"summary\":\"x\"}"));
        assertEquals(ErrorCode.PARSE_ERROR, e.code());
    }
}
