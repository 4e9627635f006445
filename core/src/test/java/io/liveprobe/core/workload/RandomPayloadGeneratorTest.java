package io.liveprobe.core.workload;

import io.liveprobe.core.routing.DocumentKey;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class RandomPayloadGeneratorTest {

    private final RandomPayloadGenerator generator = new RandomPayloadGenerator(() -> 1_700_000_000_000L);

    @Test
    void everyDocumentCarriesBaseFields() {
        Map<String, Object> doc = generator.generate(new DocumentKey(12, "doc-12", null), new Random(3));

        assertEquals(12L, doc.get("k"));
        assertEquals(1_700_000_000_000L, doc.get("ts"));
        assertEquals(0, doc.get("n"));
        assertTrue(doc.containsKey("profile"));
        assertTrue(doc.get("v") instanceof String s && s.length() == 16);
    }

    @SuppressWarnings("unchecked")
    @Test
    void addressCountryFollowsTheKeyLocation() {
        Map<String, Object> doc = generator.generate(new DocumentKey(5, "0000000000000005", "JP"), new Random(9));

        Map<String, Object> profile = (Map<String, Object>) doc.get("profile");
        Map<String, Object> address = (Map<String, Object>) profile.get("address");
        assertEquals("JP", address.get("countryCode"));
    }

    @SuppressWarnings("unchecked")
    @Test
    void orderTotalsAreDecimalWithTwoPlaces() {
        Random rnd = new Random(11);
        int checked = 0;
        for (int i = 0; i < 50; i++) {
            Map<String, Object> doc = generator.generate(new DocumentKey(i, "doc-" + i, null), rnd);
            for (Map<String, Object> order : (List<Map<String, Object>>) doc.get("orders")) {
                BigDecimal total = (BigDecimal) order.get("total");
                assertEquals(2, total.scale());
                assertTrue(total.signum() > 0);
                checked++;
            }
        }
        assertTrue(checked > 0, "expected at least one order across 50 documents");
    }
}
