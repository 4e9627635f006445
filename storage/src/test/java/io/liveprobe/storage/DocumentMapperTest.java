package io.liveprobe.storage;

import com.mongodb.MongoClientSettings;
import io.liveprobe.core.routing.DocumentKey;
import io.liveprobe.core.storage.DocumentRecord;
import io.liveprobe.core.storage.FieldUpdate;
import org.bson.BsonDocument;
import org.bson.Document;
import org.bson.conversions.Bson;
import org.bson.types.Decimal128;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class DocumentMapperTest {

    private static BsonDocument render(Bson bson) {
        return bson.toBsonDocument(BsonDocument.class, MongoClientSettings.getDefaultCodecRegistry());
    }

    @Test
    void geoshardedDocumentStartsWithIdAndLocation() {
        DocumentKey key = new DocumentKey(7, "00000000000000aa", "DE");
        Map<String, Object> payload = Map.of(
                "k", 7L,
                "orders", List.of(Map.of("total", new BigDecimal("19.99")))
        );

        Document doc = DocumentMapper.toDocument(new DocumentRecord(key, payload));

        List<String> keys = new ArrayList<>(doc.keySet());
        assertEquals("_id", keys.get(0));
        assertEquals("location", keys.get(1));
        assertEquals("DE", doc.getString("location"));
        assertEquals(7L, doc.getLong("k"));

        Document order = doc.getList("orders", Document.class).get(0);
        assertEquals(new Decimal128(new BigDecimal("19.99")), order.get("total"));
    }

    @Test
    void replicaSetDocumentHasNoLocation() {
        Document doc = DocumentMapper.toDocument(new DocumentRecord(new DocumentKey(1, "doc-1", null), Map.of()));
        assertEquals("doc-1", doc.getString("_id"));
        assertFalse(doc.containsKey("location"));
    }

    @Test
    void filterIncludesLocationOnlyWhenPresent() {
        BsonDocument plain = render(DocumentMapper.filterFor(new DocumentKey(1, "doc-1", null)));
        assertEquals("doc-1", plain.getString("_id").getValue());
        assertEquals(1, plain.size());

        String geo = render(DocumentMapper.filterFor(new DocumentKey(2, "abc", "JP"))).toJson();
        assertTrue(geo.contains("JP"), geo);
        assertTrue(geo.contains("abc"), geo);
        assertTrue(geo.contains("location"), geo);
    }

    @Test
    void touchRendersSetAndInc() {
        BsonDocument update = render(DocumentMapper.toUpdate(FieldUpdate.touch(1234L)));

        assertEquals(1234L, update.getDocument("$set").getInt64("ts").getValue());
        assertEquals(1, update.getDocument("$inc").getInt32("n").getValue());
    }

    @Test
    void nestedMapsBecomeDocumentsWithStringKeys() {
        Map<Integer, Object> byRank = Map.of(1, new BigDecimal("9.99"), 2, List.of(Map.of("sku", "A-1")));

        Object converted = DocumentMapper.toBsonValue(byRank);

        Document doc = assertInstanceOf(Document.class, converted);
        assertEquals(new Decimal128(new BigDecimal("9.99")), doc.get("1"));
        List<?> second = assertInstanceOf(List.class, doc.get("2"));
        Document item = assertInstanceOf(Document.class, second.get(0));
        assertEquals("A-1", item.getString("sku"));
    }
}
