package io.liveprobe.storage;

import com.mongodb.client.model.Filters;
import com.mongodb.client.model.Updates;
import io.liveprobe.core.routing.DocumentKey;
import io.liveprobe.core.storage.DocumentRecord;
import io.liveprobe.core.storage.FieldUpdate;
import org.bson.Document;
import org.bson.conversions.Bson;
import org.bson.types.Decimal128;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Translation between the storage SPI types and BSON.
 *
 * Layout of a stored document: _id, then location (geosharded only), then
 * the generated payload fields. Decimal values become Decimal128.
 */
final class DocumentMapper {

    static final String ID = "_id";
    static final String LOCATION = "location";

    private DocumentMapper() {
    }

    static Document toDocument(DocumentRecord record) {
        DocumentKey key = record.key();
        Document doc = new Document(ID, key.id());
        if (key.hasLocation()) {
            doc.append(LOCATION, key.location());
        }
        for (Map.Entry<String, Object> e : record.payload().entrySet()) {
            if (ID.equals(e.getKey()) || LOCATION.equals(e.getKey())) {
                continue;
            }
            doc.append(e.getKey(), toBsonValue(e.getValue()));
        }
        return doc;
    }

    /**
     * Equality filter on _id, plus location when the key carries one so that
     * mongos can target a single zone.
     */
    static Bson filterFor(DocumentKey key) {
        if (key.hasLocation()) {
            return Filters.and(Filters.eq(LOCATION, key.location()), Filters.eq(ID, key.id()));
        }
        return Filters.eq(ID, key.id());
    }

    static Bson toUpdate(FieldUpdate update) {
        List<Bson> parts = new ArrayList<>();
        update.set().forEach((field, value) -> parts.add(Updates.set(field, toBsonValue(value))));
        update.increment().forEach((field, delta) -> parts.add(Updates.inc(field, delta)));
        return Updates.combine(parts);
    }

    static Object toBsonValue(Object value) {
        if (value instanceof BigDecimal bd) {
            return new Decimal128(bd);
        }
        if (value instanceof Map<?, ?> map) {
            Document nested = new Document();
            for (Map.Entry<?, ?> e : map.entrySet()) {
                nested.append(String.valueOf(e.getKey()), toBsonValue(e.getValue()));
            }
            return nested;
        }
        if (value instanceof List<?> list) {
            List<Object> out = new ArrayList<>(list.size());
            for (Object v : list) {
                out.add(toBsonValue(v));
            }
            return out;
        }
        return value;
    }
}
