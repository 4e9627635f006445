package io.liveprobe.core.workload;

import io.liveprobe.core.routing.DocumentKey;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.UUID;
import java.util.function.LongSupplier;

/**
 * Generates heterogeneous, realistic-looking documents.
 *
 * Shapes vary from document to document on purpose: optional sub-documents,
 * arrays of 0..n elements, union-typed fields (string or object, int or
 * double, date or epoch seconds) and occasional binary blobs. Storage engines
 * and schema samplers see something closer to production data than a single
 * fixed layout.
 *
 * Every document carries the base fields k (sequence), ts (epoch millis) and
 * n (update counter).
 */
public final class RandomPayloadGenerator implements PayloadGenerator {

    private static final String[] FIRST_NAMES = {
            "Ava", "Liam", "Noah", "Mia", "Zoe", "Omar", "Ines", "Kenji", "Priya", "Lars",
            "Chloe", "Mateo", "Amara", "Yuki", "Elena", "Tariq", "Nora", "Felix", "Sofia", "Ravi"
    };
    private static final String[] LAST_NAMES = {
            "Smith", "Garcia", "Müller", "Tanaka", "Okafor", "Silva", "Novak", "Kim", "Rossi", "Dubois",
            "Nguyen", "Patel", "Johansson", "Cohen", "Moreau", "Kowalski", "Haddad", "Ito", "Lopez", "Brown"
    };
    private static final String[] COMPANIES = {
            "Acme Corp", "Globex", "Initech", "Umbrella Ltd", "Hooli", "Vandelay Industries",
            "Stark Logistics", "Wayne Freight", "Tyrell Systems", "Cyberdyne Analytics"
    };
    private static final String[] CITIES = {
            "Springfield", "Riverton", "Lakeside", "Fairview", "Greenville", "Kingston",
            "Madison", "Georgetown", "Arlington", "Salem"
    };
    private static final String[] STREETS = {
            "Main St", "Oak Ave", "Pine Rd", "Maple Dr", "Cedar Ln", "Elm St", "Harbor Way", "Hill Rd"
    };
    private static final String[] WORDS = {
            "alpha", "bravo", "delta", "echo", "lima", "orbit", "quartz", "raven", "sierra",
            "tango", "ultra", "vector", "whisky", "zephyr", "nimbus", "pixel", "cobalt", "ember"
    };
    private static final String[] JOB_TITLES = {
            "Engineer", "Analyst", "Designer", "Manager", "Consultant", "Architect", "Scientist", "Operator"
    };
    private static final String[] CATEGORIES = {"tech", "finance", "health", "travel", "food", "sports"};
    private static final String[] SOURCES = {"web", "mobile", "partner", "import"};
    private static final String[] SENIORITY = {"jr", "mid", "sr"};
    private static final String[] TIMEZONES = {
            "UTC", "Europe/Berlin", "America/New_York", "Asia/Tokyo", "Australia/Sydney", "America/Sao_Paulo"
    };
    private static final String ALPHANUM = "ABCDEFGHIJKLMNOPQRSTUVWXYZabcdefghijklmnopqrstuvwxyz0123456789";

    private final LongSupplier clockMillis;

    public RandomPayloadGenerator() {
        this(System::currentTimeMillis);
    }

    public RandomPayloadGenerator(LongSupplier clockMillis) {
        this.clockMillis = clockMillis;
    }

    @Override
    public Map<String, Object> generate(DocumentKey key, Random rnd) {
        long now = clockMillis.getAsLong();

        Map<String, Object> doc = new LinkedHashMap<>();
        doc.put("k", key.sequence());
        doc.put("ts", now);
        doc.put("n", 0);

        String first = pick(rnd, FIRST_NAMES);
        String last = pick(rnd, LAST_NAMES);
        String countryCode = key.location() != null ? key.location() : "US";

        Map<String, Object> geo = new LinkedHashMap<>();
        geo.put("lat", round(rnd.nextDouble() * 180.0 - 90.0, 6));
        geo.put("lng", round(rnd.nextDouble() * 360.0 - 180.0, 6));

        Map<String, Object> address = new LinkedHashMap<>();
        address.put("street", (1 + rnd.nextInt(9999)) + " " + pick(rnd, STREETS));
        address.put("city", pick(rnd, CITIES));
        address.put("postalCode", String.format("%05d", rnd.nextInt(100_000)));
        address.put("countryCode", countryCode);
        address.put("geo", geo);

        Map<String, Object> profile = new LinkedHashMap<>();
        profile.put("name", first + " " + last);
        profile.put("email", email(first, last, rnd));
        profile.put("company", pick(rnd, COMPANIES));
        profile.put("address", address);
        if (rnd.nextDouble() < 0.5) {
            profile.put("job", Map.of("title", pick(rnd, JOB_TITLES), "seniority", pick(rnd, SENIORITY)));
        }
        if (rnd.nextDouble() < 0.3) {
            profile.put("website", "https://" + pick(rnd, WORDS) + "." + pick(rnd, WORDS) + ".example");
        }
        if (rnd.nextDouble() < 0.3) {
            long ageDays = 365L * (18 + rnd.nextInt(72));
            profile.put("birthdate", new Date(now - ageDays * 86_400_000L));
        }
        doc.put("profile", profile);

        doc.put("phones", phones(rnd));
        doc.put("tags", words(rnd, rnd.nextInt(7)));
        doc.put("orders", orders(rnd, now));

        Map<String, Object> preferences = new LinkedHashMap<>();
        preferences.put("newsletter", rnd.nextBoolean());
        preferences.put("categories", sample(rnd, CATEGORIES, rnd.nextInt(5)));
        preferences.put("timezone", pick(rnd, TIMEZONES));
        doc.put("preferences", preferences);

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("source", pick(rnd, SOURCES));
        metadata.put("createdAt", new Date(now));
        metadata.put("updatedAt", new Date(now));
        if (rnd.nextDouble() < 0.2) {
            metadata.put("note", String.join(" ", words(rnd, 8)));
        }
        doc.put("metadata", metadata);

        // Union-typed fields.
        doc.put("contact", rnd.nextDouble() < 0.5
                ? email(first, last, rnd)
                : Map.of("email", email(first, last, rnd), "phone", phone(rnd)));
        doc.put("rating", rnd.nextDouble() < 0.5
                ? (Object) (1 + rnd.nextInt(5))
                : (Object) round(1.0 + rnd.nextDouble() * 4.0, 2));
        doc.put("lastSeen", rnd.nextDouble() < 0.5
                ? (Object) new Date(now)
                : (Object) (now / 1000L));
        doc.put("avatar", rnd.nextDouble() < 0.3 ? randomBytes(rnd, rnd.nextInt(513)) : null);

        Map<String, Object> attrs = new LinkedHashMap<>();
        attrs.put("a", mixedScalar(rnd));
        attrs.put("b", List.of(rnd.nextInt(6), pick(rnd, WORDS)));
        doc.put("attrs", attrs);

        doc.put("v", randomString(rnd, 16));
        return doc;
    }

    // ---------- helpers ----------

    private static List<Map<String, Object>> orders(Random rnd, long now) {
        int count = rnd.nextInt(4);
        List<Map<String, Object>> orders = new ArrayList<>(count);
        for (int o = 0; o < count; o++) {
            int itemCount = 1 + rnd.nextInt(3);
            List<Map<String, Object>> items = new ArrayList<>(itemCount);
            BigDecimal total = BigDecimal.ZERO;
            for (int i = 0; i < itemCount; i++) {
                int qty = 1 + rnd.nextInt(5);
                BigDecimal price = BigDecimal.valueOf(5.0 + rnd.nextDouble() * 495.0)
                        .setScale(2, RoundingMode.HALF_UP);
                Map<String, Object> item = new LinkedHashMap<>();
                item.put("sku", "SKU-" + randomString(rnd, 4).toUpperCase() + "-" + String.format("%05d", rnd.nextInt(100_000)));
                item.put("qty", qty);
                item.put("price", price);
                items.add(item);
                total = total.add(price.multiply(BigDecimal.valueOf(qty)));
            }
            Map<String, Object> order = new LinkedHashMap<>();
            order.put("id", new UUID(rnd.nextLong(), rnd.nextLong()).toString());
            order.put("total", total.setScale(2, RoundingMode.HALF_UP));
            order.put("items", items);
            order.put("placedAt", new Date(now - rnd.nextInt(30 * 86_400) * 1000L));
            orders.add(order);
        }
        return orders;
    }

    private static List<String> phones(Random rnd) {
        int count = rnd.nextInt(4);
        List<String> out = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            out.add(phone(rnd));
        }
        return out;
    }

    private static String phone(Random rnd) {
        return String.format("+1-%03d-%03d-%04d", 200 + rnd.nextInt(800), rnd.nextInt(1000), rnd.nextInt(10_000));
    }

    private static String email(String first, String last, Random rnd) {
        return (first + "." + last).toLowerCase().replaceAll("[^a-z.]", "") + rnd.nextInt(1000) + "@example.com";
    }

    private static Object mixedScalar(Random rnd) {
        return switch (rnd.nextInt(5)) {
            case 0 -> Boolean.TRUE;
            case 1 -> Boolean.FALSE;
            case 2 -> null;
            case 3 -> pick(rnd, WORDS);
            default -> rnd.nextInt(101);
        };
    }

    private static List<String> words(Random rnd, int count) {
        List<String> out = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            out.add(pick(rnd, WORDS));
        }
        return out;
    }

    private static List<String> sample(Random rnd, String[] pool, int count) {
        List<String> remaining = new ArrayList<>(List.of(pool));
        List<String> out = new ArrayList<>(count);
        for (int i = 0; i < count && !remaining.isEmpty(); i++) {
            out.add(remaining.remove(rnd.nextInt(remaining.size())));
        }
        return out;
    }

    private static byte[] randomBytes(Random rnd, int len) {
        byte[] b = new byte[len];
        rnd.nextBytes(b);
        return b;
    }

    private static String randomString(Random rnd, int len) {
        StringBuilder sb = new StringBuilder(len);
        for (int i = 0; i < len; i++) {
            sb.append(ALPHANUM.charAt(rnd.nextInt(ALPHANUM.length())));
        }
        return sb.toString();
    }

    private static String pick(Random rnd, String[] values) {
        return values[rnd.nextInt(values.length)];
    }

    private static double round(double value, int places) {
        return BigDecimal.valueOf(value).setScale(places, RoundingMode.HALF_UP).doubleValue();
    }
}
