package prayer.devotions_be.lectionary;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.InputStream;
import java.util.Map;

/**
 * Read-only daily lectionary keyed by liturgical key.
 *
 * <p>The backing JSON maps each key (e.g. {@code "Lent 2 Monday"}, {@code "14 Sep"}) to an object
 * with {@code OT} and {@code NT} references. Keys without an entry yield {@link Readings#NOT_FOUND}.
 */
public final class LectionaryStore {

    private final Map<String, Readings> entries;

    public LectionaryStore(Map<String, Readings> entries) {
        this.entries = Map.copyOf(entries);
    }

    public static LectionaryStore load(InputStream json, ObjectMapper mapper) throws IOException {
        Map<String, Readings> entries = mapper.readValue(json, new TypeReference<Map<String, Readings>>() {});
        return new LectionaryStore(entries);
    }

    public static LectionaryStore fromClasspath(String resource, ObjectMapper mapper) {
        try (InputStream in = LectionaryStore.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null) {
                throw new IllegalStateException("Lectionary resource not found: " + resource);
            }
            return load(in, mapper);
        } catch (IOException ex) {
            throw new IllegalStateException("Failed to read lectionary " + resource, ex);
        }
    }

    public Readings lookup(String key) {
        return entries.getOrDefault(key, Readings.NOT_FOUND);
    }

    public int size() {
        return entries.size();
    }
}
