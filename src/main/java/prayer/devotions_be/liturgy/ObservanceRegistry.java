package prayer.devotions_be.liturgy;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.time.LocalDate;
import java.time.MonthDay;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Read-only, ordered collection of observances.
 *
 * <p>Loaded once from a JSON array whose items carry {@code Name}, one of {@code absolute_date}
 * ({@code "MM-DD"}), {@code relative_date} (days from Easter) or {@code rule}, and an optional
 * {@code color}. Items that cannot be interpreted are skipped with a warning.
 */
public final class ObservanceRegistry {
    private static final Logger log = LoggerFactory.getLogger(ObservanceRegistry.class);

    private final List<Observance> observances;

    public ObservanceRegistry(List<Observance> observances) {
        this.observances = List.copyOf(observances);
    }

    public static ObservanceRegistry load(InputStream json, ObjectMapper mapper) throws IOException {
        JsonNode root = mapper.readTree(json);
        if (root == null || !root.isArray()) {
            throw new IOException("Observance registry must be a JSON array");
        }
        List<Observance> loaded = new ArrayList<>();
        for (JsonNode item : root) {
            parseItem(item).ifPresent(loaded::add);
        }
        log.info("Loaded {} observances ({} entries skipped)", loaded.size(), root.size() - loaded.size());
        return new ObservanceRegistry(loaded);
    }

    public static ObservanceRegistry fromClasspath(String resource, ObjectMapper mapper) {
        try (InputStream in = ObservanceRegistry.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null) {
                throw new IllegalStateException("Observance registry resource not found: " + resource);
            }
            return load(in, mapper);
        } catch (IOException ex) {
            throw new IllegalStateException("Failed to read observance registry " + resource, ex);
        }
    }

    public List<Observance> observances() {
        return observances;
    }

    /**
     * Every observance matching {@code day}, in registry order.
     */
    public List<Observance> matching(LocalDate day, ChurchYearAnchors anchors) {
        return observances.stream()
                .filter(o -> o.matches(day, anchors))
                .toList();
    }

    private static Optional<Observance> parseItem(JsonNode item) {
        String name = text(item, "Name");
        if (name == null) {
            log.warn("Skipping observance without a name: {}", item);
            return Optional.empty();
        }
        LiturgicalColor color = null;
        String colorName = text(item, "color");
        if (colorName != null) {
            color = LiturgicalColor.fromName(colorName).orElse(null);
            if (color == null) {
                log.warn("Observance '{}' has unknown color '{}', deriving it from the season", name, colorName);
            }
        }
        String absolute = text(item, "absolute_date");
        if (absolute != null) {
            try {
                return Optional.of(Observance.fixed(name, MonthDay.parse("--" + absolute), color));
            } catch (DateTimeParseException ex) {
                log.warn("Skipping observance '{}' with malformed absolute_date '{}'", name, absolute);
                return Optional.empty();
            }
        }
        JsonNode relative = item.get("relative_date");
        if (relative != null && relative.canConvertToInt()) {
            return Optional.of(Observance.easterOffset(name, relative.asInt(), color));
        }
        String rule = text(item, "rule");
        if (rule != null) {
            Optional<ObservanceRule> parsed = ObservanceRule.parse(rule);
            if (parsed.isEmpty()) {
                log.warn("Skipping observance '{}' with unknown rule '{}'", name, rule);
            }
            final LiturgicalColor ruleColor = color;
            return parsed.map(r -> Observance.ruled(name, r, ruleColor));
        }
        log.warn("Skipping observance '{}' without a date matcher", name);
        return Optional.empty();
    }

    private static String text(JsonNode item, String field) {
        JsonNode node = item.get(field);
        if (node == null || node.isNull()) {
            return null;
        }
        String value = node.asText().trim();
        return value.isEmpty() ? null : value;
    }
}
