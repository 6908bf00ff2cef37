package io.quotecache.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.Iterator;
import java.util.Map;
import java.util.TreeMap;

/**
 * Serializes a partition as {@code {"dates":{"yyyy-MM-dd":number},"fetchedAt":epochMs}}.
 */
public final class PartitionCodec {
    private final ObjectMapper mapper;

    public PartitionCodec() { this(new ObjectMapper()); }
    public PartitionCodec(ObjectMapper mapper) { this.mapper = mapper; }

    public String encode(Partition partition) {
        ObjectNode root = mapper.createObjectNode();
        ObjectNode dates = root.putObject("dates");
        partition.dates().forEach((d, v) -> dates.put(d.toString(), v));
        root.put("fetchedAt", partition.fetchedAt());
        try {
            return mapper.writeValueAsString(root);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("cannot encode partition", e);
        }
    }

    public Partition decode(String json) throws JsonProcessingException {
        JsonNode root = mapper.readTree(json);
        if (root == null || !root.isObject()) throw new MalformedPartitionException("not a JSON object");
        JsonNode dates = root.path("dates");
        if (!dates.isObject()) throw new MalformedPartitionException("missing dates object");
        TreeMap<LocalDate, Double> out = new TreeMap<>();
        Iterator<Map.Entry<String, JsonNode>> it = dates.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> e = it.next();
            if (!e.getValue().isNumber()) throw new MalformedPartitionException("non-numeric value for " + e.getKey());
            try {
                out.put(LocalDate.parse(e.getKey()), e.getValue().doubleValue());
            } catch (DateTimeParseException bad) {
                throw new MalformedPartitionException("bad date key " + e.getKey());
            }
        }
        return new Partition(out, root.path("fetchedAt").asLong(0L));
    }

    /** Payload parsed as JSON but does not have the partition shape. */
    public static final class MalformedPartitionException extends JsonProcessingException {
        MalformedPartitionException(String msg) { super(msg); }
    }
}
