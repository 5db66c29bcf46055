package dev.kms.codec;

import com.fasterxml.jackson.core.StreamReadFeature;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.kms.core.model.StoreSnapshot;

import java.io.IOException;
import java.util.Iterator;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Текстовый формат снимка: {@code {"counter": N, "entries": {"1": ..., "2": ...}}}.
 * Дерево собирается вручную, чтобы порядок полей не зависел от настроек маппера.
 * Незнакомые поля верхнего уровня пропускаются.
 */
public final class JsonSnapshotCodec<K> implements SnapshotCodec<K> {
    static final String COUNTER = "counter";

    static final String ENTRIES = "entries";

    private final ObjectMapper mapper;

    private final Class<K> type;

    public JsonSnapshotCodec(final RecordType<K> recordType) {
        this(defaultMapper(), recordType);
    }

    public JsonSnapshotCodec(final ObjectMapper mapper, final RecordType<K> recordType) {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
        this.type = recordType.type();
    }

    public static ObjectMapper defaultMapper() {
        return JsonMapper.builder()
                .enable(StreamReadFeature.STRICT_DUPLICATE_DETECTION)
                .enable(DeserializationFeature.FAIL_ON_MISSING_CREATOR_PROPERTIES)
                .build();
    }

    @Override
    public byte[] encode(final StoreSnapshot<K> snapshot) throws CodecFormatException {
        try {
            final ObjectNode root = mapper.createObjectNode();
            root.put(COUNTER, snapshot.counter());
            final ObjectNode entries = root.putObject(ENTRIES);
            for (var e : snapshot.entries().entrySet()) {
                entries.set(Long.toString(e.getKey()), mapper.valueToTree(e.getValue()));
            }
            return mapper.writeValueAsBytes(root);
        } catch (IOException | IllegalArgumentException e) {
            throw new CodecFormatException("failed to encode snapshot as json", e);
        }
    }

    @Override
    public StoreSnapshot<K> decode(final byte[] bytes) throws CodecFormatException {
        final JsonNode root;
        try {
            root = mapper.readTree(bytes);
        } catch (IOException e) {
            throw new CodecFormatException("malformed json snapshot", e);
        }
        if (root == null || !root.isObject()) {
            throw new CodecFormatException("json snapshot must be an object");
        }

        final JsonNode counterNode = root.get(COUNTER);
        if (counterNode == null || !counterNode.isIntegralNumber() || !counterNode.canConvertToLong()) {
            throw new CodecFormatException("missing or invalid '" + COUNTER + "'");
        }
        final JsonNode entriesNode = root.get(ENTRIES);
        if (entriesNode == null || !entriesNode.isObject()) {
            throw new CodecFormatException("missing or invalid '" + ENTRIES + "'");
        }

        final var entries = new TreeMap<Long, K>();
        final Iterator<Map.Entry<String, JsonNode>> it = entriesNode.fields();
        while (it.hasNext()) {
            final var field = it.next();
            final long version;
            try {
                version = Long.parseLong(field.getKey());
            } catch (NumberFormatException e) {
                throw new CodecFormatException("invalid version key '" + field.getKey() + "'", e);
            }
            // "01" и "+1" дали бы ту же версию, что и "1"
            if (!Long.toString(version).equals(field.getKey())) {
                throw new CodecFormatException("non-canonical version key '" + field.getKey() + "'");
            }
            if (field.getValue().isNull()) {
                throw new CodecFormatException("null record for version " + version);
            }
            final K record;
            try {
                record = mapper.treeToValue(field.getValue(), type);
            } catch (IOException | IllegalArgumentException e) {
                throw new CodecFormatException("invalid record for version " + version, e);
            }
            if (entries.put(version, record) != null) {
                throw new CodecFormatException("duplicate version " + version);
            }
        }

        try {
            return new StoreSnapshot<>(counterNode.asLong(), entries);
        } catch (IllegalArgumentException e) {
            throw new CodecFormatException("inconsistent snapshot: " + e.getMessage(), e);
        }
    }
}
