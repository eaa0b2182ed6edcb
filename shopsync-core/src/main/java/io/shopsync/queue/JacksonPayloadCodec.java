package io.shopsync.queue;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.shopsync.Identifier;

import java.io.IOException;
import java.util.Objects;

/**
 * {@link PayloadCodec} backed by a Jackson {@link ObjectMapper}.
 *
 * <p>Identifiers are written in their string form and parsed back with
 * {@link Identifier#parse(String)}. Unknown properties are ignored so newer writers can add
 * fields without breaking older readers of the same version.
 */
public final class JacksonPayloadCodec implements PayloadCodec {

    static final JacksonPayloadCodec INSTANCE = new JacksonPayloadCodec();

    private final ObjectMapper mapper;

    public JacksonPayloadCodec() {
        this(defaultMapper());
    }

    /**
     * Creates a codec over a caller-configured mapper. The mapper must be able to handle
     * {@link Identifier} and {@code java.time} values; see {@link #defaultMapper()}.
     *
     * @param mapper the object mapper
     */
    public JacksonPayloadCodec(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    /**
     * Returns a new mapper configured the way this codec expects.
     */
    public static ObjectMapper defaultMapper() {
        SimpleModule identifiers = new SimpleModule("shopsync-identifiers");
        identifiers.addSerializer(Identifier.class, new IdentifierSerializer());
        identifiers.addDeserializer(Identifier.class, new IdentifierDeserializer());
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .registerModule(identifiers)
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    @Override
    public String encode(SyncPayload payload) {
        Objects.requireNonNull(payload, "payload");
        try {
            return mapper.writeValueAsString(new Envelope(CURRENT_VERSION, payload));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot encode payload " + payload.getClass().getSimpleName(), e);
        }
    }

    @Override
    public SyncPayload decode(String data) {
        if (data == null || data.isBlank()) {
            throw new MalformedPayloadException("Empty payload");
        }
        Envelope envelope;
        try {
            envelope = mapper.readValue(data, Envelope.class);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new MalformedPayloadException("Cannot decode payload: " + e.getMessage(), e);
        }
        if (envelope.version() != CURRENT_VERSION) {
            throw new MalformedPayloadException("Unsupported payload version " + envelope.version());
        }
        if (envelope.payload() == null) {
            throw new MalformedPayloadException("Envelope has no payload");
        }
        return envelope.payload();
    }

    record Envelope(int version, SyncPayload payload) {
    }

    private static final class IdentifierSerializer extends JsonSerializer<Identifier> {
        @Override
        public void serialize(Identifier value, JsonGenerator gen, SerializerProvider serializers) throws IOException {
            gen.writeString(value.value());
        }
    }

    private static final class IdentifierDeserializer extends JsonDeserializer<Identifier> {
        @Override
        public Identifier deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
            String value = p.getValueAsString();
            if (value == null || value.isBlank()) {
                return (Identifier) ctxt.handleWeirdStringValue(Identifier.class, value, "blank identifier");
            }
            return Identifier.parse(value);
        }
    }
}
