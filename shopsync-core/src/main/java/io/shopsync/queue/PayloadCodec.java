package io.shopsync.queue;

/**
 * Serializes {@link SyncPayload}s into the {@code data} column of the sync queue.
 *
 * <p>The stored form is a versioned envelope:
 * <pre>{@code {"version":1,"payload":{"type":"inventory.created", ...}}}</pre>
 *
 * @see #getDefault()
 * @see JacksonPayloadCodec
 */
public interface PayloadCodec {

    int CURRENT_VERSION = 1;

    /**
     * Returns the default singleton implementation.
     *
     * @return the default {@link PayloadCodec}
     */
    static PayloadCodec getDefault() {
        return JacksonPayloadCodec.INSTANCE;
    }

    String encode(SyncPayload payload);

    /**
     * Decodes a stored envelope.
     *
     * @param data the stored envelope
     * @return the payload (never {@code null})
     * @throws MalformedPayloadException if the data is not a valid envelope of a known version
     */
    SyncPayload decode(String data);
}
