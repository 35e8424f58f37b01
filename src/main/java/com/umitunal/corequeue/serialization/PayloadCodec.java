package com.umitunal.corequeue.serialization;

/**
 * Converts job payloads and results to the bytes the store keeps.
 * The queue never looks inside the bytes.
 *
 * @param <T> the type of payload
 */
public interface PayloadCodec<T> {

    /**
     * Encode a payload to bytes.
     *
     * @throws CodecException if the payload cannot be encoded
     */
    byte[] encode(T payload);

    /**
     * Decode bytes to a payload.
     *
     * @throws CodecException if the bytes are not a valid encoding
     */
    T decode(byte[] bytes);
}
