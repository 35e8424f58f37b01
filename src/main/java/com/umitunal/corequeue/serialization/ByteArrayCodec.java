package com.umitunal.corequeue.serialization;

/**
 * Pass-through codec for payloads that are already serialized.
 */
public class ByteArrayCodec implements PayloadCodec<byte[]> {

    @Override
    public byte[] encode(byte[] payload) {
        return payload;
    }

    @Override
    public byte[] decode(byte[] bytes) {
        return bytes;
    }
}
