package com.umitunal.corequeue.serialization;

import java.nio.charset.StandardCharsets;

/**
 * UTF-8 text payloads.
 */
public class StringCodec implements PayloadCodec<String> {

    @Override
    public byte[] encode(String payload) {
        return payload.getBytes(StandardCharsets.UTF_8);
    }

    @Override
    public String decode(byte[] bytes) {
        return new String(bytes, StandardCharsets.UTF_8);
    }
}
