package com.umitunal.corequeue.serialization;

import com.umitunal.corequeue.core.QueueException;

public class CodecException extends QueueException {

    public CodecException(String message, Throwable cause) {
        super(message, cause);
    }
}
