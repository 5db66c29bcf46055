package dev.kms.codec;

import dev.kms.core.KMSException;

public class CodecFormatException extends KMSException {
    public CodecFormatException(String msg) {
        super(msg);
    }

    public CodecFormatException(String msg, Throwable cause) {
        super(msg, cause);
    }
}
