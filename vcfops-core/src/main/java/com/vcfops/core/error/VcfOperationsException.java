package com.vcfops.core.error;

/** Root of everything the service raises on its own behalf. */
public class VcfOperationsException extends RuntimeException {

    public VcfOperationsException(String message) {
        super(message);
    }

    public VcfOperationsException(String message, Throwable cause) {
        super(message, cause);
    }
}
