package com.vcfops.core.error;

/**
 * A call to a VCF Operations instance failed. Best-effort operations degrade on this type and nothing else.
 */
public abstract class OpsApiException extends VcfOperationsException {
    /** Status code reported for failures that never produced an HTTP response. */
    public static final int NO_STATUS = -1;

    private final String instanceName;
    private final int statusCode;

    protected OpsApiException(String message, String instanceName, int statusCode, Throwable cause) {
        super(message, cause);
        this.instanceName = instanceName;
        this.statusCode = statusCode;
    }

    public String instanceName() {
        return instanceName;
    }

    /** HTTP status of the failed exchange, or {@link #NO_STATUS}. */
    public int statusCode() {
        return statusCode;
    }
}
