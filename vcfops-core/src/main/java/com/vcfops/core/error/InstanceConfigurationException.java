package com.vcfops.core.error;

/** Instance configuration is unusable; raised while the registry is built. */
public class InstanceConfigurationException extends VcfOperationsException {

    public InstanceConfigurationException(String message) {
        super(message);
    }
}
