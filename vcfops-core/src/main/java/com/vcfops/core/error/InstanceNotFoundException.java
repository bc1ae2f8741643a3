package com.vcfops.core.error;

public class InstanceNotFoundException extends VcfOperationsException {
    private final String instanceName;

    public InstanceNotFoundException(String instanceName) {
        super("VCF Operations instance '" + instanceName + "' not found");
        this.instanceName = instanceName;
    }

    public String instanceName() {
        return instanceName;
    }
}
