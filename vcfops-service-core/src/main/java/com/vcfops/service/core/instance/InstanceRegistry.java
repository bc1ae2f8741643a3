package com.vcfops.service.core.instance;

import com.vcfops.core.error.InstanceConfigurationException;
import com.vcfops.core.error.InstanceNotFoundException;
import com.vcfops.core.model.InstanceSummary;
import com.vcfops.core.model.OpsCredentials;
import com.vcfops.core.model.OpsInstance;
import com.vcfops.service.core.config.VcfOperationsProperties;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;

/**
 * Immutable, ordered set of configured instances. The first entry is the default.
 */
@Slf4j
public final class InstanceRegistry {
    static final String NO_INSTANCES = "No VCF Operations instances configured";

    private final List<OpsInstance> instances;
    private final Map<String, OpsInstance> byName;

    public InstanceRegistry(List<OpsInstance> instances) {
        if (instances == null || instances.isEmpty()) {
            throw new InstanceConfigurationException(NO_INSTANCES);
        }
        Map<String, OpsInstance> index = new LinkedHashMap<>();
        for (OpsInstance instance : instances) {
            if (index.putIfAbsent(instance.name(), instance) != null) {
                throw new InstanceConfigurationException(
                        "Duplicate VCF Operations instance name '" + instance.name() + "'");
            }
        }
        this.instances = List.copyOf(instances);
        this.byName = Map.copyOf(index);
    }

    public static InstanceRegistry fromProperties(VcfOperationsProperties properties) {
        List<VcfOperationsProperties.Instance> raw = properties.getInstances();
        if (raw == null || raw.isEmpty()) {
            throw new InstanceConfigurationException(NO_INSTANCES);
        }
        List<OpsInstance> out = new ArrayList<>(raw.size());
        for (int i = 0; i < raw.size(); i++) {
            out.add(toInstance(i, raw.get(i)));
        }
        InstanceRegistry registry = new InstanceRegistry(out);
        log.info(
                "Loaded {} VCF Operations instance(s), default '{}'",
                out.size(),
                registry.defaultInstance().name());
        return registry;
    }

    private static OpsInstance toInstance(int index, VcfOperationsProperties.Instance raw) {
        String where = "vcf-operations.instances[" + index + "]";
        if (raw == null) {
            throw new InstanceConfigurationException(where + " is empty");
        }
        String name = required(raw.getName(), where + ".name");
        String baseUrl = required(raw.getBaseUrl(), where + ".base-url");
        VcfOperationsProperties.Authentication auth = raw.getAuthentication();
        if (auth == null) {
            throw new InstanceConfigurationException(where + ".authentication is required");
        }
        OpsCredentials credentials = new OpsCredentials(
                required(auth.getUsername(), where + ".authentication.username"),
                required(auth.getPassword(), where + ".authentication.password"));
        return new OpsInstance(
                name.trim(), baseUrl, raw.getMajorVersion(), credentials, raw.getRelatedInstanceNames());
    }

    private static String required(String value, String key) {
        if (value == null || value.isBlank()) {
            throw new InstanceConfigurationException(key + " is required");
        }
        return value;
    }

    /** Resolves by name; a null or blank name selects the default instance. */
    public OpsInstance resolve(String instanceName) {
        if (instanceName == null || instanceName.isBlank()) {
            return defaultInstance();
        }
        OpsInstance instance = byName.get(instanceName);
        if (instance == null) {
            throw new InstanceNotFoundException(instanceName);
        }
        return instance;
    }

    public OpsInstance defaultInstance() {
        return instances.get(0);
    }

    public List<InstanceSummary> summaries() {
        return instances.stream().map(OpsInstance::summary).toList();
    }
}
