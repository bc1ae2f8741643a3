package com.vcfops.service.core.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.vcfops.client.transport.ApiTransport;
import com.vcfops.service.core.api.SuiteApiClient;
import com.vcfops.service.core.auth.TokenAuthenticator;
import com.vcfops.service.core.instance.InstanceRegistry;
import com.vcfops.service.core.metrics.IntervalSelector;
import com.vcfops.service.core.metrics.MetricsQueryEngine;
import com.vcfops.service.core.metrics.MetricsResponseNormalizer;
import com.vcfops.service.core.resource.KindProfiles;
import com.vcfops.service.core.resource.ResourceResolver;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Builds the instance registry and query components from {@link VcfOperationsProperties}. */
@Configuration
public class VcfOperationsConfiguration {

    @Bean
    public InstanceRegistry instanceRegistry(VcfOperationsProperties properties) {
        return InstanceRegistry.fromProperties(properties);
    }

    @Bean
    public IntervalSelector intervalSelector(VcfOperationsProperties properties) {
        return IntervalSelector.fromProperties(properties);
    }

    @Bean
    public KindProfiles kindProfiles(VcfOperationsProperties properties) {
        return KindProfiles.fromProperties(properties);
    }

    @Bean
    public SuiteApiClient suiteApiClient(
            ApiTransport transport,
            TokenAuthenticator authenticator,
            ObjectMapper objectMapper,
            VcfOperationsProperties properties) {
        return new SuiteApiClient(transport, authenticator, objectMapper, properties.getAuthScheme());
    }

    @Bean
    public MetricsQueryEngine metricsQueryEngine(
            SuiteApiClient client, IntervalSelector intervalSelector, ObjectMapper objectMapper) {
        return new MetricsQueryEngine(client, intervalSelector, new MetricsResponseNormalizer(objectMapper));
    }

    @Bean
    public ResourceResolver resourceResolver(SuiteApiClient client, KindProfiles kindProfiles) {
        return new ResourceResolver(client, kindProfiles);
    }
}
