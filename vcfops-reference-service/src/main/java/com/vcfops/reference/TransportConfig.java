package com.vcfops.reference;

import com.vcfops.client.transport.ApiTransport;
import com.vcfops.client.transport.TransportSettings;
import com.vcfops.client.transport.jdkhttp.JdkHttpApiTransport;
import com.vcfops.client.transport.okhttp.OkHttpApiTransport;
import com.vcfops.service.core.config.VcfOperationsProperties;
import java.util.Locale;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Picks the HTTP transport named by {@code vcf-operations.http.client}. */
@Slf4j
@Configuration
public class TransportConfig {

    @Bean(destroyMethod = "close")
    @ConditionalOnMissingBean
    public ApiTransport apiTransport(VcfOperationsProperties properties) {
        VcfOperationsProperties.Http http = properties.getHttp();
        TransportSettings settings =
                new TransportSettings(http.getConnectTimeout(), http.getReadTimeout(), http.getCallTimeout());
        String client = http.getClient() == null ? "okhttp" : http.getClient().trim().toLowerCase(Locale.ROOT);
        log.info("Using {} transport for VCF Operations ({})", client, settings);
        return switch (client) {
            case "okhttp" -> new OkHttpApiTransport(settings);
            case "jdk" -> new JdkHttpApiTransport(settings);
            default -> throw new IllegalStateException(
                    "Unsupported vcf-operations.http.client '" + http.getClient() + "' (expected okhttp or jdk)");
        };
    }
}
