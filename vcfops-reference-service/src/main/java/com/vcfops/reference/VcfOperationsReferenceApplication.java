package com.vcfops.reference;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@Slf4j
@SpringBootApplication(scanBasePackages = {"com.vcfops"})
public class VcfOperationsReferenceApplication {

    public static void main(String[] args) {
        log.info("Starting VCF Operations reference service (java {})", Runtime.version());
        SpringApplication.run(VcfOperationsReferenceApplication.class, args);
    }
}
