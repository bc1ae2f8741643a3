package com.vcfops.client.transport;

public enum ApiMethod {
    GET,
    POST
}
