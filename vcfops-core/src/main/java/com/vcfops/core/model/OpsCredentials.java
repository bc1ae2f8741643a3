package com.vcfops.core.model;

/** Username/password pair exchanged for a session token. */
public record OpsCredentials(String username, String password) {

    @Override
    public String toString() {
        return "OpsCredentials[username=" + username + ", password=****]";
    }
}
