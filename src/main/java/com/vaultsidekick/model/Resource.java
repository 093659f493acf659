package com.vaultsidekick.model;

import lombok.Builder;
import lombok.Value;

/**
 * A declared unit of secret material kept in sync with Vault.
 *
 * Identity is the kind + path composite and is fixed for the lifetime of the process.
 */
@Value
@Builder
public class Resource {

    /**
     * Kind whose payload carries a certificate expiration.
     */
    public static final String PKI_KIND = "pki";

    String kind;

    String path;

    /**
     * Number of failed attempts tolerated before the resource is given up on, 0 = unbounded.
     */
    int maxRetries;

    /**
     * Optional output file name; the writer derives one from the id when absent.
     */
    String fileName;

    public String getId() {
        return kind + ":" + path;
    }

    public boolean isExpiryBearing() {
        return PKI_KIND.equals(kind);
    }
}
