package com.vaultsidekick.metrics;

import java.util.List;

import static com.vaultsidekick.metrics.MetricDescriptor.Kind.COUNTER;
import static com.vaultsidekick.metrics.MetricDescriptor.Kind.GAUGE;

/**
 * Every metric family the sidekick can ever emit. Fixed for the lifetime of the process.
 */
public final class MetricFamilies {

    public static final String RESOURCE_ID_LABEL = "resource_id";
    public static final String STAGE_LABEL = "stage";
    public static final String ERROR_LABEL = "error";
    public static final String ROLE_LABEL = "role";

    private static final List<String> RESOURCE_LABELS = List.of(RESOURCE_ID_LABEL, ROLE_LABEL);
    private static final List<String> STAGE_LABELS = List.of(RESOURCE_ID_LABEL, STAGE_LABEL, ROLE_LABEL);
    private static final List<String> ROLE_ONLY = List.of(ROLE_LABEL);

    public static final MetricDescriptor CERTIFICATE_EXPIRY = new MetricDescriptor(
            "vault_sidekick_certificate_expiry_gauge", GAUGE, RESOURCE_LABELS,
            "Seconds until the certificate of a pki resource expires");

    public static final MetricDescriptor RESOURCE_TOTAL = new MetricDescriptor(
            "vault_sidekick_resource_total_counter", COUNTER, RESOURCE_LABELS,
            "Fetch or renew attempts per resource");
    public static final MetricDescriptor RESOURCE_SUCCESS = new MetricDescriptor(
            "vault_sidekick_resource_success_counter", COUNTER, RESOURCE_LABELS,
            "Successful fetch or renew attempts per resource");
    public static final MetricDescriptor RESOURCE_ERROR = new MetricDescriptor(
            "vault_sidekick_resource_error_counter", COUNTER, RESOURCE_LABELS,
            "Failed fetch or renew attempts per resource");

    public static final MetricDescriptor STAGE_TOTAL = new MetricDescriptor(
            "vault_sidekick_stage_total_counter", COUNTER, STAGE_LABELS,
            "Processing stage executions per resource");
    public static final MetricDescriptor STAGE_SUCCESS = new MetricDescriptor(
            "vault_sidekick_stage_success_counter", COUNTER, STAGE_LABELS,
            "Successful processing stage executions per resource");
    public static final MetricDescriptor STAGE_ERROR = new MetricDescriptor(
            "vault_sidekick_stage_error_counter", COUNTER, STAGE_LABELS,
            "Failed processing stage executions per resource");

    public static final MetricDescriptor AUTH_TOTAL = new MetricDescriptor(
            "vault_sidekick_auth_total_counter", COUNTER, ROLE_ONLY,
            "Authentication attempts against Vault");
    public static final MetricDescriptor AUTH_SUCCESS = new MetricDescriptor(
            "vault_sidekick_auth_success_counter", COUNTER, ROLE_ONLY,
            "Successful authentication attempts against Vault");
    public static final MetricDescriptor AUTH_ERROR = new MetricDescriptor(
            "vault_sidekick_auth_error_counter", COUNTER, ROLE_ONLY,
            "Failed authentication attempts against Vault");

    public static final MetricDescriptor GENERIC_ERROR = new MetricDescriptor(
            "vault_sidekick_error_counter", COUNTER, List.of(ERROR_LABEL, ROLE_LABEL),
            "Errors not tied to a fetch attempt, by reason");

    public static final List<MetricDescriptor> ALL = List.of(
            CERTIFICATE_EXPIRY,
            RESOURCE_TOTAL, RESOURCE_SUCCESS, RESOURCE_ERROR,
            STAGE_TOTAL, STAGE_SUCCESS, STAGE_ERROR,
            AUTH_TOTAL, AUTH_SUCCESS, AUTH_ERROR,
            GENERIC_ERROR
    );

    private MetricFamilies() {
    }
}
