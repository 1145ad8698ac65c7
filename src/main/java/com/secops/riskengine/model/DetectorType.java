package com.secops.riskengine.model;

/**
 * Identifies the custom detection strategy attached to a rule.
 */
public enum DetectorType {
    DOCUMENT_DOWNLOAD,
    CONTENT_SHARING_RATE,
    GUEST_SENSITIVE_ACTION,
    SEARCH_RATE,
    CALLOUT_ENDPOINT,
    VISUALFORCE_RATE,
    AURA_REQUEST_RATE,
    PAGE_VIEW_RATE,
    DASHBOARD_RATE,
    SENSITIVE_FLOW,
    APEX_EXECUTION_RATE,
    PLATFORM_API_ANOMALY,
    BULK_API_VOLUME,
    PRIVILEGED_PERMISSION_SET
}
