package com.secops.riskengine.seeder;

import com.secops.riskengine.model.DetectorType;
import com.secops.riskengine.model.RiskRule;
import com.secops.riskengine.model.Severity;
import com.secops.riskengine.model.TimeWindow;

import java.util.ArrayList;
import java.util.List;

/**
 * Built-in rule catalog, one rule per monitored event type.
 * Deployments adjust these through the rule override file rather than code.
 */
public final class DefaultRiskRules {

    private DefaultRiskRules() {}

    public static List<RiskRule> create() {
        List<RiskRule> rules = new ArrayList<>();

        // Rule 1: every report export is a potential exfiltration
        rules.add(RiskRule.builder()
                .eventType("ReportExport")
                .description("Report Export")
                .rationale("Every report export is a potential data exfiltration risk")
                .severity(Severity.CRITICAL)
                .threshold(1)
                .timeWindow(TimeWindow.DAY)
                .countField("REPORT_ID")
                .build());

        // Rule 2: document downloads, also flagged on every download by the detector
        rules.add(RiskRule.builder()
                .eventType("DocumentAttachmentDownloads")
                .description("Document Download")
                .rationale("Every document download is a potential data exfiltration risk")
                .severity(Severity.CRITICAL)
                .threshold(1)
                .timeWindow(TimeWindow.HOUR)
                .countField("DOCUMENT_ID")
                .customDetector(DetectorType.DOCUMENT_DOWNLOAD)
                .build());

        // Rule 3: internal sharing volume
        rules.add(RiskRule.builder()
                .eventType("ContentDocumentLink")
                .description("Excessive Internal Sharing")
                .rationale("Excessive internal sharing may indicate staging for exfiltration")
                .severity(Severity.MEDIUM)
                .threshold(20)
                .timeWindow(TimeWindow.DAY)
                .countField("RELATED_RECORD_ID")
                .customDetector(DetectorType.CONTENT_SHARING_RATE)
                .build());

        // Rule 4: public links
        rules.add(RiskRule.builder()
                .eventType("ContentDistribution")
                .description("Public Sharing Activity")
                .rationale("Significant data exposure risk")
                .severity(Severity.CRITICAL)
                .threshold(5)
                .timeWindow(TimeWindow.DAY)
                .countField("CONTENT_ID")
                .build());

        // Rule 5: logins from several source IPs on one day
        rules.add(RiskRule.builder()
                .eventType("Login")
                .description("Multiple IP Logins")
                .rationale("Could indicate compromised credentials")
                .severity(Severity.HIGH)
                .threshold(3)
                .timeWindow(TimeWindow.DAY)
                .countField("SOURCE_IP")
                .build());

        // Rule 6
        rules.add(RiskRule.builder()
                .eventType("LoginAs")
                .description("Admin Impersonation")
                .rationale("Admin impersonation warrants review")
                .severity(Severity.HIGH)
                .threshold(1)
                .build());

        // Rule 7: guest user activity on public sites
        rules.add(RiskRule.builder()
                .eventType("Sites")
                .description("Internal Access via Guest User")
                .rationale("May indicate misuse of public access")
                .severity(Severity.HIGH)
                .threshold(3)
                .customDetector(DetectorType.GUEST_SENSITIVE_ACTION)
                .build());

        // Rule 8: bulk recon through search
        rules.add(RiskRule.builder()
                .eventType("Search")
                .description("Excessive Search Activity")
                .rationale("Bulk recon activity")
                .severity(Severity.HIGH)
                .threshold(100)
                .timeWindow(TimeWindow.HOUR)
                .customDetector(DetectorType.SEARCH_RATE)
                .build());

        // Rule 9
        rules.add(RiskRule.builder()
                .eventType("ApexCallout")
                .description("High Volume External Callouts")
                .rationale("May indicate external data exfiltration")
                .severity(Severity.HIGH)
                .threshold(30)
                .timeWindow(TimeWindow.HOUR)
                .countField("ENDPOINT_URL")
                .customDetector(DetectorType.CALLOUT_ENDPOINT)
                .build());

        // Rule 10: scraping through Visualforce pages
        rules.add(RiskRule.builder()
                .eventType("VisualforceRequest")
                .description("Possible Page Scraping")
                .rationale("Possible scraping or automation")
                .severity(Severity.HIGH)
                .threshold(100)
                .timeWindow(TimeWindow.HOUR)
                .countField("PAGE_NAME")
                .customDetector(DetectorType.VISUALFORCE_RATE)
                .build());

        // Rule 11: scraping through Lightning components
        rules.add(RiskRule.builder()
                .eventType("AuraRequest")
                .description("Excessive Component Loading")
                .rationale("Possible scraping or automation (Lightning specific)")
                .severity(Severity.HIGH)
                .threshold(800)
                .timeWindow(TimeWindow.HOUR)
                .countField("COMPONENT_NAME")
                .customDetector(DetectorType.AURA_REQUEST_RATE)
                .build());

        // Rule 12
        rules.add(RiskRule.builder()
                .eventType("LightningPageView")
                .description("Unusual Page View Volume")
                .rationale("Recon or bulk record viewing")
                .severity(Severity.HIGH)
                .threshold(200)
                .timeWindow(TimeWindow.HOUR)
                .countField("PAGE_ENTITY_TYPE")
                .customDetector(DetectorType.PAGE_VIEW_RATE)
                .build());

        // Rule 13
        rules.add(RiskRule.builder()
                .eventType("Dashboard")
                .description("Multiple Dashboard Access")
                .rationale("Unusual recon or data collection")
                .severity(Severity.MEDIUM)
                .threshold(100)
                .timeWindow(TimeWindow.HOUR)
                .customDetector(DetectorType.DASHBOARD_RATE)
                .build());

        // Rule 14: reports run in the background can stage data for export
        rules.add(RiskRule.builder()
                .eventType("AsyncReportRun")
                .description("Background Report Execution")
                .rationale("Every background report execution is a potential data staging risk")
                .severity(Severity.CRITICAL)
                .threshold(1)
                .timeWindow(TimeWindow.DAY)
                .build());

        // Rule 15
        rules.add(RiskRule.builder()
                .eventType("FlowExecution")
                .description("Manual Flow Trigger")
                .rationale("Direct process manipulation")
                .severity(Severity.HIGH)
                .threshold(3)
                .countField("FLOW_NAME")
                .customDetector(DetectorType.SENSITIVE_FLOW)
                .build());

        // Rule 16: only anonymous, execute-anonymous and web service executions are counted
        rules.add(RiskRule.builder()
                .eventType("ApexExecution")
                .description("Direct Apex Execution")
                .rationale("Possible direct manipulation or abuse")
                .severity(Severity.CRITICAL)
                .threshold(3)
                .countField("QUIDDITY")
                .countedValues(List.of("A", "X", "W"))
                .customDetector(DetectorType.APEX_EXECUTION_RATE)
                .build());

        // Rule 17
        rules.add(RiskRule.builder()
                .eventType("ApexTriggerExecution")
                .description("Apex Trigger Spike")
                .rationale("Unusual mass-trigger events")
                .severity(Severity.MEDIUM)
                .threshold(150)
                .timeWindow(TimeWindow.DAY)
                .countField("TRIGGER_NAME")
                .build());

        // Rule 18: the platform's own anomaly detection already flagged this
        rules.add(RiskRule.builder()
                .eventType("ApiAnomalyEventStore")
                .description("API Anomaly Detected")
                .rationale("Platform detected an API anomaly")
                .severity(Severity.CRITICAL)
                .threshold(3)
                .customDetector(DetectorType.PLATFORM_API_ANOMALY)
                .build());

        // Rule 19
        rules.add(RiskRule.builder()
                .eventType("BulkApiRequest")
                .description("Bulk API Usage")
                .rationale("Mass data operations through API")
                .severity(Severity.MEDIUM)
                .threshold(10)
                .timeWindow(TimeWindow.DAY)
                .countField("OPERATION_TYPE")
                .customDetector(DetectorType.BULK_API_VOLUME)
                .build());

        // Rule 20
        rules.add(RiskRule.builder()
                .eventType("PermissionSetAssignment")
                .description("Permission Changes")
                .rationale("Permission changes could indicate privilege escalation")
                .severity(Severity.HIGH)
                .threshold(3)
                .customDetector(DetectorType.PRIVILEGED_PERMISSION_SET)
                .build());

        // Rule 21
        rules.add(RiskRule.builder()
                .eventType("LightningError")
                .description("Unusual Error Rate")
                .rationale("High error rates may indicate attempted exploitation")
                .severity(Severity.MEDIUM)
                .threshold(30)
                .timeWindow(TimeWindow.HOUR)
                .countField("ERROR_TYPE")
                .build());

        // Rule 22
        rules.add(RiskRule.builder()
                .eventType("LogoutEvent")
                .description("Unusual Logout Pattern")
                .rationale("Excessive login/logout cycles may indicate session harvesting")
                .severity(Severity.LOW)
                .threshold(15)
                .timeWindow(TimeWindow.DAY)
                .build());

        // Rule 23
        rules.add(RiskRule.builder()
                .eventType("DataExport")
                .description("Organization Data Export")
                .rationale("Every org data export is a critical security event")
                .severity(Severity.CRITICAL)
                .threshold(1)
                .build());

        return rules;
    }
}
