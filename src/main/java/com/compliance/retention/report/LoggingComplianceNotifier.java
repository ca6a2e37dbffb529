package com.compliance.retention.report;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Default notifier: writes the payload to the log.
 */
public class LoggingComplianceNotifier implements ComplianceNotifier {
    private static final Logger log = LoggerFactory.getLogger(LoggingComplianceNotifier.class);

    @Override
    public void send(NotificationPayload payload) {
        log.info("retention.notification subject=\"{}\" status={} manifestId={} summary={}",
                payload.subject(), payload.complianceStatus(), payload.manifestId(), payload.processSummary());
    }
}
