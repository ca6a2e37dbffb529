package com.compliance.retention.report;

/**
 * Sink for end-of-cycle notifications. Delivery transport is up to the implementation.
 */
@FunctionalInterface
public interface ComplianceNotifier {

    void send(NotificationPayload payload);
}
