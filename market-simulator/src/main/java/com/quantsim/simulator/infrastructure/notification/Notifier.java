package com.quantsim.simulator.infrastructure.notification;

import java.util.List;

/**
 * Delivers human-readable trading decisions to a recipient.
 */
public interface Notifier {

    void sendDecisions(String recipient, List<String> decisions);
}
