package com.quantsim.simulator.infrastructure.notification;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Notifier that writes decisions to the application log.
 */
@Component
@Slf4j
public class LoggingNotifier implements Notifier {

    @Override
    public void sendDecisions(String recipient, List<String> decisions) {
        if (decisions.isEmpty()) {
            return;
        }
        log.info("Investment decisions for {} ({} action(s)): {}", recipient, decisions.size(),
                String.join("; ", decisions));
    }
}
