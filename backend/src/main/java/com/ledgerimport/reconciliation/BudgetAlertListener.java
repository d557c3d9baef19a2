package com.ledgerimport.reconciliation;

import com.ledgerimport.config.AsyncConfig;
import com.ledgerimport.domain.BudgetVarianceAlertEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;

/**
 * Default sink for variance alerts: structured warn log off the approval thread. Notification delivery belongs to
 * downstream consumers of the same event.
 */
@Component
@Slf4j
public class BudgetAlertListener {

    @EventListener
    @Async(AsyncConfig.RECONCILIATION_EXECUTOR)
    public void onVarianceAlert(BudgetVarianceAlertEvent event) {
        if (event.categoryId() == null) {
            log.warn("Budget {} {}: {} (variance {})", event.budgetId(), event.severity(), event.message(),
                    event.variance());
        } else {
            log.warn("Budget {} category {} {}: {} (variance {})", event.budgetId(), event.categoryId(),
                    event.severity(), event.message(), event.variance());
        }
    }
}
