package com.flagship.revenue_ledger.outbox;

import com.flagship.revenue_ledger.events.LedgerEvent;
import com.flagship.revenue_ledger.events.LedgerEventPublisher;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Routes ledger events through the transactional outbox.
 */
@Component
@RequiredArgsConstructor
public class OutboxLedgerEventPublisher implements LedgerEventPublisher {

    private final OutboxService outboxService;

    @Override
    public void publish(LedgerEvent event) {
        outboxService.saveEvent(event.getAggregateType(), event.getAggregateId(),
                event.getEventType(), event);
    }
}
