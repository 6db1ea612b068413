package com.rental.settlement.messaging;

import com.rental.settlement.domain.DealView;
import com.rental.settlement.domain.NotificationKind;
import com.rental.settlement.domain.PartySummary;
import com.rental.settlement.domain.UserRole;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Sends deal notifications on the bounded {@code notificationExecutor}. Every failure is
 * logged and dropped here; nothing propagates back to the deal workflow.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class NotificationDispatcher {

    private final Notifier notifier;

    /**
     * Tells the party that did not act yet that a deal was opened for their conversation.
     *
     * @param recipientRole OWNER or TENANT
     */
    @Async("notificationExecutor")
    public void dealCreated(DealView deal, UserRole recipientRole) {
        PartySummary recipient = recipientRole == UserRole.OWNER ? deal.getOwner() : deal.getTenant();
        PartySummary counterpart = recipientRole == UserRole.OWNER ? deal.getTenant() : deal.getOwner();
        Map<String, Object> data = baseData(deal, recipientRole);
        data.put("otherPartyName", counterpart != null ? counterpart.getFullName() : null);
        send(NotificationKind.DEAL_CREATED, deal, recipient, data);
    }

    /** Tells both parties the deal is complete. One failed recipient does not stop the other. */
    @Async("notificationExecutor")
    public void dealCompleted(DealView deal) {
        send(NotificationKind.DEAL_COMPLETED, deal, deal.getOwner(), completedData(deal, UserRole.OWNER));
        send(NotificationKind.DEAL_COMPLETED, deal, deal.getTenant(), completedData(deal, UserRole.TENANT));
    }

    private Map<String, Object> completedData(DealView deal, UserRole role) {
        Map<String, Object> data = baseData(deal, role);
        data.put("successFeeAmount", deal.getSuccessFeeAmount());
        return data;
    }

    private Map<String, Object> baseData(DealView deal, UserRole role) {
        Map<String, Object> data = new HashMap<>();
        data.put("dealId", deal.getId());
        data.put("propertyTitle", deal.getProperty() != null ? deal.getProperty().getTitle() : null);
        data.put("agreedRent", deal.getAgreedRent());
        data.put("role", role.name().toLowerCase(Locale.ROOT));
        return data;
    }

    private void send(NotificationKind kind, DealView deal, PartySummary recipient, Map<String, Object> data) {
        if (recipient == null) {
            log.warn("No recipient details for {} notification of dealId={}", kind, deal.getId());
            return;
        }
        try {
            NotificationOutcome outcome = notifier.notify(kind, recipient.getEmail(), recipient.getFirstName(), data, recipient.getId());
            log.debug("{} notification for dealId={} userId={}: {}", kind, deal.getId(), recipient.getId(), outcome);
        } catch (Exception e) {
            log.error("Failed to send {} notification for dealId={} to userId={}", kind, deal.getId(), recipient.getId(), e);
        }
    }
}
