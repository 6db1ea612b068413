package com.rental.settlement.core;

import com.rental.settlement.api.InvalidStateException;
import com.rental.settlement.api.ResourceNotFoundException;
import com.rental.settlement.domain.ConversationParties;
import com.rental.settlement.domain.DealPaymentStatus;
import com.rental.settlement.domain.DealStatus;
import com.rental.settlement.domain.DealView;
import com.rental.settlement.domain.PartySummary;
import com.rental.settlement.domain.PropertySummary;
import com.rental.settlement.domain.UserRole;
import com.rental.settlement.messaging.NotificationDispatcher;
import com.rental.settlement.persistence.service.DealLedgerService;
import com.rental.settlement.persistence.service.DealLedgerService.ConfirmationResult;
import com.rental.settlement.persistence.service.DealLedgerService.DealOpening;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.dao.DataIntegrityViolationException;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class DealStateMachineTest {

    private static final String CONVERSATION_ID = "conv-1";
    private static final String OWNER_ID = "owner-1";
    private static final String TENANT_ID = "tenant-1";
    private static final String PROPERTY_ID = "prop-1";
    private static final String DEAL_ID = "deal-1";

    @Mock private ConversationDirectory conversationDirectory;
    @Mock private DealLedgerService dealLedger;
    @Mock private UserDirectory userDirectory;
    @Mock private PropertyCatalog propertyCatalog;
    @Mock private NotificationDispatcher notificationDispatcher;

    private DealStateMachine stateMachine;

    private final ConversationParties parties = ConversationParties.builder()
            .conversationId(CONVERSATION_ID)
            .propertyId(PROPERTY_ID)
            .ownerId(OWNER_ID)
            .tenantId(TENANT_ID)
            .agreedRentDefault(18_000)
            .build();

    @BeforeEach
    void setUp() {
        stateMachine = new DealStateMachine(conversationDirectory, dealLedger, userDirectory, propertyCatalog, notificationDispatcher);
        when(userDirectory.findUser(OWNER_ID)).thenReturn(Optional.of(PartySummary.builder()
                .id(OWNER_ID).firstName("Asha").lastName("Rao").email("asha@example.com").build()));
        when(userDirectory.findUser(TENANT_ID)).thenReturn(Optional.of(PartySummary.builder()
                .id(TENANT_ID).firstName("Vikram").lastName("Shah").email("vikram@example.com").build()));
        when(propertyCatalog.findProperty(PROPERTY_ID)).thenReturn(Optional.of(PropertySummary.builder()
                .id(PROPERTY_ID).title("2BHK in Indiranagar").city("Bengaluru").rentAmount(18_000).build()));
    }

    private DealView deal(boolean ownerConfirmed, boolean tenantConfirmed) {
        DealStatus status = DealStatus.derive(ownerConfirmed, tenantConfirmed, false);
        return DealView.builder()
                .id(DEAL_ID)
                .conversationId(CONVERSATION_ID)
                .propertyId(PROPERTY_ID)
                .ownerId(OWNER_ID)
                .tenantId(TENANT_ID)
                .agreedRent(18_000)
                .ownerConfirmed(ownerConfirmed)
                .tenantConfirmed(tenantConfirmed)
                .status(status)
                .successFeeAmount(status == DealStatus.COMPLETED ? 499 : null)
                .paymentStatus(DealPaymentStatus.UNPAID)
                .build();
    }

    @Test
    void ownerConfirmOnNewDealNotifiesTenantOfCreation() {
        when(conversationDirectory.findConversationForParty(CONVERSATION_ID, OWNER_ID, UserRole.OWNER)).thenReturn(Optional.of(parties));
        when(dealLedger.openDeal(parties, 20_000)).thenReturn(new DealOpening(deal(false, false), true));
        when(dealLedger.applyConfirmation(DEAL_ID, UserRole.OWNER, 20_000))
                .thenReturn(new ConfirmationResult(deal(true, false), false));

        DealView result = stateMachine.ownerConfirm(CONVERSATION_ID, OWNER_ID, 20_000);

        assertThat(result.getStatus()).isEqualTo(DealStatus.PENDING_TENANT);
        assertThat(result.getOwner().getFullName()).isEqualTo("Asha Rao");
        assertThat(result.getTenant().getEmail()).isEqualTo("vikram@example.com");
        assertThat(result.getProperty().getTitle()).isEqualTo("2BHK in Indiranagar");
        verify(notificationDispatcher).dealCreated(any(DealView.class), eq(UserRole.TENANT));
        verify(notificationDispatcher, never()).dealCompleted(any());
    }

    @Test
    void secondConfirmationCompletesDealAndNotifiesBothParties() {
        when(conversationDirectory.findConversationForParty(CONVERSATION_ID, TENANT_ID, UserRole.TENANT)).thenReturn(Optional.of(parties));
        when(dealLedger.openDeal(parties, null)).thenReturn(new DealOpening(deal(true, false), false));
        when(dealLedger.applyConfirmation(DEAL_ID, UserRole.TENANT, null))
                .thenReturn(new ConfirmationResult(deal(true, true), true));

        DealView result = stateMachine.tenantConfirm(CONVERSATION_ID, TENANT_ID);

        assertThat(result.getStatus()).isEqualTo(DealStatus.COMPLETED);
        assertThat(result.getSuccessFeeAmount()).isEqualTo(499);
        ArgumentCaptor<DealView> captor = ArgumentCaptor.forClass(DealView.class);
        verify(notificationDispatcher).dealCompleted(captor.capture());
        assertThat(captor.getValue().getOwner()).isNotNull();
        assertThat(captor.getValue().getTenant()).isNotNull();
        verify(notificationDispatcher, never()).dealCreated(any(), any());
    }

    @Test
    void repeatedConfirmationOfCompletedDealSendsNothing() {
        when(conversationDirectory.findConversationForParty(CONVERSATION_ID, OWNER_ID, UserRole.OWNER)).thenReturn(Optional.of(parties));
        when(dealLedger.openDeal(parties, null)).thenReturn(new DealOpening(deal(true, true), false));
        when(dealLedger.applyConfirmation(DEAL_ID, UserRole.OWNER, null))
                .thenReturn(new ConfirmationResult(deal(true, true), false));

        DealView result = stateMachine.ownerConfirm(CONVERSATION_ID, OWNER_ID, null);

        assertThat(result.getStatus()).isEqualTo(DealStatus.COMPLETED);
        verifyNoInteractions(notificationDispatcher);
    }

    @Test
    void unknownConversationIsNotFound() {
        when(conversationDirectory.findConversationForParty(CONVERSATION_ID, TENANT_ID, UserRole.TENANT)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> stateMachine.tenantConfirm(CONVERSATION_ID, TENANT_ID))
                .isInstanceOf(ResourceNotFoundException.class)
                .extracting("errorCode").isEqualTo(ResourceNotFoundException.CONVERSATION_NOT_FOUND);
        verifyNoInteractions(dealLedger);
    }

    @Test
    void cancelledDealRejectsConfirmation() {
        when(conversationDirectory.findConversationForParty(CONVERSATION_ID, OWNER_ID, UserRole.OWNER)).thenReturn(Optional.of(parties));
        when(dealLedger.openDeal(parties, null)).thenReturn(new DealOpening(deal(false, false), false));
        when(dealLedger.applyConfirmation(DEAL_ID, UserRole.OWNER, null))
                .thenThrow(new InvalidStateException(InvalidStateException.INVALID_DEAL_STATUS, "Deal has been cancelled"));

        assertThatThrownBy(() -> stateMachine.ownerConfirm(CONVERSATION_ID, OWNER_ID, null))
                .isInstanceOf(InvalidStateException.class);
        verifyNoInteractions(notificationDispatcher);
    }

    @Test
    void lostInsertRaceUsesExistingDealAndDoesNotAnnounceCreation() {
        when(conversationDirectory.findConversationForParty(CONVERSATION_ID, TENANT_ID, UserRole.TENANT)).thenReturn(Optional.of(parties));
        when(dealLedger.openDeal(parties, null)).thenThrow(new DataIntegrityViolationException("uk_deal_conversation"));
        when(dealLedger.findByConversationForParticipant(CONVERSATION_ID, TENANT_ID)).thenReturn(Optional.of(deal(false, false)));
        when(dealLedger.applyConfirmation(DEAL_ID, UserRole.TENANT, null))
                .thenReturn(new ConfirmationResult(deal(false, true), false));

        DealView result = stateMachine.tenantConfirm(CONVERSATION_ID, TENANT_ID);

        assertThat(result.getStatus()).isEqualTo(DealStatus.PENDING_OWNER);
        verify(notificationDispatcher, never()).dealCreated(any(), any());
    }

    @Test
    void rejectedNotificationDoesNotFailConfirmation() {
        when(conversationDirectory.findConversationForParty(CONVERSATION_ID, TENANT_ID, UserRole.TENANT)).thenReturn(Optional.of(parties));
        when(dealLedger.openDeal(parties, null)).thenReturn(new DealOpening(deal(true, false), false));
        when(dealLedger.applyConfirmation(DEAL_ID, UserRole.TENANT, null))
                .thenReturn(new ConfirmationResult(deal(true, true), true));
        doThrow(new TaskRejectedException("queue full")).when(notificationDispatcher).dealCompleted(any());

        DealView result = stateMachine.tenantConfirm(CONVERSATION_ID, TENANT_ID);

        assertThat(result.getStatus()).isEqualTo(DealStatus.COMPLETED);
    }

    @Test
    void getOrCreateNotifiesOtherPartyOnlyWhenCreated() {
        when(conversationDirectory.findConversationForParticipant(CONVERSATION_ID, TENANT_ID)).thenReturn(Optional.of(parties));
        when(dealLedger.openDeal(parties, null)).thenReturn(new DealOpening(deal(false, false), true));

        DealView result = stateMachine.getOrCreateDeal(CONVERSATION_ID, TENANT_ID, null);

        assertThat(result.getStatus()).isEqualTo(DealStatus.PENDING_BOTH);
        verify(notificationDispatcher).dealCreated(any(DealView.class), eq(UserRole.OWNER));
    }

    @Test
    void getDealByConversationIsEmptyForStrangers() {
        when(dealLedger.findByConversationForParticipant(CONVERSATION_ID, "stranger")).thenReturn(Optional.empty());

        assertThat(stateMachine.getDealByConversation(CONVERSATION_ID, "stranger")).isEmpty();
    }

    @Test
    void getUserDealsAttachesSummaries() {
        when(dealLedger.findUserDeals(OWNER_ID, UserRole.OWNER)).thenReturn(List.of(deal(true, true), deal(false, false)));

        List<DealView> deals = stateMachine.getUserDeals(OWNER_ID, UserRole.OWNER);

        assertThat(deals).hasSize(2).allSatisfy(d -> assertThat(d.getProperty()).isNotNull());
    }

    @Test
    void cancelDelegatesToLedger() {
        DealView cancelled = deal(true, false).toBuilder().status(DealStatus.CANCELLED).build();
        when(dealLedger.cancel(DEAL_ID, OWNER_ID)).thenReturn(cancelled);

        assertThat(stateMachine.cancelDeal(DEAL_ID, OWNER_ID).getStatus()).isEqualTo(DealStatus.CANCELLED);
        verify(userDirectory, times(2)).findUser(anyString());
    }
}
