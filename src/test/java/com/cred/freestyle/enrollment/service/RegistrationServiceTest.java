package com.cred.freestyle.enrollment.service;

import com.cred.freestyle.enrollment.domain.model.Offering;
import com.cred.freestyle.enrollment.domain.model.Offering.OfferingStatus;
import com.cred.freestyle.enrollment.domain.model.Registration;
import com.cred.freestyle.enrollment.domain.model.Registration.PaymentStatus;
import com.cred.freestyle.enrollment.domain.model.Registration.RegistrationStatus;
import com.cred.freestyle.enrollment.domain.model.WaitlistEntry;
import com.cred.freestyle.enrollment.exception.EnrollmentException;
import com.cred.freestyle.enrollment.exception.ErrorCode;
import com.cred.freestyle.enrollment.infrastructure.metrics.EnrollmentMetricsService;
import com.cred.freestyle.enrollment.infrastructure.notification.EnrollmentNotifier;
import com.cred.freestyle.enrollment.infrastructure.payment.CheckoutSession;
import com.cred.freestyle.enrollment.repository.OfferingRepository;
import com.cred.freestyle.enrollment.repository.RegistrationRepository;
import com.cred.freestyle.enrollment.repository.WaitlistEntryRepository;
import com.cred.freestyle.enrollment.security.SubjectContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.transaction.PlatformTransactionManager;

import java.time.Clock;
import java.time.Duration;
import java.time.ZoneOffset;
import java.util.Optional;

import static com.cred.freestyle.enrollment.testutil.TestDataBuilder.*;
import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for RegistrationService.
 * Collaborators are mocked; the transaction manager is a mock so
 * TransactionTemplate runs its callback inline.
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("RegistrationService Unit Tests")
class RegistrationServiceTest {

    @Mock
    private OfferingRepository offeringRepository;

    @Mock
    private RegistrationRepository registrationRepository;

    @Mock
    private WaitlistEntryRepository waitlistEntryRepository;

    @Mock
    private RegistrationLedgerService registrationLedgerService;

    @Mock
    private WaitlistQueueService waitlistQueueService;

    @Mock
    private WaitlistService waitlistService;

    @Mock
    private CheckoutService checkoutService;

    @Mock
    private EnrollmentNotifier notifier;

    @Mock
    private EnrollmentMetricsService metricsService;

    @Mock
    private PlatformTransactionManager transactionManager;

    private RegistrationService registrationService;

    private SubjectContext subject;

    @BeforeEach
    void setUp() {
        registrationService = new RegistrationService(
                offeringRepository,
                registrationRepository,
                waitlistEntryRepository,
                registrationLedgerService,
                waitlistQueueService,
                waitlistService,
                checkoutService,
                notifier,
                metricsService,
                Clock.fixed(NOW, ZoneOffset.UTC),
                transactionManager
        );
        subject = member("member-1");
    }

    private void givenNoLiveRows() {
        when(registrationRepository.findByLiveKey(anyString())).thenReturn(Optional.empty());
        when(waitlistEntryRepository.findByLiveKey(anyString())).thenReturn(Optional.empty());
    }

    // ========================================
    // register() Tests
    // ========================================

    @Test
    @DisplayName("register - Free offering with a seat: Should confirm immediately")
    void register_FreeOffering_Confirms() {
        // Given
        Offering offering = offering().capacity(10).confirmedSeats(3).build();
        Registration confirmed = registration().offering(offering).build();

        when(offeringRepository.findByIdForUpdate(offering.getOfferingId())).thenReturn(Optional.of(offering));
        givenNoLiveRows();
        when(waitlistQueueService.outstandingOffers(offering.getOfferingId())).thenReturn(0L);
        when(registrationLedgerService.open(offering, subject, NOW)).thenReturn(confirmed);

        // When
        RegistrationResult result = registrationService.register(subject, offering.getOfferingId());

        // Then
        assertThat(result.getOutcome()).isEqualTo(RegistrationResult.Outcome.CONFIRMED);
        assertThat(result.getRegistration()).isSameAs(confirmed);
        verify(notifier).registrationConfirmed(confirmed, offering);
        verify(metricsService).recordRegistrationOutcome("CONFIRMED");
        verify(metricsService).recordRegistrationLatency(anyLong());
        verifyNoInteractions(checkoutService);
        verify(waitlistQueueService, never()).enqueue(any(), any(), any());
    }

    @Test
    @DisplayName("register - Paid offering: Should return checkout required with the session")
    void register_PaidOffering_StartsCheckout() {
        // Given
        Offering offering = offering().paid("50.00").build();
        Registration pending = registration().offering(offering).pendingPayment().build();
        CheckoutSession session = new CheckoutSession("cs_1", "https://pay.test/cs_1");
        RegistrationResult withSession = RegistrationResult.checkoutRequired(offering, pending, session);

        when(offeringRepository.findByIdForUpdate(offering.getOfferingId())).thenReturn(Optional.of(offering));
        givenNoLiveRows();
        when(waitlistQueueService.outstandingOffers(offering.getOfferingId())).thenReturn(0L);
        when(registrationLedgerService.open(offering, subject, NOW)).thenReturn(pending);
        when(checkoutService.startCheckout(offering, pending)).thenReturn(withSession);

        // When
        RegistrationResult result = registrationService.register(subject, offering.getOfferingId());

        // Then
        assertThat(result.getOutcome()).isEqualTo(RegistrationResult.Outcome.CHECKOUT_REQUIRED);
        assertThat(result.getCheckoutSession().getSessionId()).isEqualTo("cs_1");
        verify(notifier, never()).registrationConfirmed(any(), any());
        verify(metricsService).recordRegistrationOutcome("CHECKOUT_REQUIRED");
    }

    @Test
    @DisplayName("register - Offering full: Should join the waitlist")
    void register_OfferingFull_Waitlists() {
        // Given
        Offering offering = offering().capacity(1).confirmedSeats(1).build();
        WaitlistEntry entry = waitlistEntry().offering(offering).subjectId("member-1").build();

        when(offeringRepository.findByIdForUpdate(offering.getOfferingId())).thenReturn(Optional.of(offering));
        givenNoLiveRows();
        when(waitlistQueueService.outstandingOffers(offering.getOfferingId())).thenReturn(0L);
        when(waitlistQueueService.enqueue(offering, subject, NOW)).thenReturn(entry);

        // When
        RegistrationResult result = registrationService.register(subject, offering.getOfferingId());

        // Then
        assertThat(result.getOutcome()).isEqualTo(RegistrationResult.Outcome.WAITLISTED);
        assertThat(result.getWaitlistEntry().getPosition()).isEqualTo(1);
        verify(notifier).waitlistJoined(entry, offering);
        verify(metricsService).recordWaitlistTransition("JOINED");
        verify(registrationLedgerService, never()).open(any(), any(), any());
    }

    @Test
    @DisplayName("register - Last free seat already offered to the waitlist: Should join the waitlist")
    void register_SeatPromisedToWaitlist_Waitlists() {
        // Given
        Offering offering = offering().capacity(2).confirmedSeats(1).build();
        WaitlistEntry entry = waitlistEntry().offering(offering).subjectId("member-1").position(2).build();

        when(offeringRepository.findByIdForUpdate(offering.getOfferingId())).thenReturn(Optional.of(offering));
        givenNoLiveRows();
        when(waitlistQueueService.outstandingOffers(offering.getOfferingId())).thenReturn(1L);
        when(waitlistQueueService.enqueue(offering, subject, NOW)).thenReturn(entry);

        // When
        RegistrationResult result = registrationService.register(subject, offering.getOfferingId());

        // Then
        assertThat(result.getOutcome()).isEqualTo(RegistrationResult.Outcome.WAITLISTED);
        verify(registrationLedgerService, never()).open(any(), any(), any());
    }

    @Test
    @DisplayName("register - Offering not open: Should reject with OFFERING_NOT_OPEN")
    void register_OfferingNotOpen_Rejects() {
        // Given
        Offering offering = offering().status(OfferingStatus.DRAFT).build();
        when(offeringRepository.findByIdForUpdate(offering.getOfferingId())).thenReturn(Optional.of(offering));

        // When / Then
        assertThatThrownBy(() -> registrationService.register(subject, offering.getOfferingId()))
                .isInstanceOf(EnrollmentException.class)
                .extracting(e -> ((EnrollmentException) e).getErrorCode())
                .isEqualTo(ErrorCode.OFFERING_NOT_OPEN);

        verify(metricsService).recordRegistrationRejected("OFFERING_NOT_OPEN");
        verify(metricsService).recordRegistrationLatency(anyLong());
        verifyNoInteractions(registrationLedgerService, waitlistQueueService);
    }

    @Test
    @DisplayName("register - Deadline passed: Should reject with DEADLINE_PASSED")
    void register_DeadlinePassed_Rejects() {
        // Given
        Offering offering = offering().registrationDeadline(NOW.minus(Duration.ofMinutes(1))).build();
        when(offeringRepository.findByIdForUpdate(offering.getOfferingId())).thenReturn(Optional.of(offering));

        // When / Then
        assertThatThrownBy(() -> registrationService.register(subject, offering.getOfferingId()))
                .isInstanceOf(EnrollmentException.class)
                .extracting(e -> ((EnrollmentException) e).getErrorCode())
                .isEqualTo(ErrorCode.DEADLINE_PASSED);
    }

    @Test
    @DisplayName("register - Live registration exists: Should reject with ALREADY_REGISTERED")
    void register_AlreadyRegistered_Rejects() {
        // Given
        Offering offering = offering().build();
        Registration existing = registration().offering(offering).build();
        when(offeringRepository.findByIdForUpdate(offering.getOfferingId())).thenReturn(Optional.of(offering));
        when(registrationRepository.findByLiveKey(offering.getOfferingId() + ":member-1"))
                .thenReturn(Optional.of(existing));

        // When / Then
        assertThatThrownBy(() -> registrationService.register(subject, offering.getOfferingId()))
                .isInstanceOf(EnrollmentException.class)
                .extracting(e -> ((EnrollmentException) e).getErrorCode())
                .isEqualTo(ErrorCode.ALREADY_REGISTERED);

        verify(metricsService).recordRegistrationRejected("ALREADY_REGISTERED");
    }

    @Test
    @DisplayName("register - Live waitlist entry exists: Should reject with ALREADY_WAITLISTED")
    void register_AlreadyWaitlisted_Rejects() {
        // Given
        Offering offering = offering().build();
        WaitlistEntry existing = waitlistEntry().offering(offering).subjectId("member-1").build();
        when(offeringRepository.findByIdForUpdate(offering.getOfferingId())).thenReturn(Optional.of(offering));
        when(registrationRepository.findByLiveKey(anyString())).thenReturn(Optional.empty());
        when(waitlistEntryRepository.findByLiveKey(offering.getOfferingId() + ":member-1"))
                .thenReturn(Optional.of(existing));

        // When / Then
        assertThatThrownBy(() -> registrationService.register(subject, offering.getOfferingId()))
                .isInstanceOf(EnrollmentException.class)
                .extracting(e -> ((EnrollmentException) e).getErrorCode())
                .isEqualTo(ErrorCode.ALREADY_WAITLISTED);
    }

    @Test
    @DisplayName("register - Unknown offering: Should reject with OFFERING_NOT_FOUND")
    void register_UnknownOffering_Rejects() {
        // Given
        when(offeringRepository.findByIdForUpdate("missing")).thenReturn(Optional.empty());

        // When / Then
        assertThatThrownBy(() -> registrationService.register(subject, "missing"))
                .isInstanceOf(EnrollmentException.class)
                .extracting(e -> ((EnrollmentException) e).getErrorCode())
                .isEqualTo(ErrorCode.OFFERING_NOT_FOUND);
    }

    // ========================================
    // confirmPayment() Tests
    // ========================================

    @Test
    @DisplayName("confirmPayment - Pending registration with a free seat: Should confirm")
    void confirmPayment_Pending_Confirms() {
        // Given
        Offering offering = offering().paid("50.00").capacity(1).build();
        Registration pending = registration().registrationId("REG-1").offering(offering).pendingPayment().build();
        Registration confirmed = registration().registrationId("REG-1").offering(offering).build();

        when(registrationRepository.findOfferingIdByRegistrationId("REG-1")).thenReturn(Optional.of(offering.getOfferingId()));
        when(offeringRepository.findByIdForUpdate(offering.getOfferingId())).thenReturn(Optional.of(offering));
        when(registrationRepository.findById("REG-1")).thenReturn(Optional.of(pending));
        when(registrationLedgerService.confirm(offering, pending, "pay_1", NOW)).thenReturn(confirmed);

        // When
        Registration result = registrationService.confirmPayment("REG-1", "pay_1");

        // Then
        assertThat(result.getStatus()).isEqualTo(RegistrationStatus.CONFIRMED);
        verify(notifier).registrationConfirmed(confirmed, offering);
        verify(metricsService).recordPaymentConfirmed();
    }

    @Test
    @DisplayName("confirmPayment - Duplicate delivery: Should reject with REGISTRATION_NOT_PENDING and change nothing")
    void confirmPayment_AlreadyConfirmed_Rejects() {
        // Given
        Offering offering = offering().paid("50.00").capacity(1).confirmedSeats(1).build();
        Registration confirmed = registration().registrationId("REG-1").offering(offering).build();

        when(registrationRepository.findOfferingIdByRegistrationId("REG-1")).thenReturn(Optional.of(offering.getOfferingId()));
        when(offeringRepository.findByIdForUpdate(offering.getOfferingId())).thenReturn(Optional.of(offering));
        when(registrationRepository.findById("REG-1")).thenReturn(Optional.of(confirmed));

        // When / Then
        assertThatThrownBy(() -> registrationService.confirmPayment("REG-1", "pay_1"))
                .isInstanceOf(EnrollmentException.class)
                .extracting(e -> ((EnrollmentException) e).getErrorCode())
                .isEqualTo(ErrorCode.REGISTRATION_NOT_PENDING);

        assertThat(offering.getConfirmedSeats()).isEqualTo(1);
        verifyNoInteractions(registrationLedgerService);
    }

    @Test
    @DisplayName("confirmPayment - Unknown registration: Should reject with REGISTRATION_NOT_FOUND")
    void confirmPayment_UnknownRegistration_Rejects() {
        // Given
        when(registrationRepository.findOfferingIdByRegistrationId("missing")).thenReturn(Optional.empty());

        // When / Then
        assertThatThrownBy(() -> registrationService.confirmPayment("missing", "pay_1"))
                .isInstanceOf(EnrollmentException.class)
                .extracting(e -> ((EnrollmentException) e).getErrorCode())
                .isEqualTo(ErrorCode.REGISTRATION_NOT_FOUND);
    }

    @Test
    @DisplayName("confirmPayment - Offering filled while paying: Should cancel for refund")
    void confirmPayment_NoSeatLeft_CancelsForRefund() {
        // Given
        Offering offering = offering().paid("50.00").capacity(1).confirmedSeats(1).build();
        Registration pending = registration().registrationId("REG-1").offering(offering).pendingPayment().build();

        when(registrationRepository.findOfferingIdByRegistrationId("REG-1")).thenReturn(Optional.of(offering.getOfferingId()));
        when(offeringRepository.findByIdForUpdate(offering.getOfferingId())).thenReturn(Optional.of(offering));
        when(registrationRepository.findById("REG-1")).thenReturn(Optional.of(pending));
        when(registrationLedgerService.cancel(eq(offering), eq(pending), anyString(), eq(NOW)))
                .thenAnswer(invocation -> {
                    Registration registration = invocation.getArgument(1);
                    registration.cancel(NOW, invocation.getArgument(2));
                    return registration;
                });

        // When
        Registration result = registrationService.confirmPayment("REG-1", "pay_1");

        // Then
        assertThat(result.getStatus()).isEqualTo(RegistrationStatus.CANCELLED);
        assertThat(result.getCancelReason()).isEqualTo(RegistrationService.CAPACITY_REACHED_REASON);
        assertThat(result.getPaymentStatus()).isEqualTo(PaymentStatus.COMPLETED);
        assertThat(result.getPaymentReference()).isEqualTo("pay_1");
        verify(notifier).refundRequired(result, offering);
        verify(metricsService).recordPaymentWithoutSeat();
        verify(registrationLedgerService, never()).confirm(any(), any(), any(), any());
    }

    @Test
    @DisplayName("confirmPayment - Registration cancelled before payment arrived: Should record payment and request refund")
    void confirmPayment_CancelledUnpaid_RecordsRefund() {
        // Given
        Offering offering = offering().paid("50.00").capacity(1).build();
        Registration cancelled = registration().registrationId("REG-1").offering(offering).pendingPayment().build();
        cancelled.cancel(NOW, RegistrationService.PAYMENT_TIMEOUT_REASON);

        when(registrationRepository.findOfferingIdByRegistrationId("REG-1")).thenReturn(Optional.of(offering.getOfferingId()));
        when(offeringRepository.findByIdForUpdate(offering.getOfferingId())).thenReturn(Optional.of(offering));
        when(registrationRepository.findById("REG-1")).thenReturn(Optional.of(cancelled));
        when(registrationRepository.save(cancelled)).thenReturn(cancelled);

        // When / Then
        assertThatThrownBy(() -> registrationService.confirmPayment("REG-1", "pi_late"))
                .isInstanceOf(EnrollmentException.class)
                .extracting(e -> ((EnrollmentException) e).getErrorCode())
                .isEqualTo(ErrorCode.REGISTRATION_NOT_PENDING);

        assertThat(cancelled.getStatus()).isEqualTo(RegistrationStatus.CANCELLED);
        assertThat(cancelled.getPaymentStatus()).isEqualTo(PaymentStatus.COMPLETED);
        assertThat(cancelled.getPaymentReference()).isEqualTo("pi_late");
        verify(notifier).refundRequired(cancelled, offering);
        verify(metricsService).recordPaymentWithoutSeat();
        verifyNoInteractions(registrationLedgerService);
    }

    @Test
    @DisplayName("confirmPayment - Refund already recorded: Should reject without a second refund")
    void confirmPayment_CancelledAlreadyPaid_NoSecondRefund() {
        // Given
        Offering offering = offering().paid("50.00").capacity(1).build();
        Registration cancelled = registration().registrationId("REG-1").offering(offering).pendingPayment().build();
        cancelled.cancel(NOW, RegistrationService.PAYMENT_TIMEOUT_REASON);
        cancelled.setPaymentStatus(PaymentStatus.COMPLETED);
        cancelled.setPaymentReference("pi_late");

        when(registrationRepository.findOfferingIdByRegistrationId("REG-1")).thenReturn(Optional.of(offering.getOfferingId()));
        when(offeringRepository.findByIdForUpdate(offering.getOfferingId())).thenReturn(Optional.of(offering));
        when(registrationRepository.findById("REG-1")).thenReturn(Optional.of(cancelled));

        // When / Then
        assertThatThrownBy(() -> registrationService.confirmPayment("REG-1", "pi_late"))
                .isInstanceOf(EnrollmentException.class)
                .extracting(e -> ((EnrollmentException) e).getErrorCode())
                .isEqualTo(ErrorCode.REGISTRATION_NOT_PENDING);

        verify(registrationRepository, never()).save(any());
        verifyNoInteractions(notifier);
        verify(metricsService, never()).recordPaymentWithoutSeat();
    }

    // ========================================
    // recordPaymentFailure() Tests
    // ========================================

    @Test
    @DisplayName("recordPaymentFailure - Pending registration: Should mark payment failed and stay pending")
    void recordPaymentFailure_Pending_MarksFailed() {
        // Given
        Offering offering = offering().paid("50.00").build();
        Registration pending = registration().registrationId("REG-1").offering(offering).pendingPayment().build();

        when(registrationRepository.findOfferingIdByRegistrationId("REG-1")).thenReturn(Optional.of(offering.getOfferingId()));
        when(offeringRepository.findByIdForUpdate(offering.getOfferingId())).thenReturn(Optional.of(offering));
        when(registrationRepository.findById("REG-1")).thenReturn(Optional.of(pending));
        when(registrationRepository.save(pending)).thenReturn(pending);

        // When
        Registration result = registrationService.recordPaymentFailure("REG-1");

        // Then
        assertThat(result.getStatus()).isEqualTo(RegistrationStatus.PENDING_PAYMENT);
        assertThat(result.getPaymentStatus()).isEqualTo(PaymentStatus.FAILED);
        verify(notifier).paymentFailed(pending, offering);
        verify(metricsService).recordPaymentFailed();
    }

    @Test
    @DisplayName("recordPaymentFailure - Already failed: Should do nothing further")
    void recordPaymentFailure_AlreadyFailed_NoOp() {
        // Given
        Offering offering = offering().paid("50.00").build();
        Registration pending = registration().registrationId("REG-1").offering(offering).pendingPayment().build();
        pending.setPaymentStatus(PaymentStatus.FAILED);

        when(registrationRepository.findOfferingIdByRegistrationId("REG-1")).thenReturn(Optional.of(offering.getOfferingId()));
        when(offeringRepository.findByIdForUpdate(offering.getOfferingId())).thenReturn(Optional.of(offering));
        when(registrationRepository.findById("REG-1")).thenReturn(Optional.of(pending));

        // When
        registrationService.recordPaymentFailure("REG-1");

        // Then
        verify(registrationRepository, never()).save(any());
        verifyNoInteractions(notifier);
    }

    // ========================================
    // cancelRegistration() Tests
    // ========================================

    @Test
    @DisplayName("cancelRegistration - Confirmed registration: Should cancel and promote the waitlist")
    void cancelRegistration_Confirmed_PromotesWaitlist() {
        // Given
        Offering offering = offering().capacity(1).confirmedSeats(1).build();
        Registration confirmed = registration().offering(offering).build();

        when(offeringRepository.findByIdForUpdate(offering.getOfferingId())).thenReturn(Optional.of(offering));
        when(registrationRepository.findByLiveKey(offering.getOfferingId() + ":member-1")).thenReturn(Optional.of(confirmed));
        when(registrationLedgerService.cancel(offering, confirmed, "Changed plans", NOW)).thenAnswer(invocation -> {
            confirmed.cancel(NOW, "Changed plans");
            return confirmed;
        });

        // When
        Registration result = registrationService.cancelRegistration(subject, offering.getOfferingId(), "Changed plans");

        // Then
        assertThat(result.getStatus()).isEqualTo(RegistrationStatus.CANCELLED);
        verify(notifier).registrationCancelled(confirmed, offering);
        verify(metricsService).recordCancellation("CONFIRMED");
        verify(waitlistService).promoteNextLocked(offering, NOW);
    }

    @Test
    @DisplayName("cancelRegistration - Pending registration: Should cancel without promoting")
    void cancelRegistration_Pending_DoesNotPromote() {
        // Given
        Offering offering = offering().paid("50.00").build();
        Registration pending = registration().offering(offering).pendingPayment().build();

        when(offeringRepository.findByIdForUpdate(offering.getOfferingId())).thenReturn(Optional.of(offering));
        when(registrationRepository.findByLiveKey(offering.getOfferingId() + ":member-1")).thenReturn(Optional.of(pending));
        when(registrationLedgerService.cancel(offering, pending, null, NOW)).thenAnswer(invocation -> {
            pending.cancel(NOW, null);
            return pending;
        });

        // When
        registrationService.cancelRegistration(subject, offering.getOfferingId(), null);

        // Then
        verify(metricsService).recordCancellation("PENDING_PAYMENT");
        verifyNoInteractions(waitlistService);
    }

    @Test
    @DisplayName("cancelRegistration - Already cancelled: Should reject with CANCELLATION_NOT_ALLOWED")
    void cancelRegistration_AlreadyCancelled_Rejects() {
        // Given
        Offering offering = offering().build();
        Registration cancelled = registration().offering(offering).status(RegistrationStatus.CANCELLED).build();

        when(offeringRepository.findByIdForUpdate(offering.getOfferingId())).thenReturn(Optional.of(offering));
        when(registrationRepository.findByLiveKey(offering.getOfferingId() + ":member-1")).thenReturn(Optional.empty());
        when(registrationRepository.findFirstByOfferingIdAndSubjectIdOrderByRegisteredAtDesc(offering.getOfferingId(), "member-1"))
                .thenReturn(Optional.of(cancelled));

        // When / Then
        assertThatThrownBy(() -> registrationService.cancelRegistration(subject, offering.getOfferingId(), null))
                .isInstanceOf(EnrollmentException.class)
                .extracting(e -> ((EnrollmentException) e).getErrorCode())
                .isEqualTo(ErrorCode.CANCELLATION_NOT_ALLOWED);
        verifyNoInteractions(registrationLedgerService);
    }

    @Test
    @DisplayName("cancelRegistration - No registration: Should reject with REGISTRATION_NOT_FOUND")
    void cancelRegistration_NoRegistration_Rejects() {
        // Given
        Offering offering = offering().build();
        when(offeringRepository.findByIdForUpdate(offering.getOfferingId())).thenReturn(Optional.of(offering));
        when(registrationRepository.findByLiveKey(offering.getOfferingId() + ":member-1")).thenReturn(Optional.empty());
        when(registrationRepository.findFirstByOfferingIdAndSubjectIdOrderByRegisteredAtDesc(offering.getOfferingId(), "member-1"))
                .thenReturn(Optional.empty());

        // When / Then
        assertThatThrownBy(() -> registrationService.cancelRegistration(subject, offering.getOfferingId(), null))
                .isInstanceOf(EnrollmentException.class)
                .extracting(e -> ((EnrollmentException) e).getErrorCode())
                .isEqualTo(ErrorCode.REGISTRATION_NOT_FOUND);
    }

    @Test
    @DisplayName("cancelRegistration - Cancelled row with the same timestamp: Should cancel the live registration")
    void cancelRegistration_CancelledRowSameInstant_CancelsLiveRow() {
        // Given
        Offering offering = offering().capacity(2).confirmedSeats(1).build();
        Registration live = registration().registrationId("REG-2").offering(offering).registeredAt(NOW).build();

        when(offeringRepository.findByIdForUpdate(offering.getOfferingId())).thenReturn(Optional.of(offering));
        when(registrationRepository.findByLiveKey(offering.getOfferingId() + ":member-1")).thenReturn(Optional.of(live));
        when(registrationLedgerService.cancel(offering, live, null, NOW)).thenAnswer(invocation -> {
            live.cancel(NOW, null);
            return live;
        });

        // When
        Registration result = registrationService.cancelRegistration(subject, offering.getOfferingId(), null);

        // Then
        assertThat(result.getRegistrationId()).isEqualTo("REG-2");
        assertThat(result.getStatus()).isEqualTo(RegistrationStatus.CANCELLED);
        verify(registrationRepository, never()).findFirstByOfferingIdAndSubjectIdOrderByRegisteredAtDesc(anyString(), anyString());
    }

    // ========================================
    // cancelStalePendingRegistration() Tests
    // ========================================

    @Test
    @DisplayName("cancelStalePendingRegistration - Paid meanwhile: Should skip")
    void cancelStalePending_PaidMeanwhile_Skips() {
        // Given
        Offering offering = offering().paid("50.00").confirmedSeats(1).build();
        Registration confirmed = registration().registrationId("REG-1").offering(offering)
                .registeredAt(NOW.minus(Duration.ofHours(30))).build();

        when(registrationRepository.findOfferingIdByRegistrationId("REG-1")).thenReturn(Optional.of(offering.getOfferingId()));
        when(offeringRepository.findByIdForUpdate(offering.getOfferingId())).thenReturn(Optional.of(offering));
        when(registrationRepository.findById("REG-1")).thenReturn(Optional.of(confirmed));

        // When
        boolean cancelled = registrationService.cancelStalePendingRegistration("REG-1", NOW.minus(Duration.ofHours(24)));

        // Then
        assertThat(cancelled).isFalse();
        verifyNoInteractions(registrationLedgerService);
    }

    @Test
    @DisplayName("cancelStalePendingRegistration - Stale pending: Should cancel with payment timeout reason")
    void cancelStalePending_Stale_Cancels() {
        // Given
        Offering offering = offering().paid("50.00").build();
        Registration pending = registration().registrationId("REG-1").offering(offering).pendingPayment()
                .registeredAt(NOW.minus(Duration.ofHours(25))).build();

        when(registrationRepository.findOfferingIdByRegistrationId("REG-1")).thenReturn(Optional.of(offering.getOfferingId()));
        when(offeringRepository.findByIdForUpdate(offering.getOfferingId())).thenReturn(Optional.of(offering));
        when(registrationRepository.findById("REG-1")).thenReturn(Optional.of(pending));
        when(registrationLedgerService.cancel(offering, pending, RegistrationService.PAYMENT_TIMEOUT_REASON, NOW))
                .thenReturn(pending);

        // When
        boolean cancelled = registrationService.cancelStalePendingRegistration("REG-1", NOW.minus(Duration.ofHours(24)));

        // Then
        assertThat(cancelled).isTrue();
        verify(registrationLedgerService).cancel(offering, pending, "Payment timeout", NOW);
    }

    // ========================================
    // retryCheckout() Tests
    // ========================================

    @Test
    @DisplayName("retryCheckout - Someone else's registration: Should reject with NOT_AUTHORIZED")
    void retryCheckout_NotOwner_Rejects() {
        // Given
        Registration pending = registration().registrationId("REG-1").subjectId("member-9").pendingPayment().build();
        when(registrationRepository.findById("REG-1")).thenReturn(Optional.of(pending));

        // When / Then
        assertThatThrownBy(() -> registrationService.retryCheckout(subject, "REG-1"))
                .isInstanceOf(EnrollmentException.class)
                .extracting(e -> ((EnrollmentException) e).getErrorCode())
                .isEqualTo(ErrorCode.NOT_AUTHORIZED);
        verifyNoInteractions(checkoutService);
    }

    @Test
    @DisplayName("retryCheckout - Own pending registration: Should start a new checkout")
    void retryCheckout_Pending_StartsCheckout() {
        // Given
        Offering offering = offering().paid("50.00").build();
        Registration pending = registration().registrationId("REG-1").offering(offering).pendingPayment().build();
        RegistrationResult expected = RegistrationResult.checkoutRequired(
                offering, pending, new CheckoutSession("cs_2", "https://pay.test/cs_2"));

        when(registrationRepository.findById("REG-1")).thenReturn(Optional.of(pending));
        when(offeringRepository.findById(offering.getOfferingId())).thenReturn(Optional.of(offering));
        when(checkoutService.startCheckout(offering, pending)).thenReturn(expected);

        // When
        RegistrationResult result = registrationService.retryCheckout(subject, "REG-1");

        // Then
        assertThat(result.getCheckoutSession().getSessionId()).isEqualTo("cs_2");
    }
}
