package com.cred.freestyle.enrollment.api;

import com.cred.freestyle.enrollment.domain.model.Offering;
import com.cred.freestyle.enrollment.domain.model.Registration;
import com.cred.freestyle.enrollment.domain.model.Registration.RegistrationStatus;
import com.cred.freestyle.enrollment.infrastructure.cache.ReminderCacheService;
import com.cred.freestyle.enrollment.infrastructure.notification.KafkaNotificationPublisher;
import com.cred.freestyle.enrollment.repository.OfferingRepository;
import com.cred.freestyle.enrollment.repository.RegistrationRepository;
import com.cred.freestyle.enrollment.repository.WaitlistEntryRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CompletableFuture;

import static com.cred.freestyle.enrollment.testutil.TestDataBuilder.offering;
import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Full-stack API integration tests for registration, waitlist and payment callbacks.
 * Tests complete flow from HTTP request through service layer to database.
 */
@SpringBootTest(properties = {
    "spring.datasource.url=jdbc:h2:mem:apidb;MODE=PostgreSQL;DB_CLOSE_DELAY=-1",
    "spring.datasource.driver-class-name=org.h2.Driver",
    "spring.jpa.hibernate.ddl-auto=create-drop",
    "spring.jpa.show-sql=false",
    "spring.data.redis.enabled=false"
})
@AutoConfigureMockMvc
@Transactional
@DisplayName("Enrollment API Integration Tests")
class EnrollmentApiIT {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private OfferingRepository offeringRepository;

    @Autowired
    private RegistrationRepository registrationRepository;

    @Autowired
    private WaitlistEntryRepository waitlistEntryRepository;

    @MockBean
    private ReminderCacheService reminderCacheService;

    @MockBean
    private KafkaNotificationPublisher kafkaNotificationPublisher;

    private Offering freeOffering;
    private Offering paidOffering;

    @BeforeEach
    void setUp() {
        when(kafkaNotificationPublisher.publish(any())).thenReturn(CompletableFuture.completedFuture(null));

        // Clean up
        waitlistEntryRepository.deleteAll();
        registrationRepository.deleteAll();
        offeringRepository.deleteAll();

        Instant start = Instant.now().plus(Duration.ofDays(10));
        freeOffering = offeringRepository.save(offering()
                .offeringId("OFF-FREE-IT")
                .capacity(1)
                .startsAt(start)
                .endsAt(start.plus(Duration.ofHours(2)))
                .build());
        paidOffering = offeringRepository.save(offering()
                .offeringId("OFF-PAID-IT")
                .capacity(5)
                .paid("40.00")
                .startsAt(start)
                .endsAt(start.plus(Duration.ofHours(2)))
                .build());
    }

    // ========================================
    // Registration flow
    // ========================================

    @Test
    @DisplayName("Full flow - register, fill up, waitlist and read the queue")
    void registerUntilFull_ThenWaitlist() throws Exception {
        mockMvc.perform(post("/api/v1/offerings/{id}/registrations", freeOffering.getOfferingId())
                        .header("X-User-Id", "alice"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.outcome", is("CONFIRMED")))
                .andExpect(jsonPath("$.registration.subjectId", is("alice")));

        mockMvc.perform(post("/api/v1/offerings/{id}/registrations", freeOffering.getOfferingId())
                        .header("X-User-Id", "bob"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.outcome", is("WAITLISTED")))
                .andExpect(jsonPath("$.waitlistEntry.position", is(1)));

        mockMvc.perform(get("/api/v1/offerings/{id}/availability", freeOffering.getOfferingId())
                        .header("X-User-Id", "carol"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.confirmedSeats", is(1)))
                .andExpect(jsonPath("$.seatsLeft", is(0)));

        mockMvc.perform(get("/api/v1/offerings/{id}/waitlist/me", freeOffering.getOfferingId())
                        .header("X-User-Id", "bob"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status", is("WAITING")));

        mockMvc.perform(post("/api/v1/offerings/{id}/registrations", freeOffering.getOfferingId())
                        .header("X-User-Id", "alice"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code", is("REG001")));
    }

    @Test
    @DisplayName("Full flow - cancellation offers the seat to the head of the waitlist")
    void cancel_OffersSeatToWaitlist() throws Exception {
        mockMvc.perform(post("/api/v1/offerings/{id}/registrations", freeOffering.getOfferingId())
                .header("X-User-Id", "alice"));
        mockMvc.perform(post("/api/v1/offerings/{id}/registrations", freeOffering.getOfferingId())
                .header("X-User-Id", "bob"));

        mockMvc.perform(delete("/api/v1/offerings/{id}/registrations/me", freeOffering.getOfferingId())
                        .header("X-User-Id", "alice")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"reason\":\"Cannot attend\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status", is("CANCELLED")))
                .andExpect(jsonPath("$.cancelReason", is("Cannot attend")));

        mockMvc.perform(get("/api/v1/offerings/{id}/waitlist/me", freeOffering.getOfferingId())
                        .header("X-User-Id", "bob"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status", is("OFFERED")))
                .andExpect(jsonPath("$.responseDeadline", notNullValue()));
    }

    // ========================================
    // Payment callbacks
    // ========================================

    @Test
    @DisplayName("Full flow - paid registration confirmed by the provider callback, duplicate ignored")
    void paidRegistration_ConfirmedByCallback() throws Exception {
        mockMvc.perform(post("/api/v1/offerings/{id}/registrations", paidOffering.getOfferingId())
                        .header("X-User-Id", "alice"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.outcome", is("CHECKOUT_REQUIRED")))
                .andExpect(jsonPath("$.checkoutSessionId", startsWith("cs_mock_")))
                .andExpect(jsonPath("$.registration.status", is("PENDING_PAYMENT")));

        Registration pending = registrationRepository.findFirstByOfferingIdAndSubjectIdOrderByRegisteredAtDesc(
                paidOffering.getOfferingId(), "alice").orElseThrow();
        String callback = "{\"registrationId\":\"" + pending.getRegistrationId()
                + "\",\"paymentReference\":\"pi_it_1\"}";

        mockMvc.perform(post("/internal/payments/succeeded")
                        .header("X-User-Id", "payments")
                        .header("X-User-Role", "PAYMENT_PROVIDER")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(callback))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.result", is("processed")))
                .andExpect(jsonPath("$.registrationStatus", is("CONFIRMED")));

        mockMvc.perform(post("/internal/payments/succeeded")
                        .header("X-User-Id", "payments")
                        .header("X-User-Role", "PAYMENT_PROVIDER")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(callback))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.result", is("ignored")));

        Registration confirmed = registrationRepository.findById(pending.getRegistrationId()).orElseThrow();
        assertThat(confirmed.getStatus()).isEqualTo(RegistrationStatus.CONFIRMED);
        assertThat(offeringRepository.findById(paidOffering.getOfferingId()).orElseThrow().getConfirmedSeats())
                .isEqualTo(1);
    }

    @Test
    @DisplayName("Payment callback from a member - Should return 403")
    void paymentCallback_FromMember_Forbidden() throws Exception {
        mockMvc.perform(post("/internal/payments/succeeded")
                        .header("X-User-Id", "alice")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"registrationId\":\"REG-1\",\"paymentReference\":\"pi\"}"))
                .andExpect(status().isForbidden());
    }

    @Test
    @DisplayName("Unknown offering - Should return 404 with error code")
    void register_UnknownOffering_NotFound() throws Exception {
        mockMvc.perform(post("/api/v1/offerings/{id}/registrations", "OFF-MISSING")
                        .header("X-User-Id", "alice"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code", is("OFF001")));
    }
}
