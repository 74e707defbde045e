package com.helpdesk.remoteservice.interfaces.http;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validation;
import jakarta.validation.Validator;
import jakarta.validation.ValidatorFactory;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.oauth2.jwt.Jwt;

import com.helpdesk.remoteservice.application.RemoteSessionCoordinator;
import com.helpdesk.remoteservice.common.RemoteSessionNotFoundException;
import com.helpdesk.remoteservice.common.StaffRequiredException;
import com.helpdesk.remoteservice.common.WebExceptionAdvice;
import com.helpdesk.remoteservice.interfaces.http.dto.CreateSessionRequest;
import com.helpdesk.remoteservice.interfaces.http.dto.CreateSessionResponse;
import com.helpdesk.session.SessionRegistry;
import com.helpdesk.session.config.RemoteSessionProperties;
import com.helpdesk.session.model.SessionId;
import com.helpdesk.session.model.SessionSnapshot;
import com.helpdesk.session.model.SessionStatus;
import com.helpdesk.web.common.ApiResponse;

@DisplayName("RemoteSessionController")
class RemoteSessionControllerTest {

    private static final String STAFF_ROLE = "helpdesk-staff";
    private static final Instant START = Instant.parse("2026-03-01T09:00:00Z");

    private MovableClock clock;
    private SessionRegistry registry;
    private RemoteSessionCoordinator coordinator;
    private RemoteSessionController controller;
    private final WebExceptionAdvice advice = new WebExceptionAdvice();

    @BeforeEach
    void setUp() {
        clock = new MovableClock(START);
        registry = new SessionRegistry(clock, Duration.ofHours(2), 5);
        coordinator = mock(RemoteSessionCoordinator.class);
        RemoteSessionProperties properties = new RemoteSessionProperties();
        properties.setStaffRole(STAFF_ROLE);
        controller = new RemoteSessionController(registry, coordinator, new StaffGuard(properties));
    }

    static Jwt staffJwt() {
        return Jwt.withTokenValue("staff")
                .header("alg", "none")
                .subject("u-1")
                .claim("preferred_username", "bob")
                .claim("realm_access", Map.of("roles", List.of(STAFF_ROLE)))
                .build();
    }

    static Jwt customerJwt() {
        return Jwt.withTokenValue("customer")
                .header("alg", "none")
                .subject("u-2")
                .claim("preferred_username", "mallory")
                .claim("realm_access", Map.of("roles", List.of("customer")))
                .build();
    }

    private CreateSessionResponse create(String workItem) {
        return controller.create(new CreateSessionRequest(workItem, "alice"), staffJwt()).data();
    }

    @Nested
    @DisplayName("create")
    class CreateTests {

        @Test
        @DisplayName("returns both tokens once, named after the staff member")
        void createReturnsTokens() {
            CreateSessionResponse created = create("T-100");

            assertFalse(created.userToken().isBlank());
            assertFalse(created.operatorToken().isBlank());
            assertNotEquals(created.userToken(), created.operatorToken());
            assertEquals("T-100", created.workItemId());
            assertEquals(START.plus(Duration.ofHours(2)), created.expiresAt());

            SessionSnapshot snapshot = controller.get(created.sessionId(), staffJwt()).data();
            assertEquals("bob", snapshot.operatorName());
            assertEquals("alice", snapshot.userName());
            assertEquals(SessionStatus.PENDING, snapshot.status());
        }

        @Test
        @DisplayName("a JWT without the staff role cannot create or replace sessions")
        void nonStaffRefused() {
            CreateSessionResponse existing = create("T-100");

            StaffRequiredException e = assertThrows(StaffRequiredException.class,
                    () -> controller.create(new CreateSessionRequest("T-100", "alice"), customerJwt()));

            assertEquals(HttpStatus.FORBIDDEN, advice.forbidden(e).getStatusCode());
            assertEquals(1, registry.stats().total());
            assertTrue(registry.getSession(SessionId.of(existing.sessionId())).isPresent());
        }

        @Test
        @DisplayName("a JWT without any usable name is a bad request")
        void namelessOperator() {
            Jwt nameless = Jwt.withTokenValue("x")
                    .header("alg", "none")
                    .claim("realm_access", Map.of("roles", List.of(STAFF_ROLE)))
                    .build();

            IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                    () -> controller.create(new CreateSessionRequest("T-100", "alice"), nameless));

            assertEquals(HttpStatus.BAD_REQUEST, advice.badRequest(e).getStatusCode());
            assertEquals(0, registry.stats().total());
        }

        @Test
        @DisplayName("request body requires a work item and a user name")
        void requestValidation() {
            try (ValidatorFactory factory = Validation.buildDefaultValidatorFactory()) {
                Validator validator = factory.getValidator();

                Set<ConstraintViolation<CreateSessionRequest>> violations =
                        validator.validate(new CreateSessionRequest(" ", null));

                assertEquals(Set.of("workItemId", "userName"), violations.stream()
                        .map(v -> v.getPropertyPath().toString())
                        .collect(Collectors.toSet()));
                assertTrue(validator.validate(new CreateSessionRequest("T-1", "alice")).isEmpty());
            }
        }
    }

    @Nested
    @DisplayName("lookup")
    class LookupTests {

        @Test
        @DisplayName("by work item returns the live session")
        void byWorkItem() {
            CreateSessionResponse created = create("T-200");

            assertEquals(created.sessionId(), controller.byWorkItem("T-200", staffJwt()).data().sessionId());
        }

        @Test
        @DisplayName("unknown, expired and closed sessions map to 404")
        void notFound() {
            assertNotFound(() -> controller.get("nope", staffJwt()));
            assertNotFound(() -> controller.byWorkItem("T-404", staffJwt()));

            CreateSessionResponse closed = create("T-300");
            registry.closeSession(SessionId.of(closed.sessionId()));
            assertNotFound(() -> controller.get(closed.sessionId(), staffJwt()));

            CreateSessionResponse expiring = create("T-301");
            clock.advance(Duration.ofHours(2).plusSeconds(1));
            assertNotFound(() -> controller.get(expiring.sessionId(), staffJwt()));
            assertNotFound(() -> controller.byWorkItem("T-301", staffJwt()));
        }

        @Test
        @DisplayName("lookups also require the staff role")
        void nonStaffLookup() {
            CreateSessionResponse created = create("T-200");

            assertThrows(StaffRequiredException.class, () -> controller.get(created.sessionId(), customerJwt()));
            assertThrows(StaffRequiredException.class, () -> controller.byWorkItem("T-200", customerJwt()));
        }

        private void assertNotFound(Runnable call) {
            RemoteSessionNotFoundException e = assertThrows(RemoteSessionNotFoundException.class, call::run);
            ResponseEntity<ApiResponse<Object>> response = advice.notFound(e);
            assertEquals(HttpStatus.NOT_FOUND, response.getStatusCode());
            assertEquals(404, response.getBody().code());
        }
    }

    @Nested
    @DisplayName("close")
    class CloseTests {

        @Test
        @DisplayName("closing goes through the coordinator")
        void close() {
            when(coordinator.closeSession(SessionId.of("S1"))).thenReturn(true);

            assertTrue(controller.close("S1", staffJwt()).isSuccess());
        }

        @Test
        @DisplayName("closing an unknown session is a 404")
        void closeUnknown() {
            when(coordinator.closeSession(any())).thenReturn(false);

            assertThrows(RemoteSessionNotFoundException.class, () -> controller.close("S1", staffJwt()));
        }

        @Test
        @DisplayName("a JWT without the staff role cannot close sessions")
        void nonStaffClose() {
            assertThrows(StaffRequiredException.class, () -> controller.close("S1", customerJwt()));

            verify(coordinator, never()).closeSession(any());
        }
    }

    static final class MovableClock extends Clock {

        private Instant now;

        MovableClock(Instant start) {
            this.now = start;
        }

        void advance(Duration d) {
            now = now.plus(d);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }
}
