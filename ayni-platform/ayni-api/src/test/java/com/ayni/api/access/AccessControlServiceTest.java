package com.ayni.api.access;

import com.ayni.api.AyniApiApplication;
import com.ayni.api.config.LedgerTestConfiguration;
import com.ayni.api.config.LedgerTestData;
import com.ayni.api.event.LedgerEventService;
import com.ayni.core.domain.LedgerEvent.EventType;
import com.ayni.core.domain.Role;
import com.ayni.core.error.LedgerError;
import com.ayni.core.error.LedgerException;
import com.ayni.core.repository.RoleAssignmentRepository;
import org.assertj.core.api.ThrowableAssert.ThrowingCallable;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;

import static com.ayni.api.config.LedgerTestData.*;
import static org.assertj.core.api.Assertions.*;

@SpringBootTest(classes = AyniApiApplication.class)
@Import(LedgerTestConfiguration.class)
@ActiveProfiles("test")
class AccessControlServiceTest {

    @Autowired
    private AccessControlService accessControl;

    @Autowired
    private RoleAssignmentRepository roleRepository;

    @Autowired
    private LedgerEventService eventService;

    @Autowired
    private LedgerTestData testData;

    @BeforeEach
    void setUp() {
        testData.reset();
    }

    @Test
    void initializeGrantsConfiguredAdminOnce() {
        accessControl.initialize();
        accessControl.initialize();

        assertThat(accessControl.hasRole(ADMIN, Role.ADMIN)).isTrue();
        assertThat(roleRepository.countByRole(Role.ADMIN)).isEqualTo(1);
        assertThat(accessControl.getStatus().paused()).isFalse();
        assertThat(accessControl.getStatus().donationCount()).isZero();
    }

    @Test
    void hasRoleIsCaseInsensitiveAndFalseForGarbage() {
        assertThat(accessControl.hasRole(ADMIN.toUpperCase().replace("0X", "0x"), Role.ADMIN)).isTrue();
        assertThat(accessControl.hasRole("garbage", Role.ADMIN)).isFalse();
        assertThat(accessControl.hasRole(null, Role.ADMIN)).isFalse();
    }

    @Test
    void adminGrantsAndRevokesRoles() {
        var granted = accessControl.grantRole(ADMIN, OTHER, Role.NONPROFIT);
        assertThat(granted.roles()).containsExactly(Role.NONPROFIT);

        // granting again is a no-op
        assertThat(accessControl.grantRole(ADMIN, OTHER, Role.NONPROFIT).roles()).containsExactly(Role.NONPROFIT);

        var revoked = accessControl.revokeRole(ADMIN, OTHER, Role.NONPROFIT);
        assertThat(revoked.roles()).isEmpty();

        assertThat(eventService.eventsForIdentity(OTHER))
                .extracting(LedgerEventService.LedgerEventDto::eventType)
                .containsExactly(EventType.ROLE_GRANTED, EventType.ROLE_GRANTED, EventType.ROLE_REVOKED);
    }

    @Test
    void nonAdminsCannotManageRolesOrPause() {
        assertLedgerError(() -> accessControl.grantRole(DONOR, OTHER, Role.ADMIN), LedgerError.UNAUTHORIZED_ACCESS);
        assertLedgerError(() -> accessControl.revokeRole(DONOR, ADMIN, Role.ADMIN), LedgerError.UNAUTHORIZED_ACCESS);
        assertLedgerError(() -> accessControl.pause(DONOR), LedgerError.UNAUTHORIZED_ACCESS);
        assertLedgerError(() -> accessControl.unpause(DONOR), LedgerError.UNAUTHORIZED_ACCESS);

        assertThat(accessControl.hasRole(OTHER, Role.ADMIN)).isFalse();
    }

    @Test
    void lastAdminCannotRevokeOwnAdminRole() {
        assertLedgerError(() -> accessControl.revokeRole(ADMIN, ADMIN, Role.ADMIN), LedgerError.UNAUTHORIZED_ACCESS);

        accessControl.grantRole(ADMIN, OTHER, Role.ADMIN);
        accessControl.revokeRole(ADMIN, ADMIN, Role.ADMIN);

        assertThat(accessControl.hasRole(ADMIN, Role.ADMIN)).isFalse();
        assertThat(accessControl.hasRole(OTHER, Role.ADMIN)).isTrue();
    }

    @Test
    void pauseAndUnpauseToggleOnlyFromTheOppositeState() {
        assertLedgerError(() -> accessControl.unpause(ADMIN), LedgerError.NOT_PAUSED);

        assertThat(accessControl.pause(ADMIN).paused()).isTrue();
        assertLedgerError(() -> accessControl.pause(ADMIN), LedgerError.PAUSED);

        assertThat(accessControl.unpause(ADMIN).paused()).isFalse();
        assertThat(eventService.eventsForIdentity(ADMIN))
                .extracting(LedgerEventService.LedgerEventDto::eventType)
                .containsExactly(EventType.LEDGER_PAUSED, EventType.LEDGER_UNPAUSED);
    }

    @Test
    void roleAdministrationStaysAvailableWhilePaused() {
        accessControl.pause(ADMIN);

        assertThat(accessControl.grantRole(ADMIN, OTHER, Role.ADMIN).roles()).contains(Role.ADMIN);
    }

    @Test
    void rolesOfRejectsInvalidIdentity() {
        assertLedgerError(() -> accessControl.getRoles("0x12"), LedgerError.INVALID_ADDRESS);
    }

    private static void assertLedgerError(ThrowingCallable call, LedgerError expected) {
        assertThatThrownBy(call)
                .isInstanceOf(LedgerException.class)
                .extracting(e -> ((LedgerException) e).getError())
                .isEqualTo(expected);
    }
}
