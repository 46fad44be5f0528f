package com.ayni.api.access;

import com.ayni.api.config.LedgerProperties;
import com.ayni.api.event.LedgerEventService;
import com.ayni.api.state.LedgerStateService;
import com.ayni.api.state.ReentrancyGuard;
import com.ayni.core.domain.Identities;
import com.ayni.core.domain.LedgerEvent.EventType;
import com.ayni.core.domain.LedgerState;
import com.ayni.core.domain.Role;
import com.ayni.core.domain.RoleAssignment;
import com.ayni.core.error.LedgerError;
import com.ayni.core.error.LedgerException;
import com.ayni.core.error.ReentrantCallException;
import com.ayni.core.repository.RoleAssignmentRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigInteger;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Role registry and the ledger-wide pause switch.
 *
 * Role and pause administration is ADMIN only and stays available while the ledger is
 * paused, so an administrator can always recover it.
 */
@Service
@Transactional(noRollbackFor = ReentrantCallException.class)
public class AccessControlService {

    private static final Logger log = LoggerFactory.getLogger(AccessControlService.class);

    private final RoleAssignmentRepository roleRepository;
    private final LedgerStateService ledgerState;
    private final LedgerEventService eventService;
    private final ReentrancyGuard reentrancyGuard;
    private final LedgerProperties properties;

    public AccessControlService(
            RoleAssignmentRepository roleRepository,
            LedgerStateService ledgerState,
            LedgerEventService eventService,
            ReentrancyGuard reentrancyGuard,
            LedgerProperties properties) {
        this.roleRepository = roleRepository;
        this.ledgerState = ledgerState;
        this.eventService = eventService;
        this.reentrancyGuard = reentrancyGuard;
        this.properties = properties;
    }

    /**
     * Creates the ledger state and grants ADMIN to the configured administrator when the
     * ledger has none yet.
     */
    @EventListener(ApplicationReadyEvent.class)
    public void initialize() {
        ledgerState.lockForUpdate();
        String admin = properties.getAdminIdentity();
        if (admin == null || admin.isBlank()) {
            log.warn("No ayni.ledger.admin-identity configured, ledger starts without an administrator");
            return;
        }
        if (roleRepository.countByRole(Role.ADMIN) == 0) {
            String adminIdentity = Identities.require(admin);
            roleRepository.save(RoleAssignment.grant(adminIdentity, Role.ADMIN, adminIdentity, ledgerState.now()));
            log.info("Granted ADMIN to bootstrap administrator {}", adminIdentity);
        }
    }

    @Transactional(readOnly = true)
    public boolean hasRole(String identity, Role role) {
        if (!Identities.isValid(identity)) {
            return false;
        }
        return roleRepository.existsByIdentityAndRole(Identities.require(identity), role);
    }

    public void requireRole(String identity, Role role) {
        if (!hasRole(identity, role)) {
            throw LedgerException.of(LedgerError.UNAUTHORIZED_ACCESS, identity + " lacks role " + role);
        }
    }

    @Transactional(readOnly = true)
    public Set<Role> rolesOf(String identity) {
        Set<Role> roles = EnumSet.noneOf(Role.class);
        roleRepository.findByIdentity(Identities.require(identity))
                .forEach(assignment -> roles.add(assignment.getRole()));
        return roles;
    }

    public RoleStatusDto getRoles(String identity) {
        String normalized = Identities.require(identity);
        return new RoleStatusDto(normalized, rolesOf(normalized));
    }

    public RoleStatusDto grantRole(String caller, String identity, Role role) {
        reentrancyGuard.enter("grantRole");
        try {
            String admin = Identities.require(caller);
            String grantee = Identities.require(identity);
            requireRole(admin, Role.ADMIN);
            ledgerState.lockForUpdate();

            boolean changed = false;
            if (!roleRepository.existsByIdentityAndRole(grantee, role)) {
                roleRepository.save(RoleAssignment.grant(grantee, role, admin, ledgerState.now()));
                changed = true;
            }
            eventService.append(EventType.ROLE_GRANTED, null, grantee, admin, rolePayload(role, changed));
            log.info("{} granted {} to {} (changed={})", admin, role, grantee, changed);
            return new RoleStatusDto(grantee, rolesOf(grantee));
        } finally {
            reentrancyGuard.exit();
        }
    }

    public RoleStatusDto revokeRole(String caller, String identity, Role role) {
        reentrancyGuard.enter("revokeRole");
        try {
            String admin = Identities.require(caller);
            String target = Identities.require(identity);
            requireRole(admin, Role.ADMIN);
            ledgerState.lockForUpdate();

            if (role == Role.ADMIN && admin.equals(target) && roleRepository.countByRole(Role.ADMIN) <= 1) {
                throw LedgerException.of(LedgerError.UNAUTHORIZED_ACCESS, "The last administrator cannot revoke ADMIN");
            }
            var assignment = roleRepository.findByIdentityAndRole(target, role);
            assignment.ifPresent(roleRepository::delete);

            eventService.append(EventType.ROLE_REVOKED, null, target, admin, rolePayload(role, assignment.isPresent()));
            log.info("{} revoked {} from {} (changed={})", admin, role, target, assignment.isPresent());
            return new RoleStatusDto(target, rolesOf(target));
        } finally {
            reentrancyGuard.exit();
        }
    }

    /**
     * Grants a role as a side effect of a ledger operation. Records no event of its own.
     */
    public void grantImplicit(String identity, Role role) {
        if (!roleRepository.existsByIdentityAndRole(identity, role)) {
            roleRepository.save(RoleAssignment.grant(identity, role, identity, ledgerState.now()));
        }
    }

    public LedgerStatusDto pause(String caller) {
        reentrancyGuard.enter("pause");
        try {
            String admin = Identities.require(caller);
            requireRole(admin, Role.ADMIN);
            LedgerState state = ledgerState.lockForUpdate();
            if (state.isPaused()) {
                throw LedgerException.of(LedgerError.PAUSED, "Ledger is already paused");
            }
            state.setPaused(true, ledgerState.now());
            eventService.append(EventType.LEDGER_PAUSED, null, null, admin, Map.of("paused", true));
            log.warn("Ledger paused by {}", admin);
            return LedgerStatusDto.from(state);
        } finally {
            reentrancyGuard.exit();
        }
    }

    public LedgerStatusDto unpause(String caller) {
        reentrancyGuard.enter("unpause");
        try {
            String admin = Identities.require(caller);
            requireRole(admin, Role.ADMIN);
            LedgerState state = ledgerState.lockForUpdate();
            if (!state.isPaused()) {
                throw LedgerException.of(LedgerError.NOT_PAUSED, "Ledger is not paused");
            }
            state.setPaused(false, ledgerState.now());
            eventService.append(EventType.LEDGER_UNPAUSED, null, null, admin, Map.of("paused", false));
            log.info("Ledger unpaused by {}", admin);
            return LedgerStatusDto.from(state);
        } finally {
            reentrancyGuard.exit();
        }
    }

    /**
     * Locks the ledger state for the calling operation and fails if the ledger is paused.
     */
    public LedgerState requireNotPaused() {
        LedgerState state = ledgerState.lockForUpdate();
        if (state.isPaused()) {
            throw LedgerException.of(LedgerError.PAUSED, "Ledger is paused");
        }
        return state;
    }

    @Transactional(readOnly = true)
    public LedgerStatusDto getStatus() {
        return LedgerStatusDto.from(ledgerState.current());
    }

    private Map<String, Object> rolePayload(Role role, boolean changed) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("role", role.name());
        payload.put("changed", changed);
        return payload;
    }

    public record RoleStatusDto(String identity, Set<Role> roles) {}

    public record LedgerStatusDto(boolean paused, long donationCount, BigInteger custodiedTotal) {
        static LedgerStatusDto from(LedgerState state) {
            return new LedgerStatusDto(state.isPaused(), state.getDonationCount(), state.getCustodiedTotal());
        }
    }
}
