package com.ayni.api.access;

import com.ayni.api.config.LedgerErrorResponses;
import com.ayni.api.config.LedgerErrorResponses.ErrorResponse;
import com.ayni.api.escrow.EscrowVaultService;
import com.ayni.core.domain.Role;
import com.ayni.core.error.LedgerException;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.math.BigInteger;

/**
 * Administrative controls: pause switch, emergency sweep and role management.
 */
@RestController
@RequestMapping("/api/v1/admin")
public class AdminController {

    private final AccessControlService accessControl;
    private final EscrowVaultService escrowVault;

    public AdminController(AccessControlService accessControl, EscrowVaultService escrowVault) {
        this.accessControl = accessControl;
        this.escrowVault = escrowVault;
    }

    @PostMapping("/pause")
    public ResponseEntity<AccessControlService.LedgerStatusDto> pause(@RequestBody CallerRequest request) {
        return ResponseEntity.ok(accessControl.pause(request.caller()));
    }

    @PostMapping("/unpause")
    public ResponseEntity<AccessControlService.LedgerStatusDto> unpause(@RequestBody CallerRequest request) {
        return ResponseEntity.ok(accessControl.unpause(request.caller()));
    }

    @PostMapping("/emergency-withdraw")
    public ResponseEntity<WithdrawalResponse> emergencyWithdraw(@RequestBody CallerRequest request) {
        BigInteger amount = escrowVault.emergencyWithdraw(request.caller());
        return ResponseEntity.ok(new WithdrawalResponse(amount, escrowVault.totalCustodied()));
    }

    @PostMapping("/roles/grant")
    public ResponseEntity<AccessControlService.RoleStatusDto> grantRole(@RequestBody RoleChangeRequest request) {
        return ResponseEntity.ok(accessControl.grantRole(request.caller(), request.identity(), request.role()));
    }

    @PostMapping("/roles/revoke")
    public ResponseEntity<AccessControlService.RoleStatusDto> revokeRole(@RequestBody RoleChangeRequest request) {
        return ResponseEntity.ok(accessControl.revokeRole(request.caller(), request.identity(), request.role()));
    }

    @GetMapping("/roles/{identity}")
    public ResponseEntity<AccessControlService.RoleStatusDto> getRoles(@PathVariable String identity) {
        return ResponseEntity.ok(accessControl.getRoles(identity));
    }

    @GetMapping("/status")
    public ResponseEntity<AccessControlService.LedgerStatusDto> getStatus() {
        return ResponseEntity.ok(accessControl.getStatus());
    }

    @ExceptionHandler(LedgerException.class)
    public ResponseEntity<ErrorResponse> handleLedgerError(LedgerException e) {
        return LedgerErrorResponses.toResponse(e);
    }

    public record CallerRequest(String caller) {}
    public record RoleChangeRequest(String caller, String identity, Role role) {}
    public record WithdrawalResponse(BigInteger withdrawn, BigInteger remainingCustodied) {}
}
