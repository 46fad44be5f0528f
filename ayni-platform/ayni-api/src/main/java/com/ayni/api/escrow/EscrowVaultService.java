package com.ayni.api.escrow;

import com.ayni.api.access.AccessControlService;
import com.ayni.api.event.LedgerEventService;
import com.ayni.api.state.LedgerStateService;
import com.ayni.api.state.ReentrancyGuard;
import com.ayni.core.domain.EscrowBalance;
import com.ayni.core.domain.Identities;
import com.ayni.core.domain.LedgerEvent.EventType;
import com.ayni.core.domain.LedgerState;
import com.ayni.core.domain.Role;
import com.ayni.core.error.LedgerError;
import com.ayni.core.error.LedgerException;
import com.ayni.core.error.ReentrantCallException;
import com.ayni.core.repository.EscrowBalanceRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigInteger;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Custody of donation funds, one balance per donation.
 *
 * Payouts debit the vault's books and flush them before calling the {@link TransferGateway},
 * so anything the transfer triggers sees the balance already at zero. A failed transfer
 * fails the surrounding transaction and every effect of the operation rolls back.
 */
@Service
@Transactional(noRollbackFor = ReentrantCallException.class)
public class EscrowVaultService {

    private static final Logger log = LoggerFactory.getLogger(EscrowVaultService.class);

    private final EscrowBalanceRepository escrowRepository;
    private final LedgerStateService ledgerState;
    private final TransferGateway transferGateway;
    private final AccessControlService accessControl;
    private final LedgerEventService eventService;
    private final ReentrancyGuard reentrancyGuard;

    public EscrowVaultService(
            EscrowBalanceRepository escrowRepository,
            LedgerStateService ledgerState,
            TransferGateway transferGateway,
            AccessControlService accessControl,
            LedgerEventService eventService,
            ReentrancyGuard reentrancyGuard) {
        this.escrowRepository = escrowRepository;
        this.ledgerState = ledgerState;
        this.transferGateway = transferGateway;
        this.accessControl = accessControl;
        this.eventService = eventService;
        this.reentrancyGuard = reentrancyGuard;
    }

    @Transactional(propagation = Propagation.MANDATORY)
    public void deposit(Long donationId, BigInteger amount) {
        if (amount == null || amount.signum() <= 0) {
            throw LedgerException.of(LedgerError.ZERO_VALUE, "Deposit must be positive");
        }
        Instant now = ledgerState.now();
        LedgerState state = ledgerState.lockForUpdate();
        EscrowBalance escrow = escrowRepository.findById(donationId)
                .orElseGet(() -> EscrowBalance.open(donationId, now));
        escrow.credit(amount, now);
        escrowRepository.save(escrow);
        state.addCustody(amount, now);
        log.debug("Deposited {} into escrow for donation {}", amount, donationId);
    }

    /**
     * Pays the whole escrow balance of a donation to its nonprofit.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public BigInteger release(Long donationId, String recipient) {
        return payOut(donationId, recipient, "release");
    }

    /**
     * Returns the whole escrow balance of a donation to its donor.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public BigInteger refund(Long donationId, String recipient) {
        return payOut(donationId, recipient, "refund");
    }

    private BigInteger payOut(Long donationId, String recipient, String purpose) {
        EscrowBalance escrow = escrowRepository.findById(donationId)
                .filter(balance -> !balance.isEmpty())
                .orElseThrow(() -> LedgerException.of(LedgerError.INSUFFICIENT_FUNDS,
                        "No escrowed funds for donation " + donationId));

        Instant now = ledgerState.now();
        LedgerState state = ledgerState.lockForUpdate();
        BigInteger amount = escrow.drain(now);
        if (state.getCustodiedTotal().compareTo(amount) < 0) {
            throw LedgerException.of(LedgerError.TRANSFER_FAILED,
                    "Vault holds " + state.getCustodiedTotal() + ", cannot pay " + amount);
        }
        state.removeCustody(amount, now);
        escrowRepository.saveAndFlush(escrow);

        send(recipient, amount, purpose + " of donation " + donationId);
        log.info("Paid {} to {} ({} of donation {})", amount, recipient, purpose, donationId);
        return amount;
    }

    /**
     * Sweeps everything the vault holds to the calling administrator. Per-donation balances
     * are left as they are, so escrow records no longer match the vault afterwards.
     * Available while the ledger is paused.
     */
    public BigInteger emergencyWithdraw(String caller) {
        reentrancyGuard.enter("emergencyWithdraw");
        try {
            String admin = Identities.require(caller);
            accessControl.requireRole(admin, Role.ADMIN);

            Instant now = ledgerState.now();
            LedgerState state = ledgerState.lockForUpdate();
            BigInteger total = state.getCustodiedTotal();
            if (total.signum() == 0) {
                throw LedgerException.of(LedgerError.INSUFFICIENT_FUNDS, "Vault is empty");
            }
            state.removeCustody(total, now);
            escrowRepository.flush();

            send(admin, total, "emergency withdrawal");

            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("amount", total);
            payload.put("recipient", admin);
            eventService.append(EventType.EMERGENCY_WITHDRAWAL, null, admin, admin, payload);
            log.warn("Emergency withdrawal of {} by {}", total, admin);
            return total;
        } finally {
            reentrancyGuard.exit();
        }
    }

    @Transactional(readOnly = true)
    public BigInteger balanceOf(Long donationId) {
        return escrowRepository.findById(donationId)
                .map(EscrowBalance::getBalance)
                .orElse(BigInteger.ZERO);
    }

    @Transactional(readOnly = true)
    public BigInteger totalCustodied() {
        return ledgerState.current().getCustodiedTotal();
    }

    /**
     * Sum of the per-donation balances. Equal to {@link #totalCustodied()} unless an
     * emergency withdrawal has happened.
     */
    @Transactional(readOnly = true)
    public BigInteger totalEscrowed() {
        return escrowRepository.findByBalanceGreaterThan(BigInteger.ZERO).stream()
                .map(EscrowBalance::getBalance)
                .reduce(BigInteger.ZERO, BigInteger::add);
    }

    private void send(String recipient, BigInteger amount, String description) {
        try {
            transferGateway.transfer(recipient, amount);
        } catch (RuntimeException e) {
            log.warn("Transfer of {} to {} failed ({})", amount, recipient, description, e);
            throw new LedgerException(LedgerError.TRANSFER_FAILED,
                    "Transfer to " + recipient + " failed: " + e.getMessage(), e);
        }
    }
}
