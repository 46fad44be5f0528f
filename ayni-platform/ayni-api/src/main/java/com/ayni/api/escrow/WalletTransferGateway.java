package com.ayni.api.escrow;

import com.ayni.api.state.LedgerStateService;
import com.ayni.core.domain.WalletBalance;
import com.ayni.core.repository.WalletBalanceRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigInteger;
import java.time.Instant;

/**
 * Pays recipients by crediting their wallet balance.
 */
@Component
public class WalletTransferGateway implements TransferGateway {

    private static final Logger log = LoggerFactory.getLogger(WalletTransferGateway.class);

    private final WalletBalanceRepository walletRepository;
    private final LedgerStateService ledgerState;

    public WalletTransferGateway(WalletBalanceRepository walletRepository, LedgerStateService ledgerState) {
        this.walletRepository = walletRepository;
        this.ledgerState = ledgerState;
    }

    @Override
    @Transactional(propagation = Propagation.MANDATORY)
    public void transfer(String recipient, BigInteger amount) {
        if (recipient == null) {
            throw new TransferException("No recipient for transfer of " + amount);
        }
        Instant now = ledgerState.now();
        WalletBalance wallet = walletRepository.findById(recipient)
                .orElseGet(() -> WalletBalance.open(recipient, now));
        wallet.credit(amount, now);
        walletRepository.save(wallet);
        log.debug("Credited {} to wallet {}", amount, recipient);
    }

    @Transactional(readOnly = true)
    public BigInteger balanceOf(String identity) {
        return walletRepository.findById(identity)
                .map(WalletBalance::getBalance)
                .orElse(BigInteger.ZERO);
    }
}
