package com.ayni.blockchain.service;

import com.ayni.blockchain.contract.LedgerAnchorContract;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.web3j.crypto.Credentials;
import org.web3j.protocol.Web3j;
import org.web3j.protocol.core.methods.response.TransactionReceipt;
import org.web3j.protocol.http.HttpService;
import org.web3j.tx.gas.StaticGasProvider;

import java.math.BigInteger;
import java.util.HexFormat;
import java.util.Optional;

/**
 * Service for anchoring ledger event hashes on chain.
 * Every call degrades to {@link Optional#empty()} when anchoring is disabled or the node fails.
 */
@Service
public class BlockchainEventAnchorService {

    private static final Logger log = LoggerFactory.getLogger(BlockchainEventAnchorService.class);
    private final BlockchainConfig config;
    private LedgerAnchorContract contract;
    private Web3j web3j;

    public BlockchainEventAnchorService(BlockchainConfig config) {
        this.config = config;
        if (config.isAnchoringConfigured()) {
            initializeContract();
        } else if (config.isEnabled()) {
            log.warn("Ledger anchoring enabled without contract address or private key; anchoring stays off");
        }
    }

    private void initializeContract() {
        try {
            this.web3j = Web3j.build(new HttpService(config.getNodeUrl()));
            Credentials credentials = Credentials.create(config.getPrivateKey());
            StaticGasProvider gasProvider = new StaticGasProvider(
                    BigInteger.valueOf(config.getGasPrice()),
                    BigInteger.valueOf(config.getGasLimit()));
            this.contract = LedgerAnchorContract.load(
                    config.getAnchorContractAddress(), web3j, credentials, gasProvider);
            log.info("Ledger anchor contract initialized at {}", config.getAnchorContractAddress());
        } catch (Exception e) {
            log.error("Failed to initialize ledger anchor contract", e);
        }
    }

    /**
     * Anchors a ledger event hash.
     */
    public Optional<AnchorResult> anchorEvent(String eventHash, Long donationId, long sequence) {
        if (!isEnabled()) {
            return Optional.empty();
        }
        try {
            byte[] hashBytes = hexToBytes32(eventHash);
            BigInteger donation = donationId == null ? BigInteger.ZERO : BigInteger.valueOf(donationId);
            TransactionReceipt receipt = contract.anchorEvent(hashBytes, donation, BigInteger.valueOf(sequence)).send();
            return Optional.of(new AnchorResult(
                    receipt.getTransactionHash(),
                    receipt.getBlockNumber(),
                    receipt.isStatusOK()
            ));
        } catch (Exception e) {
            log.error("Failed to anchor ledger event {} on blockchain", sequence, e);
            return Optional.empty();
        }
    }

    /**
     * Checks whether an event hash has been anchored.
     */
    public Optional<Boolean> isAnchored(String eventHash) {
        if (!isEnabled()) {
            return Optional.empty();
        }
        try {
            return Optional.of(contract.isAnchored(hexToBytes32(eventHash)).send());
        } catch (Exception e) {
            log.error("Failed to query anchor for event hash {}", eventHash, e);
            return Optional.empty();
        }
    }

    public Optional<BigInteger> getAnchorCount() {
        if (!isEnabled()) {
            return Optional.empty();
        }
        try {
            return Optional.of(contract.getAnchorCount().send());
        } catch (Exception e) {
            log.error("Failed to get anchor count from blockchain", e);
            return Optional.empty();
        }
    }

    public boolean isEnabled() {
        return config.isEnabled() && contract != null;
    }

    /**
     * Left-pads a hex digest into a 32-byte word.
     */
    static byte[] hexToBytes32(String hex) {
        byte[] bytes = new byte[32];
        String cleanHex = hex.startsWith("0x") ? hex.substring(2) : hex;
        if (cleanHex.length() > 64) {
            cleanHex = cleanHex.substring(0, 64);
        }
        byte[] hexBytes = HexFormat.of().parseHex(cleanHex);
        System.arraycopy(hexBytes, 0, bytes, 32 - hexBytes.length, hexBytes.length);
        return bytes;
    }

    public record AnchorResult(String txHash, BigInteger blockNumber, boolean success) {}
}
