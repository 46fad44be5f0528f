package com.ayni.blockchain.service;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Settings for anchoring ledger events on chain, bound from {@code ayni.blockchain.*}.
 * Anchoring stays off unless {@code enabled} is set and both the contract address and
 * signing key are present.
 */
@Configuration
@ConfigurationProperties(prefix = "ayni.blockchain")
public class BlockchainConfig {

    private String nodeUrl = "http://localhost:8545";
    private String anchorContractAddress;
    private String privateKey;
    private long gasPrice = 20_000_000_000L; // wei
    private long gasLimit = 300_000L;
    private boolean enabled = false;

    /**
     * True when anchoring is switched on and has what it needs to sign transactions.
     */
    public boolean isAnchoringConfigured() {
        return enabled
                && anchorContractAddress != null && !anchorContractAddress.isBlank()
                && privateKey != null && !privateKey.isBlank();
    }

    public String getNodeUrl() { return nodeUrl; }
    public void setNodeUrl(String nodeUrl) { this.nodeUrl = nodeUrl; }
    public String getAnchorContractAddress() { return anchorContractAddress; }
    public void setAnchorContractAddress(String anchorContractAddress) { this.anchorContractAddress = anchorContractAddress; }
    public String getPrivateKey() { return privateKey; }
    public void setPrivateKey(String privateKey) { this.privateKey = privateKey; }
    public long getGasPrice() { return gasPrice; }
    public void setGasPrice(long gasPrice) { this.gasPrice = gasPrice; }
    public long getGasLimit() { return gasLimit; }
    public void setGasLimit(long gasLimit) { this.gasLimit = gasLimit; }
    public boolean isEnabled() { return enabled; }
    public void setEnabled(boolean enabled) { this.enabled = enabled; }
}
