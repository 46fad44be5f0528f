package com.ayni.api.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.math.BigInteger;
import java.time.Duration;

/**
 * Ledger limits and the bootstrap administrator.
 */
@Configuration
@ConfigurationProperties(prefix = "ayni.ledger")
public class LedgerProperties {

    private String adminIdentity;
    private Duration fundingPeriod = Duration.ofDays(30);
    private Duration maxExtensionPeriod = Duration.ofDays(90);
    private BigInteger minDonationAmount = new BigInteger("100000000000000000");   // 0.1 ether
    private BigInteger maxDonationAmount = new BigInteger("10000000000000000000"); // 10 ether

    public String getAdminIdentity() { return adminIdentity; }
    public void setAdminIdentity(String adminIdentity) { this.adminIdentity = adminIdentity; }
    public Duration getFundingPeriod() { return fundingPeriod; }
    public void setFundingPeriod(Duration fundingPeriod) { this.fundingPeriod = fundingPeriod; }
    public Duration getMaxExtensionPeriod() { return maxExtensionPeriod; }
    public void setMaxExtensionPeriod(Duration maxExtensionPeriod) { this.maxExtensionPeriod = maxExtensionPeriod; }
    public BigInteger getMinDonationAmount() { return minDonationAmount; }
    public void setMinDonationAmount(BigInteger minDonationAmount) { this.minDonationAmount = minDonationAmount; }
    public BigInteger getMaxDonationAmount() { return maxDonationAmount; }
    public void setMaxDonationAmount(BigInteger maxDonationAmount) { this.maxDonationAmount = maxDonationAmount; }
}
