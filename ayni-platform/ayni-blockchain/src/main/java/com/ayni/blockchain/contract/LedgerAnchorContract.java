package com.ayni.blockchain.contract;

import org.web3j.abi.TypeReference;
import org.web3j.abi.datatypes.Bool;
import org.web3j.abi.datatypes.Event;
import org.web3j.abi.datatypes.Function;
import org.web3j.abi.datatypes.generated.Bytes32;
import org.web3j.abi.datatypes.generated.Uint256;
import org.web3j.crypto.Credentials;
import org.web3j.protocol.Web3j;
import org.web3j.protocol.core.RemoteFunctionCall;
import org.web3j.protocol.core.methods.response.TransactionReceipt;
import org.web3j.tx.Contract;
import org.web3j.tx.gas.ContractGasProvider;

import java.math.BigInteger;
import java.util.Arrays;
import java.util.Collections;

/**
 * Ledger Anchor Smart Contract - Web3j wrapper.
 *
 * Records the hash of each ledger event so indexers can check the off-chain event log
 * against the chain.
 *
 * Solidity equivalent:
 * contract AyniLedgerAnchor {
 *     mapping(bytes32 => bool) public anchored;
 *     uint256 public anchorCount;
 *
 *     event EventAnchored(bytes32 indexed eventHash, uint256 indexed donationId, uint256 sequence);
 *
 *     function anchorEvent(bytes32 eventHash, uint256 donationId, uint256 sequence) external onlyOwner;
 *     function isAnchored(bytes32 eventHash) external view returns (bool);
 *     function getAnchorCount() external view returns (uint256);
 * }
 */
public class LedgerAnchorContract extends Contract {

    public static final String BINARY = "";
    public static final String FUNC_ANCHOREVENT = "anchorEvent";
    public static final String FUNC_ISANCHORED = "isAnchored";
    public static final String FUNC_GETANCHORCOUNT = "getAnchorCount";

    public static final Event EVENT_ANCHORED_EVENT = new Event("EventAnchored",
            Arrays.asList(
                    new TypeReference<Bytes32>(true) {},  // eventHash
                    new TypeReference<Uint256>(true) {},  // donationId
                    new TypeReference<Uint256>() {}       // sequence
            ));

    protected LedgerAnchorContract(String contractAddress, Web3j web3j,
                                   Credentials credentials, ContractGasProvider gasProvider) {
        super(BINARY, contractAddress, web3j, credentials, gasProvider);
    }

    /**
     * Anchors an event hash. Events without a donation use donation id 0.
     */
    public RemoteFunctionCall<TransactionReceipt> anchorEvent(
            byte[] eventHash, BigInteger donationId, BigInteger sequence) {
        return executeRemoteCallTransaction(anchorEventFunction(eventHash, donationId, sequence));
    }

    public static Function anchorEventFunction(byte[] eventHash, BigInteger donationId, BigInteger sequence) {
        return new Function(
                FUNC_ANCHOREVENT,
                Arrays.asList(
                        new Bytes32(eventHash),
                        new Uint256(donationId),
                        new Uint256(sequence)
                ),
                Collections.emptyList());
    }

    public RemoteFunctionCall<Boolean> isAnchored(byte[] eventHash) {
        final Function function = new Function(
                FUNC_ISANCHORED,
                Arrays.asList(new Bytes32(eventHash)),
                Arrays.asList(new TypeReference<Bool>() {}));
        return executeRemoteCallSingleValueReturn(function, Boolean.class);
    }

    public RemoteFunctionCall<BigInteger> getAnchorCount() {
        final Function function = new Function(
                FUNC_GETANCHORCOUNT,
                Collections.emptyList(),
                Arrays.asList(new TypeReference<Uint256>() {}));
        return executeRemoteCallSingleValueReturn(function, BigInteger.class);
    }

    public static LedgerAnchorContract load(String contractAddress, Web3j web3j,
                                            Credentials credentials, ContractGasProvider gasProvider) {
        return new LedgerAnchorContract(contractAddress, web3j, credentials, gasProvider);
    }
}
