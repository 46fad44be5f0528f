package com.ayni.api.config;

import com.ayni.api.escrow.TransferGateway;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;

/**
 * Transfer gateway that can be told to fail or to run a callback mid-transfer, before
 * handing the transfer to the real wallet gateway.
 */
public class ScriptedTransferGateway implements TransferGateway {

    private final TransferGateway delegate;
    private final List<String> recipients = new ArrayList<>();
    private volatile boolean failNext;
    private volatile Runnable duringNextTransfer;

    public ScriptedTransferGateway(TransferGateway delegate) {
        this.delegate = delegate;
    }

    @Override
    public void transfer(String recipient, BigInteger amount) {
        recipients.add(recipient);
        if (failNext) {
            failNext = false;
            throw new TransferException("Recipient rejected transfer of " + amount);
        }
        Runnable callback = duringNextTransfer;
        duringNextTransfer = null;
        if (callback != null) {
            callback.run();
        }
        delegate.transfer(recipient, amount);
    }

    public void failNextTransfer() {
        this.failNext = true;
    }

    public void onNextTransfer(Runnable callback) {
        this.duringNextTransfer = callback;
    }

    public List<String> getRecipients() {
        return List.copyOf(recipients);
    }

    public void reset() {
        failNext = false;
        duringNextTransfer = null;
        recipients.clear();
    }
}
