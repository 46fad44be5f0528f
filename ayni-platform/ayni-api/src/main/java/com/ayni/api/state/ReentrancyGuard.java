package com.ayni.api.state;

import com.ayni.core.error.ReentrantCallException;
import org.springframework.stereotype.Component;

/**
 * Per-thread lock held by a mutating ledger operation while it runs. A second mutating call
 * on the same thread, such as one made from inside an outbound transfer, is rejected.
 *
 * <pre>
 * reentrancyGuard.enter("fundDonation");
 * try {
 *     ...
 * } finally {
 *     reentrancyGuard.exit();
 * }
 * </pre>
 */
@Component
public class ReentrancyGuard {

    private final ThreadLocal<String> inFlight = new ThreadLocal<>();

    public void enter(String operation) {
        String current = inFlight.get();
        if (current != null) {
            throw new ReentrantCallException(operation + " during " + current);
        }
        inFlight.set(operation);
    }

    public void exit() {
        inFlight.remove();
    }

    public boolean isHeld() {
        return inFlight.get() != null;
    }
}
