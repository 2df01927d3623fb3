package energy.p2p.market.settlement;

import lombok.extern.slf4j.Slf4j;

import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

/**
 * Value held by the market (escrow) and the balances credited to participants.
 * Value enters escrow through {@link #receive(String, long)} and only leaves it
 * through {@link #moveFromEscrow(String, long)}; there is no refund operation.
 * Not thread-safe, callers serialize access.
 */
@Slf4j
public class EscrowLedger {

    private long escrowBalance;

    private final Map<String, Long> balances = new HashMap<>();

    /**
     * Participants that refuse incoming transfers
     */
    private final Set<String> rejectingAccounts = new HashSet<>();

    /**
     * Take value tendered by a participant into escrow
     */
    public void receive(String payer, long amount) {
        if (amount < 0) {
            throw new IllegalArgumentException("Negative amount received from " + payer + ": " + amount);
        }
        escrowBalance = Math.addExact(escrowBalance, amount);
        log.info("Escrow received: payer={}, amount={}, escrowBalance={}", payer, amount, escrowBalance);
    }

    /**
     * Whether escrow can take the amount without its total overflowing
     */
    public boolean canReceive(long amount) {
        return amount >= 0 && escrowBalance <= Long.MAX_VALUE - amount;
    }

    /**
     * Debit escrow and credit the recipient. Either both happen or neither does.
     *
     * @throws IllegalArgumentException if the amount is negative
     * @throws IllegalStateException    if escrow cannot cover the amount
     * @throws ArithmeticException      if the recipient balance would overflow
     */
    public void moveFromEscrow(String recipient, long amount) {
        if (amount < 0) {
            throw new IllegalArgumentException("Negative transfer amount: " + amount);
        }
        if (escrowBalance < amount) {
            throw new IllegalStateException("Escrow balance " + escrowBalance + " cannot cover " + amount);
        }
        long credited = Math.addExact(getBalance(recipient), amount);
        escrowBalance -= amount;
        balances.put(recipient, credited);
        log.info("Escrow paid out: recipient={}, amount={}, recipientBalance={}, escrowBalance={}",
                recipient, amount, credited, escrowBalance);
    }

    public long getEscrowBalance() {
        return escrowBalance;
    }

    public long getBalance(String participant) {
        return balances.getOrDefault(participant, 0L);
    }

    public boolean rejectsIncoming(String participant) {
        return rejectingAccounts.contains(participant);
    }

    public void setRejectsIncoming(String participant, boolean rejecting) {
        if (rejecting) {
            rejectingAccounts.add(participant);
        } else {
            rejectingAccounts.remove(participant);
        }
        log.info("Incoming transfers {} for participant={}", rejecting ? "rejected" : "accepted", participant);
    }
}
