package energy.p2p.market.registry;

import energy.p2p.market.domain.Installation;
import energy.p2p.market.event.MarketEvent;
import energy.p2p.market.event.MarketEventPublisher;
import energy.p2p.market.exception.InstallationNotInstalledException;
import energy.p2p.market.exception.InsufficientPaymentException;
import energy.p2p.market.exception.InvalidInstallationException;
import energy.p2p.market.settlement.EscrowLedger;
import lombok.extern.slf4j.Slf4j;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Registry of generation installations. Registration requires an upfront
 * payment of at least capacity x unit rate, which is taken into escrow.
 * Independent of matching and settlement.
 */
@Slf4j
public class InstallationRegistry {

    private final List<Installation> installations = new ArrayList<>();

    private final long unitRate;

    private final EscrowLedger ledger;

    private final MarketEventPublisher eventPublisher;

    public InstallationRegistry(long unitRate, EscrowLedger ledger, MarketEventPublisher eventPublisher) {
        if (unitRate < 0) {
            throw new IllegalArgumentException("Installation unit rate must not be negative: " + unitRate);
        }
        this.unitRate = unitRate;
        this.ledger = ledger;
        this.eventPublisher = eventPublisher;
    }

    /**
     * Register an installation
     *
     * @return the new installation id
     * @throws InvalidInstallationException  if owner is blank or capacity is not positive
     * @throws InsufficientPaymentException if payment is below capacity x unit rate
     */
    public long register(String owner, long capacity, long payment) {
        if (owner == null || owner.isBlank()) {
            throw new InvalidInstallationException("Installation owner must be specified");
        }
        if (capacity <= 0) {
            throw new InvalidInstallationException("Capacity must be positive: " + capacity);
        }

        long minimumPayment = getMinimumPayment(capacity);
        if (payment < minimumPayment) {
            throw new InsufficientPaymentException("Payment " + payment + " is below the minimum "
                    + minimumPayment + " for capacity " + capacity);
        }
        if (!ledger.canReceive(payment)) {
            throw new InvalidInstallationException("Payment " + payment + " exceeds the remaining escrow capacity");
        }

        ledger.receive(owner, payment);
        eventPublisher.publish(MarketEvent.paymentReceived(owner, payment));

        long installationId = installations.size();
        installations.add(Installation.builder()
                .installationId(installationId)
                .owner(owner)
                .capacity(capacity)
                .installed(true)
                .paidAmount(payment)
                .registeredAt(LocalDateTime.now())
                .build());

        log.info("Installation registered: installationId={}, owner={}, capacity={}, payment={}",
                installationId, owner, capacity, payment);
        return installationId;
    }

    /**
     * @throws InvalidInstallationException if capacity x unit rate overflows
     */
    public long getMinimumPayment(long capacity) {
        try {
            return Math.multiplyExact(capacity, unitRate);
        } catch (ArithmeticException e) {
            throw new InvalidInstallationException("Capacity too large: " + capacity);
        }
    }

    /**
     * @throws InstallationNotInstalledException if no installed record exists for the id
     */
    public Installation get(long installationId) {
        if (installationId < 0 || installationId >= installations.size()) {
            throw new InstallationNotInstalledException(installationId);
        }
        Installation installation = installations.get((int) installationId);
        if (!installation.isInstalled()) {
            throw new InstallationNotInstalledException(installationId);
        }
        return installation;
    }

    public long count() {
        return installations.size();
    }
}
