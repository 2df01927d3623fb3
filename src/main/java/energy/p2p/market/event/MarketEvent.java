package energy.p2p.market.event;

import com.fasterxml.jackson.annotation.JsonIgnore;
import energy.p2p.market.enums.MarketEventType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;

/**
 * Notification emitted by the market.
 * Match events carry buyer, seller, quantity and settlement price;
 * payment events carry the party and the amount.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class MarketEvent implements Serializable {

    private static final long serialVersionUID = 1L;

    /**
     * Position in the event log, starting at 1; 0 until published
     */
    private long sequence;

    private MarketEventType type;

    private Long buyOrderId;

    private Long sellOrderId;

    private String buyer;

    private String seller;

    private Long quantity;

    /**
     * Settlement price for match events
     */
    private Long price;

    /**
     * Recipient of a sent payment or payer of a received one
     */
    private String party;

    private Long amount;

    /**
     * Event timestamp in epoch milliseconds
     */
    private Long timestamp;

    public static MarketEvent matchConfirmed(long buyOrderId, long sellOrderId,
                                             String buyer, String seller, long quantity, long price) {
        return MarketEvent.builder()
                .type(MarketEventType.MATCH_CONFIRMED)
                .buyOrderId(buyOrderId)
                .sellOrderId(sellOrderId)
                .buyer(buyer)
                .seller(seller)
                .quantity(quantity)
                .price(price)
                .timestamp(System.currentTimeMillis())
                .build();
    }

    public static MarketEvent paymentSent(String recipient, long amount) {
        return MarketEvent.builder()
                .type(MarketEventType.PAYMENT_SENT)
                .party(recipient)
                .amount(amount)
                .timestamp(System.currentTimeMillis())
                .build();
    }

    public static MarketEvent paymentReceived(String payer, long amount) {
        return MarketEvent.builder()
                .type(MarketEventType.PAYMENT_RECEIVED)
                .party(payer)
                .amount(amount)
                .timestamp(System.currentTimeMillis())
                .build();
    }

    /**
     * Participants this event concerns
     */
    @JsonIgnore
    public List<String> getParticipants() {
        List<String> participants = new ArrayList<>(2);
        if (type == MarketEventType.MATCH_CONFIRMED) {
            participants.add(buyer);
            participants.add(seller);
        } else if (party != null) {
            participants.add(party);
        }
        return participants;
    }

    /**
     * Key used to partition the event downstream
     */
    @JsonIgnore
    public String getPrimaryParty() {
        return type == MarketEventType.MATCH_CONFIRMED ? buyer : party;
    }
}
