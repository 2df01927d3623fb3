package energy.p2p.market.service.kafka;

import energy.p2p.market.event.MarketEvent;
import energy.p2p.market.event.MarketEventListener;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.stereotype.Service;

import java.util.concurrent.CompletableFuture;

/**
 * Forwards market notifications to Kafka, fire-and-forget.
 * Partition key = primary party, so one participant's notifications stay ordered.
 */
@Slf4j
@Service
@ConditionalOnProperty(name = "market.events.kafka.enabled", havingValue = "true")
public class MarketEventProducerService implements MarketEventListener {

    @Autowired
    private KafkaTemplate<String, MarketEvent> marketEventKafkaTemplate;

    @Value("${market.events.kafka.topic:market-events}")
    private String marketEventTopic;

    @Override
    public void onEvent(MarketEvent event) {
        publishEvent(event);
    }

    /**
     * Publish a market event to Kafka
     *
     * @param event the event to publish
     * @return CompletableFuture with send result
     */
    public CompletableFuture<SendResult<String, MarketEvent>> publishEvent(MarketEvent event) {
        String partitionKey = event.getPrimaryParty();

        log.debug("Publishing market event to Kafka: sequence={}, type={}, key={}",
                event.getSequence(), event.getType(), partitionKey);

        CompletableFuture<SendResult<String, MarketEvent>> future =
                marketEventKafkaTemplate.send(marketEventTopic, partitionKey, event);

        future.whenComplete((result, ex) -> {
            if (ex == null) {
                log.debug("Market event published: sequence={}, partition={}, offset={}",
                        event.getSequence(),
                        result.getRecordMetadata().partition(),
                        result.getRecordMetadata().offset());
            } else {
                // The event stays in the market event log; Kafka delivery is best effort
                log.error("Failed to publish market event: sequence={}, type={}, error={}",
                        event.getSequence(), event.getType(), ex.getMessage(), ex);
            }
        });

        return future;
    }
}
