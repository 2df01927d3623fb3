package energy.p2p.market.controller;

import energy.p2p.market.dto.ApiResponse;
import energy.p2p.market.dto.ExecuteOrderRequest;
import energy.p2p.market.dto.MatchResult;
import energy.p2p.market.dto.OrderResponse;
import energy.p2p.market.dto.PlaceOrderRequest;
import energy.p2p.market.dto.SettlementResult;
import energy.p2p.market.service.MatchingEngineService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * REST Controller for the order book
 * Handles order placement, matching, settlement and queries
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/orders")
@Validated
@Tag(name = "Order Book", description = "Place, match and execute energy orders")
public class OrderController {

    public static final String PARTICIPANT_HEADER = "X-Participant-Id";

    @Autowired
    private MatchingEngineService matchingEngineService;

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    @Operation(
        summary = "Place an order",
        description = "Append a BUY or SELL order for the calling participant. No payment is taken at placement."
    )
    public ApiResponse<OrderResponse> placeOrder(
            @Parameter(description = "Calling participant", required = true)
            @RequestHeader(PARTICIPANT_HEADER) @NotBlank String participantId,
            @Valid @RequestBody PlaceOrderRequest request) {

        log.info("Received place order request: participantId={}, request={}", participantId, request);

        OrderResponse order = matchingEngineService.placeOrder(
                request.getSide(), participantId, request.getQuantity(), request.getPrice());
        return ApiResponse.success("Order placed", order);
    }

    @GetMapping
    @Operation(summary = "List orders", description = "All orders in placement order")
    public ApiResponse<List<OrderResponse>> getOrders() {
        return ApiResponse.success(matchingEngineService.getOrders());
    }

    @GetMapping("/count")
    @Operation(summary = "Order count", description = "Number of orders ever placed")
    public ApiResponse<Long> getOrderCount() {
        return ApiResponse.success(matchingEngineService.getOrderCount());
    }

    @GetMapping("/{orderId}")
    @Operation(summary = "Query order by ID")
    public ApiResponse<OrderResponse> getOrder(
            @Parameter(description = "Order ID", required = true)
            @PathVariable @Min(0) long orderId) {

        log.debug("Querying order: orderId={}", orderId);
        return ApiResponse.success(matchingEngineService.getOrder(orderId));
    }

    @PostMapping("/{orderId}/match")
    @Operation(
        summary = "Match a buy order",
        description = "Pair the buy order with the first sell order (lowest id) of equal quantity and a price "
                      + "not above the bid. The buyer adopts the seller's price. Finding nothing is not an error."
    )
    public ApiResponse<MatchResult> matchOrder(
            @Parameter(description = "Buy order ID", required = true)
            @PathVariable @Min(0) long orderId) {

        log.info("Received match request: buyOrderId={}", orderId);

        MatchResult result = matchingEngineService.matchOrder(orderId);
        return ApiResponse.success(result.isMatched() ? "Order matched" : "No matching sell order", result);
    }

    @PostMapping("/match-pending")
    @Operation(summary = "Match all open buy orders", description = "Attempt a match for every open buy order, oldest first")
    public ApiResponse<List<MatchResult>> matchPendingOrders() {
        log.info("Received match-pending request");
        return ApiResponse.success(matchingEngineService.matchPendingBuyOrders());
    }

    @PostMapping("/{orderId}/execute")
    @Operation(
        summary = "Execute a matched order",
        description = "Only the buyer may execute. The payment must exceed quantity x settlement price; the "
                      + "excess is kept in market escrow. If the transfer to the seller fails, the orders stay "
                      + "matched and the payment stays in escrow (no refund)."
    )
    public ApiResponse<SettlementResult> executeOrder(
            @Parameter(description = "Order ID (either leg of the match)", required = true)
            @PathVariable @Min(0) long orderId,
            @Parameter(description = "Calling participant", required = true)
            @RequestHeader(PARTICIPANT_HEADER) @NotBlank String participantId,
            @Valid @RequestBody ExecuteOrderRequest request) {

        log.info("Received execute request: orderId={}, participantId={}, payment={}",
                orderId, participantId, request.getPayment());

        SettlementResult result = matchingEngineService.executeOrder(orderId, request.getPayment(), participantId);
        return ApiResponse.success("Order executed", result);
    }
}
