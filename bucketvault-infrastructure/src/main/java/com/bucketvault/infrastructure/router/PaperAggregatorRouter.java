package com.bucketvault.infrastructure.router;

import com.bucketvault.application.ports.AggregatorRouterPort;
import com.bucketvault.application.venue.ExecutedSwap;
import com.bucketvault.domain.asset.AssetId;
import com.bucketvault.infrastructure.venue.PaperVenue;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * PAPER aggregator: executes a JSON route hop by hop on one paper venue.
 *
 * <p>Route format:
 * <pre>
 * {"legs":[{"assetIn":"USDC","assetOut":"WETH","amountIn":"1000000","minAmountOut":"0"}]}
 * </pre>
 * Amounts are decimal strings (or JSON integers) in the asset's smallest unit.
 */
public final class PaperAggregatorRouter implements AggregatorRouterPort {

    private static final Logger log = LoggerFactory.getLogger(PaperAggregatorRouter.class);

    static final String LABEL = "aggregator";

    private final ObjectMapper mapper;
    private final PaperVenue venue;

    public PaperAggregatorRouter(ObjectMapper mapper, PaperVenue venue) {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
        this.venue = Objects.requireNonNull(venue, "venue");
    }

    @Override
    public List<ExecutedSwap> execute(byte[] routeData) throws IOException {
        List<RouteLeg> legs = parse(routeData);
        List<ExecutedSwap> out = new ArrayList<>(legs.size());
        for (RouteLeg leg : legs) {
            BigInteger received = venue.swap(leg.assetIn(), leg.assetOut(), leg.amountIn(), leg.minAmountOut(), 0);
            out.add(new ExecutedSwap(LABEL + ":" + venue.id(), leg.assetIn(), leg.assetOut(), leg.amountIn(),
                    received, received));
        }
        log.info("[ROUTER] action=EXECUTE legs={} venue={}", out.size(), venue.id());
        return out;
    }

    public List<RouteLeg> parse(byte[] routeData) throws IOException {
        JsonNode root = mapper.readTree(routeData);
        JsonNode legs = root == null ? null : root.path("legs");
        if (legs == null || !legs.isArray() || legs.isEmpty()) {
            throw new IllegalArgumentException("Route has no legs");
        }
        List<RouteLeg> out = new ArrayList<>();
        for (JsonNode leg : legs) {
            out.add(new RouteLeg(
                    AssetId.of(text(leg, "assetIn")),
                    AssetId.of(text(leg, "assetOut")),
                    amount(leg, "amountIn"),
                    leg.has("minAmountOut") ? amount(leg, "minAmountOut") : BigInteger.ZERO));
        }
        return out;
    }

    public byte[] encode(List<RouteLeg> legs) {
        ObjectNode root = mapper.createObjectNode();
        ArrayNode arr = root.putArray("legs");
        for (RouteLeg leg : legs) {
            ObjectNode n = arr.addObject();
            n.put("assetIn", leg.assetIn().value());
            n.put("assetOut", leg.assetOut().value());
            n.put("amountIn", leg.amountIn().toString());
            n.put("minAmountOut", leg.minAmountOut().toString());
        }
        try {
            return mapper.writeValueAsString(root).getBytes(StandardCharsets.UTF_8);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot encode route", e);
        }
    }

    private static String text(JsonNode node, String field) {
        JsonNode v = node.path(field);
        if (!v.isTextual() || v.asText().isBlank()) {
            throw new IllegalArgumentException("Route leg is missing '" + field + "'");
        }
        return v.asText();
    }

    private static BigInteger amount(JsonNode node, String field) {
        JsonNode v = node.path(field);
        if (v.isIntegralNumber()) return v.bigIntegerValue();
        if (v.isTextual()) {
            try {
                return new BigInteger(v.asText().trim());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Route leg '" + field + "' is not an integer: " + v.asText(), e);
            }
        }
        throw new IllegalArgumentException("Route leg is missing '" + field + "'");
    }
}
