package com.bucketvault.application.ports;

import com.bucketvault.application.venue.ExecutedSwap;

import java.util.List;

/**
 * Executes a caller-supplied aggregator route against the vault's holdings.
 * The route payload is opaque to the engine.
 */
public interface AggregatorRouterPort {

    List<ExecutedSwap> execute(byte[] routeData) throws Exception;
}
