package com.bucketvault.worker.metrics;

import com.bucketvault.application.engine.VaultAccountingEngine;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

/**
 * Exposes:
 * - bucketvault.vault.supply (gauge, share units)
 * - bucketvault.vault.share_price (gauge, USD 8dp)
 */
@Component
public class VaultGauges {

  public VaultGauges(MeterRegistry registry, VaultAccountingEngine engine) {
    registry.gauge("bucketvault.vault.supply", engine, e -> e.totalSupply().doubleValue());
    registry.gauge("bucketvault.vault.share_price", engine, e -> e.sharePrice().doubleValue());
  }
}
