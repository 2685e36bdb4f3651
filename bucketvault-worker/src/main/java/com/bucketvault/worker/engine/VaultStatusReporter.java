package com.bucketvault.worker.engine;

import com.bucketvault.application.engine.AllocationView;
import com.bucketvault.application.engine.VaultAccountingEngine;
import com.bucketvault.domain.error.VaultException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

/**
 * Logs the state of the wired vault once the context is up.
 */
@Component
public class VaultStatusReporter implements ApplicationRunner {

  private static final Logger log = LoggerFactory.getLogger(VaultStatusReporter.class);

  private final VaultAccountingEngine engine;

  public VaultStatusReporter(VaultAccountingEngine engine) {
    this.engine = engine;
  }

  @Override
  public void run(ApplicationArguments args) {
    report();
  }

  public void report() {
    try {
      log.info("[VAULT] action=READY vault={} manager={} supply={} price={} valueUsd={} venues={} allocation={}",
          engine.vaultId(), engine.manager(), engine.totalSupply(), engine.sharePrice(),
          engine.currentTotalValue(), engine.venues().size(), engine.targetAllocation().orElse(null));
      for (AllocationView row : engine.currentAllocation()) {
        log.info("[VAULT] asset={} balance={} valueUsd={} weightBps={} targetBps={}",
            row.asset(), row.balance(), row.valueUsd(), row.weightBps(), row.targetBps());
      }
    } catch (VaultException e) {
      log.warn("[VAULT] action=READY vault={} status=DEGRADED code={} reason={}",
          engine.vaultId(), e.code(), e.getMessage());
    }
  }
}
