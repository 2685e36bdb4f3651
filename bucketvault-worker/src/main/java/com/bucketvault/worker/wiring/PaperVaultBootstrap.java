package com.bucketvault.worker.wiring;

import com.bucketvault.application.config.AllocationParser;
import com.bucketvault.application.config.ConfigKey;
import com.bucketvault.application.config.ConfigValidationResult;
import com.bucketvault.application.config.ConfigValidator;
import com.bucketvault.application.config.VaultParameters;
import com.bucketvault.application.engine.VaultAccountingEngine;
import com.bucketvault.application.ports.AggregatorRouterPort;
import com.bucketvault.application.ports.ConfigPort;
import com.bucketvault.application.ports.VaultJournalPort;
import com.bucketvault.application.ports.VaultStateRepository;
import com.bucketvault.application.venue.VenueConfig;
import com.bucketvault.application.venue.VenueId;
import com.bucketvault.domain.asset.Asset;
import com.bucketvault.domain.asset.AssetId;
import com.bucketvault.domain.vault.HolderId;
import com.bucketvault.domain.vault.VaultId;
import com.bucketvault.infrastructure.custody.InMemoryCustody;
import com.bucketvault.infrastructure.oracle.InMemoryPriceOracle;
import com.bucketvault.infrastructure.persistence.InMemoryVaultStateRepository;
import com.bucketvault.infrastructure.persistence.JsonFileVaultStateRepository;
import com.bucketvault.infrastructure.venue.PaperExecutionModel;
import com.bucketvault.infrastructure.venue.PaperVenue;
import com.bucketvault.infrastructure.venue.SimpleVenueRegistry;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.math.BigInteger;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Builds a PAPER vault (in-memory oracle, custody and venues) from configuration.
 */
public final class PaperVaultBootstrap {

  static final int DEFAULT_FEE_TIER = 3000;

  private PaperVaultBootstrap() {}

  public static void validate(ConfigPort config) {
    ConfigValidationResult res = new ConfigValidator().validate(config);
    if (!res.isValid()) {
      throw new IllegalStateException("Invalid vault configuration: " + res.summary());
    }
  }

  /**
   * Registers every row of {@code vault.paper.assets}: {@code ID:DECIMALS:PRICE_USD_8DP[:native]}.
   */
  public static InMemoryPriceOracle oracle(ConfigPort config) {
    InMemoryPriceOracle oracle = new InMemoryPriceOracle(
        HolderId.of(config.get(ConfigKey.PLATFORM_RECIPIENT.key(), "platform")),
        config.getInt(ConfigKey.PLATFORM_FEE_BPS.key(), 0));

    String rows = config.get(ConfigKey.PAPER_ASSETS.key(), "");
    for (String row : rows.split(",")) {
      String t = row.trim();
      if (t.isEmpty()) continue;
      String[] p = t.split(":");
      if (p.length < 3 || p.length > 4) {
        throw new IllegalArgumentException("Unsupported paper asset row: " + t);
      }
      boolean nativeCoin = p.length == 4 && "native".equalsIgnoreCase(p[3].trim());
      Asset asset = new Asset(AssetId.of(p[0]), Integer.parseInt(p[1].trim()), nativeCoin);
      oracle.register(asset, new BigInteger(p[2].trim()));
    }
    return oracle;
  }

  public static InMemoryCustody custody(ConfigPort config, InMemoryPriceOracle oracle) {
    String wrapped = config.get(ConfigKey.PAPER_WRAPPED_NATIVE.key());
    if (wrapped == null) return new InMemoryCustody();
    Asset nativeCoin = oracle.nativeAsset()
        .orElseThrow(() -> new IllegalStateException(
            ConfigKey.PAPER_WRAPPED_NATIVE.key() + " is set but no paper asset is marked native"));
    return new InMemoryCustody(nativeCoin.id(), AssetId.of(wrapped));
  }

  public static List<PaperVenue> venues(ConfigPort config, InMemoryPriceOracle oracle, InMemoryCustody custody) {
    int count = Math.max(0, config.getInt(ConfigKey.PAPER_VENUES.key(), 1));
    PaperExecutionModel model = new PaperExecutionModel(
        config.getInt(ConfigKey.PAPER_FEE_BPS.key(), PaperExecutionModel.defaults().feeBps()),
        config.getInt(ConfigKey.PAPER_SLIPPAGE_BPS.key(), PaperExecutionModel.defaults().slippageBps()));
    List<PaperVenue> out = new ArrayList<>(count);
    for (int i = 0; i < count; i++) {
      out.add(new PaperVenue(VenueId.of(i), oracle, custody, model));
    }
    return out;
  }

  public static SimpleVenueRegistry registry(List<PaperVenue> venues) {
    SimpleVenueRegistry registry = new SimpleVenueRegistry();
    venues.forEach(registry::register);
    return registry;
  }

  /** JSON files under {@code vault.state.dir} when set, otherwise memory only. */
  public static VaultStateRepository repository(ConfigPort config, ObjectMapper mapper) {
    String dir = config.get(ConfigKey.STATE_DIR.key());
    if (dir == null) return new InMemoryVaultStateRepository();
    return new JsonFileVaultStateRepository(Path.of(dir), mapper);
  }

  public static VaultAccountingEngine engine(ConfigPort config,
                                             InMemoryPriceOracle oracle,
                                             InMemoryCustody custody,
                                             List<PaperVenue> venues,
                                             SimpleVenueRegistry registry,
                                             AggregatorRouterPort aggregator,
                                             VaultStateRepository repository,
                                             VaultJournalPort journal) {
    VaultAccountingEngine.Builder b = VaultAccountingEngine.builder()
        .vaultId(VaultId.of(config.get(ConfigKey.VAULT_ID.key())))
        .manager(HolderId.of(config.get(ConfigKey.VAULT_MANAGER.key())))
        .oracle(oracle)
        .custody(custody)
        .aggregator(aggregator)
        .repository(repository)
        .journal(journal)
        .parameters(VaultParameters.fromConfig(config))
        .venueRegistry(registry);

    if (custody.supportsWrapping()) b.nativeWrapper(custody);

    String allocation = config.get(ConfigKey.ALLOCATION.key());
    if (allocation != null) b.allocation(AllocationParser.parse(allocation));

    for (PaperVenue v : venues) {
      b.venue(new VenueConfig(v.id(), v, v, DEFAULT_FEE_TIER, custody.supportsWrapping(), true));
    }
    VaultAccountingEngine engine = b.build();
    requireBackedShares(engine);
    return engine;
  }

  /**
   * Paper custody lives in memory only, so a snapshot with outstanding shares cannot be resumed after a
   * restart: the holdings behind those shares are gone.
   */
  static void requireBackedShares(VaultAccountingEngine engine) {
    if (engine.totalSupply().signum() > 0 && engine.currentTotalValue().signum() == 0) {
      throw new IllegalStateException("Stored vault " + engine.vaultId() + " has " + engine.totalSupply()
          + " shares outstanding but paper custody holds nothing; remove the snapshot under "
          + ConfigKey.STATE_DIR.key() + " to start over");
    }
  }
}
