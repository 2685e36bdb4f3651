package com.bucketvault.worker.wiring;

import com.bucketvault.application.engine.VaultAccountingEngine;
import com.bucketvault.application.ports.ConfigPort;
import com.bucketvault.application.ports.VaultStateRepository;
import com.bucketvault.infrastructure.config.FileConfigService;
import com.bucketvault.infrastructure.custody.InMemoryCustody;
import com.bucketvault.infrastructure.journal.Slf4jVaultJournal;
import com.bucketvault.infrastructure.oracle.InMemoryPriceOracle;
import com.bucketvault.infrastructure.router.PaperAggregatorRouter;
import com.bucketvault.infrastructure.venue.SimpleVenueRegistry;
import com.bucketvault.worker.metrics.VaultMetrics;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.io.IOException;

@Configuration
public class VaultWiringConfig {

  @Bean
  public ConfigPort configPort() throws IOException {
    ConfigPort config = FileConfigService.defaultFromWorkingDir();
    PaperVaultBootstrap.validate(config);
    return config;
  }

  @Bean
  public ObjectMapper objectMapper() {
    return new ObjectMapper();
  }

  @Bean
  public MeterRegistry meterRegistry() {
    return new SimpleMeterRegistry();
  }

  @Bean
  public InMemoryPriceOracle priceOracle(ConfigPort config) {
    return PaperVaultBootstrap.oracle(config);
  }

  @Bean
  public InMemoryCustody custody(ConfigPort config, InMemoryPriceOracle oracle) {
    return PaperVaultBootstrap.custody(config, oracle);
  }

  @Bean
  public PaperVenues paperVenues(ConfigPort config, InMemoryPriceOracle oracle, InMemoryCustody custody) {
    return new PaperVenues(PaperVaultBootstrap.venues(config, oracle, custody));
  }

  @Bean
  public SimpleVenueRegistry venueRegistry(PaperVenues paperVenues) {
    return PaperVaultBootstrap.registry(paperVenues.all());
  }

  @Bean
  public PaperAggregatorRouter aggregatorRouter(ObjectMapper mapper, PaperVenues paperVenues) {
    return new PaperAggregatorRouter(mapper, paperVenues.first());
  }

  @Bean
  public VaultStateRepository vaultStateRepository(ConfigPort config, ObjectMapper mapper) {
    return PaperVaultBootstrap.repository(config, mapper);
  }

  @Bean
  public VaultMetrics vaultMetrics(MeterRegistry registry) {
    return new VaultMetrics(registry, new Slf4jVaultJournal());
  }

  @Bean
  public VaultAccountingEngine vaultAccountingEngine(ConfigPort config,
                                                     InMemoryPriceOracle oracle,
                                                     InMemoryCustody custody,
                                                     PaperVenues paperVenues,
                                                     SimpleVenueRegistry venueRegistry,
                                                     PaperAggregatorRouter aggregatorRouter,
                                                     VaultStateRepository vaultStateRepository,
                                                     VaultMetrics vaultMetrics) {
    return PaperVaultBootstrap.engine(config, oracle, custody, paperVenues.all(), venueRegistry, aggregatorRouter,
        vaultStateRepository, vaultMetrics);
  }
}
