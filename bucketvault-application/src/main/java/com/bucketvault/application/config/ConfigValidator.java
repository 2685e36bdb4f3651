package com.bucketvault.application.config;

import com.bucketvault.application.ports.ConfigPort;
import com.bucketvault.domain.DomainException;
import com.bucketvault.domain.vault.FixedPoint;

public final class ConfigValidator {

    public ConfigValidationResult validate(ConfigPort config) {
        ConfigValidationResult res = new ConfigValidationResult();

        for (ConfigKey k : ConfigKey.values()) {
            if (k.isOptional()) continue;
            String v = config.get(k.key());
            if (v == null || v.isBlank()) {
                res.addError("Missing required config: " + k.key());
            }
        }

        checkBps(config, ConfigKey.TOLERANCE_BPS, res);
        checkBps(config, ConfigKey.MAX_VALUE_LOSS_BPS, res);
        checkBps(config, ConfigKey.VENUE_SLIPPAGE_BPS, res);
        checkBps(config, ConfigKey.MIN_OWNER_BPS, res);
        checkBps(config, ConfigKey.OWNER_FEE_BPS, res);
        checkBps(config, ConfigKey.CALLER_FEE_BPS, res);
        checkBps(config, ConfigKey.PLATFORM_FEE_BPS, res);
        checkBps(config, ConfigKey.PAPER_FEE_BPS, res);
        checkBps(config, ConfigKey.PAPER_SLIPPAGE_BPS, res);

        int owner = config.getInt(ConfigKey.OWNER_FEE_BPS.key(), 0);
        int caller = config.getInt(ConfigKey.CALLER_FEE_BPS.key(), 0);
        if (owner + caller > FixedPoint.BPS) {
            res.addError("vault.fee.ownerBps + vault.fee.callerBps must not exceed " + FixedPoint.BPS);
        }

        String allocation = config.get(ConfigKey.ALLOCATION.key(), "");
        if (!allocation.isBlank()) {
            try {
                AllocationParser.parse(allocation);
            } catch (DomainException | IllegalArgumentException e) {
                res.addError("vault.allocation: " + e.getMessage());
            }
        }
        return res;
    }

    private static void checkBps(ConfigPort config, ConfigKey key, ConfigValidationResult res) {
        String raw = config.get(key.key());
        if (raw == null || raw.isBlank()) return;
        try {
            int v = Integer.parseInt(raw.trim());
            if (v < 0 || v > FixedPoint.BPS) res.addError(key.key() + " must be in [0, " + FixedPoint.BPS + "]");
        } catch (NumberFormatException e) {
            res.addError(key.key() + " is not an integer: " + raw);
        }
    }
}
