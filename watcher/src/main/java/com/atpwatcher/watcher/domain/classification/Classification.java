package com.atpwatcher.watcher.domain.classification;

import java.math.BigDecimal;

public record Classification(Tier tier, BigDecimal deltaPct, BigDecimal delta) {

    static Classification none(BigDecimal deltaPct, BigDecimal delta) {
        return new Classification(Tier.NONE, deltaPct, delta);
    }

    public boolean hasTier() {
        return tier != Tier.NONE;
    }

    public boolean isIncrease() {
        return delta.signum() > 0;
    }
}
