package com.atpwatcher.watcher.domain.alert;

import com.atpwatcher.watcher.domain.classification.Classification;
import com.atpwatcher.watcher.domain.target.WatchKind;
import com.atpwatcher.watcher.domain.target.WatchTarget;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.text.NumberFormat;
import java.util.Locale;

public class AlertMessageFormatter {

    public String percentChange(WatchTarget target, Classification classification,
                                BigDecimal previous, BigDecimal current, BigDecimal threshold) {
        var direction = classification.isIncrease() ? "up" : "down";
        var headline = switch (target.kind()) {
            case PORTFOLIO -> "Significant portfolio change";
            case TOKEN -> target.displayName() + " price alert";
            case BASE_TOKEN -> target.displayName() + " base token alert";
        };
        var label = switch (target.kind()) {
            case PORTFOLIO -> "Value";
            case TOKEN, BASE_TOKEN -> "Price";
        };

        var message = new StringBuilder()
                .append(headline).append(": ").append(direction).append(' ')
                .append(signedPercent(classification.deltaPct()))
                .append(" [").append(classification.tier()).append(", threshold ")
                .append(threshold.stripTrailingZeros().toPlainString()).append("%]\n")
                .append(label).append(": ").append(currency(current))
                .append(" (was ").append(currency(previous)).append(")\n")
                .append("Change: ").append(classification.isIncrease() ? "+" : "-")
                .append(currency(classification.delta().abs()));
        if (target.kind() == WatchKind.BASE_TOKEN) {
            message.append("\nBase token moves may affect all agent prices.");
        }
        return message.toString();
    }

    public String milestoneReached(WatchTarget target, BigDecimal current) {
        return "Portfolio milestone reached: " + currency(current)
                + " is at or above " + currency(target.milestoneUsd())
                + "\nWallet: " + target.id();
    }

    private static String signedPercent(BigDecimal pct) {
        var scaled = pct.setScale(2, RoundingMode.HALF_UP);
        return (scaled.signum() > 0 ? "+" : "") + scaled.toPlainString() + "%";
    }

    private static String currency(BigDecimal amount) {
        var format = NumberFormat.getCurrencyInstance(Locale.US);
        format.setMinimumFractionDigits(2);
        format.setMaximumFractionDigits(6);
        return format.format(amount);
    }
}
