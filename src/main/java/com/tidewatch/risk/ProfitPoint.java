package com.tidewatch.risk;

import java.util.Objects;

public final class ProfitPoint {
    public final String period;
    public final Double netProfit;

    public ProfitPoint(String period, Double netProfit) {
        this.period = Objects.requireNonNull(period, "period");
        this.netProfit = netProfit;
    }
}
