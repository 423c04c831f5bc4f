package com.tidewatch.risk;

/**
 * Latest reported revenue and net profit. {@code null} means the source reported no data.
 */
public final class LatestMetrics {
    public final String period;
    public final Double revenue;
    public final Double netProfit;

    public LatestMetrics(String period, Double revenue, Double netProfit) {
        this.period = period == null ? "" : period;
        this.revenue = revenue;
        this.netProfit = netProfit;
    }
}
