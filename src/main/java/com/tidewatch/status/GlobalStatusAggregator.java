package com.tidewatch.status;

import com.tidewatch.calendar.SettlementCalendar;
import com.tidewatch.risk.FinancialRiskScanner;
import com.tidewatch.timing.TimingFunnel;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.LocalDate;
import java.util.Objects;

public final class GlobalStatusAggregator {
    private static final Logger LOG = LogManager.getLogger(GlobalStatusAggregator.class);

    private final TimingFunnel timingFunnel;
    private final SettlementCalendar settlementCalendar;
    private final FinancialRiskScanner riskScanner;

    public GlobalStatusAggregator(
            TimingFunnel timingFunnel,
            SettlementCalendar settlementCalendar,
            FinancialRiskScanner riskScanner
    ) {
        this.timingFunnel = Objects.requireNonNull(timingFunnel, "timingFunnel");
        this.settlementCalendar = Objects.requireNonNull(settlementCalendar, "settlementCalendar");
        this.riskScanner = Objects.requireNonNull(riskScanner, "riskScanner");
    }

    public GlobalStatus aggregate(LocalDate date) {
        GlobalStatus status = new GlobalStatus(
                timingFunnel.timingFor(date),
                settlementCalendar.calendarToday(date),
                riskScanner.riskSummary()
        );
        LOG.debug("Global status for {}: timing={}, risk_total={}", date, status.timing, status.risk.total);
        return status;
    }
}
