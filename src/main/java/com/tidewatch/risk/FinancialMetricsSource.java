package com.tidewatch.risk;

import com.tidewatch.core.error.FetchException;

import java.util.List;
import java.util.Optional;

/**
 * Financial data consumed by {@link FinancialRiskScanner}.
 */
public interface FinancialMetricsSource {

    /**
     * @return empty when the source has no financial data for {@code code}
     */
    Optional<LatestMetrics> fetchLatestMetrics(String code) throws FetchException;

    /**
     * Annual net profit for up to {@code years} most recent fiscal years, in any order.
     */
    List<ProfitPoint> fetchProfitHistory(String code, int years) throws FetchException;
}
