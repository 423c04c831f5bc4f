package com.tidewatch.data;

import com.tidewatch.core.error.FetchException;
import com.tidewatch.risk.FinancialMetricsSource;
import com.tidewatch.risk.LatestMetrics;
import com.tidewatch.risk.ProfitPoint;
import org.json.JSONArray;
import org.json.JSONObject;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Financial metrics from the ZhituAPI indicator and income-statement endpoints. Only annual reports
 * (periods ending 12-31) are considered.
 */
public final class ZhituFinancialSource implements FinancialMetricsSource {
    static final String[] NET_PROFIT_KEYS = {"kflr", "jlr", "netProfit", "net_profit", "parentNetProfit", "gsjlr"};
    static final String[] INCOME_PROFIT_KEYS = {"jlr", "kflr", "netProfit", "net_profit", "parentNetProfit", "gsjlr"};
    static final String[] REVENUE_KEYS = {"zyyw", "yysr", "totalRevenue", "total_revenue", "yyzsr", "revenue"};
    static final String[] DATE_KEYS = {"date", "jzrq", "reportDate", "rq", "report_date"};

    private final ZhituClient client;

    public ZhituFinancialSource(ZhituClient client) {
        this.client = Objects.requireNonNull(client, "client");
    }

    @Override
    public Optional<LatestMetrics> fetchLatestMetrics(String code) throws FetchException {
        List<JSONObject> annual = annualRows(client.financialIndicators(code));
        if (annual.isEmpty()) {
            return Optional.empty();
        }
        JSONObject latest = annual.get(annual.size() - 1);
        return Optional.of(new LatestMetrics(
                period(latest),
                FieldExtractor.number(latest, REVENUE_KEYS),
                FieldExtractor.number(latest, NET_PROFIT_KEYS)
        ));
    }

    @Override
    public List<ProfitPoint> fetchProfitHistory(String code, int years) throws FetchException {
        List<JSONObject> annual = annualRows(client.incomeStatements(code));
        int from = Math.max(0, annual.size() - Math.max(1, years));
        List<ProfitPoint> out = new ArrayList<>();
        for (JSONObject row : annual.subList(from, annual.size())) {
            out.add(new ProfitPoint(period(row), FieldExtractor.number(row, INCOME_PROFIT_KEYS)));
        }
        return out;
    }

    /**
     * Annual report rows sorted oldest first.
     */
    static List<JSONObject> annualRows(JSONArray rows) {
        List<JSONObject> out = new ArrayList<>();
        if (rows == null) {
            return out;
        }
        for (int i = 0; i < rows.length(); i++) {
            JSONObject row = rows.optJSONObject(i);
            if (row != null && isAnnual(period(row))) {
                out.add(row);
            }
        }
        out.sort(Comparator.comparing(ZhituFinancialSource::period));
        return out;
    }

    static String period(JSONObject row) {
        String raw = FieldExtractor.text(row, DATE_KEYS);
        String digits = raw.replace("-", "");
        if (digits.length() >= 8) {
            return digits.substring(0, 4) + "-" + digits.substring(4, 6) + "-" + digits.substring(6, 8);
        }
        return raw;
    }

    static boolean isAnnual(String period) {
        return period.endsWith("12-31");
    }
}
