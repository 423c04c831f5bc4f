package com.tidewatch.testsupport;

import com.tidewatch.risk.RiskRecord;
import com.tidewatch.risk.RiskRecordStore;

import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

public final class InMemoryRiskRecordStore implements RiskRecordStore {
    private final Map<String, RiskRecord> records = new TreeMap<>();
    private String currentCycle;
    private int replaceCalls;
    private boolean failWrites;

    public InMemoryRiskRecordStore failWrites() {
        this.failWrites = true;
        return this;
    }

    public String currentCycle() {
        return currentCycle;
    }

    public int replaceCalls() {
        return replaceCalls;
    }

    @Override
    public synchronized void replaceCycle(String scanCycle, List<RiskRecord> next) throws SQLException {
        replaceCalls++;
        if (failWrites) {
            throw new SQLException("connection refused");
        }
        records.clear();
        for (RiskRecord record : next) {
            records.put(record.code, record);
        }
        currentCycle = scanCycle;
    }

    @Override
    public synchronized Optional<RiskRecord> findByCodePrefix(String codePrefix) {
        for (Map.Entry<String, RiskRecord> entry : records.entrySet()) {
            if (entry.getKey().startsWith(codePrefix)) {
                return Optional.of(entry.getValue());
            }
        }
        return Optional.empty();
    }

    @Override
    public synchronized List<RiskRecord> listCurrent() {
        List<RiskRecord> out = new ArrayList<>(records.values());
        out.sort(Comparator.comparing((RiskRecord r) -> r.riskType.code()).thenComparing(r -> r.code));
        return out;
    }
}
