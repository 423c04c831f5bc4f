package com.tidewatch.strategy;

import java.sql.SQLException;
import java.util.List;

public interface SignalStore {

    void saveSignals(List<StrategySignal> signals) throws SQLException;
}
