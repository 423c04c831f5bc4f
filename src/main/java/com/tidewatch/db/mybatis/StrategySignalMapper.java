package com.tidewatch.db.mybatis;

import org.apache.ibatis.annotations.Insert;

public interface StrategySignalMapper {
    @Insert("INSERT INTO strategy_signal(strategy_name, stock_code, stock_name, signal_date, score, reason, extra_data, created_at) " +
            "VALUES(#{strategyName}, #{stockCode}, #{stockName}, #{signalDate}, #{score}, #{reason}, #{extraData}, #{createdAt})")
    int insert(StrategySignalInsertParam row);
}
