package com.tidewatch.db;

import com.tidewatch.db.mybatis.MyBatisSupport;
import com.tidewatch.db.mybatis.StrategySignalInsertParam;
import com.tidewatch.db.mybatis.StrategySignalMapper;
import com.tidewatch.strategy.SignalStore;
import com.tidewatch.strategy.StrategySignal;
import org.apache.ibatis.session.SqlSession;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;

public final class StrategySignalDao implements SignalStore {
    private final Database database;

    public StrategySignalDao(Database database) {
        this.database = database;
    }

    @Override
    public void saveSignals(List<StrategySignal> signals) throws SQLException {
        if (signals == null || signals.isEmpty()) {
            return;
        }
        OffsetDateTime now = OffsetDateTime.now(ZoneOffset.UTC);
        try (Connection conn = database.connect();
             SqlSession session = MyBatisSupport.openSession(conn)) {
            conn.setAutoCommit(false);
            StrategySignalMapper mapper = session.getMapper(StrategySignalMapper.class);
            for (StrategySignal signal : signals) {
                mapper.insert(StrategySignalInsertParam.builder()
                        .strategyName(signal.strategyName)
                        .stockCode(signal.code)
                        .stockName(signal.name)
                        .signalDate(signal.signalDate)
                        .score(signal.score)
                        .reason(signal.reason)
                        .extraData(signal.extraJson().toString())
                        .createdAt(now)
                        .build());
            }
            conn.commit();
        }
    }
}
