package com.tidewatch.db;

import com.tidewatch.db.mybatis.FinancialRiskMapper;
import com.tidewatch.db.mybatis.FinancialRiskRow;
import com.tidewatch.db.mybatis.MyBatisSupport;
import com.tidewatch.risk.Board;
import com.tidewatch.risk.RiskLevel;
import com.tidewatch.risk.RiskRecord;
import com.tidewatch.risk.RiskRecordStore;
import com.tidewatch.risk.RiskType;
import org.apache.ibatis.session.SqlSession;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * DAO for financial risk records.
 */
public final class FinancialRiskDao implements RiskRecordStore {
    private static final Logger LOG = LogManager.getLogger(FinancialRiskDao.class);

    private final Database database;

    public FinancialRiskDao(Database database) {
        this.database = database;
    }

    @Override
    public void replaceCycle(String scanCycle, List<RiskRecord> records) throws SQLException {
        OffsetDateTime now = OffsetDateTime.now(ZoneOffset.UTC);
        try (Connection conn = database.connect();
             SqlSession session = MyBatisSupport.openSession(conn)) {
            conn.setAutoCommit(false);
            try {
                FinancialRiskMapper mapper = session.getMapper(FinancialRiskMapper.class);
                for (RiskRecord record : records) {
                    mapper.upsert(toRow(record, scanCycle, now));
                }
                int superseded = mapper.deleteOtherCycles(scanCycle);
                conn.commit();
                LOG.info("Risk cycle stored. cycle={}, upserted={}, superseded={}", scanCycle, records.size(), superseded);
            } catch (RuntimeException | SQLException e) {
                conn.rollback();
                throw e;
            }
        }
    }

    @Override
    public Optional<RiskRecord> findByCodePrefix(String codePrefix) throws SQLException {
        try (Connection conn = database.connect();
             SqlSession session = MyBatisSupport.openSession(conn)) {
            FinancialRiskRow row = session.getMapper(FinancialRiskMapper.class).selectByCodePrefix(codePrefix);
            return Optional.ofNullable(row).map(FinancialRiskDao::fromRow);
        }
    }

    @Override
    public List<RiskRecord> listCurrent() throws SQLException {
        List<RiskRecord> out = new ArrayList<>();
        try (Connection conn = database.connect();
             SqlSession session = MyBatisSupport.openSession(conn)) {
            for (FinancialRiskRow row : session.getMapper(FinancialRiskMapper.class).selectAll()) {
                out.add(fromRow(row));
            }
        }
        return out;
    }

    static FinancialRiskRow toRow(RiskRecord record, String scanCycle, OffsetDateTime now) {
        return FinancialRiskRow.builder()
                .code(record.code)
                .name(record.name)
                .board(record.board.code())
                .riskType(record.riskType.code())
                .riskLevel(record.riskLevel.code())
                .reason(record.reason)
                .latestRevenue(record.revenue)
                .latestNetProfit(record.latestNetProfit)
                .lossYears(record.consecutiveLossYears)
                .cumulativeLoss(record.cumulativeLoss)
                .extreme(record.extreme)
                .scanDate(record.scanDate)
                .scanCycle(scanCycle)
                .updatedAt(now)
                .build();
    }

    static RiskRecord fromRow(FinancialRiskRow row) {
        return new RiskRecord(
                row.getCode(),
                row.getName(),
                Board.fromCode(row.getBoard()),
                RiskType.fromCode(row.getRiskType()),
                RiskLevel.fromCode(row.getRiskLevel()),
                row.getReason(),
                row.getLatestRevenue(),
                row.getLatestNetProfit(),
                row.getLossYears(),
                row.getCumulativeLoss(),
                row.isExtreme(),
                row.getScanDate(),
                row.getScanCycle()
        );
    }
}
