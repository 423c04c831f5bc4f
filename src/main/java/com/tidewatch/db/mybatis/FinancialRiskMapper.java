package com.tidewatch.db.mybatis;

import org.apache.ibatis.annotations.Delete;
import org.apache.ibatis.annotations.Insert;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;

import java.util.List;

public interface FinancialRiskMapper {
    String COLUMNS = "code, name, board, risk_type, risk_level, reason, latest_revenue, latest_net_profit, " +
            "loss_years, cumulative_loss, is_extreme AS extreme, scan_date, scan_cycle, updated_at";

    @Insert("INSERT INTO financial_risk(code, name, board, risk_type, risk_level, reason, latest_revenue, " +
            "latest_net_profit, loss_years, cumulative_loss, is_extreme, scan_date, scan_cycle, updated_at) " +
            "VALUES(#{code}, #{name}, #{board}, #{riskType}, #{riskLevel}, #{reason}, #{latestRevenue}, " +
            "#{latestNetProfit}, #{lossYears}, #{cumulativeLoss}, #{extreme}, #{scanDate}, #{scanCycle}, #{updatedAt}) " +
            "ON CONFLICT(code) DO UPDATE SET " +
            "name=excluded.name, board=excluded.board, risk_type=excluded.risk_type, risk_level=excluded.risk_level, " +
            "reason=excluded.reason, latest_revenue=excluded.latest_revenue, latest_net_profit=excluded.latest_net_profit, " +
            "loss_years=excluded.loss_years, cumulative_loss=excluded.cumulative_loss, is_extreme=excluded.is_extreme, " +
            "scan_date=excluded.scan_date, scan_cycle=excluded.scan_cycle, updated_at=excluded.updated_at")
    int upsert(FinancialRiskRow row);

    @Delete("DELETE FROM financial_risk WHERE scan_cycle <> #{scanCycle}")
    int deleteOtherCycles(@Param("scanCycle") String scanCycle);

    @Select("SELECT " + COLUMNS + " FROM financial_risk WHERE code LIKE #{prefix} || '%' ORDER BY code ASC LIMIT 1")
    FinancialRiskRow selectByCodePrefix(@Param("prefix") String prefix);

    @Select("SELECT " + COLUMNS + " FROM financial_risk ORDER BY risk_type ASC, code ASC")
    List<FinancialRiskRow> selectAll();
}
