package com.tidewatch.db.mybatis;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.time.OffsetDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FinancialRiskRow {
    private String code;
    private String name;
    private String board;
    private String riskType;
    private String riskLevel;
    private String reason;
    private Double latestRevenue;
    private Double latestNetProfit;
    private int lossYears;
    private double cumulativeLoss;
    private boolean extreme;
    private LocalDate scanDate;
    private String scanCycle;
    private OffsetDateTime updatedAt;
}
