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
public class StrategySignalInsertParam {
    private String strategyName;
    private String stockCode;
    private String stockName;
    private LocalDate signalDate;
    private double score;
    private String reason;
    private String extraData;
    private OffsetDateTime createdAt;
}
