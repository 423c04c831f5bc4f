package com.tidewatch.risk;

import java.sql.SQLException;
import java.util.List;
import java.util.Optional;

/**
 * Persistence for risk records. Only records of the latest completed scan cycle are visible.
 */
public interface RiskRecordStore {

    /**
     * Upserts {@code records} by code under {@code scanCycle} and deletes every record of older cycles,
     * atomically.
     */
    void replaceCycle(String scanCycle, List<RiskRecord> records) throws SQLException;

    Optional<RiskRecord> findByCodePrefix(String codePrefix) throws SQLException;

    /**
     * Current records ordered by risk type, then code.
     */
    List<RiskRecord> listCurrent() throws SQLException;
}
