package com.tidewatch.strategy;

import com.tidewatch.core.error.FetchException;
import com.tidewatch.data.PoolType;
import org.json.JSONArray;

import java.time.LocalDate;

@FunctionalInterface
public interface PoolSource {

    JSONArray pool(PoolType type, LocalDate date) throws FetchException;
}
