package com.tidewatch.db.mybatis;

import org.apache.ibatis.logging.log4j2.Log4j2Impl;
import org.apache.ibatis.session.Configuration;
import org.apache.ibatis.session.SqlSession;
import org.apache.ibatis.session.SqlSessionFactory;
import org.apache.ibatis.session.SqlSessionFactoryBuilder;

import java.sql.Connection;

/**
 * Centralized MyBatis bootstrap. Statement logging goes to the {@code SQL.*} Log4j loggers.
 */
public final class MyBatisSupport {
    private static final SqlSessionFactory FACTORY = buildFactory();

    private MyBatisSupport() {
    }

    public static SqlSession openSession(Connection connection) {
        return FACTORY.openSession(connection);
    }

    private static SqlSessionFactory buildFactory() {
        Configuration config = new Configuration();
        config.setMapUnderscoreToCamelCase(true);
        config.setLogImpl(Log4j2Impl.class);
        config.setLogPrefix("SQL.");

        config.addMapper(FinancialRiskMapper.class);
        config.addMapper(StrategySignalMapper.class);

        return new SqlSessionFactoryBuilder().build(config);
    }
}
