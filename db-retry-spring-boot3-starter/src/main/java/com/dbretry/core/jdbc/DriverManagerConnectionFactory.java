package com.dbretry.core.jdbc;

import com.dbretry.core.spi.ConnectionFactory;
import org.springframework.jdbc.datasource.DriverManagerDataSource;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * 每次按连接串新建物理连接, 不做池化
 */
public class DriverManagerConnectionFactory implements ConnectionFactory {

    @Override
    public Connection open(String connectionString) throws SQLException {
        if (connectionString == null || connectionString.isBlank()) {
            throw new SQLException("connection string must not be blank");
        }
        return new DriverManagerDataSource(connectionString).getConnection();
    }
}
