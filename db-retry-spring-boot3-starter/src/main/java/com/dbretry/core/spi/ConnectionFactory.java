package com.dbretry.core.spi;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * 按连接串创建新的物理连接, 调用方负责关闭
 */
public interface ConnectionFactory {

    Connection open(String connectionString) throws SQLException;
}
