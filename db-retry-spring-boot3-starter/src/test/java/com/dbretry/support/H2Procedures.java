package com.dbretry.support;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;

/**
 * H2 中通过 CREATE ALIAS 注册的存储过程
 */
public final class H2Procedures {

    private H2Procedures() {
    }

    /** 金额不低于 minAmount 的订单数 */
    public static int countOrdersAbove(Connection conn, int minAmount) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement("select count(*) from orders where amount >= ?")) {
            ps.setInt(1, minAmount);
            try (ResultSet rs = ps.executeQuery()) {
                rs.next();
                return rs.getInt(1);
            }
        }
    }
}
