package kr.crownrpg.realtime.core.store;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * JDBC 연결 공급자. {@link JdbcKeyValueStore} 는 연산마다 연결을 빌려 쓰고 바로 반납한다.
 */
public interface ConnectionProvider {

    Connection getConnection() throws SQLException;

    void close();
}
