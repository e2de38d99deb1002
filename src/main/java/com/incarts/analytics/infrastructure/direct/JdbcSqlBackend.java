package com.incarts.analytics.infrastructure.direct;

import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.ResultSetExtractor;

import java.util.List;
import java.util.Map;

/**
 * {@link SqlBackend} over a {@link JdbcTemplate}. The statement timeout is the one
 * configured on the template; Spring's {@code DataAccessException}s are left to the
 * executor to translate.
 */
@RequiredArgsConstructor
public class JdbcSqlBackend implements SqlBackend {

    private final JdbcTemplate jdbcTemplate;

    @Override
    public List<Map<String, Object>> fetch(SqlStatement statement) {
        return jdbcTemplate.queryForList(statement.getSql(), statement.getParameters().toArray());
    }

    @Override
    public Object fetchScalar(SqlStatement statement) {
        ResultSetExtractor<Object> firstValue = rs -> rs.next() ? rs.getObject(1) : null;
        return jdbcTemplate.query(statement.getSql(), firstValue, statement.getParameters().toArray());
    }
}
