package com.hhplus.coffeeshop.infrastructure.config.database;

import com.p6spy.engine.logging.Category;
import com.p6spy.engine.spy.appender.MessageFormattingStrategy;
import org.hibernate.engine.jdbc.internal.FormatStyle;

import java.util.Locale;

/**
 * P6Spy 로그 포맷
 *
 * "완성된 SQL + 실행 시간" 형태로 한 블록에 출력합니다.
 * DDL은 DDL 포매터, 나머지 문장은 BASIC 포매터를 사용하고 commit/rollback 같은 빈 문장은 출력하지 않습니다.
 */
public class P6SpyPrettySqlFormatter implements MessageFormattingStrategy {

    @Override
    public String formatMessage(int connectionId, String now, long elapsed, String category,
                                String prepared, String sql, String url) {
        if (sql == null || sql.isBlank()) {
            return "";
        }
        String formatted = format(category, sql.trim());
        return "\n[P6Spy] connection=" + connectionId
                + " | category=" + category
                + " | elapsed=" + elapsed + "ms"
                + formatted;
    }

    private String format(String category, String sql) {
        if (!Category.STATEMENT.getName().equals(category)) {
            return "\n" + sql;
        }
        String lower = sql.toLowerCase(Locale.ROOT);
        if (lower.startsWith("create") || lower.startsWith("alter") || lower.startsWith("comment")) {
            return FormatStyle.DDL.getFormatter().format(sql);
        }
        return FormatStyle.BASIC.getFormatter().format(sql);
    }
}
