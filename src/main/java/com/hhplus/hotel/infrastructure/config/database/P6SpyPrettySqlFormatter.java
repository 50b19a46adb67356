package com.hhplus.hotel.infrastructure.config.database;

import com.p6spy.engine.spy.appender.MessageFormattingStrategy;
import org.hibernate.engine.jdbc.internal.FormatStyle;

import java.util.Locale;

/**
 * P6Spy 로그 포맷
 *
 * DDL은 DDL 포매터, 그 외 문장은 BASIC 포매터로 정렬하고
 * 커밋/롤백 같은 SQL 없는 이벤트는 카테고리만 한 줄로 남긴다.
 */
public class P6SpyPrettySqlFormatter implements MessageFormattingStrategy {

    private static final String LINE = "======================================================";

    @Override
    public String formatMessage(int connectionId, String now, long elapsed, String category,
                                String prepared, String sql, String url) {
        if (sql == null || sql.isBlank()) {
            return String.format("[P6Spy] connection=%d category=%s elapsed=%dms", connectionId, category, elapsed);
        }
        return "\n" + LINE + "\n" +
                "Connection : " + connectionId + "\n" +
                "Category   : " + category + "\n" +
                "Elapsed    : " + elapsed + "ms\n" +
                "SQL        :" + format(sql.trim()) + "\n" +
                LINE;
    }

    private String format(String sql) {
        String lower = sql.toLowerCase(Locale.ROOT);
        if (lower.startsWith("create") || lower.startsWith("alter") || lower.startsWith("drop")) {
            return FormatStyle.DDL.getFormatter().format(sql);
        }
        return FormatStyle.BASIC.getFormatter().format(sql);
    }
}
