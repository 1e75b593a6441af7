package io.github.yok.roomlink.util;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import io.github.yok.roomlink.config.ConnectionConfig;
import org.junit.jupiter.api.Test;

class MaskingLogUtilTest {

    @Test
    void maskText_正常ケース_値ありと空を指定する_値ありのみマスクされること() {
        assertEquals("***", MaskingLogUtil.maskText("secret"));
        assertEquals("", MaskingLogUtil.maskText(""));
        assertNull(MaskingLogUtil.maskText(null));
    }

    @Test
    void maskJdbcUrl_正常ケース_passwordパラメータを含む_パスワードがマスクされること() {
        assertEquals("jdbc:postgresql://h:5432/db?user=u&password=***&ssl=true",
                MaskingLogUtil.maskJdbcUrl("jdbc:postgresql://h:5432/db?user=u&password=pw&ssl=true"));
        assertNull(MaskingLogUtil.maskJdbcUrl(null));
    }

    @Test
    void describe_正常ケース_接続設定を指定する_パスワードが出力されないこと() {
        ConnectionConfig config = new ConnectionConfig();
        config.setHost("db.example");
        config.setPort(5433);
        config.setName("db_students");
        config.setUser("postgres");
        config.setPassword("topsecret");

        String described = MaskingLogUtil.describe(config);

        assertEquals("url=jdbc:postgresql://db.example:5433/db_students, user=postgres, password=***",
                described);
        assertFalse(described.contains("topsecret"));
    }

    @Test
    void describe_正常ケース_nullを指定する_プレースホルダが返ること() {
        assertTrue(MaskingLogUtil.describe(null).contains("null"));
    }
}
