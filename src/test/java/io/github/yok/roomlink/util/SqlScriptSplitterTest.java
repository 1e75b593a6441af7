package io.github.yok.roomlink.util;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class SqlScriptSplitterTest {

    @TempDir
    Path tempDir;

    @Test
    void split_正常ケース_複数文を指定する_順序を保って分割されること() {
        List<String> statements =
                SqlScriptSplitter.split("SELECT 1;\n  SELECT 2 ;\n\nSELECT 3");
        assertEquals(List.of("SELECT 1", "SELECT 2", "SELECT 3"), statements);
    }

    @Test
    void split_正常ケース_空の断片を含む_空の断片が除外されること() {
        assertEquals(List.of("SELECT 1"), SqlScriptSplitter.split(";;  ;SELECT 1;\n;"));
    }

    @Test
    void split_正常ケース_nullと空白のみを指定する_空リストが返ること() {
        assertTrue(SqlScriptSplitter.split(null).isEmpty());
        assertTrue(SqlScriptSplitter.split(" \n\t ").isEmpty());
    }

    @Test
    void read_正常ケース_UTF8ファイルを指定する_文のリストが返ること() throws Exception {
        Path file = tempDir.resolve("queries.sql");
        Files.writeString(file, "SELECT '部屋';\nSELECT 2;\n", StandardCharsets.UTF_8);
        assertEquals(List.of("SELECT '部屋'", "SELECT 2"), SqlScriptSplitter.read(file));
    }

    @Test
    void read_異常ケース_存在しないファイルを指定する_IOExceptionが送出されること() {
        assertThrows(IOException.class,
                () -> SqlScriptSplitter.read(tempDir.resolve("missing.sql")));
    }
}
