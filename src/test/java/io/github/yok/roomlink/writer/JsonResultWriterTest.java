package io.github.yok.roomlink.writer;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.yok.roomlink.model.QueryResult;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Timestamp;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class JsonResultWriterTest {

    @TempDir
    Path tempDir;

    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    void write_正常ケース_部屋ごとの件数を指定する_行ごとのオブジェクト配列が出力されること()
            throws Exception {
        QueryResult result = new QueryResult("SELECT ...", List.of("id", "name", "count"));
        result.addRow(Arrays.asList(1, "Room #1", 1L));
        Path out = tempDir.resolve("output_1.json");

        new JsonResultWriter().write(result, out);

        JsonNode json = mapper.readTree(out.toFile());
        assertEquals(mapper.readTree("[{\"id\":1,\"name\":\"Room #1\",\"count\":1}]"), json);
    }

    @Test
    void write_正常ケース_整形と非ASCII文字_4空白インデントでエスケープされないこと() throws Exception {
        QueryResult result = new QueryResult("SELECT ...", List.of("id", "name"));
        result.addRow(Arrays.asList(7, "Комната №7"));
        Path out = tempDir.resolve("output_1.json");

        new JsonResultWriter().write(result, out);

        String text = Files.readString(out, StandardCharsets.UTF_8);
        assertTrue(text.contains("\n        \"id\": 7"), "4空白単位でインデントされること: " + text);
        assertTrue(text.contains("Комната №7"), "非ASCII文字がそのまま出力されること");
        assertFalse(text.contains("\\u"));
    }

    @Test
    void write_正常ケース_列順を指定する_キーが列順で出力されること() throws Exception {
        QueryResult result = new QueryResult("SELECT ...", List.of("zeta", "alpha", "mid"));
        result.addRow(Arrays.asList(1, 2, 3));
        Path out = tempDir.resolve("ordered.json");

        new JsonResultWriter().write(result, out);

        String text = Files.readString(out, StandardCharsets.UTF_8);
        assertTrue(text.indexOf("zeta") < text.indexOf("alpha"));
        assertTrue(text.indexOf("alpha") < text.indexOf("mid"));
    }

    @Test
    void write_正常ケース_結果が空_空配列が出力されること() throws Exception {
        Path out = tempDir.resolve("empty.json");
        new JsonResultWriter().write(new QueryResult("SELECT ...", List.of("id")), out);

        assertEquals("[]", Files.readString(out, StandardCharsets.UTF_8));
    }

    @Test
    void write_正常ケース_1行1列_改行とインデントを含む完全な出力になること() throws Exception {
        QueryResult result = new QueryResult("SELECT ...", List.of("id"));
        result.addRow(Arrays.asList(1));
        Path out = tempDir.resolve("single.json");

        new JsonResultWriter().write(result, out);

        assertEquals("[\n    {\n        \"id\": 1\n    }\n]",
                Files.readString(out, StandardCharsets.UTF_8));
    }

    @Test
    void toJsonValue_正常ケース_BigDecimalを指定する_doubleに変換されること() {
        assertEquals(12.5, JsonResultWriter.toJsonValue(new BigDecimal("12.50")));
    }

    @Test
    void toRecords_正常ケース_nullと文字を含む_nullと文字列に変換されること() {
        QueryResult result = new QueryResult("SELECT ...", List.of("sex", "room"));
        result.addRow(Arrays.asList('F', null));

        List<Map<String, Object>> records = JsonResultWriter.toRecords(result);

        assertEquals("F", records.get(0).get("sex"));
        assertNull(records.get(0).get("room"));
        assertTrue(records.get(0).containsKey("room"));
    }

    @Test
    void toJsonValue_異常ケース_Timestampを指定する_シリアライズ不可の例外が送出されること() {
        IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
                () -> JsonResultWriter.toJsonValue(Timestamp.valueOf("2004-01-07 00:00:00")));
        assertEquals("Object of type Timestamp is not JSON serializable", ex.getMessage());
    }

    @Test
    void write_異常ケース_未対応の型を含む_ファイルが作成されないこと() {
        QueryResult result = new QueryResult("SELECT ...", List.of("birthday"));
        result.addRow(Arrays.asList(Timestamp.valueOf("2004-01-07 00:00:00")));
        Path out = tempDir.resolve("bad.json");

        assertThrows(IllegalArgumentException.class, () -> new JsonResultWriter().write(result, out));
        assertFalse(Files.exists(out));
    }

    @Test
    void getFormat_正常ケース_RECORDSが返ること() {
        assertEquals(ExportFormat.RECORDS, new JsonResultWriter().getFormat());
    }
}
