package io.github.yok.roomlink.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import io.github.yok.roomlink.config.ConnectionConfig;
import io.github.yok.roomlink.config.LoadConfig;
import io.github.yok.roomlink.model.EntityKind;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.BatchUpdateException;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.sql.Types;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/**
 * Unit tests for {@link DataLoader}.
 */
class DataLoaderTest {

    @TempDir
    Path tempDir;

    private LoadConfig loadConfig;
    private DataLoader loader;
    private Connection session;
    private PreparedStatement ps;

    @BeforeEach
    void setup() throws Exception {
        loadConfig = new LoadConfig();
        ConnectionConfig connectionConfig = new ConnectionConfig();
        connectionConfig.setQueryTimeoutSeconds(15);
        loader = new DataLoader(loadConfig, connectionConfig);
        session = mock(Connection.class);
        ps = mock(PreparedStatement.class);
        when(session.prepareStatement(anyString())).thenReturn(ps);
    }

    private Path json(String name, String content) throws IOException {
        Path file = tempDir.resolve(name);
        Files.writeString(file, content, StandardCharsets.UTF_8);
        return file;
    }

    @Test
    void load_正常ケース_部屋レコードを指定する_全件挿入され1回コミットされること() throws Exception {
        Path rooms = json("rooms.json",
                "[{\"id\": 0, \"name\": \"Room #0\"}, {\"id\": 1, \"name\": \"Room #1\"}]");
        when(ps.executeBatch()).thenReturn(new int[] {1, 1});

        int inserted = loader.load(session, rooms, EntityKind.ROOM);

        assertEquals(2, inserted);
        verify(session).prepareStatement(EntityKind.ROOM.insertSql());
        verify(ps).setQueryTimeout(15);
        verify(ps).setInt(1, 0);
        verify(ps).setString(2, "Room #0");
        verify(ps).setInt(1, 1);
        verify(ps).setString(2, "Room #1");
        verify(ps, times(2)).addBatch();
        verify(session, times(1)).commit();
        verify(session, never()).rollback();
    }

    @Test
    void load_正常ケース_学生レコードを指定する_列ごとの型でバインドされること() throws Exception {
        Path students = json("students.json", "[{\"birthday\": \"2004-01-07T00:00:00.000000\","
                + " \"id\": 0, \"name\": \"Peggy Ryan\", \"room\": 473, \"sex\": \"F\"}]");
        when(ps.executeBatch()).thenReturn(new int[] {1});

        assertEquals(1, loader.load(session, students, EntityKind.STUDENT));

        verify(ps).setTimestamp(1, Timestamp.valueOf("2004-01-07 00:00:00"));
        verify(ps).setInt(2, 0);
        verify(ps).setString(3, "Peggy Ryan");
        verify(ps).setInt(4, 473);
        verify(ps).setString(5, "F");
    }

    @Test
    void load_正常ケース_フィールド欠落と余分なフィールド_欠落はNULLで余分は無視されること()
            throws Exception {
        Path students =
                json("students.json", "[{\"id\": 5, \"name\": \"X\", \"nickname\": \"ignored\"}]");
        when(ps.executeBatch()).thenReturn(new int[] {1});

        loader.load(session, students, EntityKind.STUDENT);

        verify(ps).setNull(1, Types.TIMESTAMP);
        verify(ps).setInt(2, 5);
        verify(ps).setString(3, "X");
        verify(ps).setNull(4, Types.INTEGER);
        verify(ps).setNull(5, Types.CHAR);
    }

    @Test
    void load_正常ケース_既存IDを含む_実際に挿入された件数のみが返ること() throws Exception {
        Path rooms = json("rooms.json",
                "[{\"id\": 0, \"name\": \"Room #0\"}, {\"id\": 1, \"name\": \"Room #1\"}]");
        when(ps.executeBatch()).thenReturn(new int[] {0, 1});

        assertEquals(1, loader.load(session, rooms, EntityKind.ROOM));

        DataLoader.LoadStats stats = loader.getStats("room");
        assertNotNull(stats);
        assertEquals(2, stats.getRead());
        assertEquals(1, stats.getInserted());
        assertEquals(1, stats.getSkipped());
    }

    @Test
    void load_正常ケース_バッチサイズを超える_分割実行され1回だけコミットされること()
            throws Exception {
        loadConfig.setBatchSize(2);
        Path rooms = json("rooms.json", "[{\"id\": 1, \"name\": \"a\"}, {\"id\": 2, \"name\": \"b\"},"
                + " {\"id\": 3, \"name\": \"c\"}]");
        when(ps.executeBatch()).thenReturn(new int[] {1, 1}, new int[] {1});

        assertEquals(3, loader.load(session, rooms, EntityKind.ROOM));

        verify(ps, times(2)).executeBatch();
        verify(session, times(1)).commit();
    }

    @Test
    void load_正常ケース_空配列を指定する_0件でコミットされること() throws Exception {
        Path rooms = json("rooms.json", "[]");

        assertEquals(0, loader.load(session, rooms, EntityKind.ROOM));

        verify(ps, never()).executeBatch();
        verify(session).commit();
    }

    @Test
    void load_正常ケース_オブジェクト以外の要素を含む_スキップされること() throws Exception {
        Path rooms = json("rooms.json", "[{\"id\": 1, \"name\": \"a\"}, 42, \"text\"]");
        when(ps.executeBatch()).thenReturn(new int[] {1});

        assertEquals(1, loader.load(session, rooms, EntityKind.ROOM));

        verify(ps, times(1)).addBatch();
        assertEquals(3, loader.getStats("room").getRead());
    }

    @Test
    void load_異常ケース_セッションがnull_ファイルを読まずに0が返ること() throws Exception {
        Path missing = tempDir.resolve("does-not-exist.json");

        assertEquals(0, loader.load(null, missing, EntityKind.ROOM));
    }

    @Test
    void load_異常ケース_セッションが閉じている_0が返ること() throws Exception {
        Connection closed = mock(Connection.class);
        when(closed.isClosed()).thenReturn(true);
        Path rooms = json("rooms.json", "[{\"id\": 1, \"name\": \"a\"}]");

        assertEquals(0, loader.load(closed, rooms, EntityKind.ROOM));

        verify(closed, never()).prepareStatement(anyString());
    }

    @Test
    void load_異常ケース_ファイルが存在しない_0が返り例外が送出されないこと() throws Exception {
        assertEquals(0, loader.load(session, tempDir.resolve("missing.json"), EntityKind.ROOM));
        verify(session, never()).prepareStatement(anyString());
    }

    @Test
    void load_異常ケース_不正なJSON_0が返ること() throws Exception {
        Path broken = json("broken.json", "[{\"id\": 1, ");

        assertEquals(0, loader.load(session, broken, EntityKind.ROOM));
        verify(session, never()).commit();
    }

    @Test
    void load_異常ケース_トップレベルが配列でない_0が返ること() throws Exception {
        Path object = json("object.json", "{\"id\": 1, \"name\": \"a\"}");

        assertEquals(0, loader.load(session, object, EntityKind.ROOM));
        verify(session, never()).prepareStatement(anyString());
    }

    @Test
    void load_異常ケース_バッチ実行で制約違反_ロールバックされSQLExceptionが送出されること()
            throws Exception {
        Path students = json("students.json", "[{\"birthday\": \"2004-01-07\", \"id\": 1,"
                + " \"name\": \"A\", \"room\": 999, \"sex\": \"M\"}]");
        BatchUpdateException fkViolation =
                new BatchUpdateException("violates foreign key constraint", "23503", new int[0]);
        when(ps.executeBatch()).thenThrow(fkViolation);

        SQLException ex = assertThrows(SQLException.class,
                () -> loader.load(session, students, EntityKind.STUDENT));

        assertSame(fkViolation, ex);
        verify(session).rollback();
        verify(session, never()).commit();
    }

    @Test
    void load_異常ケース_型変換できない値_ロールバックされIllegalArgumentExceptionが送出されること()
            throws Exception {
        Path rooms = json("rooms.json", "[{\"id\": \"abc\", \"name\": \"a\"}]");
        doThrow(new SQLException("rollback failed")).when(session).rollback();

        IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
                () -> loader.load(session, rooms, EntityKind.ROOM));

        assertTrue(ex.getMessage().contains("'id'"));
        verify(session).rollback();
        verify(ps, never()).executeBatch();
    }

    @Test
    void logSummary_正常ケース_ロード後に呼び出す_例外が送出されないこと() throws Exception {
        Path rooms = json("rooms.json", "[{\"id\": 1, \"name\": \"a\"}]");
        when(ps.executeBatch()).thenReturn(new int[] {1});
        loader.load(session, rooms, EntityKind.ROOM);

        loader.logSummary();
        new DataLoader(loadConfig, new ConnectionConfig()).logSummary();

        assertEquals(1, loader.getStats("room").getInserted());
    }
}
