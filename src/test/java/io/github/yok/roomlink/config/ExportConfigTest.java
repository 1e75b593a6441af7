package io.github.yok.roomlink.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import org.junit.jupiter.api.Test;

class ExportConfigTest {

    @Test
    void fileName_正常ケース_既定の接頭辞_連番付きファイル名が返ること() {
        ExportConfig config = new ExportConfig();
        assertEquals("output_1.json", config.fileName(1, "json"));
        assertEquals("output_4.xml", config.fileName(4, "xml"));
    }

    @Test
    void fileName_正常ケース_接頭辞を変更する_変更後の接頭辞が使われること() {
        ExportConfig config = new ExportConfig();
        config.setFilePrefix("report-");
        assertEquals("report-2.json", config.fileName(2, "json"));
    }
}
