package io.github.yok.credload.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import io.github.yok.credload.codec.Ascii85IdentifierEncoder;
import io.github.yok.credload.codec.LowercaseHexIdentifierEncoder;
import io.github.yok.credload.config.ImportConfig;
import io.github.yok.credload.model.CredentialRow;
import io.github.yok.credload.model.RowVariant;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class ImportModeTest {

    @Test
    void toRow_正常ケース_COUNTで整数を指定する_件数付きの行になること() throws Exception {
        CredentialRow row = ImportMode.COUNT.toRow("abc", "42");
        assertEquals(RowVariant.COUNT, row.getVariant());
        assertEquals(Integer.valueOf(42), row.getCount());
    }

    @Test
    void toRow_異常ケース_COUNTで整数以外を指定する_MalformedLineExceptionが送出されること() {
        assertThrows(MalformedLineException.class, () -> ImportMode.COUNT.toRow("abc", "x"));
        assertThrows(MalformedLineException.class,
                () -> ImportMode.COUNT.toRow("abc", "99999999999"));
    }

    @ParameterizedTest
    @ValueSource(strings = {"\u0665", "+5", "-", "5\u0665", " 5"})
    void toRow_異常ケース_COUNTでASCII数字以外を指定する_MalformedLineExceptionが送出されること(
            String value) {
        assertThrows(MalformedLineException.class, () -> ImportMode.COUNT.toRow("aa", value));
    }

    @Test
    void toRow_正常ケース_COUNTで負の件数を指定する_そのまま保持されること() throws Exception {
        assertEquals(Integer.valueOf(-3), ImportMode.COUNT.toRow("aa", "-3").getCount());
    }

    @Test
    void toRow_正常ケース_PASSWORDとCOMPACTを指定する_各バリアントの行になること() throws Exception {
        CredentialRow password = ImportMode.PASSWORD.toRow("abc", "hunter2");
        assertEquals("hunter2", password.getPassword());

        CredentialRow compact = ImportMode.COMPACT.toRow("abc", "17");
        assertEquals(RowVariant.IDENTIFIER, compact.getVariant());
        assertNull(compact.getCount());
    }

    @Test
    void newEncoder_正常ケース_各モードを指定する_対応するエンコーダが返されること() {
        assertTrue(ImportMode.COUNT.newEncoder() instanceof LowercaseHexIdentifierEncoder);
        assertTrue(ImportMode.PASSWORD.newEncoder() instanceof LowercaseHexIdentifierEncoder);
        assertTrue(ImportMode.COMPACT.newEncoder() instanceof Ascii85IdentifierEncoder);
    }

    @Test
    void defaultProfile_正常ケース_各モードを指定する_既定値が返されること() {
        assertEquals(new ImportConfig.Profile("hibp", 10_000, "pwned-passwords-sha1", 40),
                ImportMode.COUNT.defaultProfile());
        assertEquals(new ImportConfig.Profile("hibp", 10_000, "pwned-passwords-plain", 40),
                ImportMode.PASSWORD.defaultProfile());
        assertEquals(new ImportConfig.Profile("hibp_compact", 60_000,
                "pwned-passwords-sha1-ascii85", 25), ImportMode.COMPACT.defaultProfile());
        assertEquals("compact", ImportMode.COMPACT.key());
    }
}
