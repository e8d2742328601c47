package io.github.yok.credload.util;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.sql.SQLException;
import org.junit.jupiter.api.Test;

class ErrorHandlerTest {

    @Test
    void errorAndExit_異常ケース_exit無効を指定する_IllegalStateExceptionが送出されること() {
        ErrorHandler.disableExitForCurrentThread();
        try {
            SQLException cause = new SQLException("connection refused");
            IllegalStateException ex = assertThrows(IllegalStateException.class,
                    () -> ErrorHandler.errorAndExit("Fatal error: unreachable", cause));
            assertEquals("Fatal error: unreachable", ex.getMessage());
            assertSame(cause, ex.getCause());
        } finally {
            ErrorHandler.restoreExitForCurrentThread();
        }
    }

    @Test
    void errorAndExit_正常ケース_exit有効で原因ありを指定する_根本原因が標準エラーへ出力されること() {
        PrintStream originalErr = System.err;
        ByteArrayOutputStream err = new ByteArrayOutputStream();
        try {
            System.setErr(new PrintStream(err));
            ErrorHandler.errorAndExit("Fatal error: boom",
                    new IllegalStateException("wrapper", new SQLException("root")));
        } finally {
            System.setErr(originalErr);
        }
        String message = err.toString();
        assertTrue(message.contains("ERROR: Fatal error: boom"));
        assertTrue(message.contains("SQLException: root"));
    }

    @Test
    void errorAndExit_正常ケース_restore後はexit有効に戻る_例外が送出されないこと() {
        ErrorHandler.disableExitForCurrentThread();
        ErrorHandler.restoreExitForCurrentThread();

        PrintStream originalErr = System.err;
        ByteArrayOutputStream err = new ByteArrayOutputStream();
        try {
            System.setErr(new PrintStream(err));
            ErrorHandler.errorAndExit("boom2", new IllegalArgumentException("bad date"));
        } finally {
            System.setErr(originalErr);
        }
        assertTrue(err.toString().contains("ERROR: boom2"));
        assertTrue(err.toString().contains("IllegalArgumentException: bad date"));
    }
}
