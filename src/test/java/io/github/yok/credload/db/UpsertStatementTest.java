package io.github.yok.credload.db;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import io.github.yok.credload.model.CredentialRow;
import io.github.yok.credload.model.RowVariant;
import java.sql.PreparedStatement;
import java.util.Arrays;
import java.util.Collections;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;

class UpsertStatementTest {

    @Test
    void forBatch_正常ケース_COUNTで2行を指定する_件数を上書きするSQLが生成されること() {
        UpsertStatement st = UpsertStatement.forBatch("hibp", RowVariant.COUNT, 2);

        assertEquals("INSERT INTO hibp (hibp_id, count) VALUES (?, ?),(?, ?)"
                + " ON CONFLICT (hibp_id) DO UPDATE SET count = EXCLUDED.count", st.getSql());
        assertEquals(ConflictAction.UPDATE, st.getConflictAction());
        assertEquals(4, st.parameterCount());
    }

    @Test
    void forBatch_正常ケース_PASSWORDで1行を指定する_パスワードのみ上書きするSQLが生成されること() {
        UpsertStatement st = UpsertStatement.forBatch("hibp", RowVariant.PASSWORD, 1);

        assertEquals("INSERT INTO hibp (hibp_id, password) VALUES (?, ?)"
                + " ON CONFLICT (hibp_id) DO UPDATE SET password = EXCLUDED.password",
                st.getSql());
    }

    @Test
    void forBatch_正常ケース_IDENTIFIERで3行を指定する_DO_NOTHINGのSQLが生成されること() {
        UpsertStatement st = UpsertStatement.forBatch("hibp_compact", RowVariant.IDENTIFIER, 3);

        assertEquals("INSERT INTO hibp_compact (hibp_id) VALUES (?),(?),(?)"
                + " ON CONFLICT (hibp_id) DO NOTHING", st.getSql());
        assertEquals(ConflictAction.DO_NOTHING, st.getConflictAction());
        assertEquals(3, st.parameterCount());
    }

    @Test
    void forBatch_異常ケース_0行を指定する_IllegalArgumentExceptionが送出されること() {
        assertThrows(IllegalArgumentException.class,
                () -> UpsertStatement.forBatch("hibp", RowVariant.COUNT, 0));
    }

    @Test
    void forBatch_異常ケース_識別子でないテーブル名を指定する_IllegalArgumentExceptionが送出されること() {
        assertThrows(IllegalArgumentException.class,
                () -> UpsertStatement.forBatch("hibp; DROP TABLE imports", RowVariant.COUNT, 1));
        // スキーマ修飾は許可される
        assertEquals("public.hibp",
                UpsertStatement.forBatch("public.hibp", RowVariant.COUNT, 1).getTable());
    }

    @Test
    void bind_正常ケース_2行を指定する_入力順に値が束縛されること() throws Exception {
        UpsertStatement st = UpsertStatement.forBatch("hibp", RowVariant.COUNT, 2);
        PreparedStatement ps = mock(PreparedStatement.class);

        st.bind(ps, Arrays.asList(CredentialRow.ofCount("aa", 1), CredentialRow.ofCount("bb", 2)));

        InOrder order = inOrder(ps);
        order.verify(ps).setObject(1, "aa");
        order.verify(ps).setObject(2, 1);
        order.verify(ps).setObject(3, "bb");
        order.verify(ps).setObject(4, 2);
    }

    @Test
    void bind_異常ケース_行数が一致しない_IllegalArgumentExceptionが送出されること() {
        UpsertStatement st = UpsertStatement.forBatch("hibp", RowVariant.COUNT, 2);
        PreparedStatement ps = mock(PreparedStatement.class);

        assertThrows(IllegalArgumentException.class,
                () -> st.bind(ps, Collections.singletonList(CredentialRow.ofCount("aa", 1))));
    }

    @Test
    void bind_異常ケース_バリアントが異なる行を含む_IllegalArgumentExceptionが送出されること()
            throws Exception {
        UpsertStatement st = UpsertStatement.forBatch("hibp", RowVariant.COUNT, 1);
        PreparedStatement ps = mock(PreparedStatement.class);

        assertThrows(IllegalArgumentException.class,
                () -> st.bind(ps, Collections.singletonList(CredentialRow.ofPassword("aa", "x"))));
        verify(ps, never()).setObject(anyInt(), any());
    }
}
