package io.github.yok.credload.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.Test;

class BatchAccumulatorTest {

    @Test
    void shouldFlush_正常ケース_バッチサイズに達する_trueになること() {
        BatchAccumulator<String> acc = new BatchAccumulator<>(2);
        acc.append("a");
        assertFalse(acc.shouldFlush());
        acc.append("b");
        assertTrue(acc.shouldFlush());
    }

    @Test
    void drain_正常ケース_蓄積後に取り出す_追加順で返され空になること() {
        BatchAccumulator<String> acc = new BatchAccumulator<>(3);
        acc.append("a");
        acc.append("b");

        List<String> drained = acc.drain();

        assertEquals(Arrays.asList("a", "b"), drained);
        assertEquals(0, acc.size());
        assertFalse(acc.shouldFlush());

        // 取り出したリストは以降の追加の影響を受けない
        acc.append("c");
        assertEquals(2, drained.size());
    }

    @Test
    void drain_正常ケース_空のまま取り出す_空リストが返されること() {
        assertTrue(new BatchAccumulator<String>(1).drain().isEmpty());
    }

    @Test
    void コンストラクタ_異常ケース_0以下のバッチサイズを指定する_IllegalArgumentExceptionが送出されること() {
        assertThrows(IllegalArgumentException.class, () -> new BatchAccumulator<String>(0));
    }
}
