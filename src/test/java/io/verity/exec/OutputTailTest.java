package io.verity.exec;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

final class OutputTailTest {

    @Test
    void oversizedSingleLineKeepsItsEnd() {
        OutputTail tail = new OutputTail(10, 9);
        tail.append("abcdefghijklmnop");
        Assertions.assertEquals("ijklmnop", tail.text());
    }

    @Test
    void cutInsideMultiByteCharacterDropsReplacement() {
        OutputTail tail = new OutputTail(10, 5);
        tail.append("xxééé");
        Assertions.assertEquals("éé", tail.text());
    }

    @Test
    void endlessLineWithoutNewlineStaysWithinByteBound() {
        OutputTail tail = new OutputTail(50, 4096);
        byte[] chunk = new byte[8192];
        Arrays.fill(chunk, (byte) 'a');
        for (int i = 0; i < 8192; i++) {
            tail.write(chunk, 0, chunk.length);
        }
        String text = tail.text();
        Assertions.assertEquals(4096, text.length());
        Assertions.assertTrue(text.chars().allMatch(c -> c == 'a'));
    }

    @Test
    void markerAfterPartialLineStartsOnItsOwnLine() {
        OutputTail tail = new OutputTail(10, 1024);
        byte[] partial = "first\nsecond".getBytes(StandardCharsets.UTF_8);
        tail.write(partial, 0, partial.length);
        tail.append("[timed out after 5s]");
        Assertions.assertEquals("first\nsecond\n[timed out after 5s]", tail.text());
    }

    @Test
    void lineLimitAppliesToStreamedChunks() {
        OutputTail tail = new OutputTail(2, 1024);
        byte[] raw = "one\r\ntwo\r\nthree\r\n".getBytes(StandardCharsets.UTF_8);
        tail.write(raw, 0, 4);
        tail.write(raw, 4, raw.length - 4);
        Assertions.assertEquals("two\nthree", tail.text());
    }
}
