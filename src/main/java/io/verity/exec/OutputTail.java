package io.verity.exec;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * Keeps only the end of a process's output, bounded both by line count
 * and by UTF-8 byte size. Raw bytes go into a ring of {@code maxBytes}, so
 * memory stays fixed however long a single line is; lines are split when
 * the text is read.
 */
final class OutputTail {
    private final int maxLines;
    private final byte[] ring;
    private int start;
    private int size;
    private byte last = '\n';

    OutputTail(int maxLines, int maxBytes) {
        this.maxLines = Math.max(1, maxLines);
        this.ring = new byte[Math.max(1, maxBytes)];
    }

    synchronized void write(byte[] buffer, int offset, int length) {
        if (length <= 0) {
            return;
        }
        last = buffer[offset + length - 1];
        if (length >= ring.length) {
            System.arraycopy(buffer, offset + length - ring.length, ring, 0, ring.length);
            start = 0;
            size = ring.length;
            return;
        }
        for (int i = 0; i < length; i++) {
            int slot = (start + size) % ring.length;
            ring[slot] = buffer[offset + i];
            if (size < ring.length) {
                size++;
            } else {
                start = (start + 1) % ring.length;
            }
        }
    }

    /** Appends a whole line, starting a new one if the stream stopped mid-line. */
    synchronized void append(String line) {
        StringBuilder sb = new StringBuilder();
        if (last != '\n') {
            sb.append('\n');
        }
        sb.append(line == null ? "" : line).append('\n');
        byte[] raw = sb.toString().getBytes(StandardCharsets.UTF_8);
        write(raw, 0, raw.length);
    }

    synchronized String text() {
        byte[] raw = new byte[size];
        for (int i = 0; i < size; i++) {
            raw[i] = ring[(start + i) % ring.length];
        }
        String decoded = new String(raw, StandardCharsets.UTF_8);
        // The ring may begin inside a multi-byte character.
        while (!decoded.isEmpty() && decoded.charAt(0) == '\uFFFD' && size == ring.length) {
            decoded = decoded.substring(1);
        }
        if (decoded.endsWith("\n")) {
            decoded = decoded.substring(0, decoded.length() - 1);
        }
        String[] lines = decoded.split("\n", -1);
        int from = Math.max(0, lines.length - maxLines);
        String[] kept = Arrays.copyOfRange(lines, from, lines.length);
        for (int i = 0; i < kept.length; i++) {
            if (kept[i].endsWith("\r")) {
                kept[i] = kept[i].substring(0, kept[i].length() - 1);
            }
        }
        return String.join("\n", kept);
    }
}
