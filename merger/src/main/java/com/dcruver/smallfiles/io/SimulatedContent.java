package com.dcruver.smallfiles.io;

import com.dcruver.smallfiles.domain.SmallFile;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * Byte layout of a file inside a merged container: a {@code "FILE: <name>\n"} header
 * followed by {@code 'X'} filler up to the file's size in bytes. Files too small to
 * hold their header are stored as the header alone.
 */
final class SimulatedContent {

    static final long BYTES_PER_MB = 1024L * 1024L;

    private static final int CHUNK_SIZE = 1024;
    private static final byte[] FILLER = new byte[CHUNK_SIZE];

    static {
        Arrays.fill(FILLER, (byte) 'X');
    }

    private SimulatedContent() {
    }

    static byte[] header(SmallFile file) {
        return ("FILE: " + file.getName() + "\n").getBytes(StandardCharsets.UTF_8);
    }

    /**
     * Number of bytes the file occupies in its container
     */
    static long length(SmallFile file) {
        long sizeBytes = (long) (file.getSizeMb() * BYTES_PER_MB);
        return Math.max(sizeBytes, header(file).length);
    }

    static void write(SmallFile file, OutputStream out) throws IOException {
        byte[] header = header(file);
        out.write(header);

        long remaining = length(file) - header.length;
        while (remaining > 0) {
            int n = (int) Math.min(CHUNK_SIZE, remaining);
            out.write(FILLER, 0, n);
            remaining -= n;
        }
    }
}
