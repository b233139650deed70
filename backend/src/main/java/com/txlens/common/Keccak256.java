package com.txlens.common;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * Keccak-256 as used by Ethereum (original Keccak padding {@code 0x01}, not the SHA3-256 {@code 0x06}).
 */
public final class Keccak256 {

    private Keccak256() {}

    private static final int RATE_BYTES = 136;
    private static final int ROUNDS = 24;

    private static final long[] ROUND_CONSTANTS = {
            0x0000000000000001L, 0x0000000000008082L, 0x800000000000808AL, 0x8000000080008000L,
            0x000000000000808BL, 0x0000000080000001L, 0x8000000080008081L, 0x8000000000008009L,
            0x000000000000008AL, 0x0000000000000088L, 0x0000000080008009L, 0x000000008000000AL,
            0x000000008000808BL, 0x800000000000008BL, 0x8000000000008089L, 0x8000000000008003L,
            0x8000000000008002L, 0x8000000000000080L, 0x000000000000800AL, 0x800000008000000AL,
            0x8000000080008081L, 0x8000000000008080L, 0x0000000080000001L, 0x8000000080008008L
    };

    /** Rotation offsets indexed by {@code x + 5 * y}. */
    private static final int[] ROTATIONS = {
            0, 1, 62, 28, 27,
            36, 44, 6, 55, 20,
            3, 10, 43, 25, 39,
            41, 45, 15, 21, 8,
            18, 2, 61, 56, 14
    };

    public static byte[] hash(byte[] input) {
        byte[] padded = Arrays.copyOf(input, (input.length / RATE_BYTES + 1) * RATE_BYTES);
        padded[input.length] ^= 0x01;
        padded[padded.length - 1] ^= (byte) 0x80;

        long[] state = new long[25];
        for (int offset = 0; offset < padded.length; offset += RATE_BYTES) {
            for (int i = 0; i < RATE_BYTES / 8; i++) {
                state[i] ^= littleEndianLong(padded, offset + i * 8);
            }
            permute(state);
        }

        byte[] out = new byte[32];
        for (int i = 0; i < out.length; i++) {
            out[i] = (byte) (state[i / 8] >>> (8 * (i % 8)));
        }
        return out;
    }

    /** Hash of the UTF-8 bytes of {@code text} as 0x-prefixed lower-case hex. */
    public static String hashHex(String text) {
        return toHex(hash(text.getBytes(StandardCharsets.UTF_8)));
    }

    public static String toHex(byte[] bytes) {
        StringBuilder sb = new StringBuilder(2 + bytes.length * 2).append("0x");
        for (byte b : bytes) {
            sb.append(Character.forDigit((b >> 4) & 0xF, 16)).append(Character.forDigit(b & 0xF, 16));
        }
        return sb.toString();
    }

    private static long littleEndianLong(byte[] bytes, int offset) {
        long value = 0;
        for (int k = 0; k < 8; k++) {
            value |= (bytes[offset + k] & 0xFFL) << (8 * k);
        }
        return value;
    }

    private static void permute(long[] a) {
        long[] c = new long[5];
        long[] b = new long[25];
        for (int round = 0; round < ROUNDS; round++) {
            // theta
            for (int x = 0; x < 5; x++) {
                c[x] = a[x] ^ a[x + 5] ^ a[x + 10] ^ a[x + 15] ^ a[x + 20];
            }
            for (int x = 0; x < 5; x++) {
                long d = c[(x + 4) % 5] ^ Long.rotateLeft(c[(x + 1) % 5], 1);
                for (int y = 0; y < 25; y += 5) {
                    a[x + y] ^= d;
                }
            }
            // rho and pi
            for (int x = 0; x < 5; x++) {
                for (int y = 0; y < 5; y++) {
                    b[y + 5 * ((2 * x + 3 * y) % 5)] = Long.rotateLeft(a[x + 5 * y], ROTATIONS[x + 5 * y]);
                }
            }
            // chi
            for (int y = 0; y < 25; y += 5) {
                for (int x = 0; x < 5; x++) {
                    a[x + y] = b[x + y] ^ (~b[(x + 1) % 5 + y] & b[(x + 2) % 5 + y]);
                }
            }
            // iota
            a[0] ^= ROUND_CONSTANTS[round];
        }
    }
}
