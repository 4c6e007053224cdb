package com.quizharvester.core.util;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

/** SHA-256 hex 지문. 캐시 키와 콘텐츠 중복 판정에 공용으로 쓴다. */
public final class Fingerprints {
    private static final char[] HEX = "0123456789abcdef".toCharArray();

    private Fingerprints() {}

    /** 각 part 사이에 NUL 구분자를 넣어 (a,bc)/(ab,c) 충돌을 막는다. null은 빈 문자열 취급. */
    public static String sha256Hex(String... parts) {
        MessageDigest md = newDigest();
        for (int i = 0; i < parts.length; i++) {
            if (i > 0) md.update((byte) 0);
            String p = parts[i] == null ? "" : parts[i];
            md.update(p.getBytes(StandardCharsets.UTF_8));
        }
        return toHex(md.digest());
    }

    static String toHex(byte[] digest) {
        char[] out = new char[digest.length * 2];
        for (int i = 0; i < digest.length; i++) {
            int v = digest[i] & 0xff;
            out[i * 2] = HEX[v >>> 4];
            out[i * 2 + 1] = HEX[v & 0x0f];
        }
        return new String(out);
    }

    private static MessageDigest newDigest() {
        try {
            return MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
