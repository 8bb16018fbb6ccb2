package com.rchttp.core.correlation;

import java.security.SecureRandom;
import java.util.Random;

/**
 * X-Request-Id 체인 생성기.
 *
 * 상류 값이 없으면 20자 ID 하나, 있으면 "상류값,새ID".
 * 새 ID 길이는 상류 첫 세그먼트 길이의 절반(첫 콤마 위치가 1보다 클 때만 콤마 기준, 아니면 전체 길이 기준).
 */
public final class RequestIdChain {

    public static final String REQUEST_ID_HEADER = "X-Request-Id";
    public static final String USER_IDENTITY_HEADER = "User-Identity";
    public static final int DEFAULT_ID_LENGTH = 20;

    private static final char[] ALPHABET =
            "abcdefghijklmnopqrstuvwxyzABCDEFGHIJKLMNOPQRSTUVWXYZ0123456789".toCharArray();

    private final Random random;

    public RequestIdChain() { this(new SecureRandom()); }

    /** 테스트에서 시드 고정용 */
    public RequestIdChain(Random random) { this.random = random; }

    /** upstream이 null/빈 값이면 새 체인을 시작한다. 기존 세그먼트는 그대로 보존. */
    public String build(String upstream) {
        if (upstream == null || upstream.isEmpty()) {
            return newId(DEFAULT_ID_LENGTH);
        }
        return upstream + "," + newId(appendedLength(upstream));
    }

    /** 1자 상류 값이면 0이 나오므로 최소 1자 */
    static int appendedLength(String upstream) {
        int len = upstream.length() / 2;
        int comma = upstream.indexOf(',');
        if (comma > 1) len = comma / 2;
        return Math.max(1, len);
    }

    public String newId(int length) {
        char[] out = new char[length];
        for (int i = 0; i < length; i++) {
            out[i] = ALPHABET[random.nextInt(ALPHABET.length)];
        }
        return new String(out);
    }
}
