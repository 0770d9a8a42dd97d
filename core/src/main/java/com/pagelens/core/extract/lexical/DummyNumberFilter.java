package com.pagelens.core.extract.lexical;

import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * 전화번호처럼 보이지만 테스트/플레이스홀더인 숫자열 판별.
 * 판단은 숫자만 남긴 문자열 기준.
 */
public final class DummyNumberFilter {
    private DummyNumberFilter() {}

    private static final List<Pattern> PATTERNS = List.of(
            Pattern.compile("^555\\d{4}$"),          // 555-0100 류
            Pattern.compile("^555\\d{7}$"),
            Pattern.compile("^1234567890?$"),
            Pattern.compile("^0000000000?$"),
            Pattern.compile("^0123456789?$"),
            Pattern.compile("^9876543210?$"),
            Pattern.compile("^(\\d)\\1{9,}$"));      // 한 숫자 반복(10자리 이상)

    private static final Pattern LONG_RUN = Pattern.compile("(\\d)\\1{6,}");

    private static final Set<String> KNOWN_TEST_NUMBERS = Set.of(
            "5550100", "5550199", "5551234", "5555555",
            "1234567", "12345678", "123456789", "1234567890",
            "0000000", "00000000", "000000000", "0000000000",
            "1111111", "11111111", "111111111", "1111111111",
            "9999999", "99999999", "999999999", "9999999999");

    public static boolean isDummy(String phone) {
        if (phone == null) return true;
        String digits = digitsOnly(phone);
        if (digits.isEmpty()) return true;

        for (Pattern p : PATTERNS) {
            if (p.matcher(digits).matches()) return true;
        }
        // 10자리 이상 번호 안에 같은 숫자 7연속
        if (digits.length() >= 10 && LONG_RUN.matcher(digits).find()) return true;
        if (digits.length() >= 7 && isMonotonicRun(digits)) return true;
        return KNOWN_TEST_NUMBERS.contains(digits);
    }

    public static String digitsOnly(String s) {
        StringBuilder sb = new StringBuilder(s.length());
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c >= '0' && c <= '9') sb.append(c);
        }
        return sb.toString();
    }

    /** 앞 10자리까지가 1씩 증가 또는 감소 */
    private static boolean isMonotonicRun(String digits) {
        boolean up = true;
        boolean down = true;
        int n = Math.min(digits.length(), 10);
        for (int i = 1; i < n; i++) {
            int cur = digits.charAt(i) - '0';
            int prev = digits.charAt(i - 1) - '0';
            if (cur != prev + 1) up = false;
            if (cur != prev - 1) down = false;
        }
        return up || down;
    }
}
