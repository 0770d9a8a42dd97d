package com.pagelens.core.extract.lexical;

import com.pagelens.core.extract.PageContext;
import org.jsoup.nodes.Element;

import java.util.Locale;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 이메일 주소 수집.
 * 출처: mailto 링크 → 문서 텍스트 → 직렬화 마크업 → content 속성 → data-email/data-mail
 */
public final class EmailExtractor {
    static final Pattern EMAIL = Pattern.compile("[a-zA-Z0-9._%+-]+@[a-zA-Z0-9.-]+\\.[a-zA-Z]{2,}");

    private static final String[] BLOCKED_FRAGMENTS = {"example.com", "test@", "noreply", "no-reply"};

    public SortedSet<String> extract(PageContext ctx) {
        SortedSet<String> out = new TreeSet<>();

        for (Element a : ctx.document().select("a[href^=\"mailto:\"]")) {
            String addr = a.attr("href").replaceFirst("(?i)^mailto:", "");
            addr = cutAt(cutAt(addr, '?'), '&').trim();
            if (!addr.isEmpty()) add(out, addr);
        }

        scan(out, ctx.fullText());
        scan(out, ctx.markup());

        for (Element el : ctx.document().select("[content*=\"@\"]")) {
            scan(out, el.attr("content"));
        }

        for (Element el : ctx.document().select("[data-email], [data-mail]")) {
            String v = el.attr("data-email");
            if (v.isEmpty()) v = el.attr("data-mail");
            if (!v.isEmpty()) add(out, v);
        }
        return out;
    }

    private static void scan(SortedSet<String> out, String text) {
        if (text == null || text.isEmpty()) return;
        Matcher m = EMAIL.matcher(text);
        while (m.find()) add(out, m.group());
    }

    static void add(SortedSet<String> out, String raw) {
        String email = raw.toLowerCase(Locale.ROOT).trim();
        if (isAcceptable(email)) out.add(email);
    }

    /** 테스트/플레이스홀더 주소와 형식 오류 제외 */
    static boolean isAcceptable(String email) {
        if (email.length() <= 3) return false;
        for (String f : BLOCKED_FRAGMENTS) {
            if (email.contains(f)) return false;
        }
        if (email.startsWith("@") || email.endsWith("@")) return false;
        return email.indexOf('@') >= 0 && email.indexOf('@') == email.lastIndexOf('@');
    }

    private static String cutAt(String s, char c) {
        int i = s.indexOf(c);
        return i < 0 ? s : s.substring(0, i);
    }
}
