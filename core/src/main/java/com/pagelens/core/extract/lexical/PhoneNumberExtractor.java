package com.pagelens.core.extract.lexical;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.pagelens.core.extract.PageContext;
import com.pagelens.core.util.StructuredLog;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.regex.Pattern;

/**
 * 전화번호 수집.
 * 후보 정리/더미 필터/폴백은 여기서, 실제 번호 인식은 PhoneCandidateDetector에 위임한다.
 * 출처 순서(10단계)는 고정이며 결과는 국제 형식 정렬 집합.
 */
public final class PhoneNumberExtractor {
    private static final StructuredLog SLOG = StructuredLog.get(PhoneNumberExtractor.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    static final int MIN_CANDIDATE_LENGTH = 7;
    private static final Pattern HAS_DIGIT = Pattern.compile("\\+?\\d");
    private static final Pattern PREFIX_TEL = Pattern.compile("(?i)^tel:");
    private static final Pattern PREFIX_CALL = Pattern.compile("(?i)^call\\s*:?");
    private static final Pattern PREFIX_PHONE = Pattern.compile("(?i)^phone\\s*:?");
    private static final Pattern DISALLOWED = Pattern.compile("[^\\d+\\-().\\s]");

    private static final String[] DATA_ATTRS = {
            "data-phone", "data-tel", "data-telephone", "data-mobile", "data-contact", "data-phone-number"};
    private static final String[] JSON_LD_KEYS = {"telephone", "phone", "phoneNumber"};

    private final PhoneCandidateDetector detector;
    private final String defaultRegion;

    public PhoneNumberExtractor(PhoneCandidateDetector detector, String defaultRegion) {
        this.detector = Objects.requireNonNull(detector, "detector");
        this.defaultRegion = defaultRegion;
    }

    public SortedSet<String> extract(PageContext ctx) {
        SortedSet<String> found = new TreeSet<>();
        Document doc = ctx.document();

        // 1) tel: 링크
        for (Element a : doc.select("a[href^=\"tel:\"]")) {
            String v = cutAt(PREFIX_TEL.matcher(a.attr("href")).replaceFirst(""), '?').trim();
            if (!v.isEmpty()) addCandidate(found, v);
        }

        // 2) 문서 전체 텍스트(유효 또는 가능)
        scanText(found, ctx.fullText(), false);

        // 3) 요소별 텍스트(유효만), script/style/noscript 제외
        Element body = doc.body();
        if (body != null) {
            for (Element el : body.select("*")) {
                if (el == body || el.is("script, style, noscript")) continue;
                String text = el.text();
                if (text.length() > 5) scanText(found, text, true);
            }
        }

        // 4) content 속성
        for (Element el : doc.select("[content*=\"+\"], [content*=tel], [content*=phone]")) {
            String content = el.attr("content");
            if (HAS_DIGIT.matcher(content).find()) detectOrAdd(found, content);
        }

        // 5) data-* 속성
        for (Element el : doc.select("[data-phone], [data-tel], [data-telephone], [data-mobile], [data-contact], [data-phone-number]")) {
            String v = firstAttr(el, DATA_ATTRS);
            if (!v.isEmpty()) addCandidate(found, v);
        }

        // 6) JSON-LD
        for (Element script : doc.select("script[type=\"application/ld+json\"]")) {
            String json = script.data();
            if (json.isBlank()) continue;
            try {
                walkJsonLd(found, MAPPER.readTree(json));
            } catch (JsonProcessingException e) {
                SLOG.debug("phone.jsonld.skip", "reason", e.getOriginalMessage());
            }
        }

        // 7) 마이크로데이터
        for (Element el : doc.select("[itemprop=telephone], [itemprop=phone]")) {
            String v = el.text().trim();
            if (v.isEmpty()) v = el.attr("content");
            if (!v.isEmpty()) addCandidate(found, v);
        }

        // 8) href 안의 tel:
        for (Element a : doc.select("a[href*=\"tel:\"], a[href*=phone], a[href*=call]")) {
            String href = a.attr("href");
            if (!href.contains("tel:")) continue;
            String v = cutAt(cutAt(href.replaceFirst("(?i)^.*tel:", ""), '?'), '#').trim();
            if (!v.isEmpty()) addCandidate(found, v);
        }

        // 9) 연락처 성격의 요소
        for (Element el : doc.select("address, .phone, .telephone, .contact-phone, [class*=phone], [class*=tel], [id*=phone], [id*=tel]")) {
            scanText(found, el.text(), true);
        }

        // 10) phone/tel 메타 태그
        for (Element meta : doc.select("meta[property*=phone], meta[name*=phone], meta[property*=tel], meta[name*=tel]")) {
            String v = meta.attr("content");
            if (!v.isEmpty()) addCandidate(found, v);
        }

        SortedSet<String> out = new TreeSet<>();
        for (String p : found) {
            if (!DummyNumberFilter.isDummy(p)) out.add(p);
        }
        return out;
    }

    /**
     * 단일 후보 문자열 처리: 접두어/불필요 문자 제거 → 길이/더미 검사 → 탐지기 → 폴백.
     */
    void addCandidate(SortedSet<String> out, String raw) {
        String clean = clean(raw);
        if (clean.length() < MIN_CANDIDATE_LENGTH || DummyNumberFilter.isDummy(clean)) return;

        List<PhoneCandidate> candidates = detect(clean);
        if (!candidates.isEmpty()) {
            for (PhoneCandidate c : candidates) {
                if (c.acceptable()) addFormatted(out, c);
            }
            return;
        }

        // 탐지기가 못 찾은 경우: +로 시작하는 7~15자리는 그대로, 10자리 이상 숫자는 + 접두
        String digits = DummyNumberFilter.digitsOnly(clean);
        if (digits.length() < 7 || digits.length() > 15 || DummyNumberFilter.isDummy(digits)) return;
        if (clean.startsWith("+")) {
            out.add(clean);
        } else if (digits.length() >= 10) {
            out.add("+" + digits);
        }
    }

    /** strict=true면 유효 번호만, 아니면 유효 또는 가능 */
    void scanText(SortedSet<String> out, String text, boolean strict) {
        if (text == null || text.length() < MIN_CANDIDATE_LENGTH) return;
        for (PhoneCandidate c : detect(text)) {
            if (strict ? c.valid() : c.acceptable()) addFormatted(out, c);
        }
    }

    /** 탐지 결과가 있으면 유효 번호만, 없으면 단일 후보로 처리 */
    private void detectOrAdd(SortedSet<String> out, String text) {
        List<PhoneCandidate> candidates = detect(text);
        if (candidates.isEmpty()) {
            addCandidate(out, text);
            return;
        }
        for (PhoneCandidate c : candidates) {
            if (c.valid()) addFormatted(out, c);
        }
    }

    private void walkJsonLd(SortedSet<String> out, JsonNode node) {
        if (node == null) return;
        if (node.isTextual()) {
            String s = node.asText();
            if (HAS_DIGIT.matcher(s).find()) detectOrAdd(out, s);
            return;
        }
        if (node.isObject()) {
            String direct = phoneField(node);
            if (direct != null) addCandidate(out, direct);
            Iterator<JsonNode> it = node.elements();
            while (it.hasNext()) walkJsonLd(out, it.next());
            return;
        }
        if (node.isArray()) {
            for (JsonNode child : node) walkJsonLd(out, child);
        }
    }

    private static String phoneField(JsonNode obj) {
        for (String k : JSON_LD_KEYS) {
            JsonNode v = obj.get(k);
            if (v != null && v.isValueNode() && !v.asText().isEmpty()) return v.asText();
        }
        JsonNode cp = obj.get("contactPoint");
        if (cp != null && cp.isObject()) {
            JsonNode t = cp.get("telephone");
            if (t != null && t.isValueNode() && !t.asText().isEmpty()) return t.asText();
        }
        return null;
    }

    private List<PhoneCandidate> detect(String text) {
        try {
            return detector.detect(text, defaultRegion);
        } catch (RuntimeException e) {
            SLOG.debug("phone.detector.fail", "error", e.getClass().getSimpleName(), "message", e.getMessage());
            return List.of();
        }
    }

    private static void addFormatted(SortedSet<String> out, PhoneCandidate c) {
        if (DummyNumberFilter.isDummy(c.matchedText())) return;
        String formatted = c.formatInternational();
        if (formatted != null && !formatted.isBlank() && !DummyNumberFilter.isDummy(formatted)) {
            out.add(formatted);
        }
    }

    static String clean(String raw) {
        String s = raw.trim();
        s = PREFIX_TEL.matcher(s).replaceFirst("");
        s = PREFIX_CALL.matcher(s).replaceFirst("");
        s = PREFIX_PHONE.matcher(s).replaceFirst("");
        return DISALLOWED.matcher(s).replaceAll("").trim();
    }

    private static String firstAttr(Element el, String... names) {
        for (String n : names) {
            String v = el.attr(n);
            if (!v.isEmpty()) return v;
        }
        return "";
    }

    private static String cutAt(String s, char c) {
        int i = s.indexOf(c);
        return i < 0 ? s : s.substring(0, i);
    }
}
