package com.pagelens.core.util;

import com.pagelens.core.api.ErrorKind;
import com.pagelens.core.api.ExtractionException;
import com.pagelens.core.model.NormalizedUrl;

import java.net.MalformedURLException;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.URL;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * URL 검증/정규화 + 상대 참조 해석 유틸.
 * - normalize(): 네트워크 요청 전에 반드시 통과해야 하는 유일한 SSRF 게이트
 * - resolve(): 추출기에서 참조 하나씩 호출. 실패 시 null(예외 전파 금지)
 */
public final class UrlResolver {
    private UrlResolver() {}

    private static final Pattern HAS_SCHEME = Pattern.compile("^[a-zA-Z][a-zA-Z0-9+.-]*://");

    // 루프백/사설/링크로컬 대역
    private static final List<Pattern> PRIVATE_HOSTS = List.of(
            Pattern.compile("(^|\\.)localhost$"),
            Pattern.compile("^127\\."),
            Pattern.compile("^10\\."),
            Pattern.compile("^172\\.(1[6-9]|2[0-9]|3[01])\\."),
            Pattern.compile("^192\\.168\\."),
            Pattern.compile("^0\\.0\\.0\\.0$"),
            Pattern.compile("^::1$"),
            Pattern.compile("^f[cd][0-9a-f]{0,2}:"),      // fc00::/7
            Pattern.compile("^fe[89ab][0-9a-f]?:")         // fe80::/10
    );

    private static final Pattern IPV4_LITERAL = Pattern.compile("^(\\d{1,3}\\.){3}\\d{1,3}$");
    private static final Pattern IPV6_LITERAL = Pattern.compile("^[0-9a-f:.]*:[0-9a-f:.]*$");

    /**
     * 입력 URL을 정규화하고 검증한다.
     * 규칙:
     * - 앞뒤 공백 제거, scheme 없으면 https:// 추가
     * - URI로 파싱되지 않거나 host가 없으면 INVALID_URL
     * - 사설/루프백/링크로컬 또는 IP 리터럴 host면 FORBIDDEN_TARGET
     * - http/https 외 스킴은 UNSUPPORTED_SCHEME
     */
    public static NormalizedUrl normalize(String rawUrl) throws ExtractionException {
        if (rawUrl == null || rawUrl.isBlank()) {
            throw new ExtractionException(ErrorKind.INVALID_URL, "Invalid URL format: empty");
        }
        String normalized = rawUrl.trim();
        if (!HAS_SCHEME.matcher(normalized).find()) {
            normalized = "https://" + normalized;
        }

        URI uri;
        try {
            uri = new URI(normalized);
        } catch (URISyntaxException e) {
            throw new ExtractionException(ErrorKind.INVALID_URL, "Invalid URL format: " + rawUrl, e);
        }
        String host = uri.getHost();
        if (host == null || host.isEmpty()) {
            throw new ExtractionException(ErrorKind.INVALID_URL, "Invalid URL format: " + rawUrl);
        }

        if (isForbiddenHost(host)) {
            throw new ExtractionException(ErrorKind.FORBIDDEN_TARGET,
                    "Access to private/internal IP addresses is not allowed: " + host);
        }

        String scheme = uri.getScheme().toLowerCase(Locale.ROOT);
        if (!scheme.equals("http") && !scheme.equals("https")) {
            throw new ExtractionException(ErrorKind.UNSUPPORTED_SCHEME,
                    "Only HTTP and HTTPS protocols are allowed: " + scheme);
        }

        return new NormalizedUrl(normalized, uri, origin(uri));
    }

    /** host 문자열 기준 차단 여부. IPv6 리터럴의 대괄호와 FQDN 끝 점은 제거 후 판단 */
    public static boolean isForbiddenHost(String rawHost) {
        if (rawHost == null) return true;
        String host = rawHost.toLowerCase(Locale.ROOT);
        if (host.startsWith("[") && host.endsWith("]")) {
            host = host.substring(1, host.length() - 1);
        }
        if (host.endsWith(".")) {
            host = host.substring(0, host.length() - 1);
        }
        if (IPV4_LITERAL.matcher(host).matches() || IPV6_LITERAL.matcher(host).matches()) {
            return true; // IP로 직접 지정하는 우회 차단
        }
        for (Pattern p : PRIVATE_HOSTS) {
            if (p.matcher(host).find()) return true;
        }
        return false;
    }

    /** scheme://host[:port] (기본 포트는 생략) */
    public static String origin(URI u) {
        if (u == null || u.getHost() == null) return "";
        String scheme = u.getScheme() == null ? "https" : u.getScheme().toLowerCase(Locale.ROOT);
        String host = u.getHost().toLowerCase(Locale.ROOT);
        int port = u.getPort();
        if ((scheme.equals("http") && port == 80) || (scheme.equals("https") && port == 443)) {
            port = -1;
        }
        return scheme + "://" + host + (port > 0 ? ":" + port : "");
    }

    /**
     * 참조 문자열을 base 기준 절대 URL로 바꾼다.
     * - http(s) 절대 URL: 그대로
     * - //host/x: base 스킴 상속
     * - /x: base origin 상속
     * - 그 외: base 전체 경로 기준 상대 해석
     * 해석 불가/빈 값이거나 결과가 http(s)가 아니면 null
     */
    public static String resolve(String reference, NormalizedUrl base) {
        if (reference == null || base == null) return null;
        String ref = reference.trim();
        if (ref.isEmpty()) return null;

        String lower = ref.toLowerCase(Locale.ROOT);
        if (lower.startsWith("http://") || lower.startsWith("https://")) {
            return ref;
        }
        if (ref.startsWith("//")) {
            return base.scheme() + ":" + ref;
        }
        if (ref.startsWith("/")) {
            return base.origin() + ref;
        }
        try {
            URL resolved = new URL(new URL(base.url()), ref);
            String scheme = resolved.getProtocol().toLowerCase(Locale.ROOT);
            return (scheme.equals("http") || scheme.equals("https")) ? resolved.toString() : null;
        } catch (MalformedURLException | IllegalArgumentException e) {
            return null; // 잘못된 참조는 호출자가 건너뜀
        }
    }

    /** 해석된 href의 origin이 base와 다르면 외부 링크 */
    public static boolean isExternal(String absoluteHref, NormalizedUrl base) {
        if (absoluteHref == null || base == null) return false;
        try {
            URI u = new URI(absoluteHref);
            if (u.getHost() == null) {
                return !absoluteHref.startsWith(base.origin());
            }
            return !origin(u).equals(base.origin());
        } catch (URISyntaxException e) {
            // 파싱 불가(공백 등) → 접두어 비교로 대체
            return !absoluteHref.startsWith(base.origin());
        }
    }
}
