package com.pagelens.core.extract.lexical;

/**
 * 탐지기가 찾은 전화번호 후보.
 * international/e164는 탐지기가 포맷한 값(없으면 null).
 */
public record PhoneCandidate(String matchedText, boolean valid, boolean possible, String international, String e164) {

    /** 국제 형식. 포맷 실패 시 E.164로 대체 */
    public String formatInternational() {
        return (international != null && !international.isBlank()) ? international : e164;
    }

    public String formatE164() { return e164; }

    public boolean acceptable() { return valid || possible; }
}
