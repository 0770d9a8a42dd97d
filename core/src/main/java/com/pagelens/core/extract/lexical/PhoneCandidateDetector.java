package com.pagelens.core.extract.lexical;

import java.util.List;

/**
 * 텍스트에서 전화번호 후보를 찾는 외부 역량 경계.
 * defaultRegion이 null이면 국가번호(+)가 붙은 번호만 인식한다.
 */
@FunctionalInterface
public interface PhoneCandidateDetector {
    List<PhoneCandidate> detect(String text, String defaultRegion);
}
