package com.pagelens.core.extract.lexical;

import com.google.i18n.phonenumbers.PhoneNumberMatch;
import com.google.i18n.phonenumbers.PhoneNumberUtil;
import com.google.i18n.phonenumbers.PhoneNumberUtil.PhoneNumberFormat;
import com.google.i18n.phonenumbers.Phonenumber.PhoneNumber;

import java.util.ArrayList;
import java.util.List;

/** Google libphonenumber 기반 기본 탐지기 (Leniency.POSSIBLE) */
public final class LibPhoneNumberDetector implements PhoneCandidateDetector {
    /** 지역 미지정. +국가번호 형식만 매칭된다 */
    static final String UNKNOWN_REGION = "ZZ";

    private final PhoneNumberUtil util;

    public LibPhoneNumberDetector() {
        this(PhoneNumberUtil.getInstance());
    }

    LibPhoneNumberDetector(PhoneNumberUtil util) {
        this.util = util;
    }

    @Override
    public List<PhoneCandidate> detect(String text, String defaultRegion) {
        List<PhoneCandidate> out = new ArrayList<>();
        if (text == null || text.isEmpty()) return out;
        String region = (defaultRegion == null || defaultRegion.isBlank()) ? UNKNOWN_REGION : defaultRegion;

        for (PhoneNumberMatch m : util.findNumbers(text, region, PhoneNumberUtil.Leniency.POSSIBLE, Long.MAX_VALUE)) {
            PhoneNumber n = m.number();
            out.add(new PhoneCandidate(
                    m.rawString(),
                    util.isValidNumber(n),
                    util.isPossibleNumber(n),
                    util.format(n, PhoneNumberFormat.INTERNATIONAL),
                    util.format(n, PhoneNumberFormat.E164)));
        }
        return out;
    }
}
