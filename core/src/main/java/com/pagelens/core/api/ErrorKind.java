package com.pagelens.core.api;

/** 추출 요청을 종료시키는 오류 종류. 코어 내부에서는 재시도하지 않는다. */
public enum ErrorKind {
    INVALID_URL,
    FORBIDDEN_TARGET,
    UNSUPPORTED_SCHEME,
    FETCH_FAILURE,
    EMPTY_RESPONSE,
    INVALID_SELECTOR
}
