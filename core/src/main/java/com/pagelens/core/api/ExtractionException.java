package com.pagelens.core.api;

import java.util.Objects;

/**
 * API 경계에서 던지는 단일 오류.
 * 호출자는 ExtractedDocument 또는 이 예외 둘 중 하나만 받는다(부분 성공 없음).
 */
public class ExtractionException extends Exception {

    private final ErrorKind kind;

    public ExtractionException(ErrorKind kind, String message) {
        this(kind, message, null);
    }

    public ExtractionException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    public ErrorKind getKind() { return kind; }

    @Override
    public String toString() {
        return "ExtractionException[" + kind + "]: " + getMessage();
    }
}
