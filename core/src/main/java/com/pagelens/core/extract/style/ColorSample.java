package com.pagelens.core.extract.style;

/** 색 후보 하나: 선언에서 읽은 원 값 + 용도 라벨(Background, Text, Border, Detected) */
public record ColorSample(String value, String usage) {}
