package com.pagelens.core.model;

/** 앵커 링크. href는 절대 URL, external은 원본 문서와 origin이 다르면 true */
public record Link(String text, String href, boolean external) {}
