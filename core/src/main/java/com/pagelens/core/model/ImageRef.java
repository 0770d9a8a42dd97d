package com.pagelens.core.model;

public record ImageRef(String src, String alt) {}
