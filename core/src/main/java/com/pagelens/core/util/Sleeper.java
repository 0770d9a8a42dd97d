package com.pagelens.core.util;

import java.time.Duration;

/** 재시도 대기 훅. 테스트에서는 실제로 잠들지 않는 구현을 주입한다. */
@FunctionalInterface
public interface Sleeper {
    void sleep(Duration d) throws InterruptedException;
}
