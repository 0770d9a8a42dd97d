package com.pagelens.core.robots;

/** 캐시 만료 판단용 시계. 테스트에서 고정 시계로 교체 */
@FunctionalInterface
public interface RobotsClock {
    RobotsClock SYSTEM = System::currentTimeMillis;

    long nowMillis();
}
