package com.quizharvester.core.util;

import java.time.Duration;

/** 대기 추상화. 스로틀/백오프/정체 대기가 모두 여기를 거친다(테스트에서는 기록용 구현). */
@FunctionalInterface
public interface Sleeper {
    void sleep(Duration d) throws InterruptedException;

    /** 실제 Thread.sleep. 0 이하는 즉시 반환 */
    Sleeper SYSTEM = d -> {
        long ms = (d == null) ? 0 : d.toMillis();
        if (ms > 0) Thread.sleep(ms);
    };
}
