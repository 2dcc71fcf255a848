package com.webtomd.core.util;

import java.time.Duration;

/** 요청 간 대기 훅(테스트에서 시간 없이 대체 가능) */
@FunctionalInterface
public interface Sleeper {
    void sleep(Duration d) throws InterruptedException;

    /** 실제 대기. 0 이하는 바로 반환 */
    Sleeper SYSTEM = d -> {
        long ms = (d == null) ? 0 : d.toMillis();
        if (ms > 0) Thread.sleep(ms);
    };

    Sleeper NONE = d -> {};
}
