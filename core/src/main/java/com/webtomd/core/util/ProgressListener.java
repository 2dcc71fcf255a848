package com.webtomd.core.util;

/** 크롤 단계별 진행 콜백. 페이지 단위 단계(fetch/convert)와 1회성 단계(assemble/persist) */
@FunctionalInterface
public interface ProgressListener {
    String FETCH = "fetch";
    String CONVERT = "convert";
    String ASSEMBLE = "assemble";
    String PERSIST = "persist";

    /**
     * @param progress 단계 안에서 0.0~1.0
     * @param phase    FETCH | CONVERT | ASSEMBLE | PERSIST
     * @param done     처리한 페이지 수(1회성 단계는 0 또는 1)
     * @param total    단계 전체 수
     */
    void onProgress(double progress, String phase, long done, long total);

    /** 페이지 단위 단계인지(콘솔 표시용) */
    static boolean isPerPage(String phase) {
        return FETCH.equals(phase) || CONVERT.equals(phase);
    }

    ProgressListener NONE = (p, phase, d, t) -> {};
}
