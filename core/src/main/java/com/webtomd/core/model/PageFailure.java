package com.webtomd.core.model;

/** 런 전체를 멈추지 않는 페이지 단위 오류 기록 */
public record PageFailure(String url, Kind kind, String reason) {

    public enum Kind {
        /** 가져오기 실패: 페이지는 결과에서 빠진다 */
        FETCH,
        /** 변환 실패: 안내 문구 + 원본 HTML로 대체된다 */
        CONVERSION
    }
}
