package com.waybackminer.core.model;

/** 로컬 실패 분류. 어느 것도 실행 전체를 중단시키지 않는다. */
public enum FailureKind {
    /** 네트워크/전송 계층 오류 */
    TRANSPORT,
    /** 2xx 가 아닌 응답 */
    HTTP_STATUS,
    /** 본문을 해석할 수 없음(JSON 등) */
    MALFORMED_RESPONSE,
    /** 아카이브가 "This page can't be displayed" 로 응답 */
    CAPTURE_UNAVAILABLE,
    /** 작업 단위 안에서 예상하지 못한 예외 */
    UNEXPECTED
}
