package com.waybackminer.core.expand;

import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Stream;

/** 아카이브된 내용에서 후보 URL 을 뽑는 전략 인터페이스. */
public interface Expander {

    /** 출처 태그 접미(":robots", ":source") */
    String sourceSuffix();

    /**
     * 호출마다 새로 시작하는 지연 스트림. 네트워크 작업은 소비 시점에 일어난다.
     * 개별 캡처 실패는 건너뛰고, 취소는 CancellationException 으로 전파한다.
     */
    Stream<String> expand(String url, AtomicBoolean cancel);
}
