package com.waybackminer.core.api;

import com.waybackminer.core.harvest.HarvestRun;

/** 다중 소스 집계기가 소비하는 최소 계약: 도메인 하나에 대한 URL 스트림. */
public interface UrlSource {
    /** 출처 태그의 접두("wayback") */
    String name();

    /** 실행을 시작하고 즉시 반환. 결과는 HarvestRun 을 끝까지 읽거나 close 해야 한다. */
    HarvestRun run(String domain);
}
