package com.waybackminer.app.cli;

/** 잘못된 명령행 인자. 종료 코드 2 로 이어진다. */
public final class UsageException extends Exception {
    public UsageException(String message) {
        super(message);
    }
}
