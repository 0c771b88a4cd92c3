package com.goormthonuniv.videocheck.llm;

/** 추론 제공자 호출 실패 (네트워크/타임아웃/비정상 응답 구분 없음) */
public class InferenceException extends RuntimeException {

    public InferenceException(String message) {
        super(message);
    }

    public InferenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
