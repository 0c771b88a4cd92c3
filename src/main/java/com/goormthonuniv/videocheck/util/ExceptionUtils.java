package com.goormthonuniv.videocheck.util;

import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

public final class ExceptionUtils {

    private ExceptionUtils() {}

    /** CompletionException / ExecutionException 껍데기를 벗긴 원인 */
    public static Throwable unwrap(Throwable ex) {
        Throwable t = ex;
        while ((t instanceof CompletionException || t instanceof ExecutionException) && t.getCause() != null) {
            t = t.getCause();
        }
        return t;
    }

    /** 원인 메시지, 없으면 예외 클래스명 */
    public static String rootMessage(Throwable ex) {
        Throwable t = unwrap(ex);
        return t.getMessage() != null ? t.getMessage() : t.getClass().getSimpleName();
    }
}
