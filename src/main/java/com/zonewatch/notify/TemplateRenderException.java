package com.zonewatch.notify;

/** 템플릿 문법 오류 또는 없는 필드 참조 */
public class TemplateRenderException extends RuntimeException {

    public TemplateRenderException(String message, Throwable cause) {
        super(message, cause);
    }
}
