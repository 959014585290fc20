package com.oatcode.backend.renderer;

public class RenderFailedException extends RuntimeException {

    private final String code;

    public RenderFailedException(String code, String message) {
        super(message);
        this.code = code;
    }

    public RenderFailedException(String code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public String code() { return code; }
}
