package com.eventfilter.filter;

public class FilterException extends RuntimeException {
    private final ErrorKind kind;

    public FilterException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public FilterException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }

    public static FilterException unsupportedSpec(String message) {
        return new FilterException(ErrorKind.UNSUPPORTED_SPEC, message);
    }

    public static FilterException unsupportedDomain(String message) {
        return new FilterException(ErrorKind.UNSUPPORTED_DOMAIN, message);
    }

    public static FilterException unsupportedOperator(String message) {
        return new FilterException(ErrorKind.UNSUPPORTED_OPERATOR, message);
    }

    public static FilterException unsupportedKey(String message) {
        return new FilterException(ErrorKind.UNSUPPORTED_KEY, message);
    }
}
