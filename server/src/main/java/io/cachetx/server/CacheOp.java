package io.cachetx.server;

import java.util.Arrays;
import java.util.Optional;

/**
 * Operations exposed under POST /cache/{op}.
 */
public enum CacheOp {
    GET("get"),
    GET_MULTI("getMulti"),
    SET("set"),
    SET_MULTI("setMulti"),
    DELETE("delete"),
    DELETE_MULTI("deleteMulti"),
    ADD("add"),
    REPLACE("replace"),
    CAS("cas"),
    INCREMENT("increment"),
    DECREMENT("decrement"),
    TOUCH("touch"),
    FLUSH("flush");

    private final String path;

    CacheOp(String path) {
        this.path = path;
    }

    /** Path segment after /cache/. */
    public String path() {
        return path;
    }

    public static Optional<CacheOp> fromPath(String segment) {
        return Arrays.stream(values())
                .filter(op -> op.path.equals(segment))
                .findFirst();
    }
}
