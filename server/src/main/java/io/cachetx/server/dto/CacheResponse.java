package io.cachetx.server.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Map;

/**
 * Result of POST /cache/{op}. Only the fields relevant to the operation are set.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class CacheResponse {
    public boolean ok;
    public String valueBase64;
    public String token;
    public Map<String, ValueDto> values;
    public Map<String, Boolean> results;
    public Long number;

    public static CacheResponse of(boolean ok) {
        var r = new CacheResponse();
        r.ok = ok;
        return r;
    }
}
