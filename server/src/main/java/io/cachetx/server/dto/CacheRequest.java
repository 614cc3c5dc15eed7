package io.cachetx.server.dto;

import java.util.List;
import java.util.Map;

/**
 * Body of POST /cache/{op}. Which fields are required depends on the operation.
 */
public class CacheRequest {
    public String key;
    public List<String> keys;
    public String valueBase64;
    public Map<String, String> items;   // key -> Base64 value
    public long expire;
    public String token;
    public Long offset;                 // default 1
    public Long initial;                // default 0
}
