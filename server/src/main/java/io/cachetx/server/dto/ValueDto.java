package io.cachetx.server.dto;

public class ValueDto {
    public String valueBase64;
    public String token;

    public ValueDto() {
    }

    public ValueDto(String valueBase64, String token) {
        this.valueBase64 = valueBase64;
        this.token = token;
    }
}
