package com.rchttp.testserver;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/** 서버가 돌려주는 에코 본문. 클라이언트 테스트가 그대로 역직렬화한다. */
@JsonIgnoreProperties(ignoreUnknown = true)
public class Responder {
    @JsonProperty("body")       public String body;
    @JsonProperty("call_count") public int callCount;
    @JsonProperty("method")     public String method;
    @JsonProperty("error")      public String error;
    @JsonProperty("headers")    public Map<String, List<String>> headers;
    @JsonProperty("path")       public String path;

    /** 헤더 첫 값(대소문자 무시). 없으면 null. */
    public String header(String name) {
        List<String> vs = headerValues(name);
        return vs.isEmpty() ? null : vs.get(0);
    }

    public List<String> headerValues(String name) {
        if (headers == null || name == null) return List.of();
        for (var e : headers.entrySet()) {
            if (e.getKey() != null && e.getKey().equalsIgnoreCase(name)) {
                return e.getValue() == null ? List.of() : e.getValue();
            }
        }
        return List.of();
    }
}
