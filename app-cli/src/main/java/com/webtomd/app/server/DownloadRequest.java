package com.webtomd.app.server;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/** POST /download/ 요청 본문 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record DownloadRequest(
        @JsonProperty("url") String url,
        @JsonProperty("config") Map<String, Object> config,
        @JsonProperty("filename") String filename,
        @JsonProperty("pre_remove_type") String preRemoveType,
        @JsonProperty("pre_remove_value") String preRemoveValue) {
}
