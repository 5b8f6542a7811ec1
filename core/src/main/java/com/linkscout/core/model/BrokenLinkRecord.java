package com.linkscout.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

/** 깨진 링크 한 건: 어느 페이지(parent)에서 발견된 어떤 링크가 어떤 상태였는지. */
@JsonPropertyOrder({"parent_url", "broken_link", "status", "error"})
public record BrokenLinkRecord(
        @JsonProperty("parent_url") String parentUrl,
        @JsonProperty("broken_link") String brokenLink,
        @JsonProperty("status") Integer status,
        @JsonProperty("error") String error
) {
    public BrokenLinkRecord {
        Objects.requireNonNull(parentUrl, "parentUrl");
        Objects.requireNonNull(brokenLink, "brokenLink");
        error = (error == null) ? "" : error;
    }
}
