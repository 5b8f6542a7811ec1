package com.linkscout.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/** 성공적으로 가져온 페이지 한 건의 추출 결과(불변). */
public final class PageData {
    private final String url;
    private final String title;
    private final String text;
    private final List<ImageRef> images;
    private final Set<String> links;

    private PageData(Builder b) {
        this.url = b.url;
        this.title = (b.title == null) ? "" : b.title;
        this.text = (b.text == null) ? "" : b.text;
        this.images = Collections.unmodifiableList(new ArrayList<>(b.images));
        this.links = Collections.unmodifiableSet(new LinkedHashSet<>(b.links));
    }

    public String getUrl() { return url; }
    public String getTitle() { return title; }
    public String getText() { return text; }
    public List<ImageRef> getImages() { return images; }
    /** 중복 제거된 링크 집합. 순서는 의미 없음 */
    public Set<String> getLinks() { return links; }

    /** 이미지 한 건: 절대 URL + alt 텍스트(없으면 빈 문자열) */
    public record ImageRef(String url, String altText) {
        public ImageRef {
            Objects.requireNonNull(url, "url");
            altText = (altText == null) ? "" : altText;
        }
    }

    // ----- 빌더 -----
    public static Builder builder() { return new Builder(); }

    public static final class Builder {
        private String url;
        private String title;
        private String text;
        private final List<ImageRef> images = new ArrayList<>();
        private final Set<String> links = new LinkedHashSet<>();

        public Builder url(String url) { this.url = url; return this; }
        public Builder title(String title) { this.title = title; return this; }
        public Builder text(String text) { this.text = text; return this; }
        public Builder image(String src, String alt) { this.images.add(new ImageRef(src, alt)); return this; }
        public Builder links(Set<String> links) { if (links != null) this.links.addAll(links); return this; }

        public PageData build() {
            Objects.requireNonNull(url, "url");
            return new PageData(this);
        }
    }
}
