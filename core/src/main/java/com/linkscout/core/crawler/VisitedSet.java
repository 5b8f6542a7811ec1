package com.linkscout.core.crawler;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 한 번의 트래버설에서 공유되는 방문 장부.
 * URL 은 최대 한 번만 들어가며, 들어간 URL 은 다시 가져오지 않는다.
 */
public final class VisitedSet {
    private final Set<String> urls = ConcurrentHashMap.newKeySet();

    /** 처음 보는 URL 이면 기록하고 true (원자적 check-and-insert) */
    public boolean markVisited(String url) {
        return urls.add(url);
    }

    public boolean contains(String url) {
        return urls.contains(url);
    }

    public int size() {
        return urls.size();
    }

    public Set<String> snapshot() {
        return Set.copyOf(urls);
    }
}
