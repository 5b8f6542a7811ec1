package com.linkscout.core.model;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Objects;

/**
 * 링크 트리의 노드 한 개. 생성 후 변경되지 않는다.
 * JSON 입출력은 TreeJsonExporter 담당.
 */
public final class TreeNode {
    private final String url;
    private final String title;
    private final List<String> links;      // 정렬된 스냅샷
    private final List<TreeNode> children; // 방문 순서

    public TreeNode(String url, String title, List<String> links, List<TreeNode> children) {
        this.url = Objects.requireNonNull(url, "url");
        this.title = (title == null) ? "" : title;
        this.links = (links == null) ? List.of() : List.copyOf(links);
        this.children = (children == null) ? List.of() : List.copyOf(children);
    }

    public String getUrl() { return url; }
    public String getTitle() { return title; }
    public List<String> getLinks() { return links; }
    public List<TreeNode> getChildren() { return children; }

    /** 자기 자신 포함 서브트리 노드 수 (깊은 트리에서도 스택을 쓰지 않게 반복) */
    public int size() {
        int n = 0;
        Deque<TreeNode> stack = new ArrayDeque<>();
        stack.push(this);
        while (!stack.isEmpty()) {
            TreeNode cur = stack.pop();
            n++;
            for (TreeNode c : cur.children) stack.push(c);
        }
        return n;
    }

    @Override public String toString() {
        return "TreeNode[" + url + ", children=" + children.size() + "]";
    }
}
