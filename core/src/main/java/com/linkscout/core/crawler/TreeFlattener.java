package com.linkscout.core.crawler;

import com.linkscout.core.model.TreeNode;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** 트리를 (url → title) 로 평탄화. 전위 순회, 같은 URL 은 처음 본 제목 유지. */
public final class TreeFlattener {
    private TreeFlattener() {}

    public static Map<String, String> uniqueLinks(TreeNode root) {
        Map<String, String> out = new LinkedHashMap<>();
        if (root == null) return out;

        Deque<TreeNode> stack = new ArrayDeque<>();
        stack.push(root);
        while (!stack.isEmpty()) {
            TreeNode n = stack.pop();
            out.putIfAbsent(n.getUrl(), n.getTitle());
            List<TreeNode> children = n.getChildren();
            // 전위 순서 유지를 위해 역순으로 push
            for (int i = children.size() - 1; i >= 0; i--) stack.push(children.get(i));
        }
        return out;
    }
}
