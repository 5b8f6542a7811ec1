package com.linkscout.core.crawler;

import com.linkscout.core.api.IPageFetcher;
import com.linkscout.core.model.AuditConfig;
import com.linkscout.core.model.FetchResult;
import com.linkscout.core.model.PageData;
import com.linkscout.core.model.TreeNode;
import com.linkscout.core.util.ProgressListener;
import com.linkscout.core.util.StructuredLog;
import com.linkscout.core.util.UrlUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * 깊이 제한 DFS 로 링크 트리를 만든다.
 * - 방문 장부(VisitedSet)로 URL 당 최대 1회만 가져옴 → 순환/다이아몬드 그래프도 유한
 * - 가져오기 실패한 URL 은 방문 처리만 되고 트리에는 나타나지 않음(가지 가지치기)
 * - file:// 루트는 file:// 링크만, 네트워크 루트는 netloc 이 정확히 같은 링크만 따라감
 * - 재귀 대신 명시적 스택 사용. 방문 순서는 재귀 전위 순서와 같다(정렬된 링크 순)
 */
public class TreeBuilder {

    private static final Logger LOG = LoggerFactory.getLogger(TreeBuilder.class);
    private static final StructuredLog SLOG = StructuredLog.get(TreeBuilder.class);

    private final IPageFetcher fetcher;

    public TreeBuilder(AuditConfig config) {
        this(new DefaultPageFetcher(config, LinkPolicy.IN_SCOPE));
    }

    /** DI/테스트용 */
    public TreeBuilder(IPageFetcher fetcher) {
        this.fetcher = Objects.requireNonNull(fetcher, "fetcher");
    }

    public Optional<TreeNode> build(String seedUrl, int maxDepth) {
        return build(seedUrl, maxDepth, new VisitedSet(), ProgressListener.NONE);
    }

    /**
     * @param visited 호출자가 소유한 방문 장부(여러 번 호출 간 공유 가능)
     * @return 시드를 가져오지 못했거나 이미 방문했으면 empty
     */
    public Optional<TreeNode> build(String seedUrl, int maxDepth, VisitedSet visited, ProgressListener listener) {
        Objects.requireNonNull(seedUrl, "seedUrl");
        Objects.requireNonNull(visited, "visited");
        if (maxDepth < 0) throw new IllegalArgumentException("maxDepth must be >= 0");
        final ProgressListener pl = (listener != null) ? listener : ProgressListener.NONE;

        LOG.info("Crawl start: seed={}, maxDepth={}", seedUrl, maxDepth);
        SLOG.info("crawl-start", "seed", seedUrl, "maxDepth", maxDepth);

        final Scope scope = Scope.of(seedUrl);
        PageData root = visit(seedUrl, visited, pl);
        if (root == null) {
            SLOG.info("crawl-done", "seed", seedUrl, "nodes", 0, "visited", visited.size());
            return Optional.empty();
        }

        Deque<Frame> stack = new ArrayDeque<>();
        stack.push(new Frame(root, maxDepth, scope));
        TreeNode result = null;

        while (!stack.isEmpty()) {
            Frame top = stack.peek();
            String next = top.nextLink();
            if (next != null) {
                PageData child = visit(next, visited, pl);
                if (child != null) stack.push(new Frame(child, top.remaining - 1, scope));
                continue;
            }
            // 자식 탐색 완료 → 노드 확정 후 부모에 붙임
            stack.pop();
            TreeNode node = top.toNode();
            if (stack.isEmpty()) result = node;
            else stack.peek().children.add(node);
        }

        LOG.info("Crawl done: seed={}, nodes={}, visited={}", seedUrl, result.size(), visited.size());
        SLOG.info("crawl-done", "seed", seedUrl, "nodes", result.size(), "visited", visited.size());
        return Optional.of(result);
    }

    /** 이미 방문했거나 가져오기 실패면 null */
    private PageData visit(String url, VisitedSet visited, ProgressListener pl) {
        if (!visited.markVisited(url)) return null;
        LOG.info("Scraping: {}", url);
        FetchResult r = fetcher.fetch(url);
        ProgressListener.emit(pl, "crawl", visited.size(), -1);
        if (!r.isOk()) {
            LOG.debug("Pruned {}: {}", url, r.getReason());
            return null;
        }
        return r.page().orElse(null);
    }

    /** 루트 기준 추적 범위 */
    private record Scope(boolean fileRoot, String rootNetloc) {
        static Scope of(String seed) {
            return new Scope(UrlUtils.isFileUrl(seed), UrlUtils.netloc(seed));
        }

        boolean follows(String link) {
            if (fileRoot) return UrlUtils.isFileUrl(link);
            return !UrlUtils.isFileUrl(link) && UrlUtils.netloc(link).equals(rootNetloc);
        }
    }

    /** 스택 프레임: 페이지 + 남은 깊이 + 아직 보지 않은 링크 */
    private static final class Frame {
        final PageData page;
        final int remaining;
        final List<String> sortedLinks;
        final Iterator<String> pending;
        final List<TreeNode> children = new ArrayList<>();
        final Scope scope;

        Frame(PageData page, int remaining, Scope scope) {
            this.page = page;
            this.remaining = remaining;
            this.scope = scope;
            this.sortedLinks = page.getLinks().stream().sorted().toList();
            // 깊이 0 이면 자식 탐색 없음
            this.pending = (remaining > 0) ? sortedLinks.iterator() : List.<String>of().iterator();
        }

        String nextLink() {
            while (pending.hasNext()) {
                String link = pending.next();
                if (scope.follows(link)) return link;
            }
            return null;
        }

        TreeNode toNode() {
            return new TreeNode(page.getUrl(), page.getTitle(), sortedLinks, children);
        }
    }
}
