package com.linkscout.core.crawler;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class VisitedSetTest {

    @Test
    void markVisited_is_true_only_the_first_time() {
        VisitedSet v = new VisitedSet();
        assertThat(v.markVisited("https://ex.com/")).isTrue();
        assertThat(v.markVisited("https://ex.com/")).isFalse();
        assertThat(v.markVisited("https://ex.com")).isTrue(); // 정규화 없음
        assertThat(v.size()).isEqualTo(2);
        assertThat(v.snapshot()).containsExactlyInAnyOrder("https://ex.com/", "https://ex.com");
    }

    @Test
    void concurrent_marking_admits_exactly_one_winner() throws Exception {
        VisitedSet v = new VisitedSet();
        int threads = 16;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<Boolean>> results = new ArrayList<>();
            for (int i = 0; i < threads; i++) {
                results.add(pool.submit(() -> {
                    start.await();
                    return v.markVisited("https://ex.com/same");
                }));
            }
            start.countDown();
            int winners = 0;
            for (Future<Boolean> f : results) if (f.get(5, TimeUnit.SECONDS)) winners++;
            assertThat(winners).isEqualTo(1);
        } finally {
            pool.shutdownNow();
        }
    }
}
