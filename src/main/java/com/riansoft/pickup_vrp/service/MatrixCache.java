package com.riansoft.pickup_vrp.service;

import com.riansoft.pickup_vrp.model.TravelMatrix;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.Supplier;

/**
 * 정류장 좌표 집합 단위의 시간/거리 행렬 캐시 (LRU, 용량 제한).
 *
 * <p>같은 키에 대한 계산은 동시에 한 번만 실행됩니다. 먼저 들어온 요청이 계산하는 동안
 * 나머지 요청은 그 결과를 기다립니다. 실패한 계산은 캐시에 남지 않습니다.</p>
 */
public class MatrixCache {

    private final int capacity;
    private final Map<String, TravelMatrix> entries;
    private final ConcurrentMap<String, CompletableFuture<TravelMatrix>> inFlight = new ConcurrentHashMap<>();

    public MatrixCache(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("cache capacity must be at least 1: " + capacity);
        }
        this.capacity = capacity;
        this.entries = new LinkedHashMap<>(16, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, TravelMatrix> eldest) {
                return size() > MatrixCache.this.capacity;
            }
        };
    }

    public synchronized TravelMatrix get(String key) {
        return entries.get(key);
    }

    public synchronized int size() {
        return entries.size();
    }

    public TravelMatrix getOrCompute(String key, Supplier<TravelMatrix> loader) {
        TravelMatrix cached = get(key);
        if (cached != null) {
            return cached;
        }

        CompletableFuture<TravelMatrix> mine = new CompletableFuture<>();
        CompletableFuture<TravelMatrix> running = inFlight.putIfAbsent(key, mine);
        if (running != null) {
            return await(running);
        }

        try {
            // 앞선 계산이 방금 끝났을 수 있음
            TravelMatrix computed = get(key);
            if (computed == null) {
                computed = loader.get();
                put(key, computed);
            }
            mine.complete(computed);
            return computed;
        } catch (RuntimeException | Error e) {
            // 기다리는 요청도 같은 오류로 깨움
            mine.completeExceptionally(e);
            throw e;
        } finally {
            inFlight.remove(key, mine);
        }
    }

    private synchronized void put(String key, TravelMatrix matrix) {
        entries.put(key, matrix);
    }

    private static TravelMatrix await(CompletableFuture<TravelMatrix> running) {
        try {
            return running.join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException) {
                throw (RuntimeException) e.getCause();
            }
            if (e.getCause() instanceof Error) {
                throw (Error) e.getCause();
            }
            throw e;
        }
    }
}
