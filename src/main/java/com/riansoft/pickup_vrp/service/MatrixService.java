package com.riansoft.pickup_vrp.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.riansoft.pickup_vrp.client.GeocodingClient;
import com.riansoft.pickup_vrp.client.RouteMatrixClient;
import com.riansoft.pickup_vrp.config.RoutingProperties;
import com.riansoft.pickup_vrp.exception.InvalidInputException;
import com.riansoft.pickup_vrp.exception.UpstreamException;
import com.riansoft.pickup_vrp.model.GeoPoint;
import com.riansoft.pickup_vrp.model.RouteMatrixElement;
import com.riansoft.pickup_vrp.model.RoutingPreference;
import com.riansoft.pickup_vrp.model.Stop;
import com.riansoft.pickup_vrp.model.TravelMatrix;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 정류장 목록으로 이동 시간(분)/거리(m) 행렬을 만듭니다.
 *
 * <p>주소만 있는 정류장은 지오코딩으로 좌표를 구하고, 좌표 목록을 batchSize 단위 블록으로 나눠
 * 블록 쌍마다 한 번씩 행렬 API를 호출합니다. 경로가 없거나 응답에서 빠진 칸은 센티널 값으로
 * 채워 행렬이 항상 꽉 차 있도록 합니다. 결과는 좌표/출발 시각/경로 옵션 기준으로 캐시합니다.</p>
 */
@Service
public class MatrixService {

    private static final Logger log = LoggerFactory.getLogger(MatrixService.class);

    private static final int COORDINATE_SCALE = 6;

    private final GeocodingClient geocodingClient;
    private final RouteMatrixClient routeMatrixClient;
    private final ObjectMapper objectMapper;
    private final MatrixCache cache;
    private final int batchSize;
    private final ExecutorService blockExecutor;

    public MatrixService(GeocodingClient geocodingClient, RouteMatrixClient routeMatrixClient,
                         ObjectMapper objectMapper, RoutingProperties properties) {
        RoutingProperties.Matrix matrix = properties.getMatrix();
        if (matrix.getBatchSize() < 1 || matrix.getMaxConcurrentBlocks() < 1) {
            throw new IllegalArgumentException("matrix batch size and worker count must be positive");
        }
        this.geocodingClient = geocodingClient;
        this.routeMatrixClient = routeMatrixClient;
        this.objectMapper = objectMapper;
        this.cache = new MatrixCache(matrix.getCacheCapacity());
        this.batchSize = matrix.getBatchSize();
        this.blockExecutor = Executors.newFixedThreadPool(matrix.getMaxConcurrentBlocks(), blockThreadFactory());
    }

    public TravelMatrix build(List<Stop> stops, String departureTime, RoutingPreference routingPreference,
                              boolean requireCoordinates) {
        if (stops == null || stops.isEmpty()) {
            throw new InvalidInputException("Stop list is empty; nothing to build a matrix from");
        }
        RoutingPreference preference = routingPreference == null ? RoutingPreference.TRAFFIC_AWARE : routingPreference;
        checkDepartureTime(departureTime);

        List<String> ids = collectIds(stops);
        List<GeoPoint> coordinates = resolveCoordinates(stops, requireCoordinates);

        String key = cacheKey(coordinates, departureTime, preference);
        TravelMatrix matrix = cache.getOrCompute(key, () -> compute(ids, coordinates, departureTime, preference));
        return matrix.withIds(ids);
    }

    MatrixCache cache() {
        return cache;
    }

    @PreDestroy
    public void shutdown() {
        blockExecutor.shutdownNow();
    }

    private List<String> collectIds(List<Stop> stops) {
        List<String> ids = new ArrayList<>(stops.size());
        Set<String> seen = new HashSet<>();
        for (Stop stop : stops) {
            if (stop == null || stop.id == null || stop.id.isBlank()) {
                throw new InvalidInputException("Every stop needs a non-blank id");
            }
            if (!seen.add(stop.id)) {
                throw new InvalidInputException("Duplicate stop id: " + stop.id);
            }
            ids.add(stop.id);
        }
        return ids;
    }

    private List<GeoPoint> resolveCoordinates(List<Stop> stops, boolean requireCoordinates) {
        List<GeoPoint> coordinates = new ArrayList<>(stops.size());
        Map<String, GeoPoint> resolvedAddresses = new HashMap<>();
        for (Stop stop : stops) {
            if (stop.coordinate != null) {
                coordinates.add(stop.coordinate);
            } else if (requireCoordinates) {
                throw new InvalidInputException("Point " + stop.id + " missing lat/lng (geocoding disabled)");
            } else if (stop.hasAddress()) {
                // 같은 요청 안에서 같은 주소는 한 번만 조회
                coordinates.add(resolvedAddresses.computeIfAbsent(stop.address.strip(), geocodingClient::resolve));
            } else {
                throw new InvalidInputException("Point " + stop.id + " missing both (lat,lng) and address");
            }
        }
        if (!resolvedAddresses.isEmpty()) {
            log.info("[MATRIX] 주소 {}건 좌표 변환 완료", resolvedAddresses.size());
        }
        return coordinates;
    }

    private TravelMatrix compute(List<String> ids, List<GeoPoint> coordinates, String departureTime,
                                 RoutingPreference preference) {
        int n = coordinates.size();
        int blocks = (n + batchSize - 1) / batchSize;
        log.info("========= [MATRIX] 캐시 없음: {}x{} 행렬 계산 시작 (블록 {}x{}, {}) =========",
                n, n, blocks, blocks, preference);

        long[][] minutes = new long[n][n];
        long[][] meters = new long[n][n];

        List<Runnable> tasks = new ArrayList<>(blocks * blocks);
        for (int originStart = 0; originStart < n; originStart += batchSize) {
            for (int destinationStart = 0; destinationStart < n; destinationStart += batchSize) {
                int oStart = originStart;
                int dStart = destinationStart;
                tasks.add(() -> fillBlock(coordinates, oStart, dStart, departureTime, preference, minutes, meters));
            }
        }
        runBlocks(tasks);

        for (int i = 0; i < n; i++) {
            minutes[i][i] = 0;
            meters[i][i] = 0;
        }
        log.info("========= [MATRIX] 행렬 계산 완료 ({} 블록 요청) =========", tasks.size());
        return new TravelMatrix(ids, minutes, meters);
    }

    private void runBlocks(List<Runnable> tasks) {
        if (tasks.size() == 1) {
            tasks.get(0).run();
            return;
        }
        List<CompletableFuture<Void>> futures = new ArrayList<>(tasks.size());
        for (Runnable task : tasks) {
            futures.add(CompletableFuture.runAsync(task, blockExecutor));
        }
        try {
            CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException) {
                throw (RuntimeException) e.getCause();
            }
            if (e.getCause() instanceof Error) {
                throw (Error) e.getCause();
            }
            throw new UpstreamException("Matrix block failed: " + e.getCause(), false, e.getCause());
        }
    }

    /**
     * 블록 하나를 요청해 전체 행렬의 해당 구역에 씁니다. 블록마다 쓰는 구역이 겹치지 않으므로
     * 별도의 락은 필요 없습니다.
     */
    private void fillBlock(List<GeoPoint> coordinates, int originStart, int destinationStart,
                           String departureTime, RoutingPreference preference,
                           long[][] minutes, long[][] meters) {
        List<GeoPoint> origins = coordinates.subList(originStart, Math.min(originStart + batchSize, coordinates.size()));
        List<GeoPoint> destinations = coordinates.subList(destinationStart, Math.min(destinationStart + batchSize, coordinates.size()));

        for (int i = 0; i < origins.size(); i++) {
            for (int j = 0; j < destinations.size(); j++) {
                minutes[originStart + i][destinationStart + j] = TravelMatrix.UNREACHABLE_MINUTES;
                meters[originStart + i][destinationStart + j] = TravelMatrix.UNREACHABLE_METERS;
            }
        }

        List<RouteMatrixElement> elements = routeMatrixClient.computeBlock(origins, destinations, departureTime, preference);
        int unreachable = 0;
        for (RouteMatrixElement element : elements) {
            if (element.originIndex < 0 || element.originIndex >= origins.size()
                    || element.destinationIndex < 0 || element.destinationIndex >= destinations.size()) {
                throw new UpstreamException("Routes API returned element (" + element.originIndex + ", "
                        + element.destinationIndex + ") outside a " + origins.size() + "x" + destinations.size() + " block", false);
            }
            int row = originStart + element.originIndex;
            int col = destinationStart + element.destinationIndex;
            if (element.isRouted()) {
                minutes[row][col] = (long) Math.rint(element.durationSeconds / 60.0);
                meters[row][col] = element.distanceMeters;
            } else {
                unreachable++;
            }
        }
        log.debug("[MATRIX] 블록 ({}, {}) 완료: 응답 {}건, 경로 없음 {}건", originStart, destinationStart, elements.size(), unreachable);
    }

    private void checkDepartureTime(String departureTime) {
        if (departureTime == null) {
            return;
        }
        try {
            OffsetDateTime.parse(departureTime);
        } catch (DateTimeParseException e) {
            throw new InvalidInputException("departureTime is not an ISO-8601 timestamp: " + departureTime);
        }
    }

    String cacheKey(List<GeoPoint> coordinates, String departureTime, RoutingPreference preference) {
        List<List<BigDecimal>> rounded = new ArrayList<>(coordinates.size());
        for (GeoPoint point : coordinates) {
            rounded.add(List.of(round(point.lat), round(point.lng)));
        }
        Map<String, Object> signature = new LinkedHashMap<>();
        signature.put("coords", rounded);
        signature.put("dep", departureTime);
        signature.put("pref", preference.name());
        try {
            byte[] json = objectMapper.writeValueAsString(signature).getBytes(StandardCharsets.UTF_8);
            return HexFormat.of().formatHex(MessageDigest.getInstance("SHA-256").digest(json));
        } catch (JsonProcessingException | NoSuchAlgorithmException e) {
            throw new IllegalStateException("Could not build matrix cache key", e);
        }
    }

    private static BigDecimal round(double value) {
        return BigDecimal.valueOf(value).setScale(COORDINATE_SCALE, RoundingMode.HALF_EVEN);
    }

    private static ThreadFactory blockThreadFactory() {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "matrix-block-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
