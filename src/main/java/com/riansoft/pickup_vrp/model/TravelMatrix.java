package com.riansoft.pickup_vrp.model;

import java.util.List;

/**
 * 정류장 순서 기준의 이동 시간(분)/거리(m) 행렬.
 * 갈 수 없는 칸은 빈 값 대신 {@link #UNREACHABLE_MINUTES}, {@link #UNREACHABLE_METERS}를 가집니다.
 * 내부 배열은 그대로 내주지 않고 {@link #getMinutes()}, {@link #getMeters()}는 복사본을 돌려줍니다.
 */
public class TravelMatrix {
    public static final long UNREACHABLE_MINUTES = 1_000_000L;
    public static final long UNREACHABLE_METERS = 1_000_000_000L;

    private final List<String> ids;
    private final long[][] minutes;
    private final long[][] meters;

    public TravelMatrix(List<String> ids, long[][] minutes, long[][] meters) {
        this.ids = List.copyOf(ids);
        this.minutes = minutes;
        this.meters = meters;
    }

    public List<String> getIds() { return ids; }
    public int size() { return ids.size(); }
    public long minutesAt(int from, int to) { return minutes[from][to]; }
    public long metersAt(int from, int to) { return meters[from][to]; }
    public long[][] getMinutes() { return copy(minutes); }
    public long[][] getMeters() { return copy(meters); }

    /**
     * 값은 그대로 두고 정류장 id만 바꾼 행렬. 같은 좌표의 다른 요청에 캐시된 행렬을 줄 때 씁니다.
     */
    public TravelMatrix withIds(List<String> newIds) {
        if (newIds.size() != ids.size()) {
            throw new IllegalArgumentException("id count " + newIds.size() + " does not match matrix size " + ids.size());
        }
        return new TravelMatrix(newIds, minutes, meters);
    }

    private static long[][] copy(long[][] source) {
        long[][] target = new long[source.length][];
        for (int i = 0; i < source.length; i++) {
            target[i] = source[i].clone();
        }
        return target;
    }
}
