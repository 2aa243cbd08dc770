package com.webgraph.core.crawler;

import java.util.HashSet;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 결과 노드 수 예산. 여러 시드 크롤이 하나를 공유하면 전역 상한이 된다.
 * id 기반 예약은 노드 id 당 한 번만 센다: 시드 간 겹치는 노드는 예산을 다시 쓰지 않으므로
 * 공유 시 used() == 병합 결과의 서로 다른 노드 수 <= max.
 */
public final class ResultBudget {
    private static final int UNLIMITED = -1;

    private final AtomicInteger used = new AtomicInteger();
    private final Set<String> claimed = new HashSet<>(); // guarded by this
    private final int max;

    private ResultBudget(int max) { this.max = max; }

    public static ResultBudget unlimited() { return new ResultBudget(UNLIMITED); }

    /** max == null 이면 무제한, 음수는 0으로 */
    public static ResultBudget of(Integer max) {
        return max == null ? unlimited() : new ResultBudget(Math.max(0, max));
    }

    /** 예산이 남아있으면 1 소모하고 true, 아니면 false */
    public boolean tryReserve() {
        if (max == UNLIMITED) {
            used.incrementAndGet();
            return true;
        }
        while (true) {
            int cur = used.get();
            if (cur >= max) return false;
            if (used.compareAndSet(cur, cur + 1)) return true;
        }
    }

    /** 노드 id 단위 예약. 이미 예약된 id 는 추가 소모 없이 true. */
    public synchronized boolean tryReserve(String nodeId) {
        if (nodeId == null) return tryReserve();
        if (claimed.contains(nodeId)) return true;
        if (!tryReserve()) return false;
        claimed.add(nodeId);
        return true;
    }

    public boolean isExhausted() { return max != UNLIMITED && used.get() >= max; }
    public boolean isUnlimited() { return max == UNLIMITED; }
    public int used() { return used.get(); }

    /** 무제한이면 Integer.MAX_VALUE */
    public int remaining() { return max == UNLIMITED ? Integer.MAX_VALUE : Math.max(0, max - used.get()); }
}
