package com.webgraph.core.graph;

import java.util.*;

/**
 * 노드(id → WebNode) + 방향 간선(id → 이웃 id 집합) 컨테이너.
 *
 * <p>모든 public 메서드는 this 모니터로 동기화된다. {@link #mergeFrom(WebGraph)} 는
 * 상대 그래프를 먼저 스냅샷한 뒤 자신의 락만 잡고 합집합을 적용하므로, 겹치는 서브그래프를
 * 동시에 병합해도 노드가 유실되거나 중복 집계되지 않는다.
 *
 * <p>간선 source 는 항상 노드로 존재한다. target 은 노드가 아닐 수도 있다
 * (발견되었지만 아직 방문되지 않은 URL).
 */
public final class WebGraph {
    private final Map<String, WebNode> nodes = new LinkedHashMap<>();
    private final Map<String, Set<String>> edges = new LinkedHashMap<>();

    /** 이미 있으면 기존 노드 유지, 새로 추가되었으면 true */
    public synchronized boolean addNode(WebNode node) {
        Objects.requireNonNull(node, "node");
        return nodes.putIfAbsent(node.getId(), node) == null;
    }

    /** from 이 없으면 노드로 추가. 중복 간선은 무시되며, 새 간선이면 true */
    public synchronized boolean addEdge(WebNode from, WebNode to) {
        Objects.requireNonNull(from, "from");
        Objects.requireNonNull(to, "to");
        nodes.putIfAbsent(from.getId(), from);
        return edges.computeIfAbsent(from.getId(), k -> new LinkedHashSet<>()).add(to.getId());
    }

    public synchronized boolean containsNode(String id) { return nodes.containsKey(id); }

    public synchronized WebNode getNode(String id) { return nodes.get(id); }

    /** 삽입 순서 보존 복사본 */
    public synchronized List<WebNode> allNodes() { return new ArrayList<>(nodes.values()); }

    public synchronized Set<String> nodeIds() { return new LinkedHashSet<>(nodes.keySet()); }

    public synchronized int nodeCount() { return nodes.size(); }

    public synchronized boolean isEmpty() { return nodes.isEmpty(); }

    public synchronized Set<String> neighborsOf(String id) {
        Set<String> n = edges.get(id);
        return n == null ? Set.of() : Collections.unmodifiableSet(new LinkedHashSet<>(n));
    }

    public synchronized int edgeCount() {
        int c = 0;
        for (Set<String> s : edges.values()) c += s.size();
        return c;
    }

    /** source id → target id 집합 (깊은 복사) */
    public synchronized Map<String, Set<String>> edges() {
        Map<String, Set<String>> out = new LinkedHashMap<>();
        for (Map.Entry<String, Set<String>> e : edges.entrySet()) {
            out.put(e.getKey(), Collections.unmodifiableSet(new LinkedHashSet<>(e.getValue())));
        }
        return Collections.unmodifiableMap(out);
    }

    /**
     * other 의 노드/간선을 이 그래프에 합친다(제자리 변경).
     * 노드는 id 기준 합집합(기존 노드 유지), 간선은 source 별 집합 합집합.
     * 같은 그래프를 여러 번 병합해도 결과는 같고(멱등), 병합 순서는 최종 노드/간선 집합에 영향이 없다.
     */
    public WebGraph mergeFrom(WebGraph other) {
        Objects.requireNonNull(other, "other");
        if (other == this) return this;
        Snapshot snap = other.snapshot();
        synchronized (this) {
            for (WebNode n : snap.nodes) nodes.putIfAbsent(n.getId(), n);
            for (Map.Entry<String, Set<String>> e : snap.edges.entrySet()) {
                edges.computeIfAbsent(e.getKey(), k -> new LinkedHashSet<>()).addAll(e.getValue());
            }
        }
        return this;
    }

    /** 양쪽을 건드리지 않고 합집합 그래프를 새로 만든다. */
    public static WebGraph merged(WebGraph a, WebGraph b) {
        return new WebGraph().mergeFrom(a).mergeFrom(b);
    }

    /** 노드 id 집합과 간선 집합이 같으면 true (삽입 순서 무시) */
    public boolean sameStructureAs(WebGraph other) {
        if (other == null) return false;
        Snapshot a = this.snapshot();
        Snapshot b = other.snapshot();
        if (!ids(a.nodes).equals(ids(b.nodes))) return false;
        return nonEmpty(a.edges).equals(nonEmpty(b.edges));
    }

    private synchronized Snapshot snapshot() {
        Map<String, Set<String>> e = new LinkedHashMap<>();
        for (Map.Entry<String, Set<String>> en : edges.entrySet()) e.put(en.getKey(), new LinkedHashSet<>(en.getValue()));
        return new Snapshot(new ArrayList<>(nodes.values()), e);
    }

    private static Set<String> ids(List<WebNode> ns) {
        Set<String> s = new HashSet<>();
        for (WebNode n : ns) s.add(n.getId());
        return s;
    }

    private static Map<String, Set<String>> nonEmpty(Map<String, Set<String>> m) {
        Map<String, Set<String>> out = new HashMap<>();
        m.forEach((k, v) -> { if (!v.isEmpty()) out.put(k, new HashSet<>(v)); });
        return out;
    }

    @Override public synchronized String toString() {
        return "WebGraph{nodes=" + nodes.size() + ", edges=" + edgeCount() + "}";
    }

    private record Snapshot(List<WebNode> nodes, Map<String, Set<String>> edges) { }
}
