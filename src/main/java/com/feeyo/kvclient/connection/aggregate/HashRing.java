package com.feeyo.kvclient.connection.aggregate;

import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

import com.google.common.hash.HashFunction;
import com.google.common.hash.Hashing;

/**
 * Consistent hash ring, CRC32 based. Each node owns a number of points proportional to its weight.
 */
public class HashRing<T> {

	public static final int DEFAULT_REPLICAS = 128;
	public static final int DEFAULT_WEIGHT = 100;

	private static final HashFunction CRC32 = Hashing.crc32();

	private final int replicas;

	// node -> weight, insertion ordered
	private final Map<T, Integer> nodes = new LinkedHashMap<T, Integer>();
	private final Map<T, String> nodeIds = new LinkedHashMap<T, String>();

	private TreeMap<Long, T> ring;

	public HashRing() {
		this(DEFAULT_REPLICAS);
	}

	public HashRing(int replicas) {
		this.replicas = replicas;
	}

	public void add(T node, String id, int weight) {
		nodes.put(node, Math.max(1, weight));
		nodeIds.put(node, id);
		ring = null;
	}

	public boolean remove(T node) {
		boolean removed = nodes.remove(node) != null;
		nodeIds.remove(node);
		if (removed) {
			ring = null;
		}
		return removed;
	}

	public int size() {
		return nodes.size();
	}

	public static long hash(String value) {
		return CRC32.hashString(value, StandardCharsets.UTF_8).padToLong();
	}

	public T get(long hash) {
		TreeMap<Long, T> ring = getRing();
		if (ring.isEmpty()) {
			return null;
		}
		SortedMap<Long, T> tail = ring.tailMap(hash);
		return tail.isEmpty() ? ring.firstEntry().getValue() : tail.get(tail.firstKey());
	}

	public T get(String key) {
		return get(hash(key));
	}

	private TreeMap<Long, T> getRing() {
		if (ring == null) {
			ring = build();
		}
		return ring;
	}

	private TreeMap<Long, T> build() {
		TreeMap<Long, T> points = new TreeMap<Long, T>();
		if (nodes.isEmpty()) {
			return points;
		}

		long totalWeight = 0;
		for (int weight : nodes.values()) {
			totalWeight += weight;
		}

		int nodeCount = nodes.size();
		for (Map.Entry<T, Integer> entry : nodes.entrySet()) {
			long count = Math.max(1, Math.round((double) entry.getValue() / totalWeight * nodeCount * replicas));
			String id = nodeIds.get(entry.getKey());
			for (int i = 0; i < count; i++) {
				points.put(hash(id + ":" + i), entry.getKey());
			}
		}
		return points;
	}
}
