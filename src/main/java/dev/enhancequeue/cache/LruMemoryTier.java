package dev.enhancequeue.cache;

import dev.enhancequeue.ser.ImageCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.image.BufferedImage;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Fast tier: an access-ordered map bounded by item count and total byte cost.
 *
 * <p>Inserts evict least-recently-used entries until both ceilings hold. The entry just inserted
 * is never evicted by its own insert: an image whose cost alone exceeds the byte ceiling stays
 * resident as the only entry, so a read right after a write always hits. The next insert evicts
 * it first. All access is synchronized on the instance.
 */
public final class LruMemoryTier {
    private static final Logger logger = LoggerFactory.getLogger(LruMemoryTier.class);

    private record Slot(BufferedImage image, long cost) {}

    private final int maxItems;
    private final long maxBytes;
    private final LinkedHashMap<String, Slot> map = new LinkedHashMap<>(16, 0.75f, true);
    private long totalCost;

    public LruMemoryTier(int maxItems, long maxBytes) {
        if (maxItems <= 0 || maxBytes <= 0) {
            throw new IllegalArgumentException("maxItems and maxBytes must be positive");
        }
        this.maxItems = maxItems;
        this.maxBytes = maxBytes;
    }

    /**
     * Inserts or replaces an entry, then evicts older entries until the ceilings hold.
     */
    public synchronized void put(String key, BufferedImage image) {
        long cost = ImageCodec.estimateCost(image);
        Slot old = map.remove(key);
        if (old != null) {
            totalCost -= old.cost();
        }
        map.put(key, new Slot(image, cost));
        totalCost += cost;
        evict();
        if (cost > maxBytes) {
            logger.debug("'{}' alone exceeds memory capacity ({} > {}), kept as sole entry", key, cost, maxBytes);
        }
    }

    public synchronized BufferedImage get(String key) {
        Slot slot = map.get(key);
        return slot == null ? null : slot.image();
    }

    public synchronized boolean remove(String key) {
        Slot slot = map.remove(key);
        if (slot == null) {
            return false;
        }
        totalCost -= slot.cost();
        return true;
    }

    public synchronized void clear() {
        map.clear();
        totalCost = 0;
    }

    private void evict() {
        Iterator<Map.Entry<String, Slot>> it = map.entrySet().iterator();
        while ((map.size() > maxItems || totalCost > maxBytes) && map.size() > 1) {
            Map.Entry<String, Slot> eldest = it.next();
            totalCost -= eldest.getValue().cost();
            it.remove();
            logger.debug("Evicted '{}' from memory tier", eldest.getKey());
        }
    }

    public synchronized int size() {
        return map.size();
    }

    public synchronized long totalCost() {
        return totalCost;
    }

    public synchronized boolean contains(String key) {
        return map.containsKey(key);
    }

    /**
     * @return resident keys, least recently used first
     */
    public synchronized List<String> keysByRecency() {
        return new ArrayList<>(map.keySet());
    }

    public int maxItems() {
        return maxItems;
    }

    public long maxBytes() {
        return maxBytes;
    }
}
