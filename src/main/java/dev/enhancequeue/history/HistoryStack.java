package dev.enhancequeue.history;

import dev.enhancequeue.api.EnhancementMode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.image.BufferedImage;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Bounded undo/redo stack of produced artifacts.
 *
 * <p>The cursor points at the entry currently shown. Pushing while the cursor is not at the tip
 * discards everything ahead of it first; pushing past the bound drops the oldest entry.
 * All methods are synchronized.
 */
public class HistoryStack {
    private static final Logger logger = LoggerFactory.getLogger(HistoryStack.class);

    public static final int DEFAULT_MAX_SIZE = 10;

    private final int maxSize;
    private final Clock clock;
    private final List<HistoryEntry> entries = new ArrayList<>();
    private int cursor = -1;

    public HistoryStack() {
        this(DEFAULT_MAX_SIZE, null);
    }

    /**
     * @param maxSize maximum number of retained entries, must be positive
     * @param clock   clock for entry timestamps, null for system UTC
     */
    public HistoryStack(int maxSize, Clock clock) {
        if (maxSize <= 0) {
            throw new IllegalArgumentException("maxSize must be positive, got " + maxSize);
        }
        this.maxSize = maxSize;
        this.clock = (clock != null) ? clock : Clock.systemUTC();
    }

    public synchronized HistoryEntry push(BufferedImage image, EnhancementMode mode) {
        HistoryEntry entry = new HistoryEntry(image, mode, clock.instant());

        if (cursor < entries.size() - 1) {
            entries.subList(cursor + 1, entries.size()).clear();
        }
        entries.add(entry);
        if (entries.size() > maxSize) {
            entries.remove(0);
        }
        cursor = entries.size() - 1;

        logger.debug("History push {} (index: {}, total: {})", mode, cursor, entries.size());
        return entry;
    }

    /**
     * Moves the cursor back one entry.
     *
     * @return the entry now under the cursor, or empty when already at the oldest entry
     */
    public synchronized Optional<HistoryEntry> undo() {
        if (!canUndo()) {
            return Optional.empty();
        }
        cursor--;
        HistoryEntry entry = entries.get(cursor);
        logger.debug("History undo to {} (index: {})", entry.mode(), cursor);
        return Optional.of(entry);
    }

    /**
     * Moves the cursor forward one entry.
     *
     * @return the entry now under the cursor, or empty when already at the newest entry
     */
    public synchronized Optional<HistoryEntry> redo() {
        if (!canRedo()) {
            return Optional.empty();
        }
        cursor++;
        HistoryEntry entry = entries.get(cursor);
        logger.debug("History redo to {} (index: {})", entry.mode(), cursor);
        return Optional.of(entry);
    }

    public synchronized boolean canUndo() {
        return cursor > 0;
    }

    public synchronized boolean canRedo() {
        return cursor < entries.size() - 1;
    }

    public synchronized Optional<HistoryEntry> current() {
        if (cursor < 0 || cursor >= entries.size()) {
            return Optional.empty();
        }
        return Optional.of(entries.get(cursor));
    }

    public synchronized int size() {
        return entries.size();
    }

    public synchronized int cursor() {
        return cursor;
    }

    public int maxSize() {
        return maxSize;
    }

    public synchronized void clear() {
        entries.clear();
        cursor = -1;
        logger.debug("History cleared");
    }
}
