package com.querydigest.log.parser.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Raw lines of one slow query occurrence, from a "# Time" boundary up to (not including) the next one.
 * The number of line slots is bounded; {@link #add(String)} reports when a line does not fit.
 */
public class RawRecordBlock {

    public static final int DEFAULT_CAPACITY = 9;

    /** Marker handed to workers once the framer has pushed its last block. */
    public static final RawRecordBlock END_OF_STREAM = new RawRecordBlock(-1, 0);

    private final long position;
    private final int capacity;
    private final List<String> lines;

    public RawRecordBlock(long position) {
        this(position, DEFAULT_CAPACITY);
    }

    public RawRecordBlock(long position, int capacity) {
        this.position = position;
        this.capacity = capacity;
        this.lines = new ArrayList<>(capacity);
    }

    /**
     * @return false when every slot is taken; the line was not stored
     */
    public boolean add(String line) {
        if (lines.size() >= capacity) {
            return false;
        }
        lines.add(line);
        return true;
    }

    /**
     * Appends a continuation line to the last slot, separated by a space.
     */
    public void foldIntoLast(String line) {
        int last = lines.size() - 1;
        if (last < 0) {
            throw new IllegalStateException("Cannot fold into an empty block");
        }
        lines.set(last, lines.get(last) + " " + line);
    }

    public String lastLine() {
        return lines.isEmpty() ? null : lines.get(lines.size() - 1);
    }

    public boolean isFull() {
        return lines.size() >= capacity;
    }

    public List<String> getLines() {
        return Collections.unmodifiableList(lines);
    }

    public int size() {
        return lines.size();
    }

    public long getPosition() {
        return position;
    }

    public int getCapacity() {
        return capacity;
    }

    @Override
    public String toString() {
        return "RawRecordBlock[position=" + position + ", lines=" + lines.size() + "]";
    }
}
