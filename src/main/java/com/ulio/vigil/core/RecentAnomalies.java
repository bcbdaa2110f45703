package com.ulio.vigil.core;

import com.ulio.vigil.record.AnomalyRecord;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;

public class RecentAnomalies {
    private final int capacity;
    private final Deque<AnomalyRecord> records = new ArrayDeque<>();

    public RecentAnomalies(int capacity) {
        this.capacity = Math.max(1, capacity);
    }

    public synchronized void add(AnomalyRecord record) {
        if (record == null) {
            return;
        }
        records.addLast(record);
        while (records.size() > capacity) {
            records.removeFirst();
        }
    }

    // oldest first
    public synchronized List<AnomalyRecord> recent(int limit) {
        if (limit <= 0 || records.isEmpty()) {
            return Collections.emptyList();
        }

        int count = Math.min(limit, records.size());
        List<AnomalyRecord> newestFirst = new ArrayList<>(count);
        Iterator<AnomalyRecord> iterator = records.descendingIterator();
        while (iterator.hasNext() && newestFirst.size() < count) {
            newestFirst.add(iterator.next());
        }
        Collections.reverse(newestFirst);
        return Collections.unmodifiableList(newestFirst);
    }

    public synchronized int size() {
        return records.size();
    }

    public synchronized void clear() {
        records.clear();
    }
}
