package com.roomrelay.support;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import com.roomrelay.model.ClientConnection;

/**
 * In-memory connection that records every frame written to it.
 * A broken connection fails every write.
 */
public class RecordingConnection implements ClientConnection {
    private static final AtomicInteger IDS = new AtomicInteger();

    private final String id = "conn-" + IDS.incrementAndGet();
    private final List<String> frames = new CopyOnWriteArrayList<>();
    private final AtomicBoolean open = new AtomicBoolean(true);
    private final AtomicInteger closeCalls = new AtomicInteger();
    private volatile boolean broken;

    public static RecordingConnection broken() {
        RecordingConnection connection = new RecordingConnection();
        connection.breakConnection();
        return connection;
    }

    public void breakConnection() {
        this.broken = true;
    }

    @Override
    public String getId() {
        return id;
    }

    @Override
    public boolean send(String frame) {
        if (broken || !open.get()) {
            return false;
        }
        frames.add(frame);
        return true;
    }

    @Override
    public void close() {
        closeCalls.incrementAndGet();
        open.set(false);
    }

    @Override
    public boolean isOpen() {
        return open.get();
    }

    public List<String> getFrames() {
        return frames;
    }

    public String lastFrame() {
        return frames.isEmpty() ? null : frames.get(frames.size() - 1);
    }

    public int getCloseCalls() {
        return closeCalls.get();
    }
}
