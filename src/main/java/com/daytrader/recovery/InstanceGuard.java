package com.daytrader.recovery;

import com.daytrader.exception.ConfigurationException;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.channels.OverlappingFileLockException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Component;

/**
 * Guarantees that a single engine trades an account at a time.
 *
 * <p>Holds an exclusive OS lock on {@code daytrader.instance.lock-file} for the life of the
 * process and writes the owning PID into it. A second instance fails to start with a
 * {@link ConfigurationException}. The OS drops the lock when the process dies, so a crash
 * never leaves a stale marker behind. The file itself is never deleted; only the lock on it
 * means an engine is running.
 *
 * <p>Starts before startup recovery and stops after everything else of ours.
 */
@Component
public class InstanceGuard implements SmartLifecycle {

    private static final Logger log = LoggerFactory.getLogger(InstanceGuard.class);

    private final Path lockFile;
    private final AtomicBoolean running = new AtomicBoolean(false);

    private FileChannel channel;
    private FileLock fileLock;

    public InstanceGuard(@Value("${daytrader.instance.lock-file:daytrader.lock}") String lockFile) {
        this.lockFile = Path.of(lockFile);
    }

    public synchronized void acquire() {
        if (fileLock != null) {
            return;
        }
        try {
            Path parent = lockFile.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            channel = FileChannel.open(lockFile, StandardOpenOption.CREATE, StandardOpenOption.WRITE);
            FileLock acquired;
            try {
                acquired = channel.tryLock();
            } catch (OverlappingFileLockException e) {
                acquired = null;
            }
            if (acquired == null) {
                closeChannel();
                throw new ConfigurationException("Another engine instance is running (lock " + lockFile
                        + " held by pid " + readOwner() + "); refusing to start");
            }
            fileLock = acquired;

            long pid = ProcessHandle.current().pid();
            channel.truncate(0);
            channel.write(ByteBuffer.wrap(String.valueOf(pid).getBytes(StandardCharsets.UTF_8)), 0);
            channel.force(false);
            log.info("Instance lock acquired: {} (pid {})", lockFile.toAbsolutePath(), pid);
        } catch (IOException e) {
            closeChannel();
            throw new ConfigurationException("Cannot open instance lock file " + lockFile, e);
        }
    }

    public synchronized void release() {
        if (fileLock == null) {
            return;
        }
        try {
            fileLock.release();
        } catch (IOException e) {
            log.warn("Failed to release instance lock {}: {}", lockFile, e.getMessage());
        }
        fileLock = null;
        // The lock file is left in place
        closeChannel();
        log.info("Instance lock released: {}", lockFile.toAbsolutePath());
    }

    public synchronized boolean isHeld() {
        return fileLock != null && fileLock.isValid();
    }

    private String readOwner() {
        try {
            String content = Files.readString(lockFile, StandardCharsets.UTF_8).trim();
            return content.isEmpty() ? "unknown" : content;
        } catch (IOException e) {
            return "unknown";
        }
    }

    private void closeChannel() {
        if (channel == null) {
            return;
        }
        try {
            channel.close();
        } catch (IOException e) {
            log.warn("Failed to close instance lock channel: {}", e.getMessage());
        }
        channel = null;
    }

    // ========================
    // LIFECYCLE
    // ========================

    @Override
    public void start() {
        acquire();
        running.set(true);
    }

    @Override
    public void stop() {
        release();
        running.set(false);
    }

    @Override
    public boolean isRunning() {
        return running.get();
    }

    @Override
    public int getPhase() {
        return Integer.MAX_VALUE - 3;
    }
}
