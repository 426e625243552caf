package com.whereq.pilot.resource;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.FileVisitOption;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.EnumSet;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Recursive directory size, symlinks are neither followed nor counted
 */
@Slf4j
public final class DiskUsage {

    private DiskUsage() {
    }

    /**
     * @param path directory to measure
     * @return bytes used by regular files below the path
     */
    public static long du(Path path) {
        log.debug("du of {}", path);
        AtomicLong total = new AtomicLong();
        try {
            Files.walkFileTree(path, EnumSet.noneOf(FileVisitOption.class), Integer.MAX_VALUE,
                new SimpleFileVisitor<>() {
                    @Override
                    public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                        if (attrs.isRegularFile()) {
                            total.addAndGet(attrs.size());
                        }
                        return FileVisitResult.CONTINUE;
                    }

                    @Override
                    public FileVisitResult visitFileFailed(Path file, IOException exc) {
                        log.debug("cannot read {}: {}", file, exc.getMessage());
                        return FileVisitResult.CONTINUE;
                    }
                });
        } catch (IOException e) {
            log.warn("du of {} failed: {}", path, e.getMessage());
        }
        log.debug("du of {} finished: {}", path, total.get());
        return total.get();
    }
}
