package com.traneptora.lightlevel.util;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.io.IOException;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class TaskListTest {

    private ExecutorService pool;

    @BeforeEach
    void setUp() {
        pool = Executors.newFixedThreadPool(3);
    }

    @AfterEach
    void tearDown() {
        pool.shutdownNow();
    }

    @Test
    void testResultsInSubmissionOrder() {
        TaskList<Integer> tasks = new TaskList<>(pool);
        for (int i = 0; i < 3; i++) {
            int delay = 30 - i * 10;
            int value = i;
            tasks.submit(() -> {
                Thread.sleep(delay);
                return value;
            });
        }
        assertEquals(3, tasks.size());
        assertEquals(List.of(0, 1, 2), tasks.collect());
        assertEquals(0, tasks.size());
    }

    @Test
    void testCheckedExceptionIsNotWrapped() {
        AtomicInteger finished = new AtomicInteger();
        TaskList<Integer> tasks = new TaskList<>(pool);
        tasks.submit(() -> {
            throw new IOException("first");
        });
        tasks.submit(() -> {
            Thread.sleep(20);
            return finished.incrementAndGet();
        });
        IOException ex = assertThrows(IOException.class, tasks::collect);
        assertEquals("first", ex.getMessage());
        assertEquals(1, finished.get());
    }

    @Test
    void testLaterFailuresAreSuppressed() {
        TaskList<Integer> tasks = new TaskList<>(pool);
        tasks.submit(() -> {
            throw new IllegalStateException("one");
        });
        tasks.submit(() -> {
            throw new IllegalStateException("two");
        });
        IllegalStateException ex = assertThrows(IllegalStateException.class, tasks::collect);
        assertEquals("one", ex.getMessage());
        assertEquals(1, ex.getSuppressed().length);
        assertEquals("two", ex.getSuppressed()[0].getMessage());
    }
}
