/*
 * MIT License
 *
 * Copyright (c) 2025 mnn-correct contributors
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in all
 * copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN THE
 * SOFTWARE.
 */
package com.github.mnncorrect;

import static org.junit.jupiter.api.Assertions.*;

import java.util.concurrent.atomic.AtomicIntegerArray;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class ParallelLoopsTest {

    @Test
    @DisplayName("Every index is visited exactly once")
    void coversRange() {
        int count = 103;
        AtomicIntegerArray visits = new AtomicIntegerArray(count);
        ParallelLoops.process(4, count, (worker, from, to) -> {
            for (int i = from; i < to; i++) visits.incrementAndGet(i);
        });
        for (int i = 0; i < count; i++) assertEquals(1, visits.get(i), "index " + i);
    }

    @Test
    @DisplayName("Blocks are contiguous and numbered by worker")
    void contiguousBlocks() {
        int[][] blocks = new int[3][];
        ParallelLoops.process(3, 10, (worker, from, to) -> blocks[worker] = new int[] {from, to});
        assertArrayEquals(new int[] {0, 3}, blocks[0]);
        assertArrayEquals(new int[] {3, 6}, blocks[1]);
        assertArrayEquals(new int[] {6, 10}, blocks[2]);
    }

    @Test
    @DisplayName("Single worker runs on the calling thread")
    void singleWorkerInline() {
        Thread caller = Thread.currentThread();
        Thread[] ran = new Thread[1];
        ParallelLoops.process(1, 5, (worker, from, to) -> ran[0] = Thread.currentThread());
        assertSame(caller, ran[0]);
    }

    @Test
    @DisplayName("Worker count is bounded by the work available")
    void workerCount() {
        assertEquals(1, ParallelLoops.workerCount(8, 0));
        assertEquals(2, ParallelLoops.workerCount(8, 2));
        assertEquals(3, ParallelLoops.workerCount(3, 50));
    }

    @Test
    @DisplayName("Worker exceptions reach the caller unchanged")
    void propagatesFailure() {
        DegenerateInputException e = assertThrows(
                DegenerateInputException.class,
                () -> ParallelLoops.process(2, 10, (worker, from, to) -> {
                    if (worker == 1) throw new DegenerateInputException("worker " + worker);
                }));
        assertEquals("worker 1", e.getMessage());
    }
}
