package cn.bafuka.tierstore.store;

import cn.bafuka.tierstore.store.impl.WriteBehindFlusher;
import org.junit.Test;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.Assert.*;

/**
 * WriteBehindFlusher 单元测试
 */
public class WriteBehindFlusherTest {

    /**
     * 测试周期刷新，单次异常不会终止后续调度
     */
    @Test
    public void testTicksSurviveFailures() throws InterruptedException {
        AtomicInteger ticks = new AtomicInteger();
        CountDownLatch threeTicks = new CountDownLatch(3);
        WriteBehindFlusher flusher = new WriteBehindFlusher("products", Duration.ofMillis(20), () -> {
            threeTicks.countDown();
            if (ticks.incrementAndGet() == 1) {
                throw new IllegalStateException("first tick fails");
            }
        }, () -> {
        });

        flusher.start();
        assertEquals(WriteBehindFlusher.FlusherState.RUNNING, flusher.getState());

        assertTrue(threeTicks.await(3, TimeUnit.SECONDS));
        flusher.stop();
        assertEquals(WriteBehindFlusher.FlusherState.STOPPED, flusher.getState());
    }

    /**
     * 测试停止时在调用线程上执行一次最终清空
     */
    @Test
    public void testStopRunsDrainOnceOnCallerThread() {
        AtomicInteger drains = new AtomicInteger();
        Thread caller = Thread.currentThread();
        WriteBehindFlusher flusher = new WriteBehindFlusher("products", Duration.ofHours(1), () -> {
        }, () -> {
            assertSame(caller, Thread.currentThread());
            drains.incrementAndGet();
        });

        flusher.start();
        flusher.stop();
        flusher.stop();

        assertEquals(1, drains.get());
        assertEquals(WriteBehindFlusher.FlusherState.STOPPED, flusher.getState());
    }

    /**
     * 测试未启动直接停止也执行最终清空
     */
    @Test
    public void testStopWithoutStart() {
        AtomicInteger drains = new AtomicInteger();
        WriteBehindFlusher flusher = new WriteBehindFlusher("products", Duration.ofSeconds(1), () -> {
        }, drains::incrementAndGet);

        assertEquals(WriteBehindFlusher.FlusherState.NEW, flusher.getState());
        flusher.stop();

        assertEquals(1, drains.get());
        assertEquals(WriteBehindFlusher.FlusherState.STOPPED, flusher.getState());
    }

    @Test(expected = IllegalStateException.class)
    public void testStartTwiceRejected() {
        WriteBehindFlusher flusher = new WriteBehindFlusher("products", Duration.ofHours(1), () -> {
        }, () -> {
        });
        flusher.start();
        try {
            flusher.start();
        } finally {
            flusher.stop();
        }
    }

    @Test(expected = IllegalArgumentException.class)
    public void testNonPositiveIntervalRejected() {
        new WriteBehindFlusher("products", Duration.ZERO, () -> {
        }, () -> {
        });
    }
}
