package xyz.firestige.netdeploy.infrastructure.execution;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * 有界工作线程池，承载可并行的逐设备任务（生成、批量备份、预览抓取、校验）。
 * <p>
 * 队列满时由调用线程执行（降级而不是拒绝）。调用方的 MDC 会带入工作线程。
 * 部署阶段不使用本线程池，部署严格串行。
 */
public class DeviceWorkerPool implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(DeviceWorkerPool.class);

    private final ThreadPoolExecutor pool;

    public DeviceWorkerPool(int poolSize, int queueCapacity) {
        this.pool = new ThreadPoolExecutor(
                poolSize,
                poolSize,
                60L, TimeUnit.SECONDS,
                new ArrayBlockingQueue<>(queueCapacity),
                new ThreadFactory() {
                    private final AtomicLong idx = new AtomicLong();

                    @Override
                    public Thread newThread(Runnable r) {
                        Thread t = new Thread(r, "netdeploy-worker-" + idx.incrementAndGet());
                        t.setDaemon(true);
                        return t;
                    }
                },
                new ThreadPoolExecutor.CallerRunsPolicy()
        );
    }

    /**
     * 对每个输入并行执行 task，按输入顺序返回结果。
     * task 应当自行把设备级错误转换为结果值；若仍抛出异常，原样向上抛出。
     */
    public <I, O> List<O> map(List<I> inputs, Function<? super I, ? extends O> task) {
        Map<String, String> mdc = MDC.getCopyOfContextMap();
        List<CompletableFuture<O>> futures = new ArrayList<>(inputs.size());
        for (I input : inputs) {
            futures.add(CompletableFuture.supplyAsync(() -> withMdc(mdc, () -> task.apply(input)), pool));
        }
        List<O> results = new ArrayList<>(inputs.size());
        for (CompletableFuture<O> f : futures) {
            try {
                results.add(f.join());
            } catch (CompletionException e) {
                if (e.getCause() instanceof RuntimeException re) {
                    throw re;
                }
                throw e;
            }
        }
        return results;
    }

    static <T> T withMdc(Map<String, String> mdc, Supplier<T> body) {
        Map<String, String> previous = MDC.getCopyOfContextMap();
        if (mdc != null) {
            MDC.setContextMap(mdc);
        } else {
            MDC.clear();
        }
        try {
            return body.get();
        } finally {
            if (previous != null) {
                MDC.setContextMap(previous);
            } else {
                MDC.clear();
            }
        }
    }

    @Override
    public void close() {
        log.debug("Shutting down device worker pool");
        pool.shutdown();
    }
}
