package xyz.firestige.netdeploy.infrastructure.execution;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import xyz.firestige.netdeploy.domain.shared.exception.SessionException;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;

/**
 * 单次设备操作的超时保护
 * <p>
 * 每个会话调用（连接、抓取、下发、保存、状态查询）在独立的 device-io 线程上执行，
 * 超过 operationTimeout 即视为该设备的 SESSION_ERROR；超时只影响当前设备，不阻塞其他设备。
 */
public class DeviceOperationGuard implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(DeviceOperationGuard.class);

    private final Duration operationTimeout;
    private final ExecutorService ioPool;

    public DeviceOperationGuard(Duration operationTimeout) {
        this.operationTimeout = operationTimeout;
        this.ioPool = Executors.newCachedThreadPool(new ThreadFactory() {
            private final AtomicLong idx = new AtomicLong();

            @Override
            public Thread newThread(Runnable r) {
                Thread t = new Thread(r, "netdeploy-device-io-" + idx.incrementAndGet());
                t.setDaemon(true);
                return t;
            }
        });
    }

    public Duration getOperationTimeout() {
        return operationTimeout;
    }

    public <T> T call(String device, String operation, Supplier<T> body) {
        Map<String, String> mdc = MDC.getCopyOfContextMap();
        Future<T> future = ioPool.submit(() -> DeviceWorkerPool.withMdc(mdc, body));
        try {
            return future.get(operationTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("Device operation timed out: device={}, operation={}, timeout={}", device, operation, operationTimeout);
            throw new SessionException(operation + " on " + device + " timed out after " + operationTimeout.toMillis() + "ms", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException re) {
                throw re;
            }
            throw new SessionException(operation + " on " + device + " failed: " + cause, cause);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new SessionException(operation + " on " + device + " interrupted", e);
        }
    }

    public void run(String device, String operation, Runnable body) {
        call(device, operation, () -> {
            body.run();
            return null;
        });
    }

    @Override
    public void close() {
        ioPool.shutdownNow();
    }
}
