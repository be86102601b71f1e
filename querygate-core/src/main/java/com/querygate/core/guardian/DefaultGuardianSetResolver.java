package com.querygate.core.guardian;

import com.querygate.api.exception.GuardianSetException;
import com.querygate.api.exception.GuardianSetException.Failure;
import com.querygate.api.guardian.GuardianSet;
import com.querygate.api.guardian.GuardianSetResolver;
import com.querygate.core.security.CallKeyCodec;
import com.querygate.core.spi.ContractCaller;
import com.querygate.core.spi.ContractCallerFactory;
import lombok.extern.slf4j.Slf4j;
import org.web3j.utils.Numeric;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * 默认 Guardian Set 解析实现
 * <p>
 * 一次解析包含两次合约读取（当前索引、该索引下的 Guardian Set），
 * 二者共享同一个截止时间（默认 5 秒）。内部不重试，不跨调用保留状态。
 * </p>
 */
@Slf4j
public class DefaultGuardianSetResolver implements GuardianSetResolver {

    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(5);

    private final ContractCallerFactory callerFactory;
    private final Duration timeout;

    public DefaultGuardianSetResolver(ContractCallerFactory callerFactory) {
        this(callerFactory, DEFAULT_TIMEOUT);
    }

    public DefaultGuardianSetResolver(ContractCallerFactory callerFactory, Duration timeout) {
        if (timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("timeout must be positive");
        }
        this.callerFactory = callerFactory;
        this.timeout = timeout;
    }

    @Override
    public GuardianSet fetchCurrentGuardianSet(String rpcUrl, String coreBridgeAddress) {
        String contract = Numeric.toHexString(CallKeyCodec.validateAddress(coreBridgeAddress));
        long deadline = System.nanoTime() + timeout.toNanos();

        try (ContractCaller caller = callerFactory.open(rpcUrl, timeout)) {
            String indexData = await(caller.call(contract,
                    CoreBridgeAbi.encode(CoreBridgeAbi.getCurrentGuardianSetIndex())),
                    deadline, "requesting current guardian set index");
            long index = decode(() -> CoreBridgeAbi.decodeIndex(indexData), "current guardian set index");

            String setData = await(caller.call(contract,
                    CoreBridgeAbi.encode(CoreBridgeAbi.getGuardianSet(index))),
                    deadline, "requesting current guardian set value");
            List<String> keys = decode(() -> CoreBridgeAbi.decodeGuardianKeys(setData), "current guardian set value");

            log.info("Fetched guardian set {} with {} keys from core bridge {}", index, keys.size(), contract);
            return new GuardianSet(index, keys);
        }
    }

    private String await(CompletableFuture<String> future, long deadline, String step) {
        try {
            long remaining = deadline - System.nanoTime();
            if (remaining <= 0) {
                throw new TimeoutException();
            }
            return future.get(remaining, TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new GuardianSetException(Failure.TIMEOUT,
                    "timed out after " + timeout.toMillis() + " ms " + step, e);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new GuardianSetException(Failure.CANCELLED, "interrupted while " + step, e);
        } catch (CancellationException e) {
            throw new GuardianSetException(Failure.CANCELLED, "cancelled while " + step, e);
        } catch (ExecutionException e) {
            throw translate(e.getCause(), step);
        }
    }

    private GuardianSetException translate(Throwable cause, String step) {
        while (cause instanceof CompletionException && cause.getCause() != null) {
            cause = cause.getCause();
        }
        if (cause instanceof ContractCallException) {
            return new GuardianSetException(Failure.CONTRACT_CALL, "error " + step + ": " + cause.getMessage(), cause);
        }
        if (cause instanceof InterruptedIOException) {
            // OkHttp 的 callTimeout 与 socket 超时都以 InterruptedIOException 报告
            return new GuardianSetException(Failure.TIMEOUT, "timed out " + step + ": " + cause.getMessage(), cause);
        }
        if (cause instanceof IOException || cause instanceof IllegalArgumentException) {
            return new GuardianSetException(Failure.CONNECTION, "failed to connect to ethereum while " + step
                    + ": " + cause.getMessage(), cause);
        }
        return new GuardianSetException(Failure.CONTRACT_CALL, "error " + step + ": " + cause, cause);
    }

    private <T> T decode(Supplier<T> decoder, String what) {
        try {
            return decoder.get();
        } catch (ContractCallException e) {
            throw new GuardianSetException(Failure.CONTRACT_CALL, "error decoding " + what + ": " + e.getMessage(), e);
        } catch (RuntimeException e) {
            throw new GuardianSetException(Failure.CONTRACT_CALL, "malformed " + what + ": " + e.getMessage(), e);
        }
    }
}
